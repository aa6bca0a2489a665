package org.javai.netguard.config;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves configuration from system properties with environment-variable fallback.
 *
 * <p>The environment variable for a property is its upper-cased name with dots and dashes
 * replaced by underscores: {@code netguard.cache.base-ttl-ms} → {@code NETGUARD_CACHE_BASE_TTL_MS}.
 */
public final class ConfigResolver {

    private final Function<String, String> properties;
    private final Function<String, String> environment;

    public ConfigResolver(Function<String, String> properties, Function<String, String> environment) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.environment = Objects.requireNonNull(environment, "environment must not be null");
    }

    /**
     * A resolver over {@link System#getProperty(String)} and {@link System#getenv(String)}.
     */
    public static ConfigResolver system() {
        return new ConfigResolver(System::getProperty, System::getenv);
    }

    static String envVarFor(String sysProp) {
        return sysProp.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    /**
     * Resolves an optional value; blank values count as unset.
     */
    public Optional<String> optional(String sysProp) {
        String value = properties.apply(sysProp);
        if (value == null || value.isBlank()) {
            value = environment.apply(envVarFor(sysProp));
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    public Optional<Long> optionalLong(String sysProp) {
        return optional(sysProp).map(value -> parse(sysProp, value, Long::parseLong));
    }

    public Optional<Integer> optionalInt(String sysProp) {
        return optional(sysProp).map(value -> parse(sysProp, value, Integer::parseInt));
    }

    public Optional<Double> optionalDouble(String sysProp) {
        return optional(sysProp).map(value -> parse(sysProp, value, Double::parseDouble));
    }

    private static <T> T parse(String sysProp, String value, Function<String, T> parser) {
        try {
            return parser.apply(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid value '" + value + "' for configuration '" + sysProp + "'", e);
        }
    }
}
