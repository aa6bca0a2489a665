package org.javai.netguard.config;

import org.javai.netguard.cache.GeoCacheConfig;
import org.javai.netguard.classify.DefaultErrorClassifier;
import org.javai.netguard.network.StatusMonitor;
import org.javai.netguard.retry.RetryPolicy;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Deployment overrides for the adaptive defaults.
 *
 * <p>Every setting is optional. A retry override is only produced if at least one
 * {@code netguard.retry.*} property is set; unset fields of it take their usual defaults.
 *
 * <table>
 *   <caption>Recognised settings</caption>
 *   <tr><th>System property</th><th>Environment variable</th></tr>
 *   <tr><td>{@code netguard.retry.max-attempts}</td><td>{@code NETGUARD_RETRY_MAX_ATTEMPTS}</td></tr>
 *   <tr><td>{@code netguard.retry.base-delay-ms}</td><td>{@code NETGUARD_RETRY_BASE_DELAY_MS}</td></tr>
 *   <tr><td>{@code netguard.retry.max-delay-ms}</td><td>{@code NETGUARD_RETRY_MAX_DELAY_MS}</td></tr>
 *   <tr><td>{@code netguard.retry.backoff-multiplier}</td><td>{@code NETGUARD_RETRY_BACKOFF_MULTIPLIER}</td></tr>
 *   <tr><td>{@code netguard.cache.base-ttl-ms}</td><td>{@code NETGUARD_CACHE_BASE_TTL_MS}</td></tr>
 *   <tr><td>{@code netguard.cache.accuracy-multiplier}</td><td>{@code NETGUARD_CACHE_ACCURACY_MULTIPLIER}</td></tr>
 *   <tr><td>{@code netguard.cache.min-ttl-ms}</td><td>{@code NETGUARD_CACHE_MIN_TTL_MS}</td></tr>
 *   <tr><td>{@code netguard.cache.max-ttl-ms}</td><td>{@code NETGUARD_CACHE_MAX_TTL_MS}</td></tr>
 *   <tr><td>{@code netguard.classifier.retry-after-seconds}</td><td>{@code NETGUARD_CLASSIFIER_RETRY_AFTER_SECONDS}</td></tr>
 * </table>
 */
public final class NetguardProperties {

    public static final String RETRY_MAX_ATTEMPTS = "netguard.retry.max-attempts";
    public static final String RETRY_BASE_DELAY_MS = "netguard.retry.base-delay-ms";
    public static final String RETRY_MAX_DELAY_MS = "netguard.retry.max-delay-ms";
    public static final String RETRY_BACKOFF_MULTIPLIER = "netguard.retry.backoff-multiplier";
    public static final String CACHE_BASE_TTL_MS = "netguard.cache.base-ttl-ms";
    public static final String CACHE_ACCURACY_MULTIPLIER = "netguard.cache.accuracy-multiplier";
    public static final String CACHE_MIN_TTL_MS = "netguard.cache.min-ttl-ms";
    public static final String CACHE_MAX_TTL_MS = "netguard.cache.max-ttl-ms";
    public static final String CLASSIFIER_RETRY_AFTER_SECONDS = "netguard.classifier.retry-after-seconds";

    static final String OVERRIDE_POLICY_ID = "configured";
    static final int DEFAULT_MAX_ATTEMPTS = 4;
    static final long DEFAULT_BASE_DELAY_MS = 500;
    static final long DEFAULT_MAX_DELAY_MS = 15_000;
    static final double DEFAULT_BACKOFF_MULTIPLIER = 1.5;

    private final ConfigResolver resolver;

    public NetguardProperties(ConfigResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    public static NetguardProperties fromSystem() {
        return new NetguardProperties(ConfigResolver.system());
    }

    /**
     * Returns the configured retry override, if any {@code netguard.retry.*} property is set.
     *
     * @throws IllegalStateException if a value is malformed or the resulting policy is invalid
     */
    public Optional<RetryPolicy> retryOverride() {
        Optional<Integer> maxAttempts = resolver.optionalInt(RETRY_MAX_ATTEMPTS);
        Optional<Long> baseDelay = resolver.optionalLong(RETRY_BASE_DELAY_MS);
        Optional<Long> maxDelay = resolver.optionalLong(RETRY_MAX_DELAY_MS);
        Optional<Double> multiplier = resolver.optionalDouble(RETRY_BACKOFF_MULTIPLIER);
        if (maxAttempts.isEmpty() && baseDelay.isEmpty() && maxDelay.isEmpty() && multiplier.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new RetryPolicy(
                    OVERRIDE_POLICY_ID,
                    maxAttempts.orElse(DEFAULT_MAX_ATTEMPTS),
                    baseDelay.orElse(DEFAULT_BASE_DELAY_MS),
                    maxDelay.orElse(DEFAULT_MAX_DELAY_MS),
                    multiplier.orElse(DEFAULT_BACKOFF_MULTIPLIER)));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid retry configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Applies configured cache overrides on top of {@code defaults}.
     *
     * @throws IllegalStateException if a value is malformed or the resulting config is invalid
     */
    public GeoCacheConfig cacheConfig(GeoCacheConfig defaults) {
        Objects.requireNonNull(defaults, "defaults must not be null");
        try {
            return new GeoCacheConfig(
                    resolver.optionalLong(CACHE_BASE_TTL_MS).map(Duration::ofMillis).orElse(defaults.baseTtl()),
                    resolver.optionalDouble(CACHE_ACCURACY_MULTIPLIER).orElse(defaults.accuracyMultiplier()),
                    resolver.optionalLong(CACHE_MIN_TTL_MS).map(Duration::ofMillis).orElse(defaults.minTtl()),
                    resolver.optionalLong(CACHE_MAX_TTL_MS).map(Duration::ofMillis).orElse(defaults.maxTtl()),
                    defaults.coordinateToleranceDegrees());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid cache configuration: " + e.getMessage(), e);
        }
    }

    public int rateLimitRetryAfterSeconds() {
        return resolver.optionalInt(CLASSIFIER_RETRY_AFTER_SECONDS)
                .orElse(DefaultErrorClassifier.DEFAULT_RATE_LIMIT_RETRY_AFTER_SECONDS);
    }

    public DefaultErrorClassifier errorClassifier(Clock clock) {
        try {
            return new DefaultErrorClassifier(rateLimitRetryAfterSeconds(), clock);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid classifier configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Builds an {@link AdaptiveConfigProvider} honouring the retry override.
     */
    public AdaptiveConfigProvider adaptiveConfig(StatusMonitor monitor) {
        return new AdaptiveConfigProvider(monitor, retryOverride().orElse(null));
    }
}
