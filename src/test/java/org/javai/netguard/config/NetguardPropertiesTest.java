package org.javai.netguard.config;

import org.javai.netguard.MutableClock;
import org.javai.netguard.cache.GeoCacheConfig;
import org.javai.netguard.classify.HttpStatusException;
import org.javai.netguard.network.LinkType;
import org.javai.netguard.network.NetworkStatus;
import org.javai.netguard.network.StatusMonitor;
import org.javai.netguard.retry.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class NetguardPropertiesTest {

    private final Map<String, String> properties = new HashMap<>();
    private final NetguardProperties config = new NetguardProperties(
            new ConfigResolver(properties::get, name -> null));

    @Test
    void retryOverride_nothingSet_isEmpty() {
        assertThat(config.retryOverride()).isEmpty();
    }

    @Test
    void retryOverride_partial_fillsDefaults() {
        properties.put(NetguardProperties.RETRY_MAX_ATTEMPTS, "2");

        RetryPolicy policy = config.retryOverride().orElseThrow();

        assertThat(policy.maxAttempts()).isEqualTo(2);
        assertThat(policy.baseDelayMs()).isEqualTo(500);
        assertThat(policy.maxDelayMs()).isEqualTo(15_000);
        assertThat(policy.backoffMultiplier()).isEqualTo(1.5);
    }

    @Test
    void retryOverride_invalidCombination_throws() {
        properties.put(NetguardProperties.RETRY_BASE_DELAY_MS, "20000");

        assertThatThrownBy(config::retryOverride)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("retry");
    }

    @Test
    void cacheConfig_appliesOverridesOnDefaults() {
        properties.put(NetguardProperties.CACHE_BASE_TTL_MS, "120000");

        GeoCacheConfig cache = config.cacheConfig(GeoCacheConfig.weatherDefaults());

        assertThat(cache.baseTtl()).isEqualTo(Duration.ofMinutes(2));
        assertThat(cache.minTtl()).isEqualTo(Duration.ofMinutes(5));
        assertThat(cache.accuracyMultiplier()).isEqualTo(2);
    }

    @Test
    void rateLimitRetryAfterSeconds_defaultsToSixty() {
        assertThat(config.rateLimitRetryAfterSeconds()).isEqualTo(60);

        properties.put(NetguardProperties.CLASSIFIER_RETRY_AFTER_SECONDS, "5");
        assertThat(config.rateLimitRetryAfterSeconds()).isEqualTo(5);
    }

    @Test
    void adaptiveConfig_appliesRetryOverrideWhileOnline() {
        properties.put(NetguardProperties.RETRY_MAX_ATTEMPTS, "6");
        StatusMonitor monitor = new StatusMonitor(() -> {
            throw new IOException("not used");
        });

        AdaptiveConfigProvider provider = config.adaptiveConfig(monitor);

        NetworkStatus wifi = NetworkStatus.online(LinkType.WIFI, false, Instant.EPOCH);
        assertThat(provider.policyFor(wifi).maxAttempts()).isEqualTo(6);
        assertThat(provider.policyFor(wifi).id()).isEqualTo("configured");
        assertThat(provider.policyFor(NetworkStatus.offline(Instant.EPOCH)).maxAttempts()).isZero();
    }

    @Test
    void errorClassifier_usesConfiguredRetryAfter() {
        properties.put(NetguardProperties.CLASSIFIER_RETRY_AFTER_SECONDS, "12");

        assertThat(config.errorClassifier(MutableClock.at("2024-01-20T10:00:00Z"))
                .classify(new HttpStatusException(429))
                .retryAfterSeconds()).isEqualTo(12);
    }

    @Test
    void errorClassifier_negativeRetryAfter_throws() {
        properties.put(NetguardProperties.CLASSIFIER_RETRY_AFTER_SECONDS, "-1");

        assertThatThrownBy(() -> config.errorClassifier(MutableClock.at("2024-01-20T10:00:00Z")))
                .isInstanceOf(IllegalStateException.class);
    }
}
