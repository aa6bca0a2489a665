package org.javai.netguard.config;

import org.javai.netguard.network.LinkType;
import org.javai.netguard.network.NetworkStatus;
import org.javai.netguard.network.StatusMonitor;
import org.javai.netguard.retry.RetryPolicy;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Derives retry, timeout, caching and location-sampling parameters from link quality.
 *
 * <ul>
 *   <li>Offline: zero attempts and a minimal timeout, so callers fall back to cached data at once.</li>
 *   <li>Online: richer links get longer timeouts, more attempts and shorter base delays
 *       (wired &gt; wifi &gt; cellular &gt; unknown).</li>
 *   <li>Degraded: timeout and attempts reduced, base delay and backoff growth increased.</li>
 * </ul>
 *
 * <p>Every call builds a new immutable {@link RetryPolicy}.
 */
public final class AdaptiveConfigProvider {

    static final Duration OFFLINE_TIMEOUT = Duration.ofSeconds(1);
    static final double BACKOFF_MULTIPLIER = 1.5;
    static final double DEGRADED_BACKOFF_MULTIPLIER = 2.0;
    static final long DEGRADED_MAX_BASE_DELAY_MS = 2000;

    private final StatusMonitor monitor;
    private final RetryPolicy override;

    public AdaptiveConfigProvider(StatusMonitor monitor) {
        this(monitor, null);
    }

    /**
     * @param monitor Source of the current status for the {@code current*} shortcuts
     * @param override Policy used instead of the adaptive one while online (may be null)
     */
    public AdaptiveConfigProvider(StatusMonitor monitor, RetryPolicy override) {
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
        this.override = override;
    }

    /**
     * Returns the retry policy for the given status.
     */
    public RetryPolicy policyFor(NetworkStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        if (!status.online()) {
            return RetryPolicy.noAttempts("adaptive-offline");
        }
        if (override != null) {
            return override;
        }
        Tier tier = tierFor(status);
        return new RetryPolicy(
                policyId(status),
                tier.maxAttempts(),
                tier.baseDelayMs(),
                tier.maxDelayMs(),
                status.degraded() ? DEGRADED_BACKOFF_MULTIPLIER : BACKOFF_MULTIPLIER);
    }

    /**
     * Returns the per-attempt transport timeout for the given status.
     */
    public Duration requestTimeoutFor(NetworkStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        if (!status.online()) {
            return OFFLINE_TIMEOUT;
        }
        return Duration.ofMillis(tierFor(status).timeoutMs());
    }

    /**
     * Returns the location-sampling parameters for the given status.
     */
    public FetchParams fetchParamsFor(NetworkStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        if (!status.online()) {
            return new FetchParams(Duration.ofSeconds(5), Duration.ofSeconds(5), 50, SamplingAccuracy.BALANCED);
        }
        if (status.degraded() || status.linkType() == LinkType.CELLULAR) {
            return new FetchParams(Duration.ofSeconds(15), Duration.ofSeconds(10), 15, SamplingAccuracy.HIGH);
        }
        if (status.linkType() == LinkType.WIFI || status.linkType() == LinkType.WIRED) {
            return new FetchParams(Duration.ofSeconds(25), Duration.ofSeconds(20), 3, SamplingAccuracy.HIGHEST);
        }
        return new FetchParams(Duration.ofSeconds(20), Duration.ofSeconds(15), 5, SamplingAccuracy.HIGHEST);
    }

    /**
     * Returns how eagerly cached data should be preferred: aggressively when offline or degraded,
     * minimally on wifi or wired links, balanced otherwise.
     */
    public CacheStrategy cacheStrategyFor(NetworkStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        if (!status.online() || status.degraded()) {
            return CacheStrategy.AGGRESSIVE;
        }
        if (status.linkType() == LinkType.WIFI || status.linkType() == LinkType.WIRED) {
            return CacheStrategy.MINIMAL;
        }
        return CacheStrategy.BALANCED;
    }

    public RetryPolicy currentPolicy() {
        return policyFor(monitor.current());
    }

    public Duration currentRequestTimeout() {
        return requestTimeoutFor(monitor.current());
    }

    public FetchParams currentFetchParams() {
        return fetchParamsFor(monitor.current());
    }

    public CacheStrategy currentCacheStrategy() {
        return cacheStrategyFor(monitor.current());
    }

    public Optional<RetryPolicy> override() {
        return Optional.ofNullable(override);
    }

    private static Tier tierFor(NetworkStatus status) {
        Tier tier = switch (status.linkType()) {
            case WIRED -> new Tier(12_000, 5, 200, 25_000);
            case WIFI -> new Tier(10_000, 4, 300, 20_000);
            case CELLULAR -> new Tier(8_000, 3, 500, 15_000);
            case UNKNOWN -> new Tier(6_000, 2, 1_000, 10_000);
        };
        return status.degraded() ? tier.degraded() : tier;
    }

    private static String policyId(NetworkStatus status) {
        String link = status.linkType().name().toLowerCase(Locale.ROOT);
        return status.degraded() ? "adaptive-" + link + "-degraded" : "adaptive-" + link;
    }

    private record Tier(long timeoutMs, int maxAttempts, long baseDelayMs, long maxDelayMs) {

        Tier degraded() {
            return new Tier(
                    timeoutMs * 3 / 4,
                    Math.max(maxAttempts - 1, 1),
                    Math.min(baseDelayMs * 2, DEGRADED_MAX_BASE_DELAY_MS),
                    maxDelayMs);
        }
    }
}
