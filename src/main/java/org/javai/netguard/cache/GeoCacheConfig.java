package org.javai.netguard.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * TTL settings for a {@link GeoCache}.
 *
 * <p>{@code ttl = clamp(baseTtl + baseTtl * accuracyFactor * accuracyMultiplier, minTtl, maxTtl)}
 * where {@code accuracyFactor = max(0, 100 - accuracyMeters) / 100}.
 *
 * @param baseTtl TTL for a sample at or beyond the 100 m reference accuracy
 * @param accuracyMultiplier How much a perfect fix extends the base TTL
 * @param minTtl Lower bound of any TTL
 * @param maxTtl Upper bound of any TTL
 * @param coordinateToleranceDegrees Largest per-axis distance between a request and a stored entry
 */
public record GeoCacheConfig(
        Duration baseTtl,
        double accuracyMultiplier,
        Duration minTtl,
        Duration maxTtl,
        double coordinateToleranceDegrees
) {

    public static final double REFERENCE_ACCURACY_METERS = 100;
    public static final double DEFAULT_COORDINATE_TOLERANCE_DEGREES = 0.001;

    public GeoCacheConfig {
        Objects.requireNonNull(baseTtl, "baseTtl must not be null");
        Objects.requireNonNull(minTtl, "minTtl must not be null");
        Objects.requireNonNull(maxTtl, "maxTtl must not be null");
        if (baseTtl.isNegative() || minTtl.isNegative()) {
            throw new IllegalArgumentException("TTLs must not be negative");
        }
        if (minTtl.compareTo(maxTtl) > 0) {
            throw new IllegalArgumentException("minTtl must not exceed maxTtl: " + minTtl + " > " + maxTtl);
        }
        if (Double.isNaN(accuracyMultiplier) || accuracyMultiplier < 0) {
            throw new IllegalArgumentException("accuracyMultiplier must be >= 0, was: " + accuracyMultiplier);
        }
        if (Double.isNaN(coordinateToleranceDegrees) || coordinateToleranceDegrees < 0) {
            throw new IllegalArgumentException(
                    "coordinateToleranceDegrees must be >= 0, was: " + coordinateToleranceDegrees);
        }
    }

    public GeoCacheConfig(Duration baseTtl, double accuracyMultiplier, Duration minTtl, Duration maxTtl) {
        this(baseTtl, accuracyMultiplier, minTtl, maxTtl, DEFAULT_COORDINATE_TOLERANCE_DEGREES);
    }

    /**
     * Weather data: 10 min base, doubled for a perfect fix, between 5 min and 1 h.
     */
    public static GeoCacheConfig weatherDefaults() {
        return new GeoCacheConfig(Duration.ofMinutes(10), 2, Duration.ofMinutes(5), Duration.ofHours(1));
    }

    /**
     * Location data: 30 min base, 1.5x for a perfect fix, between 10 min and 4 h.
     */
    public static GeoCacheConfig locationDefaults() {
        return new GeoCacheConfig(Duration.ofMinutes(30), 1.5, Duration.ofMinutes(10), Duration.ofHours(4));
    }

    /**
     * Computes the TTL for a sample of the given accuracy. Always within {@code [minTtl, maxTtl]}
     * and never longer for a worse accuracy.
     */
    public Duration ttlFor(double accuracyMeters) {
        double accuracyFactor = Math.max(0, REFERENCE_ACCURACY_METERS - accuracyMeters) / REFERENCE_ACCURACY_METERS;
        double base = baseTtl.toMillis();
        long ttl = Math.round(base + base * accuracyFactor * accuracyMultiplier);
        long clamped = Math.min(Math.max(ttl, minTtl.toMillis()), maxTtl.toMillis());
        return Duration.ofMillis(clamped);
    }
}
