package org.javai.netguard.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A cached value with the facts needed to judge its freshness.
 *
 * @param value The cached value
 * @param capturedAt When the value was stored
 * @param sampleAccuracyMeters Accuracy of the position the value was fetched for
 * @param ttl How long the value stays valid
 * @param keyCoordinates The unrounded position the value was fetched for
 */
public record CacheEntry<T>(
        T value,
        Instant capturedAt,
        double sampleAccuracyMeters,
        Duration ttl,
        Coordinates keyCoordinates
) {

    public CacheEntry {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        Objects.requireNonNull(ttl, "ttl must not be null");
        Objects.requireNonNull(keyCoordinates, "keyCoordinates must not be null");
    }

    public long ttlMs() {
        return ttl.toMillis();
    }

    public Duration age(Instant now) {
        return Duration.between(capturedAt, now);
    }

    /**
     * An entry is fresh while {@code now - capturedAt < ttl}.
     */
    public boolean isFresh(Instant now) {
        return age(now).compareTo(ttl) < 0;
    }
}
