package org.javai.netguard.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory cache of location-dependent values whose TTL grows with the accuracy of the
 * position sample they were fetched for.
 *
 * <p>Entries are keyed by coordinates rounded to four decimal places plus an optional
 * parameter fingerprint, so nearby requests share an entry. A lookup only hits while the
 * entry is fresh and the requested position lies within the configured tolerance of the
 * stored one; expired or out-of-tolerance entries are removed on lookup.
 *
 * <p>Thread-safe. Values must be immutable or treated as read-only by callers.
 */
public final class GeoCache<T> implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(GeoCache.class);

    /**
     * Accuracy assumed for samples that report none (NaN, infinite or negative).
     */
    public static final double UNKNOWN_ACCURACY_METERS = GeoCacheConfig.REFERENCE_ACCURACY_METERS;

    /**
     * A hit requested with a sample this much more accurate than the stored one is logged.
     */
    static final double ACCURACY_IMPROVEMENT_THRESHOLD_METERS = 20;

    private final String name;
    private final GeoCacheConfig config;
    private final Clock clock;
    private final Map<CacheKey, CacheEntry<T>> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private boolean closed;

    public GeoCache(String name, GeoCacheConfig config) {
        this(name, config, Clock.systemUTC());
    }

    public GeoCache(String name, GeoCacheConfig config, Clock clock) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public String name() {
        return name;
    }

    public GeoCacheConfig config() {
        return config;
    }

    public Optional<T> get(Coordinates coordinates, double accuracyMeters) {
        return get(coordinates, accuracyMeters, Map.of());
    }

    /**
     * Returns the cached value for a request, if a fresh entry within tolerance exists.
     *
     * @param coordinates the requested position
     * @param accuracyMeters accuracy of the requested position; does not affect the lookup
     * @param params request parameters that are part of the key
     */
    public Optional<T> get(Coordinates coordinates, double accuracyMeters, Map<String, ?> params) {
        return getEntry(coordinates, accuracyMeters, params).map(CacheEntry::value);
    }

    /**
     * Like {@link #get(Coordinates, double, Map)} but returns the whole entry.
     */
    public Optional<CacheEntry<T>> getEntry(Coordinates coordinates, double accuracyMeters, Map<String, ?> params) {
        CacheKey key = CacheKey.of(coordinates, params);
        lock.lock();
        try {
            ensureOpen();
            CacheEntry<T> entry = entries.get(key);
            if (entry == null) {
                LOG.debug("[{}] miss for {}", name, key);
                return Optional.empty();
            }
            Instant now = clock.instant();
            if (!entry.isFresh(now)) {
                entries.remove(key);
                LOG.debug("[{}] expired entry for {} (age {} ms, ttl {} ms)",
                        name, key, entry.age(now).toMillis(), entry.ttlMs());
                return Optional.empty();
            }
            if (!entry.keyCoordinates().isWithin(coordinates, config.coordinateToleranceDegrees())) {
                entries.remove(key);
                LOG.debug("[{}] entry for {} out of tolerance of requested position", name, key);
                return Optional.empty();
            }
            double requested = effectiveAccuracy(accuracyMeters);
            if (entry.sampleAccuracyMeters() - requested > ACCURACY_IMPROVEMENT_THRESHOLD_METERS) {
                LOG.debug("[{}] request for {} is more accurate than cached entry ({} m vs {} m), may need refresh",
                        name, key, requested, entry.sampleAccuracyMeters());
            }
            LOG.debug("[{}] hit for {} (age {} ms)", name, key, entry.age(now).toMillis());
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    public CacheEntry<T> put(Coordinates coordinates, double accuracyMeters, T value) {
        return put(coordinates, accuracyMeters, value, Map.of());
    }

    /**
     * Stores a value, replacing any entry under the same key.
     *
     * @return the stored entry
     */
    public CacheEntry<T> put(Coordinates coordinates, double accuracyMeters, T value, Map<String, ?> params) {
        Objects.requireNonNull(value, "value must not be null");
        CacheKey key = CacheKey.of(coordinates, params);
        double accuracy = effectiveAccuracy(accuracyMeters);
        Duration ttl = config.ttlFor(accuracy);
        CacheEntry<T> entry = new CacheEntry<>(value, clock.instant(), accuracy, ttl, coordinates);
        lock.lock();
        try {
            ensureOpen();
            entries.put(key, entry);
            LOG.debug("[{}] stored {} (accuracy {} m, ttl {} ms)", name, key, accuracy, ttl.toMillis());
            return entry;
        } finally {
            lock.unlock();
        }
    }

    public boolean invalidate(Coordinates coordinates) {
        return invalidate(coordinates, Map.of());
    }

    /**
     * Removes the entry for a request.
     *
     * @return whether an entry was removed
     */
    public boolean invalidate(Coordinates coordinates, Map<String, ?> params) {
        CacheKey key = CacheKey.of(coordinates, params);
        lock.lock();
        try {
            ensureOpen();
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return the number of entries removed
     */
    public int sweep() {
        lock.lock();
        try {
            ensureOpen();
            Instant now = clock.instant();
            int removed = 0;
            Iterator<CacheEntry<T>> it = entries.values().iterator();
            while (it.hasNext()) {
                if (!it.next().isFresh(now)) {
                    it.remove();
                    removed++;
                }
            }
            if (removed > 0) {
                LOG.debug("[{}] swept {} expired entries", name, removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            ensureOpen();
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of stored entries, expired ones included until they are swept or looked up.
     */
    public int size() {
        lock.lock();
        try {
            ensureOpen();
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            ensureOpen();
            Instant now = clock.instant();
            List<CacheStats.EntryStats> stats = new ArrayList<>(entries.size());
            entries.forEach((key, entry) -> stats.add(new CacheStats.EntryStats(
                    key.value(),
                    entry.age(now),
                    entry.sampleAccuracyMeters(),
                    entry.ttl(),
                    entry.isFresh(now))));
            return new CacheStats(stats.size(), stats);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops all entries. Further reads and writes fail with {@link IllegalStateException}.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            entries.clear();
            closed = true;
        } finally {
            lock.unlock();
        }
    }

    static double effectiveAccuracy(double accuracyMeters) {
        return !Double.isFinite(accuracyMeters) || accuracyMeters < 0 ? UNKNOWN_ACCURACY_METERS : accuracyMeters;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Cache [" + name + "] is closed");
        }
    }
}
