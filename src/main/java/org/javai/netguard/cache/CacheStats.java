package org.javai.netguard.cache;

import java.time.Duration;
import java.util.List;

/**
 * Point-in-time view of a {@link GeoCache}.
 */
public record CacheStats(int size, List<EntryStats> entries) {

    public CacheStats {
        entries = List.copyOf(entries);
    }

    public record EntryStats(String key, Duration age, double accuracyMeters, Duration ttl, boolean fresh) {
    }
}
