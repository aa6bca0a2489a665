package org.javai.netguard.config;

/**
 * How eagerly callers should rely on cached data instead of fetching.
 */
public enum CacheStrategy {
    /** Prefer cached data whenever a fresh entry exists; offline or degraded links. */
    AGGRESSIVE,
    /** Use cached data within its TTL. */
    BALANCED,
    /** Fetch readily; fast links where a round trip is cheap. */
    MINIMAL
}
