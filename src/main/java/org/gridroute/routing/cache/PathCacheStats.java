package org.gridroute.routing.cache;

/**
 * Snapshot of {@link PathCache} counters.
 *
 * @param size stored entries.
 * @param capacity configured maximum entries.
 * @param hits successful lookups since the last clear.
 * @param misses failed lookups since the last clear.
 * @param rejectedInserts offers dropped because the cache was full.
 */
public record PathCacheStats(int size, int capacity, long hits, long misses, long rejectedInserts) {

    public boolean saturated() {
        return size >= capacity;
    }
}
