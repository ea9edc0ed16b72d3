package org.gridroute.routing.cache;

import lombok.extern.slf4j.Slf4j;
import org.gridroute.routing.grid.Grid;
import org.gridroute.routing.grid.GridFingerprint;
import org.gridroute.routing.grid.Path;
import org.gridroute.routing.grid.Point;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide memo of point-to-point shortest paths.
 *
 * <p>Keys are {@code (grid fingerprint, start, end)}. A key always maps to the same path
 * for a deterministic search, so entries never go stale and are never evicted.</p>
 *
 * <p><strong>Capacity policy:</strong> insert-only up to {@link #capacity()} entries. Once
 * full, further offers are rejected and callers keep their freshly computed result;
 * existing entries stay readable until {@link #clear()}.</p>
 *
 * <p>Thread-safe. Lookups are lock-free. Inserts and {@link #clear()} share one monitor so
 * the capacity check and the insert happen atomically.</p>
 */
@Slf4j
public final class PathCache {
    public static final int DEFAULT_CAPACITY = 1_000;

    private final int capacity;
    private final ConcurrentMap<Key, Path> entries = new ConcurrentHashMap<>();
    private final Object insertLock = new Object();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder rejectedInserts = new LongAdder();
    private boolean saturationReported;

    /**
     * Creates an empty cache.
     *
     * @param capacity maximum number of stored entries (must be positive).
     */
    public PathCache(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    public static PathCache withDefaultCapacity() {
        return new PathCache(DEFAULT_CAPACITY);
    }

    /**
     * Returns the cached path for a key, recording a hit or miss.
     */
    public Optional<Path> lookup(Key key) {
        Objects.requireNonNull(key, "key");
        Path path = entries.get(key);
        if (path == null) {
            misses.increment();
            return Optional.empty();
        }
        hits.increment();
        return Optional.of(path);
    }

    /**
     * Offers a computed path for storage.
     *
     * @param key cache key the path was computed for.
     * @param path computed path; its endpoints must match the key.
     * @return {@code true} if the entry is present after the call, {@code false} if it was
     * rejected because the cache is full.
     * @throws IllegalArgumentException when the path endpoints do not match the key.
     */
    public boolean offer(Key key, Path path) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(path, "path");
        if (!path.start().equals(key.start()) || !path.end().equals(key.end())) {
            throw new IllegalArgumentException(
                    "path " + path.start() + " -> " + path.end() + " does not match key " + key.start() + " -> " + key.end()
            );
        }
        if (entries.containsKey(key)) {
            return true;
        }
        synchronized (insertLock) {
            if (entries.containsKey(key)) {
                return true;
            }
            if (entries.size() >= capacity) {
                rejectedInserts.increment();
                if (!saturationReported) {
                    saturationReported = true;
                    log.warn("Path cache reached capacity {}; new results will not be stored", capacity);
                }
                return false;
            }
            entries.put(key, path);
            return true;
        }
    }

    /**
     * Drops every entry and resets counters.
     */
    public void clear() {
        int dropped;
        synchronized (insertLock) {
            dropped = entries.size();
            entries.clear();
            saturationReported = false;
            hits.reset();
            misses.reset();
            rejectedInserts.reset();
        }
        log.info("Path cache cleared ({} entries dropped)", dropped);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }

    public boolean isFull() {
        return entries.size() >= capacity;
    }

    /**
     * Point-in-time counters snapshot.
     */
    public PathCacheStats stats() {
        return new PathCacheStats(entries.size(), capacity, hits.sum(), misses.sum(), rejectedInserts.sum());
    }

    /**
     * Cache key: grid content plus ordered endpoints.
     *
     * @param grid content fingerprint of the searched grid.
     * @param start search origin.
     * @param end search destination.
     */
    public record Key(GridFingerprint grid, Point start, Point end) {
        public Key {
            Objects.requireNonNull(grid, "grid");
            Objects.requireNonNull(start, "start");
            Objects.requireNonNull(end, "end");
        }

        public static Key of(Grid grid, Point start, Point end) {
            return new Key(Objects.requireNonNull(grid, "grid").fingerprint(), start, end);
        }
    }
}
