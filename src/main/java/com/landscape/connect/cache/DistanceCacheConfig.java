package com.landscape.connect.cache;

/**
 * Configuration for the distance cache.
 *
 * @param flushThreshold number of pending distances that triggers a bulk write
 * @param deferWrites    whether new distances are buffered (true) or written through at once
 */
public record DistanceCacheConfig(int flushThreshold, boolean deferWrites) {

    public static final int DEFAULT_FLUSH_THRESHOLD = 300;

    public DistanceCacheConfig {
        if (flushThreshold <= 0) {
            throw new IllegalArgumentException("flushThreshold must be > 0");
        }
    }

    /**
     * Default configuration: buffered writes flushed every 300 new distances.
     */
    public static DistanceCacheConfig defaults() {
        return new DistanceCacheConfig(DEFAULT_FLUSH_THRESHOLD, true);
    }

    /**
     * Every new distance is written to the store immediately.
     */
    public static DistanceCacheConfig writeThrough() {
        return new DistanceCacheConfig(1, false);
    }
}
