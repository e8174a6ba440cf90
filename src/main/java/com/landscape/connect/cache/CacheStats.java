package com.landscape.connect.cache;

/**
 * Distance cache metrics.
 *
 * @param hitCount      lookups answered from memory
 * @param missCount     lookups that found nothing
 * @param computedCount distances computed by the distance function
 * @param size          current number of cached distances
 * @param pendingWrites distances not yet written to the store
 */
public record CacheStats(long hitCount, long missCount, long computedCount, long size, int pendingWrites) {

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = hitCount + missCount;
        return total == 0 ? 0.0 : (double) hitCount / total;
    }
}
