package com.landscape.connect.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.landscape.connect.core.model.DistanceEntry;
import com.landscape.connect.core.model.MinimumId;
import com.landscape.connect.core.model.MinimumPair;
import com.landscape.connect.distance.Alignment;
import com.landscape.connect.distance.DistanceComputationException;
import com.landscape.connect.distance.DistanceFunction;
import com.landscape.connect.metrics.MetricsService;
import com.landscape.connect.metrics.NoOpMetricsService;
import com.landscape.connect.storage.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentMap;

/**
 * Memoized pairwise distances between minima, backed by deferred bulk persistence.
 *
 * <p>Entries are never evicted: once computed, a distance is treated as immutable truth
 * and relevance pruning relies on cache residency. Newly computed distances accumulate
 * in a pending buffer that {@link #flushPending(boolean)} writes to the store in bulk.
 * Implements {@link MergeListener} to repoint entries of a merged-away minimum.</p>
 */
public class DistanceCache implements MergeListener {
    private static final Logger log = LoggerFactory.getLogger(DistanceCache.class);

    private final EntityStore store;
    private final DistanceFunction distanceFunction;
    private final DistanceCacheConfig config;
    private final MetricsService metrics;
    private final Cache<MinimumPair, Double> cache;
    private final Map<MinimumPair, Double> pending = new LinkedHashMap<>();
    private long computed;

    public DistanceCache(EntityStore store, DistanceFunction distanceFunction) {
        this(store, distanceFunction, DistanceCacheConfig.defaults(), new NoOpMetricsService());
    }

    public DistanceCache(EntityStore store, DistanceFunction distanceFunction,
                         DistanceCacheConfig config, MetricsService metrics) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.distanceFunction = Objects.requireNonNull(distanceFunction, "distanceFunction is required");
        this.config = Objects.requireNonNull(config, "config is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.cache = Caffeine.newBuilder()
                .recordStats()
                .build();
        log.info("DistanceCache initialized: flushThreshold={}, deferWrites={}",
                config.flushThreshold(), config.deferWrites());
    }

    /**
     * Loads every persisted distance into memory.
     *
     * @return number of entries loaded
     */
    public int warm() {
        List<DistanceEntry> entries = store.allDistances();
        ConcurrentMap<MinimumPair, Double> view = cache.asMap();
        for (DistanceEntry entry : entries) {
            view.putIfAbsent(entry.pair(), entry.distance());
        }
        log.info("cache.warmed entries={}", entries.size());
        return entries.size();
    }

    /**
     * Looks up a distance without ever computing it.
     */
    public OptionalDouble get(MinimumId a, MinimumId b) {
        if (a.equals(b)) {
            return OptionalDouble.of(0.0);
        }
        Double distance = cache.getIfPresent(MinimumPair.of(a, b));
        if (distance == null) {
            metrics.recordCacheMiss();
            return OptionalDouble.empty();
        }
        metrics.recordCacheHit();
        return OptionalDouble.of(distance);
    }

    /**
     * Checks residency without touching hit/miss statistics.
     */
    public boolean contains(MinimumId a, MinimumId b) {
        return a.equals(b) || cache.asMap().containsKey(MinimumPair.of(a, b));
    }

    /**
     * Returns the cached distance, computing and recording it if absent.
     * This is the only place new distances are computed.
     *
     * @throws DistanceComputationException if the distance function fails
     */
    public double getOrCompute(MinimumId a, MinimumId b) {
        OptionalDouble known = get(a, b);
        if (known.isPresent()) {
            return known.getAsDouble();
        }
        double[] coordsA = store.requireMinimum(a).getCoordinates();
        double[] coordsB = store.requireMinimum(b).getCoordinates();
        Alignment alignment;
        try {
            alignment = distanceFunction.align(coordsA, coordsB);
        } catch (DistanceComputationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DistanceComputationException("Distance between " + a + " and " + b + " failed", e);
        }
        if (alignment == null) {
            throw new DistanceComputationException("Distance function returned no alignment for " + a + ", " + b);
        }
        synchronized (this) {
            computed++;
        }
        metrics.incrementDistanceComputed();
        log.debug("cache.computed minimum1={} minimum2={} distance={}", a, b, alignment.distance());
        record(a, b, alignment.distance());
        return alignment.distance();
    }

    /**
     * Records a distance. A pair that already has a value keeps it.
     */
    public synchronized void record(MinimumId a, MinimumId b, double distance) {
        DistanceEntry entry = DistanceEntry.of(a, b, distance);
        if (cache.asMap().putIfAbsent(entry.pair(), entry.distance()) != null) {
            return;
        }
        if (config.deferWrites()) {
            pending.put(entry.pair(), entry.distance());
        } else {
            store.writeDistance(entry);
        }
    }

    /**
     * Writes pending distances to the store when {@code force} is set or the buffer has
     * reached the flush threshold. On failure the buffer is left intact.
     *
     * @return number of distances written
     */
    public synchronized int flushPending(boolean force) {
        int count = pending.size();
        if (count == 0) {
            return 0;
        }
        if (!force && count < config.flushThreshold()) {
            return 0;
        }
        List<DistanceEntry> batch = new ArrayList<>(count);
        pending.forEach((pair, d) -> batch.add(new DistanceEntry(pair, d)));
        store.bulkWriteDistances(batch);
        pending.clear();
        metrics.recordFlush(count);
        log.info("cache.flushed distances={} forced={}", count, force);
        return count;
    }

    /**
     * Forgets a distance, both in memory and in the pending buffer.
     * Used to undo the cache side of a rolled-back admission.
     */
    public synchronized void discard(MinimumPair pair) {
        cache.invalidate(pair);
        pending.remove(pair);
    }

    /**
     * Returns a copy of the pending buffer.
     */
    public synchronized Map<MinimumPair, Double> snapshotPending() {
        return new LinkedHashMap<>(pending);
    }

    /**
     * Puts entries of an earlier snapshot back into the pending buffer, for when a flush
     * went into a store transaction that was later rolled back. Discarded pairs stay out.
     */
    public synchronized void restorePending(Map<MinimumPair, Double> snapshot) {
        ConcurrentMap<MinimumPair, Double> view = cache.asMap();
        snapshot.forEach((pair, d) -> {
            if (view.containsKey(pair)) {
                pending.putIfAbsent(pair, d);
            }
        });
    }

    @Override
    public synchronized void onMerge(MinimumId keep, MinimumId drop) {
        Map<MinimumPair, Double> movedPending = new LinkedHashMap<>();
        pending.entrySet().removeIf(entry -> {
            if (!entry.getKey().contains(drop)) {
                return false;
            }
            MinimumId partner = entry.getKey().other(drop);
            if (!partner.equals(keep)) {
                movedPending.put(MinimumPair.of(keep, partner), entry.getValue());
            }
            return true;
        });

        ConcurrentMap<MinimumPair, Double> view = cache.asMap();
        int moved = 0;
        for (MinimumPair pair : new ArrayList<>(view.keySet())) {
            if (!pair.contains(drop)) {
                continue;
            }
            Double distance = view.remove(pair);
            MinimumId partner = pair.other(drop);
            if (distance != null && !partner.equals(keep)
                    && view.putIfAbsent(MinimumPair.of(keep, partner), distance) == null) {
                moved++;
            }
        }
        movedPending.forEach((pair, d) -> {
            if (d.equals(view.get(pair))) {
                pending.putIfAbsent(pair, d);
            }
        });
        log.debug("cache.repointed keep={} drop={} moved={}", keep, drop, moved);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    public long size() {
        return cache.asMap().size();
    }

    public synchronized CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                computed,
                cache.asMap().size(),
                pending.size()
        );
    }

    public DistanceCacheConfig getConfig() {
        return config;
    }
}
