package com.landscape.connect.cache;

import com.landscape.connect.core.model.DistanceEntry;
import com.landscape.connect.core.model.MinimumPair;
import com.landscape.connect.distance.DistanceComputationException;
import com.landscape.connect.distance.DistanceFunction;
import com.landscape.connect.metrics.NoOpMetricsService;
import com.landscape.connect.storage.EntityStore;
import com.landscape.connect.storage.InMemoryEntityStore;
import com.landscape.connect.storage.StoreException;
import com.landscape.connect.testutil.CountingDistanceFunction;
import com.landscape.connect.testutil.LandscapeFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static com.landscape.connect.testutil.LandscapeFixtures.id;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

class DistanceCacheTest {

    private InMemoryEntityStore store;
    private CountingDistanceFunction distanceFunction;
    private DistanceCache cache;

    @BeforeEach
    void setUp() {
        store = LandscapeFixtures.storeWithPoints(new double[][]{{0, 0}, {3, 4}, {6, 8}, {0, 1}});
        distanceFunction = new CountingDistanceFunction();
        cache = new DistanceCache(store, distanceFunction, new DistanceCacheConfig(3, true), new NoOpMetricsService());
    }

    @Nested
    @DisplayName("Lookups")
    class LookupTests {

        @Test
        @DisplayName("get never computes a missing distance")
        void getDoesNotCompute() {
            DistanceFunction mockFunction = mock(DistanceFunction.class);
            DistanceCache lookupOnly = new DistanceCache(store, mockFunction);

            assertTrue(lookupOnly.get(id(1), id(2)).isEmpty());
            verifyNoInteractions(mockFunction);
        }

        @Test
        @DisplayName("Distance from a minimum to itself is zero")
        void selfDistance() {
            assertEquals(OptionalDouble.of(0.0), cache.get(id(2), id(2)));
            assertEquals(0.0, cache.getOrCompute(id(2), id(2)));
            assertEquals(0, distanceFunction.calls());
        }

        @Test
        @DisplayName("getOrCompute computes once and is symmetric")
        void computeOnceSymmetric() {
            assertEquals(5.0, cache.getOrCompute(id(1), id(2)), 1e-12);
            assertEquals(5.0, cache.getOrCompute(id(2), id(1)), 1e-12);
            assertEquals(OptionalDouble.of(5.0), cache.get(id(2), id(1)));

            assertEquals(1, distanceFunction.calls());
            assertEquals(1, cache.getStats().computedCount());
            assertTrue(cache.contains(id(2), id(1)));
        }

        @Test
        @DisplayName("A failing distance function is reported and nothing is cached")
        void failingFunction() {
            DistanceCache failing = new DistanceCache(store, (a, b) -> {
                throw new IllegalStateException("alignment diverged");
            });

            DistanceComputationException e = assertThrows(DistanceComputationException.class,
                    () -> failing.getOrCompute(id(1), id(2)));
            assertInstanceOf(IllegalStateException.class, e.getCause());
            assertFalse(failing.contains(id(1), id(2)));
            assertEquals(0, failing.pendingCount());
        }

        @Test
        @DisplayName("Computing against an unknown minimum fails")
        void unknownMinimum() {
            assertThrows(StoreException.class, () -> cache.getOrCompute(id(1), id(99)));
        }

        @Test
        @DisplayName("Recording keeps the first value for a pair")
        void recordKeepsFirst() {
            cache.record(id(1), id(3), 10.0);
            cache.record(id(3), id(1), 12.0);

            assertEquals(OptionalDouble.of(10.0), cache.get(id(1), id(3)));
            assertEquals(1, cache.pendingCount());
        }

        @Test
        @DisplayName("Hits and misses are counted, contains is not")
        void stats() {
            cache.getOrCompute(id(1), id(2));
            cache.getOrCompute(id(2), id(1));
            cache.get(id(1), id(2));
            cache.get(id(1), id(3));
            cache.contains(id(1), id(4));

            CacheStats stats = cache.getStats();
            assertEquals(2, stats.hitCount());
            assertEquals(2, stats.missCount());
            assertEquals(1, stats.size());
            assertEquals(0.5, stats.hitRate(), 1e-12);
        }
    }

    @Nested
    @DisplayName("Persistence")
    class PersistenceTests {

        @Test
        @DisplayName("warm loads every persisted distance")
        void warmLoads() {
            store.bulkWriteDistances(List.of(
                    DistanceEntry.of(id(1), id(2), 5.0),
                    DistanceEntry.of(id(2), id(3), 5.0)));

            assertEquals(2, cache.warm());
            assertEquals(OptionalDouble.of(5.0), cache.get(id(3), id(2)));
            assertEquals(0, cache.pendingCount());
            assertEquals(0, distanceFunction.calls());
        }

        @Test
        @DisplayName("Pending distances are flushed once the threshold is reached")
        void flushAtThreshold() {
            cache.getOrCompute(id(1), id(2));
            cache.getOrCompute(id(1), id(3));
            assertEquals(0, cache.flushPending(false));
            assertEquals(0, store.committedDistanceCount());

            cache.getOrCompute(id(1), id(4));
            assertEquals(3, cache.flushPending(false));

            assertEquals(3, store.committedDistanceCount());
            assertEquals(0, cache.pendingCount());
            assertEquals(1, store.bulkWriteCount());
        }

        @Test
        @DisplayName("A forced flush writes whatever is pending")
        void forcedFlush() {
            cache.getOrCompute(id(1), id(2));

            assertEquals(1, cache.flushPending(true));
            assertEquals(0, cache.flushPending(true));
            assertEquals(Optional.of(5.0), store.committedDistance(id(1), id(2)));
        }

        @Test
        @DisplayName("A failed flush leaves the pending buffer intact")
        void failedFlushKeepsBuffer() {
            EntityStore failingStore = mock(EntityStore.class);
            when(failingStore.requireMinimum(any())).thenAnswer(inv -> store.requireMinimum(inv.getArgument(0)));
            doThrow(new StoreException("disk full")).when(failingStore).bulkWriteDistances(anyCollection());
            DistanceCache failing = new DistanceCache(failingStore, distanceFunction);

            failing.getOrCompute(id(1), id(2));
            assertThrows(StoreException.class, () -> failing.flushPending(true));

            assertEquals(1, failing.pendingCount());
            assertTrue(failing.contains(id(1), id(2)));
        }

        @Test
        @DisplayName("Write-through mode persists every new distance at once")
        void writeThrough() {
            DistanceCache direct = new DistanceCache(store, distanceFunction,
                    DistanceCacheConfig.writeThrough(), new NoOpMetricsService());

            direct.getOrCompute(id(1), id(2));

            assertEquals(0, direct.pendingCount());
            assertEquals(Optional.of(5.0), store.committedDistance(id(1), id(2)));
        }

        @Test
        @DisplayName("Config rejects a non-positive flush threshold")
        void configValidation() {
            assertThrows(IllegalArgumentException.class, () -> new DistanceCacheConfig(0, true));
            assertEquals(DistanceCacheConfig.DEFAULT_FLUSH_THRESHOLD, DistanceCacheConfig.defaults().flushThreshold());
        }
    }

    @Nested
    @DisplayName("Undo support")
    class UndoTests {

        @Test
        @DisplayName("discard forgets a distance in memory and in the buffer")
        void discard() {
            cache.getOrCompute(id(1), id(2));

            cache.discard(MinimumPair.of(1, 2));

            assertFalse(cache.contains(id(1), id(2)));
            assertEquals(0, cache.pendingCount());
        }

        @Test
        @DisplayName("restorePending brings back flushed entries that are still cached")
        void restorePending() {
            cache.getOrCompute(id(1), id(2));
            cache.getOrCompute(id(1), id(3));
            Map<MinimumPair, Double> snapshot = cache.snapshotPending();

            cache.flushPending(true);
            cache.discard(MinimumPair.of(1, 3));
            cache.restorePending(snapshot);

            assertEquals(1, cache.pendingCount());
            assertEquals(Map.of(MinimumPair.of(1, 2), 5.0), cache.snapshotPending());
        }
    }

    @Nested
    @DisplayName("Merging")
    class MergeTests {

        @Test
        @DisplayName("Entries of the dropped minimum are repointed to the kept one")
        void repoints() {
            cache.record(id(2), id(3), 5.0);
            cache.record(id(2), id(1), 5.0);

            cache.onMerge(id(1), id(2));

            assertEquals(OptionalDouble.of(5.0), cache.get(id(1), id(3)));
            assertFalse(cache.contains(id(2), id(3)));
            assertFalse(cache.contains(id(1), id(2)));
            assertEquals(Map.of(MinimumPair.of(1, 3), 5.0), cache.snapshotPending());
        }

        @Test
        @DisplayName("An existing distance of the kept minimum wins")
        void keepWins() {
            cache.record(id(1), id(3), 10.0);
            cache.record(id(2), id(3), 5.0);

            cache.onMerge(id(1), id(2));

            assertEquals(OptionalDouble.of(10.0), cache.get(id(1), id(3)));
            assertEquals(1, cache.size());
            assertEquals(1, cache.pendingCount());
        }
    }
}
