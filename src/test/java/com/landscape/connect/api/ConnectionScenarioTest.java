package com.landscape.connect.api;

import com.landscape.connect.core.model.MinimumId;
import com.landscape.connect.dgraph.DistanceGraph;
import com.landscape.connect.dgraph.PathResult;
import com.landscape.connect.storage.InMemoryEntityStore;
import com.landscape.connect.testutil.CountingDistanceFunction;
import com.landscape.connect.testutil.LandscapeFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.landscape.connect.testutil.LandscapeFixtures.id;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Ten minima, five transition states forming two clusters (1-2-3-4 and 5-6-7) and three
 * isolated minima, all admitted.
 */
class ConnectionScenarioTest {

    private InMemoryEntityStore store;
    private CountingDistanceFunction distanceFunction;
    private ConnectionPlanner planner;
    private DistanceGraph graph;

    @BeforeEach
    void setUp() {
        store = LandscapeFixtures.twoClusterStore();
        distanceFunction = new CountingDistanceFunction();
        planner = ConnectionPlanner.builder()
                .entityStore(store)
                .distanceFunction(distanceFunction)
                .options(PlannerOptions.allMinima())
                .build();
        planner.initialize(id(4), id(5));
        graph = planner.getDistanceGraph();
    }

    @Test
    @DisplayName("Every minimum is admitted and only pairs from different clusters need a distance")
    void admission() {
        assertEquals(10, graph.nodeCount());
        assertEquals(45, graph.edgeCount());
        assertEquals(36, distanceFunction.calls());
        assertTrue(graph.checkConsistency().isConsistent());
    }

    @Test
    @DisplayName("A path inside a cluster weighs zero")
    void sameClusterPath() {
        PathResult path = graph.shortestPath(id(1), id(4));

        assertTrue(path.isFound());
        assertEquals(0.0, path.totalWeight());
        assertTrue(planner.nextCandidate(id(1), id(4)).isEmpty());
    }

    @Test
    @DisplayName("The path between the clusters uses no zero-weight edge")
    void crossClusterPath() {
        PathResult path = graph.shortestPath(id(4), id(5));

        assertEquals(List.of(id(4), id(5)), path.nodes());
        assertEquals(49.0, path.totalWeight(), 1e-9);
        assertTrue(path.weights().stream().allMatch(w -> w > 0.0));
    }

    @Test
    @DisplayName("Merging duplicates from different clusters keeps the lower weight to every other minimum")
    void crossClusterMerge() {
        MinimumId keep = id(4);
        MinimumId drop = id(5);
        Map<MinimumId, Double> expected = new HashMap<>();
        for (MinimumId other : graph.nodes()) {
            if (!other.equals(keep) && !other.equals(drop)) {
                expected.put(other, Math.min(
                        graph.weight(keep, other).orElseThrow(),
                        graph.weight(drop, other).orElseThrow()));
            }
        }

        planner.mergeMinima(keep, drop, "duplicate");

        assertEquals(9, graph.nodeCount());
        assertFalse(graph.contains(drop));
        expected.forEach((other, weight) ->
                assertEquals(weight, graph.weight(keep, other).orElseThrow(), "edge to " + other));
        assertEquals(0.0, graph.weight(keep, id(6)).orElseThrow());
        assertTrue(planner.isConnected(id(1), id(7)));

        planner.checkConsistency();
        assertEquals(0.0, graph.shortestPath(id(1), id(7)).totalWeight());
    }

    @Test
    @DisplayName("Closing the session persists every computed distance")
    void closePersists() {
        planner.close();

        assertEquals(36, store.committedDistanceCount());
        assertEquals(0, planner.getCacheStats().pendingWrites());
    }
}
