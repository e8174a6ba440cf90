package com.landscape.connect.dgraph;

import com.landscape.connect.cache.DistanceCache;
import com.landscape.connect.core.model.MinimumId;
import com.landscape.connect.core.model.MinimumPair;
import com.landscape.connect.graph.ConnectivityGraph;
import com.landscape.connect.logging.LogContext;
import com.landscape.connect.metrics.MetricsService;
import com.landscape.connect.metrics.NoOpMetricsService;
import com.landscape.connect.storage.StoreTransaction;
import com.landscape.connect.storage.TransactionScope;
import com.landscape.connect.transaction.CompensatingTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Complete weighted graph over the admitted subset of known minima, used to plan which
 * pair of minima to try to connect next.
 *
 * <p>Edge weights follow {@link EdgeWeights}: zero for pairs joined by transition states,
 * {@code d²} for pairs at cached distance {@code d}, and {@link EdgeWeights#INF_WEIGHT}
 * for pairs that should not be retried. The lowest-weight path between two minima of the
 * same connected component must weigh zero; {@link #checkConsistency()} detects and
 * repairs violations caused by connectivity changes made behind this graph's back.</p>
 *
 * <p>Not thread-safe. {@code ConnectionPlanner} serializes every call.</p>
 */
public class DistanceGraph {
    private static final Logger log = LoggerFactory.getLogger(DistanceGraph.class);

    private final Map<MinimumId, Map<MinimumId, Double>> adjacency = new LinkedHashMap<>();
    private final ShortestPathFinder pathFinder = new ShortestPathFinder(adjacency);
    private final DistanceCache cache;
    private final TransactionScope transactionScope;
    private final MetricsService metrics;
    private ConnectivityGraph connectivity;
    private int consecutiveInconsistentPasses;

    public DistanceGraph(ConnectivityGraph connectivity, DistanceCache cache, TransactionScope transactionScope) {
        this(connectivity, cache, transactionScope, new NoOpMetricsService());
    }

    public DistanceGraph(ConnectivityGraph connectivity, DistanceCache cache,
                         TransactionScope transactionScope, MetricsService metrics) {
        this.connectivity = Objects.requireNonNull(connectivity, "connectivity is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.transactionScope = Objects.requireNonNull(transactionScope, "transactionScope is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Swaps in a rebuilt connectivity graph.
     */
    public void replaceConnectivityGraph(ConnectivityGraph connectivity) {
        this.connectivity = Objects.requireNonNull(connectivity, "connectivity is required");
    }

    /**
     * Admits a minimum using the default transaction scope.
     *
     * @return true if the minimum was added, false if it was already a node
     * @throws AdmissionException if the admission failed and was rolled back
     */
    public boolean admit(MinimumId minimum) {
        return admit(minimum, transactionScope);
    }

    /**
     * Adds {@code minimum} as a node with an edge to every admitted node: zero weight to
     * nodes in its connected component, {@code d²} to the rest. Runs as one unit against
     * the store; on failure the node, its edges and the distances it introduced are
     * removed and the store transaction is rolled back.
     *
     * @return true if the minimum was added, false if it was already a node
     * @throws AdmissionException if the admission failed and was rolled back
     */
    public boolean admit(MinimumId minimum, TransactionScope scope) {
        Objects.requireNonNull(minimum, "minimum is required");
        Objects.requireNonNull(scope, "scope is required");
        if (adjacency.containsKey(minimum)) {
            return false;
        }
        long started = System.nanoTime();
        Map<MinimumPair, Double> pendingBefore = cache.snapshotPending();

        try (LogContext ctx = LogContext.forAdmission(minimum.toString());
             StoreTransaction storeTx = scope.begin();
             CompensatingTransaction tx = new CompensatingTransaction("admit " + minimum)) {

            tx.onRollback("restore pending distances", () -> cache.restorePending(pendingBefore));
            tx.execute("add node",
                    () -> adjacency.put(minimum, new LinkedHashMap<>()),
                    () -> removeNode(minimum));

            int zeroEdges = 0;
            for (MinimumId other : connectivity.connectedComponent(minimum)) {
                if (!other.equals(minimum) && adjacency.containsKey(other)) {
                    setWeight(minimum, other, 0.0);
                    zeroEdges++;
                }
            }

            int distanceEdges = 0;
            for (MinimumId other : new ArrayList<>(adjacency.keySet())) {
                if (other.equals(minimum) || adjacency.get(minimum).containsKey(other)) {
                    continue;
                }
                double distance;
                if (cache.contains(minimum, other)) {
                    distance = cache.getOrCompute(minimum, other);
                } else {
                    MinimumPair pair = MinimumPair.of(minimum, other);
                    distance = tx.compute("distance to " + other,
                            () -> cache.getOrCompute(minimum, other),
                            d -> cache.discard(pair));
                }
                setWeight(minimum, other, EdgeWeights.fromDistance(distance));
                distanceEdges++;
            }

            cache.flushPending(false);
            storeTx.commit();
            tx.markSuccess();

            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            metrics.recordAdmission(elapsed, zeroEdges + distanceEdges);
            log.debug("distgraph.admitted minimumId={} zeroEdges={} distanceEdges={} nodes={} elapsedMs={}",
                    minimum, zeroEdges, distanceEdges, adjacency.size(), elapsed.toMillis());
            return true;
        } catch (RuntimeException e) {
            metrics.incrementAdmissionFailure();
            log.warn("distgraph.admissionFailed minimumId={} error={}", minimum, e.getMessage());
            throw new AdmissionException(minimum, e);
        }
    }

    /**
     * Records that a transition state directly joins two admitted minima.
     * The zero weight is not propagated to the rest of their component.
     *
     * @return false if either minimum is not admitted
     */
    public boolean markConnected(MinimumId a, MinimumId b) {
        if (a.equals(b)) {
            return false;
        }
        if (!adjacency.containsKey(a) || !adjacency.containsKey(b)) {
            log.debug("distgraph.markConnectedSkipped minimum1={} minimum2={} reason=notAdmitted", a, b);
            return false;
        }
        setWeight(a, b, 0.0);
        return true;
    }

    /**
     * Marks a pair as not worth retrying. A known connection is never overwritten.
     *
     * @return true if the weight was changed
     */
    public boolean markUnproductive(MinimumId a, MinimumId b) {
        Double weight = rawWeight(a, b);
        if (weight == null || EdgeWeights.isConnection(weight)) {
            return false;
        }
        setWeight(a, b, EdgeWeights.INF_WEIGHT);
        return true;
    }

    /**
     * Folds {@code drop} into {@code keep}. For every other node the edge to {@code keep}
     * takes the lower of the two prior weights; {@code drop} is removed and the distance
     * cache is repointed. A {@code drop} absent from this graph or from the connectivity
     * graph is tolerated.
     */
    public void merge(MinimumId keep, MinimumId drop) {
        if (keep.equals(drop)) {
            throw new IllegalArgumentException("Cannot merge a minimum into itself: " + keep);
        }
        Map<MinimumId, Double> dropped = adjacency.get(drop);
        int moved = 0;
        if (dropped != null) {
            adjacency.computeIfAbsent(keep, k -> new LinkedHashMap<>());
            for (Map.Entry<MinimumId, Double> edge : new ArrayList<>(dropped.entrySet())) {
                MinimumId other = edge.getKey();
                if (other.equals(keep)) {
                    continue;
                }
                Double kept = rawWeight(keep, other);
                double weight = kept == null ? edge.getValue() : Math.min(kept, edge.getValue());
                setWeight(keep, other, weight);
                moved++;
            }
            removeNode(drop);
        }
        cache.onMerge(keep, drop);
        log.debug("distgraph.merged keep={} drop={} edgesMoved={}", keep, drop, moved);
    }

    /**
     * Scans every edge and repairs disagreements with the connectivity graph:
     * <ul>
     *   <li>connected pair with a non-zero edge: zeroed; a genuine inconsistency unless a
     *       zero-weight detour already existed</li>
     *   <li>unconnected pair with a zero edge: a genuine inconsistency; reset to {@code d²}</li>
     * </ul>
     */
    public ConsistencyReport checkConsistency() {
        try (LogContext ctx = LogContext.forConsistencyCheck()) {
            log.info("distgraph.checking nodes={}", adjacency.size());
            cache.flushPending(false);

            int scanned = 0;
            int connectedNonZero = 0;
            int disconnectedZero = 0;
            int redundant = 0;
            for (WeightedEdge edge : edges()) {
                scanned++;
                MinimumId a = edge.pair().first();
                MinimumId b = edge.pair().second();
                double weight = rawWeight(a, b);
                boolean connected = connectivity.areConnected(a, b);
                boolean zero = EdgeWeights.isZero(weight);

                if (connected && !zero) {
                    double pathWeight = pathFinder.find(a, b).totalWeight();
                    if (pathWeight > EdgeWeights.PATH_ZERO_TOLERANCE) {
                        connectedNonZero++;
                        log.warn("distgraph.inconsistent minimum1={} minimum2={} connected=true weight={} "
                                        + "distance={} pathWeight={}",
                                a, b, weight, describe(cache.get(a, b)), pathWeight);
                    } else {
                        redundant++;
                    }
                    setWeight(a, b, 0.0);
                } else if (!connected && zero) {
                    disconnectedZero++;
                    double distance = cache.getOrCompute(a, b);
                    log.warn("distgraph.inconsistent minimum1={} minimum2={} connected=false weight={} distance={}",
                            a, b, weight, distance);
                    setWeight(a, b, EdgeWeights.fromDistance(distance));
                }
            }

            ConsistencyReport report = new ConsistencyReport(scanned, connectedNonZero, disconnectedZero, redundant);
            metrics.recordConsistencyCheck(report.inconsistencies(), redundant);
            if (report.isConsistent()) {
                consecutiveInconsistentPasses = 0;
            } else {
                consecutiveInconsistentPasses++;
                log.info("distgraph.repaired inconsistencies={} redundant={}", report.inconsistencies(), redundant);
                if (consecutiveInconsistentPasses > 1) {
                    metrics.incrementRepeatedInconsistency();
                    log.warn("distgraph.repeatedInconsistency passes={} - check the order in which "
                            + "transition states are reported", consecutiveInconsistentPasses);
                }
            }
            return report;
        }
    }

    /**
     * Returns the lowest-weight path between two minima, or {@link PathResult#noPath}.
     * Never mutates the graph.
     */
    public PathResult shortestPath(MinimumId a, MinimumId b) {
        PathResult result = pathFinder.find(a, b);
        if (result.isFound()) {
            metrics.recordPathLength(result.edgeCount());
        }
        return result;
    }

    /**
     * Writes buffered distances to the store.
     *
     * @see DistanceCache#flushPending(boolean)
     */
    public int flushPending(boolean force) {
        return cache.flushPending(force);
    }

    public boolean contains(MinimumId minimum) {
        return adjacency.containsKey(minimum);
    }

    public Set<MinimumId> nodes() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(adjacency.keySet()));
    }

    public int nodeCount() {
        return adjacency.size();
    }

    /**
     * Returns the weight of the edge between two admitted minima, if any.
     */
    public OptionalDouble weight(MinimumId a, MinimumId b) {
        Double weight = rawWeight(a, b);
        return weight == null ? OptionalDouble.empty() : OptionalDouble.of(weight);
    }

    /**
     * Returns every edge once.
     */
    public List<WeightedEdge> edges() {
        List<WeightedEdge> edges = new ArrayList<>();
        for (Map.Entry<MinimumId, Map<MinimumId, Double>> node : adjacency.entrySet()) {
            for (Map.Entry<MinimumId, Double> edge : node.getValue().entrySet()) {
                if (node.getKey().compareTo(edge.getKey()) < 0) {
                    edges.add(new WeightedEdge(MinimumPair.of(node.getKey(), edge.getKey()), edge.getValue()));
                }
            }
        }
        return edges;
    }

    public int edgeCount() {
        int degreeSum = 0;
        for (Map<MinimumId, Double> neighbours : adjacency.values()) {
            degreeSum += neighbours.size();
        }
        return degreeSum / 2;
    }

    public DistanceCache getCache() {
        return cache;
    }

    private Double rawWeight(MinimumId a, MinimumId b) {
        Map<MinimumId, Double> neighbours = adjacency.get(a);
        return neighbours == null ? null : neighbours.get(b);
    }

    private void setWeight(MinimumId a, MinimumId b, double weight) {
        adjacency.get(a).put(b, weight);
        adjacency.get(b).put(a, weight);
    }

    private void removeNode(MinimumId minimum) {
        Map<MinimumId, Double> neighbours = adjacency.remove(minimum);
        if (neighbours == null) {
            return;
        }
        for (MinimumId other : neighbours.keySet()) {
            Map<MinimumId, Double> back = adjacency.get(other);
            if (back != null) {
                back.remove(minimum);
            }
        }
    }

    private static String describe(OptionalDouble distance) {
        return distance.isPresent() ? Double.toString(distance.getAsDouble()) : "unknown";
    }
}
