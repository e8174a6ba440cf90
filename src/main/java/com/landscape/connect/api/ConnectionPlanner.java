package com.landscape.connect.api;

import com.landscape.connect.audit.MergeLedger;
import com.landscape.connect.audit.MergeRecord;
import com.landscape.connect.cache.CacheStats;
import com.landscape.connect.cache.DistanceCache;
import com.landscape.connect.cache.MergeListener;
import com.landscape.connect.core.model.Minimum;
import com.landscape.connect.core.model.MinimumId;
import com.landscape.connect.core.model.TransitionState;
import com.landscape.connect.dgraph.ConsistencyReport;
import com.landscape.connect.dgraph.DistanceGraph;
import com.landscape.connect.dgraph.PathResult;
import com.landscape.connect.dgraph.WeightedEdge;
import com.landscape.connect.distance.DistanceFunction;
import com.landscape.connect.graph.TransitionStateGraph;
import com.landscape.connect.logging.LogContext;
import com.landscape.connect.metrics.MetricsService;
import com.landscape.connect.metrics.NoOpMetricsService;
import com.landscape.connect.storage.EntityStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Main entry point for planning connections between two minima.
 *
 * <p>The driver asks for the next candidate pair, runs its expensive transition-state
 * search on it, and reports the outcome back. The planner keeps the distance graph,
 * the distance cache and the connectivity graph in step.</p>
 *
 * <pre>
 * ConnectionPlanner planner = ConnectionPlanner.builder()
 *     .entityStore(store)
 *     .distanceFunction(mindist)
 *     .build();
 *
 * planner.initialize(start, end);
 * Optional&lt;WeightedEdge&gt; next;
 * while ((next = planner.nextCandidate(start, end)).isPresent()) {
 *     MinimumPair pair = next.get().pair();
 *     // run the transition-state search on pair, then report:
 *     //   planner.recordTransitionState(ts)  or  planner.markUnproductive(a, b)
 * }
 * planner.close();
 * </pre>
 *
 * <p>Every call is serialized through one lock, so several drivers may share a planner.</p>
 */
public class ConnectionPlanner implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPlanner.class);

    private final String sessionId = LogContext.generateCorrelationId();
    private final ReentrantLock lock = new ReentrantLock();
    private final EntityStore store;
    private final TransitionStateGraph connectivity;
    private final DistanceCache cache;
    private final DistanceGraph distanceGraph;
    private final PlannerOptions options;
    private final MetricsService metrics;
    private final MergeLedger mergeLedger;
    private final List<MergeListener> mergeListeners = new CopyOnWriteArrayList<>();
    private int mutationsSinceCheck;

    private ConnectionPlanner(Builder builder) {
        this.store = builder.store;
        this.options = builder.options;
        this.metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.mergeLedger = builder.mergeLedger != null ? builder.mergeLedger : new MergeLedger();
        this.connectivity = builder.connectivityGraph != null
                ? builder.connectivityGraph : buildConnectivityGraph(store);
        this.cache = new DistanceCache(store, builder.distanceFunction, options.getCacheConfig(), metrics);
        this.distanceGraph = new DistanceGraph(connectivity, cache, store, metrics);
        this.mergeListeners.addAll(builder.mergeListeners);
        log.info("ConnectionPlanner initialized: sessionId={}, admissionMode={}, minima={}",
                sessionId, options.getAdmissionMode(), connectivity.size());
    }

    private static TransitionStateGraph buildConnectivityGraph(EntityStore store) {
        List<MinimumId> ids = new ArrayList<>();
        for (Minimum m : store.minima()) {
            ids.add(m.getId());
        }
        return TransitionStateGraph.of(ids, store.transitionStates());
    }

    /**
     * Prepares the distance graph for connecting {@code start} and {@code end}: warms the
     * cache, admits both endpoints and, depending on the admission mode, other known minima.
     */
    public InitializationResult initialize(MinimumId start, MinimumId end) {
        return locked(() -> {
            try (LogContext ctx = LogContext.forSession(sessionId, start.toString(), end.toString())) {
                if (options.isLoadDistances()) {
                    log.info("planner.loadingDistances");
                    cache.warm();
                }
                double startEnd = cache.getOrCompute(start, end);
                distanceGraph.admit(start);
                distanceGraph.admit(end);

                int scanned = switch (options.getAdmissionMode()) {
                    case ALL -> admitAll(start, end);
                    case RELEVANT -> admitRelevant(start, end, startEnd);
                    case ENDPOINTS -> 0;
                };
                log.info("planner.initialized startEndDistance={} scanned={} nodes={}",
                        startEnd, scanned, distanceGraph.nodeCount());
                return new InitializationResult(startEnd, scanned, distanceGraph.nodeCount());
            }
        });
    }

    private int admitAll(MinimumId start, MinimumId end) {
        log.info("planner.admittingAll minima={} - this might take a while", connectivity.size());
        int scanned = 0;
        for (MinimumId m : connectivity.minima()) {
            if (m.equals(start) || m.equals(end)) {
                continue;
            }
            scanned++;
            distanceGraph.admit(m);
        }
        return scanned;
    }

    // Relevance is decided from cache-resident distances only, before any admission
    // can add new ones.
    private int admitRelevant(MinimumId start, MinimumId end, double startEnd) {
        List<MinimumId> relevant = new ArrayList<>();
        int scanned = 0;
        for (MinimumId m : connectivity.minima()) {
            if (m.equals(start) || m.equals(end)) {
                continue;
            }
            scanned++;
            OptionalDouble toStart = cache.get(m, start);
            if (toStart.isEmpty() || toStart.getAsDouble() > startEnd) {
                continue;
            }
            OptionalDouble toEnd = cache.get(m, end);
            if (toEnd.isEmpty() || toEnd.getAsDouble() > startEnd) {
                continue;
            }
            log.debug("planner.relevant minimumId={} toStart={} toEnd={} startEnd={}",
                    m, toStart.getAsDouble(), toEnd.getAsDouble(), startEnd);
            relevant.add(m);
        }
        log.info("planner.relevantMinima accepted={} scanned={}", relevant.size(), scanned);
        relevant.forEach(distanceGraph::admit);
        return scanned;
    }

    /**
     * Returns the next pair to try to connect: the heaviest edge of the lowest-weight path
     * between {@code start} and {@code end}. Empty when no path exists among admitted
     * minima or when the path already weighs zero.
     */
    public Optional<WeightedEdge> nextCandidate(MinimumId start, MinimumId end) {
        return locked(() -> {
            int interval = options.getConsistencyCheckInterval();
            if (interval > 0 && mutationsSinceCheck >= interval) {
                checkConsistency();
            }
            PathResult path = distanceGraph.shortestPath(start, end);
            if (!path.isFound()) {
                log.info("planner.noPath start={} end={}", start, end);
                return Optional.empty();
            }
            Optional<WeightedEdge> heaviest = path.heaviestEdge();
            if (heaviest.isEmpty() || heaviest.get().weight() <= 0.0) {
                return Optional.empty();
            }
            log.debug("planner.candidate pair={} weight={} pathEdges={}",
                    heaviest.get().pair(), heaviest.get().weight(), path.edgeCount());
            return heaviest;
        });
    }

    public boolean admit(MinimumId minimum) {
        return locked(() -> distanceGraph.admit(minimum));
    }

    public PathResult shortestPath(MinimumId a, MinimumId b) {
        return locked(() -> distanceGraph.shortestPath(a, b));
    }

    public boolean markConnected(MinimumId a, MinimumId b) {
        return locked(() -> distanceGraph.markConnected(a, b));
    }

    public boolean markUnproductive(MinimumId a, MinimumId b) {
        return locked(() -> {
            boolean changed = distanceGraph.markUnproductive(a, b);
            log.debug("planner.unproductive minimum1={} minimum2={} changed={}", a, b, changed);
            return changed;
        });
    }

    /**
     * Merges {@code drop} into {@code keep} in the distance graph and cache only.
     *
     * @see #mergeMinima(MinimumId, MinimumId, String)
     */
    public void merge(MinimumId keep, MinimumId drop) {
        locked(() -> {
            distanceGraph.merge(keep, drop);
            return null;
        });
    }

    public ConsistencyReport checkConsistency() {
        return locked(() -> {
            mutationsSinceCheck = 0;
            return distanceGraph.checkConsistency();
        });
    }

    public int flushPending(boolean force) {
        return locked(() -> distanceGraph.flushPending(force));
    }

    /**
     * Registers a minimum found by the driver. It is not admitted until a transition
     * state touches it or it is admitted explicitly.
     */
    public void recordMinimum(Minimum minimum) {
        locked(() -> {
            store.addMinimum(minimum);
            connectivity.addMinimum(minimum.getId());
            return null;
        });
    }

    /**
     * Absorbs a transition state found by the driver: persists it, adds it to the
     * connectivity graph, admits its endpoints and zeroes the edge between them.
     * Degenerate states are persisted but otherwise ignored.
     */
    public void recordTransitionState(TransitionState ts) {
        locked(() -> {
            store.addTransitionState(ts);
            if (!connectivity.addTransitionState(ts)) {
                return null;
            }
            distanceGraph.admit(ts.minimum1());
            distanceGraph.admit(ts.minimum2());
            distanceGraph.markConnected(ts.minimum1(), ts.minimum2());
            mutationsSinceCheck++;
            log.debug("planner.transitionStateRecorded tsId={} minimum1={} minimum2={}",
                    ts.id(), ts.minimum1(), ts.minimum2());
            return null;
        });
    }

    /**
     * Folds a duplicate minimum into the one that is kept, across the store, the
     * connectivity graph, the distance graph and the cache, and records the merge.
     */
    public MergeRecord mergeMinima(MinimumId keep, MinimumId drop, String triggeredBy) {
        return locked(() -> {
            try (LogContext ctx = LogContext.forMerge(LogContext.generateCorrelationId(),
                    keep.toString(), drop.toString())) {
                log.info("merge.starting keep={} drop={} triggeredBy={}", keep, drop, triggeredBy);
                OptionalDouble distance = cache.get(keep, drop);

                store.mergeMinimum(keep, drop);
                connectivity.mergeMinima(keep, drop);
                distanceGraph.merge(keep, drop);

                MergeRecord record = mergeLedger.recordMerge(keep, drop,
                        distance.isPresent() ? distance.getAsDouble() : null,
                        triggeredBy, "structurally identical minima");
                for (MergeListener listener : mergeListeners) {
                    try {
                        listener.onMerge(keep, drop);
                    } catch (RuntimeException e) {
                        log.warn("Merge listener failed: {}", e.getMessage());
                    }
                }
                metrics.incrementMerge();
                mutationsSinceCheck++;
                log.info("merge.completed keep={} drop={}", keep, drop);
                return record;
            }
        });
    }

    public boolean isConnected(MinimumId a, MinimumId b) {
        return locked(() -> connectivity.areConnected(a, b));
    }

    /**
     * Registers a listener notified after each successful {@link #mergeMinima}.
     */
    public void addMergeListener(MergeListener listener) {
        mergeListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public DistanceGraph getDistanceGraph() {
        return distanceGraph;
    }

    public TransitionStateGraph getConnectivityGraph() {
        return connectivity;
    }

    public DistanceCache getDistanceCache() {
        return cache;
    }

    public MergeLedger getMergeLedger() {
        return mergeLedger;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public PlannerOptions getOptions() {
        return options;
    }

    /**
     * Flushes every pending distance to the store.
     */
    @Override
    public void close() {
        int written = flushPending(true);
        log.info("ConnectionPlanner closed: sessionId={}, distancesFlushed={}", sessionId, written);
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EntityStore store;
        private DistanceFunction distanceFunction;
        private TransitionStateGraph connectivityGraph;
        private PlannerOptions options = PlannerOptions.defaults();
        private MetricsService metricsService;
        private MergeLedger mergeLedger;
        private final List<MergeListener> mergeListeners = new ArrayList<>();

        public Builder entityStore(EntityStore store) {
            this.store = store;
            return this;
        }

        public Builder distanceFunction(DistanceFunction distanceFunction) {
            this.distanceFunction = distanceFunction;
            return this;
        }

        /**
         * Sets the connectivity graph; by default one is built from the store's minima and
         * transition states.
         */
        public Builder connectivityGraph(TransitionStateGraph connectivityGraph) {
            this.connectivityGraph = connectivityGraph;
            return this;
        }

        public Builder options(PlannerOptions options) {
            this.options = options;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder mergeLedger(MergeLedger mergeLedger) {
            this.mergeLedger = mergeLedger;
            return this;
        }

        public Builder mergeListener(MergeListener listener) {
            this.mergeListeners.add(listener);
            return this;
        }

        public ConnectionPlanner build() {
            Objects.requireNonNull(store, "entityStore is required");
            Objects.requireNonNull(distanceFunction, "distanceFunction is required");
            Objects.requireNonNull(options, "options is required");
            return new ConnectionPlanner(this);
        }
    }
}
