package com.landscape.connect.graph;

import com.landscape.connect.core.model.MinimumId;
import com.landscape.connect.core.model.TransitionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * In-memory connectivity graph built from transition states.
 *
 * <p>Nodes are minima; each undirected edge carries the ids of the transition states
 * that join its endpoints, so removing one of several parallel states keeps the edge.
 * Degenerate transition states are ignored. Methods are synchronized so the driver
 * may mutate the graph while the planner reads it.</p>
 */
public class TransitionStateGraph implements ConnectivityGraph {
    private static final Logger log = LoggerFactory.getLogger(TransitionStateGraph.class);

    private final Map<MinimumId, Map<MinimumId, Set<Long>>> adjacency = new LinkedHashMap<>();

    public TransitionStateGraph() {
    }

    /**
     * Builds a graph from the given minima and transition states.
     */
    public static TransitionStateGraph of(Collection<MinimumId> minima, Collection<TransitionState> states) {
        TransitionStateGraph graph = new TransitionStateGraph();
        minima.forEach(graph::addMinimum);
        states.forEach(graph::addTransitionState);
        return graph;
    }

    public synchronized void addMinimum(MinimumId minimum) {
        adjacency.computeIfAbsent(minimum, k -> new HashMap<>());
    }

    /**
     * Adds a transition state edge; endpoints are added as nodes if missing.
     *
     * @return false if the state is degenerate and was ignored
     */
    public synchronized boolean addTransitionState(TransitionState ts) {
        if (ts.isDegenerate()) {
            log.debug("connectivity.degenerateIgnored tsId={} minimumId={}", ts.id(), ts.minimum1());
            return false;
        }
        addMinimum(ts.minimum1());
        addMinimum(ts.minimum2());
        adjacency.get(ts.minimum1()).computeIfAbsent(ts.minimum2(), k -> new HashSet<>()).add(ts.id());
        adjacency.get(ts.minimum2()).computeIfAbsent(ts.minimum1(), k -> new HashSet<>()).add(ts.id());
        return true;
    }

    /**
     * Removes a transition state edge. The edge disappears once no state backs it.
     */
    public synchronized void removeTransitionState(TransitionState ts) {
        if (ts.isDegenerate()) {
            return;
        }
        detach(ts.minimum1(), ts.minimum2(), ts.id());
        detach(ts.minimum2(), ts.minimum1(), ts.id());
    }

    private void detach(MinimumId from, MinimumId to, long tsId) {
        Map<MinimumId, Set<Long>> neighbours = adjacency.get(from);
        if (neighbours == null) {
            return;
        }
        Set<Long> states = neighbours.get(to);
        if (states != null) {
            states.remove(tsId);
            if (states.isEmpty()) {
                neighbours.remove(to);
            }
        }
    }

    /**
     * Removes a minimum and every edge touching it.
     */
    public synchronized void removeMinimum(MinimumId minimum) {
        Map<MinimumId, Set<Long>> neighbours = adjacency.remove(minimum);
        if (neighbours == null) {
            return;
        }
        for (MinimumId neighbour : neighbours.keySet()) {
            Map<MinimumId, Set<Long>> back = adjacency.get(neighbour);
            if (back != null) {
                back.remove(minimum);
            }
        }
    }

    /**
     * Folds {@code drop} into {@code keep}: every edge of {@code drop} is moved onto
     * {@code keep}, edges between the two become degenerate and vanish, and {@code drop}
     * is removed. A missing {@code drop} is tolerated.
     */
    public synchronized void mergeMinima(MinimumId keep, MinimumId drop) {
        if (keep.equals(drop)) {
            throw new IllegalArgumentException("Cannot merge a minimum into itself: " + keep);
        }
        Map<MinimumId, Set<Long>> dropped = adjacency.get(drop);
        addMinimum(keep);
        if (dropped == null) {
            return;
        }
        Map<MinimumId, Set<Long>> kept = adjacency.get(keep);
        for (Map.Entry<MinimumId, Set<Long>> edge : dropped.entrySet()) {
            MinimumId neighbour = edge.getKey();
            if (neighbour.equals(keep)) {
                continue;
            }
            kept.computeIfAbsent(neighbour, k -> new HashSet<>()).addAll(edge.getValue());
            adjacency.get(neighbour).computeIfAbsent(keep, k -> new HashSet<>()).addAll(edge.getValue());
        }
        removeMinimum(drop);
    }

    @Override
    public synchronized boolean areConnected(MinimumId a, MinimumId b) {
        if (a.equals(b)) {
            return true;
        }
        if (!adjacency.containsKey(a) || !adjacency.containsKey(b)) {
            return false;
        }
        return traverse(a, b).contains(b);
    }

    @Override
    public synchronized Set<MinimumId> connectedComponent(MinimumId minimum) {
        if (!adjacency.containsKey(minimum)) {
            return Set.of(minimum);
        }
        return Collections.unmodifiableSet(traverse(minimum, null));
    }

    // Breadth-first search; stops early once target is reached
    private Set<MinimumId> traverse(MinimumId source, MinimumId target) {
        Set<MinimumId> seen = new LinkedHashSet<>();
        Deque<MinimumId> queue = new ArrayDeque<>();
        seen.add(source);
        queue.add(source);
        while (!queue.isEmpty()) {
            MinimumId current = queue.poll();
            for (MinimumId next : adjacency.get(current).keySet()) {
                if (seen.add(next)) {
                    if (next.equals(target)) {
                        return seen;
                    }
                    queue.add(next);
                }
            }
        }
        return seen;
    }

    @Override
    public synchronized boolean contains(MinimumId minimum) {
        return adjacency.containsKey(minimum);
    }

    @Override
    public synchronized Set<MinimumId> minima() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(adjacency.keySet()));
    }

    /**
     * Returns the number of distinct neighbours of a minimum.
     */
    public synchronized int degree(MinimumId minimum) {
        Map<MinimumId, Set<Long>> neighbours = adjacency.get(minimum);
        return neighbours == null ? 0 : neighbours.size();
    }

    public synchronized int size() {
        return adjacency.size();
    }
}
