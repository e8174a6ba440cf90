package com.landscape.connect.dgraph;

import com.landscape.connect.core.model.MinimumId;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Single-pair Dijkstra over a weighted adjacency map.
 * Stale frontier entries are skipped on poll instead of decreasing keys in place.
 * Read-only: the adjacency map is never modified.
 */
final class ShortestPathFinder {

    private final Map<MinimumId, Map<MinimumId, Double>> adjacency;

    ShortestPathFinder(Map<MinimumId, Map<MinimumId, Double>> adjacency) {
        this.adjacency = Objects.requireNonNull(adjacency, "adjacency");
    }

    PathResult find(MinimumId source, MinimumId target) {
        if (!adjacency.containsKey(source) || !adjacency.containsKey(target)) {
            return PathResult.noPath(source, target);
        }
        if (source.equals(target)) {
            return new PathResult(source, target, List.of(source), List.of());
        }

        Map<MinimumId, Double> best = new HashMap<>();
        Map<MinimumId, MinimumId> predecessor = new HashMap<>();
        Set<MinimumId> settled = new HashSet<>();
        PriorityQueue<FrontierState> frontier = new PriorityQueue<>();

        best.put(source, 0.0);
        frontier.add(new FrontierState(source, 0.0));

        while (!frontier.isEmpty()) {
            FrontierState state = frontier.poll();
            if (!settled.add(state.node())) {
                continue;
            }
            if (state.node().equals(target)) {
                return buildPath(source, target, predecessor);
            }
            for (Map.Entry<MinimumId, Double> edge : adjacency.get(state.node()).entrySet()) {
                MinimumId next = edge.getKey();
                if (settled.contains(next)) {
                    continue;
                }
                double nextCost = state.cost() + edge.getValue();
                Double known = best.get(next);
                if (known == null || nextCost < known) {
                    best.put(next, nextCost);
                    predecessor.put(next, state.node());
                    frontier.add(new FrontierState(next, nextCost));
                }
            }
        }
        return PathResult.noPath(source, target);
    }

    private PathResult buildPath(MinimumId source, MinimumId target, Map<MinimumId, MinimumId> predecessor) {
        List<MinimumId> nodes = new ArrayList<>();
        MinimumId current = target;
        while (current != null) {
            nodes.add(current);
            current = current.equals(source) ? null : predecessor.get(current);
        }
        Collections.reverse(nodes);

        List<Double> weights = new ArrayList<>(nodes.size() - 1);
        for (int i = 0; i < nodes.size() - 1; i++) {
            weights.add(adjacency.get(nodes.get(i)).get(nodes.get(i + 1)));
        }
        return new PathResult(source, target, nodes, weights);
    }

    private record FrontierState(MinimumId node, double cost) implements Comparable<FrontierState> {
        @Override
        public int compareTo(FrontierState other) {
            int byCost = Double.compare(cost, other.cost);
            return byCost != 0 ? byCost : node.compareTo(other.node);
        }
    }
}
