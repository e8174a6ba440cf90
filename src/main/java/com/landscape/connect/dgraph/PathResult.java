package com.landscape.connect.dgraph;

import com.landscape.connect.core.model.MinimumId;
import com.landscape.connect.core.model.MinimumPair;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a shortest-path query: the ordered nodes and the parallel edge weights,
 * or an explicit "no path" when the endpoints lie in different components of the
 * distance graph. No path is an expected outcome, not an error.
 */
public record PathResult(MinimumId source, MinimumId target, List<MinimumId> nodes, List<Double> weights) {

    public PathResult {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(target, "target is required");
        nodes = List.copyOf(nodes);
        weights = List.copyOf(weights);
        if (!nodes.isEmpty() && weights.size() != nodes.size() - 1) {
            throw new IllegalArgumentException("weights must have one entry per edge");
        }
    }

    public static PathResult noPath(MinimumId source, MinimumId target) {
        return new PathResult(source, target, List.of(), List.of());
    }

    public boolean isFound() {
        return !nodes.isEmpty();
    }

    public int edgeCount() {
        return weights.size();
    }

    public double totalWeight() {
        if (!isFound()) {
            return Double.POSITIVE_INFINITY;
        }
        double sum = 0.0;
        for (double w : weights) {
            sum += w;
        }
        return sum;
    }

    /**
     * Returns the costliest edge on the path; the first one wins ties.
     * This is the pair the driver should try to connect next.
     */
    public Optional<WeightedEdge> heaviestEdge() {
        int best = -1;
        for (int i = 0; i < weights.size(); i++) {
            if (best < 0 || weights.get(i) > weights.get(best)) {
                best = i;
            }
        }
        if (best < 0) {
            return Optional.empty();
        }
        return Optional.of(new WeightedEdge(MinimumPair.of(nodes.get(best), nodes.get(best + 1)), weights.get(best)));
    }
}
