package com.landscape.connect.dgraph;

import com.landscape.connect.core.model.MinimumPair;

import java.util.Objects;

/**
 * An edge of the distance graph with its current weight.
 */
public record WeightedEdge(MinimumPair pair, double weight) {

    public WeightedEdge {
        Objects.requireNonNull(pair, "pair is required");
    }

    public boolean isUnproductive() {
        return weight >= EdgeWeights.INF_WEIGHT;
    }
}
