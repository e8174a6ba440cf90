package com.landscape.connect.core.model;

import java.util.Objects;

/**
 * A computed structural distance between two minima.
 */
public record DistanceEntry(MinimumPair pair, double distance) {

    public DistanceEntry {
        Objects.requireNonNull(pair, "pair is required");
        if (!(distance >= 0.0) || Double.isInfinite(distance)) {
            throw new IllegalArgumentException("distance must be finite and >= 0, got " + distance);
        }
    }

    public static DistanceEntry of(MinimumId a, MinimumId b, double distance) {
        return new DistanceEntry(MinimumPair.of(a, b), distance);
    }
}
