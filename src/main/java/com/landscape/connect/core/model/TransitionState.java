package com.landscape.connect.core.model;

import java.util.Objects;

/**
 * A saddle point connecting exactly two minima.
 * After a merge both endpoints may refer to the same minimum; such a state is
 * degenerate and is ignored by the connectivity graph.
 */
public record TransitionState(long id, MinimumId minimum1, MinimumId minimum2, double energy) {

    public TransitionState {
        Objects.requireNonNull(minimum1, "minimum1 is required");
        Objects.requireNonNull(minimum2, "minimum2 is required");
    }

    public static TransitionState of(long id, long minimum1, long minimum2, double energy) {
        return new TransitionState(id, MinimumId.of(minimum1), MinimumId.of(minimum2), energy);
    }

    public boolean isDegenerate() {
        return minimum1.equals(minimum2);
    }

    public boolean touches(MinimumId minimumId) {
        return minimum1.equals(minimumId) || minimum2.equals(minimumId);
    }

    /**
     * Returns a copy with every reference to {@code from} replaced by {@code to}.
     */
    public TransitionState repoint(MinimumId from, MinimumId to) {
        MinimumId m1 = minimum1.equals(from) ? to : minimum1;
        MinimumId m2 = minimum2.equals(from) ? to : minimum2;
        return new TransitionState(id, m1, m2, energy);
    }
}
