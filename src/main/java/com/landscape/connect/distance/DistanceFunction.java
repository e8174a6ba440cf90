package com.landscape.connect.distance;

/**
 * Structural-alignment distance between two coordinate sets.
 *
 * <p>Implementations may be arbitrarily expensive (permutational, rotational and
 * translational symmetry). They are assumed symmetric and deterministic up to
 * realignment, so each unordered pair is computed at most once by the planner.</p>
 */
@FunctionalInterface
public interface DistanceFunction {

    /**
     * Aligns {@code coordsA} onto {@code coordsB}.
     *
     * @throws DistanceComputationException if the alignment cannot be computed
     */
    Alignment align(double[] coordsA, double[] coordsB);
}
