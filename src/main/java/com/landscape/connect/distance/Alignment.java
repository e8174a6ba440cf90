package com.landscape.connect.distance;

/**
 * Result of a structural alignment: the optimised distance and the coordinate
 * sets in the alignment that realises it.
 *
 * @param distance   non-negative aligned distance
 * @param realignedA first structure after alignment
 * @param realignedB second structure after alignment
 */
public record Alignment(double distance, double[] realignedA, double[] realignedB) {

    public Alignment {
        if (!(distance >= 0.0) || Double.isInfinite(distance)) {
            throw new DistanceComputationException("alignment produced an invalid distance: " + distance);
        }
    }
}
