package com.landscape.connect.dgraph;

/**
 * Edge weight conventions of the distance graph.
 *
 * <ul>
 *   <li>{@code 0} : endpoints are joined by known transition states</li>
 *   <li>{@code d²} : estimated difficulty of connecting endpoints at distance {@code d}</li>
 *   <li>{@link #INF_WEIGHT} : the pair was tried and should not be suggested again</li>
 * </ul>
 * Squaring favours paths of many short edges over paths of few long ones.
 */
public final class EdgeWeights {

    public static final double INF_WEIGHT = 1e20;

    /** Below this a weight counts as a connection and is never overwritten by a failed attempt. */
    public static final double CONNECTION_TOLERANCE = 1e-6;

    /** Below this an edge counts as zero during consistency checks. */
    public static final double EDGE_ZERO_TOLERANCE = 1e-10;

    /** Below this a path sum counts as zero during consistency checks. */
    public static final double PATH_ZERO_TOLERANCE = 1e-5;

    private EdgeWeights() {
    }

    public static double fromDistance(double distance) {
        return distance * distance;
    }

    public static boolean isZero(double weight) {
        return weight < EDGE_ZERO_TOLERANCE;
    }

    public static boolean isConnection(double weight) {
        return weight < CONNECTION_TOLERANCE;
    }
}
