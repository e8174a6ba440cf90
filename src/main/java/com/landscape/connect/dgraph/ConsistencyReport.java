package com.landscape.connect.dgraph;

/**
 * Result of a consistency pass over the distance graph.
 *
 * @param edgesScanned          number of edges examined
 * @param connectedNonZero      connected pairs whose weight was non-zero with no zero-weight detour
 * @param disconnectedZero      unconnected pairs that carried a zero weight
 * @param redundantZeroed       connected pairs with a non-zero edge but a zero-weight detour
 */
public record ConsistencyReport(int edgesScanned, int connectedNonZero, int disconnectedZero, int redundantZeroed) {

    public boolean isConsistent() {
        return inconsistencies() == 0;
    }

    public int inconsistencies() {
        return connectedNonZero + disconnectedZero;
    }
}
