package com.landscape.connect.api;

/**
 * Which known minima are admitted into the distance graph when a session starts.
 */
public enum AdmissionMode {
    /** Only the start and end minima. */
    ENDPOINTS,
    /**
     * Start, end, and every minimum whose cached distances to both are no larger than the
     * start-end distance. No new distance is computed to decide relevance.
     */
    RELEVANT,
    /** Every known minimum. Expensive: one distance per pair of admitted minima. */
    ALL
}
