package com.landscape.connect.metrics;

import java.time.Duration;

/**
 * Diagnostics sink for the distance-graph planner.
 * Implementations can integrate with Micrometer or another metrics system.
 * The default {@link NoOpMetricsService} does nothing.
 */
public interface MetricsService {

    void recordAdmission(Duration duration, int edgesAdded);

    void incrementAdmissionFailure();

    void incrementDistanceComputed();

    void recordCacheHit();

    void recordCacheMiss();

    void recordFlush(int distancesWritten);

    void recordConsistencyCheck(int inconsistencies, int redundantEdges);

    void incrementRepeatedInconsistency();

    void incrementMerge();

    void recordPathLength(int edges);
}
