package com.landscape.connect.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordAdmission(Duration duration, int edgesAdded) {
    }

    @Override
    public void incrementAdmissionFailure() {
    }

    @Override
    public void incrementDistanceComputed() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordFlush(int distancesWritten) {
    }

    @Override
    public void recordConsistencyCheck(int inconsistencies, int redundantEdges) {
    }

    @Override
    public void incrementRepeatedInconsistency() {
    }

    @Override
    public void incrementMerge() {
    }

    @Override
    public void recordPathLength(int edges) {
    }
}
