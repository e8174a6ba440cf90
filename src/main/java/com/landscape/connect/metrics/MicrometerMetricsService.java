package com.landscape.connect.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code distgraph.admission.duration} : Timer</li>
 *   <li>{@code distgraph.admission.edges} : DistributionSummary</li>
 *   <li>{@code distgraph.admission.failed} : Counter</li>
 *   <li>{@code distgraph.distance.computed} : Counter</li>
 *   <li>{@code distgraph.cache.hit} / {@code distgraph.cache.miss} : Counter</li>
 *   <li>{@code distgraph.cache.flush.size} : DistributionSummary</li>
 *   <li>{@code distgraph.consistency.checks} : Counter</li>
 *   <li>{@code distgraph.consistency.inconsistencies} : Counter</li>
 *   <li>{@code distgraph.consistency.redundant} : Counter</li>
 *   <li>{@code distgraph.consistency.repeated} : Counter</li>
 *   <li>{@code distgraph.merge} : Counter</li>
 *   <li>{@code distgraph.path.edges} : DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer admissionTimer;
    private final DistributionSummary admissionEdges;
    private final Counter admissionFailures;
    private final Counter distancesComputed;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final DistributionSummary flushSize;
    private final Counter consistencyChecks;
    private final Counter inconsistencies;
    private final Counter redundantEdges;
    private final Counter repeatedInconsistencies;
    private final Counter merges;
    private final DistributionSummary pathEdges;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.admissionTimer = Timer.builder("distgraph.admission.duration")
                .description("Duration of minimum admissions into the distance graph")
                .register(registry);
        this.admissionEdges = DistributionSummary.builder("distgraph.admission.edges")
                .description("Edges created per admission")
                .register(registry);
        this.admissionFailures = Counter.builder("distgraph.admission.failed")
                .description("Admissions rolled back after a failure")
                .register(registry);
        this.distancesComputed = Counter.builder("distgraph.distance.computed")
                .description("Distances computed by the alignment routine")
                .register(registry);
        this.cacheHits = Counter.builder("distgraph.cache.hit")
                .description("Distance cache hits")
                .register(registry);
        this.cacheMisses = Counter.builder("distgraph.cache.miss")
                .description("Distance cache misses")
                .register(registry);
        this.flushSize = DistributionSummary.builder("distgraph.cache.flush.size")
                .description("Distances written per bulk flush")
                .register(registry);
        this.consistencyChecks = Counter.builder("distgraph.consistency.checks")
                .description("Consistency passes over the distance graph")
                .register(registry);
        this.inconsistencies = Counter.builder("distgraph.consistency.inconsistencies")
                .description("Genuine inconsistencies found and repaired")
                .register(registry);
        this.redundantEdges = Counter.builder("distgraph.consistency.redundant")
                .description("Redundant non-zero edges zeroed")
                .register(registry);
        this.repeatedInconsistencies = Counter.builder("distgraph.consistency.repeated")
                .description("Consecutive consistency passes that found inconsistencies")
                .register(registry);
        this.merges = Counter.builder("distgraph.merge")
                .description("Duplicate minima merged")
                .register(registry);
        this.pathEdges = DistributionSummary.builder("distgraph.path.edges")
                .description("Edges on returned shortest paths")
                .register(registry);
    }

    @Override
    public void recordAdmission(Duration duration, int edgesAdded) {
        admissionTimer.record(duration);
        admissionEdges.record(edgesAdded);
    }

    @Override
    public void incrementAdmissionFailure() {
        admissionFailures.increment();
    }

    @Override
    public void incrementDistanceComputed() {
        distancesComputed.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHits.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    @Override
    public void recordFlush(int distancesWritten) {
        flushSize.record(distancesWritten);
    }

    @Override
    public void recordConsistencyCheck(int inconsistencies, int redundantEdges) {
        consistencyChecks.increment();
        this.inconsistencies.increment(inconsistencies);
        this.redundantEdges.increment(redundantEdges);
    }

    @Override
    public void incrementRepeatedInconsistency() {
        repeatedInconsistencies.increment();
    }

    @Override
    public void incrementMerge() {
        merges.increment();
    }

    @Override
    public void recordPathLength(int edges) {
        pathEdges.record(edges);
    }
}
