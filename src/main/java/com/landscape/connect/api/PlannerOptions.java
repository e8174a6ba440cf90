package com.landscape.connect.api;

import com.landscape.connect.cache.DistanceCacheConfig;

import java.util.Objects;

/**
 * Options for a {@link ConnectionPlanner} session.
 */
public class PlannerOptions {

    private static final int DEFAULT_CONSISTENCY_CHECK_INTERVAL = 10;

    private final AdmissionMode admissionMode;
    private final boolean loadDistances;
    private final DistanceCacheConfig cacheConfig;
    private final int consistencyCheckInterval;

    private PlannerOptions(Builder builder) {
        this.admissionMode = builder.admissionMode;
        this.loadDistances = builder.loadDistances;
        this.cacheConfig = builder.cacheConfig;
        this.consistencyCheckInterval = builder.consistencyCheckInterval;
    }

    public AdmissionMode getAdmissionMode() {
        return admissionMode;
    }

    /**
     * Whether persisted distances are loaded into the cache when a session starts.
     */
    public boolean isLoadDistances() {
        return loadDistances;
    }

    public DistanceCacheConfig getCacheConfig() {
        return cacheConfig;
    }

    /**
     * Number of reported mutations after which a consistency pass runs before the next
     * candidate is chosen; 0 disables automatic passes.
     */
    public int getConsistencyCheckInterval() {
        return consistencyCheckInterval;
    }

    /**
     * Creates default options: relevance pruning, persisted distances loaded,
     * 300-entry flush threshold, consistency pass every 10 mutations.
     */
    public static PlannerOptions defaults() {
        return builder().build();
    }

    /**
     * Creates options that admit every known minimum.
     */
    public static PlannerOptions allMinima() {
        return builder().admissionMode(AdmissionMode.ALL).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private AdmissionMode admissionMode = AdmissionMode.RELEVANT;
        private boolean loadDistances = true;
        private DistanceCacheConfig cacheConfig = DistanceCacheConfig.defaults();
        private int consistencyCheckInterval = DEFAULT_CONSISTENCY_CHECK_INTERVAL;

        public Builder admissionMode(AdmissionMode admissionMode) {
            this.admissionMode = Objects.requireNonNull(admissionMode, "admissionMode");
            return this;
        }

        public Builder loadDistances(boolean loadDistances) {
            this.loadDistances = loadDistances;
            return this;
        }

        public Builder cacheConfig(DistanceCacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig");
            return this;
        }

        public Builder flushThreshold(int flushThreshold) {
            this.cacheConfig = new DistanceCacheConfig(flushThreshold, cacheConfig.deferWrites());
            return this;
        }

        public Builder consistencyCheckInterval(int consistencyCheckInterval) {
            if (consistencyCheckInterval < 0) {
                throw new IllegalArgumentException("consistencyCheckInterval must be >= 0");
            }
            this.consistencyCheckInterval = consistencyCheckInterval;
            return this;
        }

        public PlannerOptions build() {
            return new PlannerOptions(this);
        }
    }
}
