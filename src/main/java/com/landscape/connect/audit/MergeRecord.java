package com.landscape.connect.audit;

import com.landscape.connect.core.model.MinimumId;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one duplicate-minimum merge.
 *
 * @param distance aligned distance between the two minima when it was known, else null
 */
public record MergeRecord(
        String id,
        MinimumId keepMinimumId,
        MinimumId dropMinimumId,
        Double distance,
        String triggeredBy,
        String reason,
        Instant timestamp
) {
    public MergeRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(keepMinimumId, "keepMinimumId is required");
        Objects.requireNonNull(dropMinimumId, "dropMinimumId is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private MinimumId keepMinimumId;
        private MinimumId dropMinimumId;
        private Double distance;
        private String triggeredBy;
        private String reason;
        private Instant timestamp = Instant.now();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder keepMinimumId(MinimumId keepMinimumId) {
            this.keepMinimumId = keepMinimumId;
            return this;
        }

        public Builder dropMinimumId(MinimumId dropMinimumId) {
            this.dropMinimumId = dropMinimumId;
            return this;
        }

        public Builder distance(Double distance) {
            this.distance = distance;
            return this;
        }

        public Builder triggeredBy(String triggeredBy) {
            this.triggeredBy = triggeredBy;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public MergeRecord build() {
            return new MergeRecord(id, keepMinimumId, dropMinimumId, distance, triggeredBy, reason, timestamp);
        }
    }
}
