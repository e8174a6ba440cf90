package com.landscape.connect.bulk;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.landscape.connect.core.model.DistanceEntry;
import com.landscape.connect.core.model.MinimumId;

/**
 * One JSON Lines row: {@code {"minimum1":1,"minimum2":2,"distance":0.75}}.
 */
record DistanceRecord(long minimum1, long minimum2, double distance) {

    @JsonCreator
    DistanceRecord(@JsonProperty(value = "minimum1", required = true) long minimum1,
                   @JsonProperty(value = "minimum2", required = true) long minimum2,
                   @JsonProperty(value = "distance", required = true) double distance) {
        this.minimum1 = minimum1;
        this.minimum2 = minimum2;
        this.distance = distance;
    }

    static DistanceRecord from(DistanceEntry entry) {
        return new DistanceRecord(entry.pair().first().value(), entry.pair().second().value(), entry.distance());
    }

    DistanceEntry toEntry() {
        return DistanceEntry.of(MinimumId.of(minimum1), MinimumId.of(minimum2), distance);
    }
}
