package com.landscape.connect.core.model;

/**
 * Stable, immutable identity of a local energy minimum.
 * All graph and cache structures are keyed by this value rather than by {@link Minimum}.
 */
public record MinimumId(long value) implements Comparable<MinimumId> {

    public static MinimumId of(long value) {
        return new MinimumId(value);
    }

    @Override
    public int compareTo(MinimumId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return Long.toString(value);
    }
}
