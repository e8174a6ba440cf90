package com.landscape.connect.core.model;

import java.util.Objects;

/**
 * Unordered pair of distinct minima. The pair is normalised so that
 * {@code first < second}, which makes {@code of(a, b)} equal to {@code of(b, a)}.
 */
public record MinimumPair(MinimumId first, MinimumId second) {

    public MinimumPair {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
        if (first.compareTo(second) >= 0) {
            throw new IllegalArgumentException(
                    "MinimumPair must be normalised and distinct: " + first + ", " + second);
        }
    }

    public static MinimumPair of(MinimumId a, MinimumId b) {
        Objects.requireNonNull(a, "a is required");
        Objects.requireNonNull(b, "b is required");
        if (a.equals(b)) {
            throw new IllegalArgumentException("A pair needs two distinct minima, got " + a + " twice");
        }
        return a.compareTo(b) < 0 ? new MinimumPair(a, b) : new MinimumPair(b, a);
    }

    public static MinimumPair of(long a, long b) {
        return of(MinimumId.of(a), MinimumId.of(b));
    }

    public boolean contains(MinimumId id) {
        return first.equals(id) || second.equals(id);
    }

    /**
     * Returns the member that is not {@code id}.
     */
    public MinimumId other(MinimumId id) {
        if (first.equals(id)) {
            return second;
        }
        if (second.equals(id)) {
            return first;
        }
        throw new IllegalArgumentException(id + " is not part of " + this);
    }

    @Override
    public String toString() {
        return "(" + first + ", " + second + ")";
    }
}
