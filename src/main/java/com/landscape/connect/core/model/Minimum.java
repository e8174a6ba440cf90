package com.landscape.connect.core.model;

import java.util.Objects;

/**
 * A locally energy-minimal configuration.
 *
 * <p>Coordinates are opaque to the planner; they are only handed to the
 * {@link com.landscape.connect.distance.DistanceFunction}. Equality is by id.</p>
 */
public final class Minimum {

    private final MinimumId id;
    private final double energy;
    private final double[] coordinates;

    public Minimum(MinimumId id, double energy, double[] coordinates) {
        this.id = Objects.requireNonNull(id, "id is required");
        this.energy = energy;
        this.coordinates = Objects.requireNonNull(coordinates, "coordinates are required").clone();
    }

    public static Minimum of(long id, double energy, double... coordinates) {
        return new Minimum(MinimumId.of(id), energy, coordinates);
    }

    public MinimumId getId() {
        return id;
    }

    public double getEnergy() {
        return energy;
    }

    /**
     * Returns a copy of the coordinates.
     */
    public double[] getCoordinates() {
        return coordinates.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Minimum other)) return false;
        return id.equals(other.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Minimum{id=" + id + ", energy=" + energy + ", dof=" + coordinates.length + "}";
    }
}
