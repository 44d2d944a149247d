package org.ambudispatch.engine.domain.model;

import java.util.Objects;

/**
 * Node of the road network. Coordinates are optional and only carried
 * through for reporting.
 */
public final class Location {

    private final String id;
    private final Double latitude;
    private final Double longitude;

    public Location(String id) {
        this(id, null, null);
    }

    public Location(String id, Double latitude, Double longitude) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        if ((latitude == null) != (longitude == null)) {
            throw new IllegalArgumentException("latitude and longitude must be given together for " + id);
        }
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public String getId() {
        return id;
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public boolean hasCoordinate() {
        return latitude != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Location)) {
            return false;
        }
        return id.equals(((Location) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return hasCoordinate()
                ? String.format("Location{%s (%.5f, %.5f)}", id, latitude, longitude)
                : "Location{" + id + "}";
    }
}
