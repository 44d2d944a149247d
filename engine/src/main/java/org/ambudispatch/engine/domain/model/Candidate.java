package org.ambudispatch.engine.domain.model;

import java.util.Objects;

/**
 * An Idle ambulance considered for one call, with its travel time to the
 * call origin. Natural order is nearest first, ties by ambulance id.
 */
public final class Candidate implements Comparable<Candidate> {

    private final String ambulanceId;
    private final String locationId;
    private final String baseLocationId;
    private final double travelTime;

    public Candidate(String ambulanceId, String locationId, String baseLocationId, double travelTime) {
        this.ambulanceId = Objects.requireNonNull(ambulanceId, "ambulanceId must not be null");
        this.locationId = Objects.requireNonNull(locationId, "locationId must not be null");
        this.baseLocationId = Objects.requireNonNull(baseLocationId, "baseLocationId must not be null");
        this.travelTime = travelTime;
    }

    public String getAmbulanceId() {
        return ambulanceId;
    }

    public String getLocationId() {
        return locationId;
    }

    public String getBaseLocationId() {
        return baseLocationId;
    }

    public double getTravelTime() {
        return travelTime;
    }

    public boolean isReachable() {
        return travelTime < Double.POSITIVE_INFINITY;
    }

    @Override
    public int compareTo(Candidate other) {
        int byTime = Double.compare(this.travelTime, other.travelTime);
        return byTime != 0 ? byTime : this.ambulanceId.compareTo(other.ambulanceId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Candidate)) {
            return false;
        }
        Candidate that = (Candidate) o;
        return Double.compare(travelTime, that.travelTime) == 0
                && ambulanceId.equals(that.ambulanceId)
                && locationId.equals(that.locationId)
                && baseLocationId.equals(that.baseLocationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ambulanceId, locationId, baseLocationId, travelTime);
    }

    @Override
    public String toString() {
        return String.format("Candidate{%s @ %s, travel=%.2f}", ambulanceId, locationId, travelTime);
    }
}
