package org.ambudispatch.engine.domain.model;

import java.util.Objects;

/**
 * Input record for one ambulance: its id and staging location.
 */
public final class AmbulanceRecord {

    private final String id;
    private final String baseLocationId;

    public AmbulanceRecord(String id, String baseLocationId) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.baseLocationId = Objects.requireNonNull(baseLocationId, "baseLocationId must not be null");
    }

    public String getId() {
        return id;
    }

    public String getBaseLocationId() {
        return baseLocationId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AmbulanceRecord)) {
            return false;
        }
        AmbulanceRecord that = (AmbulanceRecord) o;
        return id.equals(that.id) && baseLocationId.equals(that.baseLocationId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, baseLocationId);
    }

    @Override
    public String toString() {
        return "AmbulanceRecord{" + id + " @ " + baseLocationId + "}";
    }
}
