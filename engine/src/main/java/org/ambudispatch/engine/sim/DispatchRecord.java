package org.ambudispatch.engine.sim;

import org.ambudispatch.engine.domain.model.PriorityLevel;

/**
 * One assignment as it appears in the dispatch log.
 */
public final class DispatchRecord {

    private final String callId;
    private final String callTypeCode;
    private final PriorityLevel priority;
    private final String locationId;
    private final String ambulanceId;
    private final double assignedAt;
    private final double travelTime;

    public DispatchRecord(String callId, String callTypeCode, PriorityLevel priority, String locationId,
                          String ambulanceId, double assignedAt, double travelTime) {
        this.callId = callId;
        this.callTypeCode = callTypeCode;
        this.priority = priority;
        this.locationId = locationId;
        this.ambulanceId = ambulanceId;
        this.assignedAt = assignedAt;
        this.travelTime = travelTime;
    }

    public String getCallId() {
        return callId;
    }

    public String getCallTypeCode() {
        return callTypeCode;
    }

    public PriorityLevel getPriority() {
        return priority;
    }

    public String getLocationId() {
        return locationId;
    }

    public String getAmbulanceId() {
        return ambulanceId;
    }

    public double getAssignedAt() {
        return assignedAt;
    }

    public double getTravelTime() {
        return travelTime;
    }

    @Override
    public String toString() {
        return String.format("DispatchRecord{%s -> %s, travel=%.2f}", callId, ambulanceId, travelTime);
    }
}
