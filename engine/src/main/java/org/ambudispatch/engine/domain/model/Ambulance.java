package org.ambudispatch.engine.domain.model;

import org.ambudispatch.engine.domain.exception.InvalidTransitionException;

import java.util.Objects;

/**
 * Mutable per-run state of one ambulance. The fleet registry is the only
 * caller of the mutators.
 */
public final class Ambulance {

    private final String id;
    private final String baseLocationId;

    private String locationId;
    private AmbulanceState state = AmbulanceState.IDLE;
    private String callId;
    private double busySince = Double.NaN;
    private double busyTime;

    public Ambulance(String id, String baseLocationId) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.baseLocationId = Objects.requireNonNull(baseLocationId, "baseLocationId must not be null");
        this.locationId = baseLocationId;
    }

    public static Ambulance fromRecord(AmbulanceRecord record) {
        return new Ambulance(record.getId(), record.getBaseLocationId());
    }

    public String getId() {
        return id;
    }

    public String getBaseLocationId() {
        return baseLocationId;
    }

    public String getLocationId() {
        return locationId;
    }

    public AmbulanceState getState() {
        return state;
    }

    public String getCallId() {
        return callId;
    }

    public boolean isIdle() {
        return state == AmbulanceState.IDLE;
    }

    /**
     * Moves to the next lifecycle state. Leaving IDLE starts the busy clock,
     * returning to IDLE stops it and clears the call reference.
     */
    public void transitionTo(AmbulanceState target, double now) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidTransitionException("ambulance " + id, state, target);
        }
        if (state == AmbulanceState.IDLE) {
            busySince = now;
        }
        if (target == AmbulanceState.IDLE) {
            busyTime += now - busySince;
            busySince = Double.NaN;
            callId = null;
        }
        state = target;
    }

    public void assignCall(String callId) {
        this.callId = Objects.requireNonNull(callId, "callId must not be null");
    }

    public void moveTo(String locationId) {
        this.locationId = Objects.requireNonNull(locationId, "locationId must not be null");
    }

    /**
     * Busy time accumulated up to {@code now}, including an ongoing job.
     */
    public double getBusyTime(double now) {
        return Double.isNaN(busySince) ? busyTime : busyTime + (now - busySince);
    }

    @Override
    public String toString() {
        return "Ambulance{" + id + " " + state + " @ " + locationId + (callId != null ? " call=" + callId : "") + "}";
    }
}
