package org.ambudispatch.engine.domain.model;

import org.ambudispatch.engine.domain.exception.InvalidTransitionException;

import java.util.Objects;

/**
 * A call being handled during one run. State changes go through
 * {@link #transitionTo(CallState, double)} so that illegal moves fail fast.
 */
public final class Call {

    private final String id;
    private final double arrivalTime;
    private final String originLocationId;
    private final String callTypeCode;
    private final PriorityLevel priority;

    private CallState state = CallState.PENDING;
    private String ambulanceId;
    private double travelTime = Double.NaN;
    private double assignedAt = Double.NaN;
    private double onSceneAt = Double.NaN;
    private double closedAt = Double.NaN;

    public Call(String id, double arrivalTime, String originLocationId, String callTypeCode, PriorityLevel priority) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.arrivalTime = arrivalTime;
        this.originLocationId = Objects.requireNonNull(originLocationId, "originLocationId must not be null");
        this.callTypeCode = Objects.requireNonNull(callTypeCode, "callTypeCode must not be null");
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
    }

    public static Call fromRecord(CallRecord record, PriorityTable priorities) {
        return new Call(record.getId(), record.getArrivalTime(), record.getOriginLocationId(),
                record.getCallTypeCode(), priorities.levelFor(record.getCallTypeCode()));
    }

    public void transitionTo(CallState target, double now) {
        if (!state.canTransitionTo(target)) {
            throw new InvalidTransitionException("call " + id, state, target);
        }
        state = target;
        switch (target) {
            case ASSIGNED:
                assignedAt = now;
                break;
            case ON_SCENE:
                onSceneAt = now;
                break;
            case COMPLETED:
            case ABANDONED:
                closedAt = now;
                break;
            default:
                break;
        }
    }

    public String getId() {
        return id;
    }

    public double getArrivalTime() {
        return arrivalTime;
    }

    public String getOriginLocationId() {
        return originLocationId;
    }

    public String getCallTypeCode() {
        return callTypeCode;
    }

    public PriorityLevel getPriority() {
        return priority;
    }

    public CallState getState() {
        return state;
    }

    public String getAmbulanceId() {
        return ambulanceId;
    }

    public void setAmbulanceId(String ambulanceId) {
        this.ambulanceId = ambulanceId;
    }

    /**
     * Travel time of the assigned ambulance to the call origin, NaN until assigned.
     */
    public double getTravelTime() {
        return travelTime;
    }

    public void setTravelTime(double travelTime) {
        this.travelTime = travelTime;
    }

    public double getAssignedAt() {
        return assignedAt;
    }

    public double getOnSceneAt() {
        return onSceneAt;
    }

    public double getClosedAt() {
        return closedAt;
    }

    public boolean isPending() {
        return state == CallState.PENDING;
    }

    /**
     * Arrival to on-scene time, NaN if no ambulance reached the scene.
     */
    public double getResponseTime() {
        return Double.isNaN(onSceneAt) ? Double.NaN : onSceneAt - arrivalTime;
    }

    @Override
    public String toString() {
        return String.format("Call{%s %s %s @ %s}", id, priority, state, originLocationId);
    }
}
