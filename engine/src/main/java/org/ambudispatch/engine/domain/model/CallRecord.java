package org.ambudispatch.engine.domain.model;

import java.util.Objects;

/**
 * Input record for one incoming call, as read from the call log.
 */
public final class CallRecord {

    private final String id;
    private final double arrivalTime;
    private final String originLocationId;
    private final String callTypeCode;

    public CallRecord(String id, double arrivalTime, String originLocationId, String callTypeCode) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.originLocationId = Objects.requireNonNull(originLocationId, "originLocationId must not be null");
        this.callTypeCode = Objects.requireNonNull(callTypeCode, "callTypeCode must not be null");
        if (Double.isNaN(arrivalTime) || Double.isInfinite(arrivalTime)) {
            throw new IllegalArgumentException("arrivalTime must be finite for call " + id);
        }
        this.arrivalTime = arrivalTime;
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

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CallRecord)) {
            return false;
        }
        CallRecord that = (CallRecord) o;
        return Double.compare(arrivalTime, that.arrivalTime) == 0
                && id.equals(that.id)
                && originLocationId.equals(that.originLocationId)
                && callTypeCode.equals(that.callTypeCode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, arrivalTime, originLocationId, callTypeCode);
    }

    @Override
    public String toString() {
        return String.format("CallRecord{%s t=%.2f @ %s type=%s}", id, arrivalTime, originLocationId, callTypeCode);
    }
}
