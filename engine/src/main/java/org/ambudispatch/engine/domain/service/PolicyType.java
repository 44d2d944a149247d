package org.ambudispatch.engine.domain.service;

/**
 * The closed set of dispatch policies a run can be configured with.
 */
public enum PolicyType {
    NEAREST_AVAILABLE,
    PRIORITY_RESERVATION;

    public DispatchPolicy create() {
        switch (this) {
            case PRIORITY_RESERVATION:
                return new PriorityReservationPolicy();
            case NEAREST_AVAILABLE:
            default:
                return new NearestAvailablePolicy();
        }
    }

    /**
     * Accepts the enum name in any case, with dashes or underscores, or the
     * policy's short name ("nearest", "reservation").
     */
    public static PolicyType fromString(String value) {
        String normalized = value.trim().toUpperCase().replace('-', '_');
        if ("NEAREST".equals(normalized)) {
            return NEAREST_AVAILABLE;
        }
        if ("RESERVATION".equals(normalized)) {
            return PRIORITY_RESERVATION;
        }
        return valueOf(normalized);
    }
}
