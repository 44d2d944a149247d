package org.ambudispatch.engine.domain.model;

/**
 * Ambulance lifecycle: IDLE, DISPATCHED, EN_ROUTE, ON_SCENE, RETURNING and
 * back to IDLE. No step may be skipped.
 */
public enum AmbulanceState {
    IDLE,
    DISPATCHED,
    EN_ROUTE,
    ON_SCENE,
    RETURNING;

    public AmbulanceState next() {
        switch (this) {
            case IDLE:
                return DISPATCHED;
            case DISPATCHED:
                return EN_ROUTE;
            case EN_ROUTE:
                return ON_SCENE;
            case ON_SCENE:
                return RETURNING;
            default:
                return IDLE;
        }
    }

    public boolean canTransitionTo(AmbulanceState target) {
        return next() == target;
    }
}
