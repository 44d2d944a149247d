package org.ambudispatch.engine.domain.model;

/**
 * Call lifecycle. ABANDONED is only reachable from PENDING.
 */
public enum CallState {
    PENDING,
    ASSIGNED,
    EN_ROUTE,
    ON_SCENE,
    COMPLETED,
    ABANDONED;

    public boolean isTerminal() {
        return this == COMPLETED || this == ABANDONED;
    }

    public boolean canTransitionTo(CallState target) {
        switch (this) {
            case PENDING:
                return target == ASSIGNED || target == ABANDONED;
            case ASSIGNED:
                return target == EN_ROUTE;
            case EN_ROUTE:
                return target == ON_SCENE;
            case ON_SCENE:
                return target == COMPLETED;
            default:
                return false;
        }
    }
}
