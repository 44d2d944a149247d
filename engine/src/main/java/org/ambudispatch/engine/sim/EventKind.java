package org.ambudispatch.engine.sim;

/**
 * Kinds of simulation events. Some are only scheduled on the clock, some
 * only appear in the event log, most do both.
 */
public enum EventKind {
    CALL_ARRIVAL(true, true),
    ASSIGNMENT_MADE(false, true),
    DEPARTURE(true, true),
    ARRIVAL_ON_SCENE(true, true),
    SERVICE_COMPLETE(true, true),
    RETURN_COMPLETE(true, true),
    ABANDON_CHECK(true, false),
    CALL_ABANDONED(false, true),
    POLICY_REJECTED(false, true);

    private final boolean schedulable;
    private final boolean logged;

    EventKind(boolean schedulable, boolean logged) {
        this.schedulable = schedulable;
        this.logged = logged;
    }

    public boolean isSchedulable() {
        return schedulable;
    }

    public boolean isLogged() {
        return logged;
    }
}
