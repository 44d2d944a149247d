package org.ambudispatch.engine.sim;

public enum RunStatus {
    /** Every call ended Completed or Abandoned. */
    COMPLETED,
    /** The event heap drained while some calls were still open. */
    INCOMPLETE,
    /** Stopped between events on request. */
    CANCELLED
}
