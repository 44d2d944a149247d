package org.ambudispatch.engine.sim;

import java.util.Locale;
import java.util.Objects;

/**
 * One line of the event log.
 */
public final class EventLogEntry {

    private final double time;
    private final EventKind kind;
    private final String callId;
    private final String ambulanceId;

    public EventLogEntry(double time, EventKind kind, String callId, String ambulanceId) {
        this.time = time;
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.callId = callId;
        this.ambulanceId = ambulanceId;
    }

    public double getTime() {
        return time;
    }

    public EventKind getKind() {
        return kind;
    }

    public String getCallId() {
        return callId;
    }

    public String getAmbulanceId() {
        return ambulanceId;
    }

    /**
     * Stable textual form, identical for identical entries on every platform.
     */
    public String toLine() {
        return String.format(Locale.ROOT, "%.4f,%s,%s,%s", time, kind,
                callId == null ? "" : callId, ambulanceId == null ? "" : ambulanceId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EventLogEntry)) {
            return false;
        }
        EventLogEntry that = (EventLogEntry) o;
        return Double.compare(time, that.time) == 0
                && kind == that.kind
                && Objects.equals(callId, that.callId)
                && Objects.equals(ambulanceId, that.ambulanceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(time, kind, callId, ambulanceId);
    }

    @Override
    public String toString() {
        return toLine();
    }
}
