package org.ambudispatch.engine.sim;

import java.util.Objects;

/**
 * An event waiting on the clock. Ordered by time, then by the sequence the
 * clock handed out when it was scheduled.
 */
public final class SimulationEvent implements Comparable<SimulationEvent> {

    private final EventKind kind;
    private final double time;
    private final long sequence;
    private final String callId;
    private final String ambulanceId;

    SimulationEvent(EventKind kind, double time, long sequence, String callId, String ambulanceId) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.time = time;
        this.sequence = sequence;
        this.callId = callId;
        this.ambulanceId = ambulanceId;
    }

    public EventKind getKind() {
        return kind;
    }

    public double getTime() {
        return time;
    }

    public long getSequence() {
        return sequence;
    }

    public String getCallId() {
        return callId;
    }

    public String getAmbulanceId() {
        return ambulanceId;
    }

    @Override
    public int compareTo(SimulationEvent other) {
        int byTime = Double.compare(time, other.time);
        return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return String.format("SimulationEvent{#%d %s t=%.3f call=%s ambulance=%s}",
                sequence, kind, time, callId, ambulanceId);
    }
}
