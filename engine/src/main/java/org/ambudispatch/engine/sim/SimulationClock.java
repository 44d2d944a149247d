package org.ambudispatch.engine.sim;

import org.ambudispatch.engine.domain.exception.SimulationException;

import java.util.PriorityQueue;

/**
 * Simulated time plus the min-heap of pending events. One clock per run.
 */
public final class SimulationClock {

    private final PriorityQueue<SimulationEvent> pending = new PriorityQueue<>();
    private double now;
    private long nextSequence;

    public SimulationClock() {
        reset(0.0);
    }

    /**
     * Drops all pending events and moves time to {@code startTime}.
     */
    public void reset(double startTime) {
        pending.clear();
        now = startTime;
        nextSequence = 0;
    }

    public SimulationEvent schedule(EventKind kind, double time, String callId, String ambulanceId) {
        if (!kind.isSchedulable()) {
            throw new SimulationException(kind + " cannot be scheduled");
        }
        if (Double.isNaN(time) || time < now) {
            throw new SimulationException(String.format("Cannot schedule %s at %.3f, clock is at %.3f", kind, time, now));
        }
        SimulationEvent event = new SimulationEvent(kind, time, nextSequence++, callId, ambulanceId);
        pending.add(event);
        return event;
    }

    public boolean hasPending() {
        return !pending.isEmpty();
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Time of the earliest pending event.
     *
     * @throws SimulationException if nothing is pending
     */
    public double peekTime() {
        SimulationEvent head = pending.peek();
        if (head == null) {
            throw new SimulationException("No pending events");
        }
        return head.getTime();
    }

    /**
     * Removes the earliest event and advances the clock to its time.
     */
    public SimulationEvent next() {
        SimulationEvent event = pending.poll();
        if (event == null) {
            throw new SimulationException("No pending events");
        }
        now = event.getTime();
        return event;
    }

    public double now() {
        return now;
    }
}
