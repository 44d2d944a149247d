package org.ambudispatch.engine.queue;

import org.ambudispatch.engine.domain.exception.SimulationException;
import org.ambudispatch.engine.domain.model.Call;
import org.ambudispatch.engine.domain.model.CallState;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Pending calls waiting for an ambulance.
 *
 * Order: higher priority first, then earlier arrival, then earlier
 * enqueue. The enqueue sequence makes the order total, so two calls never
 * compare equal. Priorities are fixed once a call is queued.
 */
public final class CallQueue {

    static final Comparator<Entry> ORDER = Comparator
            .comparingInt((Entry e) -> -e.call.getPriority().getRank())
            .thenComparingDouble(e -> e.call.getArrivalTime())
            .thenComparingLong(e -> e.sequence);

    private final PriorityQueue<Entry> heap = new PriorityQueue<>(ORDER);
    private final Map<String, Entry> entries = new HashMap<>();
    private long nextSequence;

    public void enqueue(Call call) {
        if (call.getState() != CallState.PENDING) {
            throw new SimulationException("Only Pending calls can be queued: " + call);
        }
        if (entries.containsKey(call.getId())) {
            throw new SimulationException("Call already queued: " + call.getId());
        }
        Entry entry = new Entry(call, nextSequence++);
        entries.put(call.getId(), entry);
        heap.add(entry);
    }

    public Optional<Call> peekNext() {
        Entry head = heap.peek();
        return head == null ? Optional.empty() : Optional.of(head.call);
    }

    /**
     * Removes a call that has just been assigned.
     *
     * @throws SimulationException if the call is not queued
     */
    public Call dequeueAssigned(String callId) {
        Entry entry = entries.remove(callId);
        if (entry == null) {
            throw new SimulationException("Call not in queue: " + callId);
        }
        heap.remove(entry);
        return entry.call;
    }

    /**
     * Removes every call that has waited at least {@code maxWait} by
     * {@code now} and returns them in queue order. The caller is responsible
     * for moving them to ABANDONED.
     */
    public List<Call> abandonExpired(double now, double maxWait) {
        List<Call> expired = new ArrayList<>();
        for (Call call : snapshot()) {
            if (call.getArrivalTime() + maxWait <= now) {
                dequeueAssigned(call.getId());
                expired.add(call);
            }
        }
        return expired;
    }

    /**
     * Queued calls in dispatch order. The queue itself is not modified.
     */
    public List<Call> snapshot() {
        List<Entry> ordered = new ArrayList<>(heap);
        ordered.sort(ORDER);
        List<Call> calls = new ArrayList<>(ordered.size());
        for (Entry entry : ordered) {
            calls.add(entry.call);
        }
        return calls;
    }

    public boolean contains(String callId) {
        return entries.containsKey(callId);
    }

    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    static final class Entry {
        final Call call;
        final long sequence;

        Entry(Call call, long sequence) {
            this.call = call;
            this.sequence = sequence;
        }
    }
}
