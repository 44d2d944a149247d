package org.ambudispatch.engine.queue;

import org.ambudispatch.engine.domain.exception.SimulationException;
import org.ambudispatch.engine.domain.model.Call;
import org.ambudispatch.engine.domain.model.CallState;
import org.ambudispatch.engine.domain.model.PriorityLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallQueueTest {

    private static Call call(String id, double arrival, PriorityLevel priority) {
        return new Call(id, arrival, "A", "type", priority);
    }

    private static List<String> ids(List<Call> calls) {
        List<String> ids = new ArrayList<>();
        for (Call call : calls) {
            ids.add(call.getId());
        }
        return ids;
    }

    @Test
    // Priority first, then arrival, then enqueue order
    void snapshotFollowsPriorityArrivalSequence() {
        CallQueue queue = new CallQueue();
        queue.enqueue(call("low-early", 0, PriorityLevel.LOW));
        queue.enqueue(call("high-late", 5, PriorityLevel.HIGH));
        queue.enqueue(call("critical", 7, PriorityLevel.CRITICAL));
        queue.enqueue(call("high-early", 1, PriorityLevel.HIGH));
        queue.enqueue(call("high-early-2", 1, PriorityLevel.HIGH));

        assertEquals(List.of("critical", "high-early", "high-early-2", "high-late", "low-early"),
                ids(queue.snapshot()));
        assertEquals("critical", queue.peekNext().get().getId());
        assertEquals(5, queue.size());
    }

    @Test
    // Non-increasing priority, non-decreasing arrival within a priority
    void snapshotIsOrderedAfterRemovals() {
        CallQueue queue = new CallQueue();
        PriorityLevel[] levels = PriorityLevel.values();
        for (int i = 0; i < 40; i++) {
            queue.enqueue(call("c" + i, (i * 7) % 13, levels[(i * 3) % levels.length]));
        }
        queue.dequeueAssigned("c3");
        queue.dequeueAssigned("c17");

        List<Call> snapshot = queue.snapshot();
        for (int i = 1; i < snapshot.size(); i++) {
            Call previous = snapshot.get(i - 1);
            Call current = snapshot.get(i);
            assertTrue(previous.getPriority().getRank() >= current.getPriority().getRank());
            if (previous.getPriority() == current.getPriority()) {
                assertTrue(previous.getArrivalTime() <= current.getArrivalTime());
            }
        }
        assertEquals(38, snapshot.size());
    }

    @Test
    void emptyQueue() {
        CallQueue queue = new CallQueue();
        assertTrue(queue.isEmpty());
        assertFalse(queue.peekNext().isPresent());
        assertTrue(queue.snapshot().isEmpty());
    }

    @Test
    void rejectsDuplicateAndNonPendingCalls() {
        CallQueue queue = new CallQueue();
        Call call = call("c1", 0, PriorityLevel.LOW);
        queue.enqueue(call);
        assertThrows(SimulationException.class, () -> queue.enqueue(call));

        Call assigned = call("c2", 0, PriorityLevel.LOW);
        assigned.transitionTo(CallState.ASSIGNED, 0);
        assertThrows(SimulationException.class, () -> queue.enqueue(assigned));
    }

    @Test
    void dequeueUnknownCallFails() {
        CallQueue queue = new CallQueue();
        assertThrows(SimulationException.class, () -> queue.dequeueAssigned("missing"));
    }

    @Test
    void abandonExpiredRemovesOnlyCallsPastTheirLimit() {
        CallQueue queue = new CallQueue();
        queue.enqueue(call("c1", 0, PriorityLevel.LOW));
        queue.enqueue(call("c2", 4, PriorityLevel.CRITICAL));
        queue.enqueue(call("c3", 6, PriorityLevel.LOW));

        List<Call> expired = queue.abandonExpired(9, 5);

        assertEquals(List.of("c2", "c1"), ids(expired));
        assertEquals(List.of("c3"), ids(queue.snapshot()));
        assertFalse(queue.contains("c1"));
    }
}
