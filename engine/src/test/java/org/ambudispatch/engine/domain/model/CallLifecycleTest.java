package org.ambudispatch.engine.domain.model;

import org.ambudispatch.engine.domain.exception.InvalidTransitionException;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallLifecycleTest {

    @Test
    void priorityCodesMapToLevels() {
        assertEquals(PriorityLevel.CRITICAL, PriorityLevel.fromCode(1));
        assertEquals(PriorityLevel.HIGH, PriorityLevel.fromCode(2));
        assertEquals(PriorityLevel.MEDIUM, PriorityLevel.fromCode(3));
        assertEquals(PriorityLevel.LOW, PriorityLevel.fromCode(4));
        assertEquals(PriorityLevel.LOW, PriorityLevel.fromCode(99));
        assertThrows(IllegalArgumentException.class, () -> PriorityLevel.fromCode(0));
        assertTrue(PriorityLevel.CRITICAL.isAtLeast(PriorityLevel.HIGH));
        assertFalse(PriorityLevel.LOW.isAtLeast(PriorityLevel.MEDIUM));
    }

    @Test
    // Unmapped call types fall back to the lowest priority
    void unknownCallTypeIsLow() {
        PriorityTable table = PriorityTable.of(Collections.singletonMap("cardiac", PriorityLevel.CRITICAL));
        assertEquals(PriorityLevel.CRITICAL, table.levelFor("cardiac"));
        assertEquals(PriorityLevel.LOW, table.levelFor("unknown"));

        Call call = Call.fromRecord(new CallRecord("c1", 3, "A", "unknown"), table);
        assertEquals(PriorityLevel.LOW, call.getPriority());
    }

    @Test
    void fullLifecycleRecordsResponseTime() {
        Call call = new Call("c1", 2, "A", "cardiac", PriorityLevel.CRITICAL);
        assertTrue(Double.isNaN(call.getResponseTime()));
        call.transitionTo(CallState.ASSIGNED, 2);
        call.transitionTo(CallState.EN_ROUTE, 3);
        call.transitionTo(CallState.ON_SCENE, 9);
        call.transitionTo(CallState.COMPLETED, 39);

        assertEquals(7.0, call.getResponseTime());
        assertEquals(39.0, call.getClosedAt());
        assertTrue(call.getState().isTerminal());
    }

    @Test
    // Abandonment is only possible while waiting
    void abandonOnlyFromPending() {
        Call waiting = new Call("c1", 0, "A", "t", PriorityLevel.LOW);
        waiting.transitionTo(CallState.ABANDONED, 5);
        assertEquals(CallState.ABANDONED, waiting.getState());
        assertThrows(InvalidTransitionException.class, () -> waiting.transitionTo(CallState.ASSIGNED, 6));

        Call assigned = new Call("c2", 0, "A", "t", PriorityLevel.LOW);
        assigned.transitionTo(CallState.ASSIGNED, 0);
        assertThrows(InvalidTransitionException.class, () -> assigned.transitionTo(CallState.ABANDONED, 5));
    }

    @Test
    void statesCannotBeSkipped() {
        Call call = new Call("c1", 0, "A", "t", PriorityLevel.LOW);
        assertThrows(InvalidTransitionException.class, () -> call.transitionTo(CallState.ON_SCENE, 1));
        assertEquals(CallState.PENDING, call.getState());
    }

    @Test
    void callRecordRejectsNonFiniteArrival() {
        assertThrows(IllegalArgumentException.class, () -> new CallRecord("c1", Double.NaN, "A", "t"));
    }

    @Test
    void dispatchConfigDefaultsAndOverrides() {
        DispatchConfig config = DispatchConfig.defaults();
        assertEquals(1, config.getReservedUnits());
        assertEquals(PriorityLevel.HIGH, config.getReservationMinPriority());
        assertFalse(config.isStrictReserve());

        DispatchConfig changed = config.with(DispatchConfig.RESERVED_UNITS, 2)
                .with(DispatchConfig.RESERVATION_MIN_PRIORITY, 4);
        assertEquals(2, changed.getReservedUnits());
        assertEquals(PriorityLevel.CRITICAL, changed.getReservationMinPriority());
        assertEquals(1, config.getReservedUnits());
        assertThrows(IllegalArgumentException.class, () -> DispatchConfig.fromMap(Collections.emptyMap()).get("x"));
    }
}
