package org.ambudispatch.simulation.source;

import org.ambudispatch.engine.domain.model.CallRecord;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CallSourceTest {

    private static final List<String> LOCATIONS = Arrays.asList("A", "B", "C");
    private static final List<String> TYPES = Arrays.asList("cardiac", "fall");

    @Test
    // Same seed, same log
    void generatorIsReproducible() {
        List<CallRecord> first = new CallGenerator(7, 50, 4.0, LOCATIONS, TYPES).drain();
        List<CallRecord> second = new CallGenerator(7, 50, 4.0, LOCATIONS, TYPES).drain();
        List<CallRecord> other = new CallGenerator(8, 50, 4.0, LOCATIONS, TYPES).drain();

        assertEquals(first, second);
        assertFalse(first.equals(other));
    }

    @Test
    void generatedArrivalsAreOrderedAndNumbered() {
        CallGenerator generator = new CallGenerator(1, 25, 3.0, LOCATIONS, TYPES);
        List<CallRecord> calls = generator.drain();

        assertEquals(25, calls.size());
        assertEquals(25, generator.getCallSequence());
        assertEquals(0.0, calls.get(0).getArrivalTime());
        for (int i = 0; i < calls.size(); i++) {
            assertEquals(String.valueOf(i + 1), calls.get(i).getId());
            assertTrue(LOCATIONS.contains(calls.get(i).getOriginLocationId()));
            assertTrue(TYPES.contains(calls.get(i).getCallTypeCode()));
            if (i > 0) {
                assertTrue(calls.get(i).getArrivalTime() >= calls.get(i - 1).getArrivalTime());
            }
        }
        assertThrows(NoSuchElementException.class, generator::nextCall);
    }

    @Test
    void zeroMeanIntervalPutsEveryCallAtTimeZero() {
        for (CallRecord call : new CallGenerator(3, 10, 0.0, LOCATIONS, TYPES).drain()) {
            assertEquals(0.0, call.getArrivalTime());
        }
    }

    @Test
    void generatorRejectsBadParameters() {
        assertThrows(IllegalArgumentException.class, () -> new CallGenerator(1, -1, 1.0, LOCATIONS, TYPES));
        assertThrows(IllegalArgumentException.class, () -> new CallGenerator(1, 5, Double.NaN, LOCATIONS, TYPES));
        assertThrows(IllegalArgumentException.class, () -> new CallGenerator(1, 5, 1.0, Arrays.asList(), TYPES));
        assertTrue(new CallGenerator(1, 0, 1.0, Arrays.asList(), TYPES).drain().isEmpty());
    }

    @Test
    // Ties keep their position in the log
    void recordedSourceReplaysInArrivalOrder() {
        CallRecord late = new CallRecord("late", 9, "A", "fall");
        CallRecord tieFirst = new CallRecord("x", 2, "B", "fall");
        CallRecord tieSecond = new CallRecord("y", 2, "C", "fall");
        CallRecord early = new CallRecord("early", 0, "A", "cardiac");

        RecordedCallSource source = new RecordedCallSource(Arrays.asList(late, tieFirst, tieSecond, early));

        assertEquals(Arrays.asList(early, tieFirst, tieSecond, late), source.drain());
        assertFalse(source.hasNextCall());
        assertThrows(NoSuchElementException.class, source::nextCall);
    }
}
