package org.ambudispatch.engine.domain.service;

import org.ambudispatch.engine.domain.model.Call;
import org.ambudispatch.engine.domain.model.Candidate;
import org.ambudispatch.engine.domain.model.DispatchConfig;
import org.ambudispatch.engine.domain.model.DispatchSnapshot;
import org.ambudispatch.engine.domain.model.PriorityLevel;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

class NearestAvailablePolicyTest {

    private final DispatchPolicy policy = new NearestAvailablePolicy();
    private final Call call = new Call("c1", 0, "A", "type", PriorityLevel.MEDIUM);

    private static Candidate candidate(String id, double travelTime) {
        return new Candidate(id, "L-" + id, "L-" + id, travelTime);
    }

    private Optional<String> select(List<Candidate> candidates) {
        DispatchSnapshot snapshot = new DispatchSnapshot(0, candidates, Collections.emptyMap());
        return policy.select(call, snapshot, DispatchConfig.defaults());
    }

    @Test
    // The chosen unit has the minimum travel time among all Idle units
    void picksMinimumTravelTime() {
        Random random = new Random(7);
        for (int round = 0; round < 50; round++) {
            List<Candidate> candidates = new ArrayList<>();
            String best = null;
            double bestTime = Double.POSITIVE_INFINITY;
            for (int i = 0; i < 8; i++) {
                double time = (round * 8 + i) % 17 + random.nextDouble();
                candidates.add(candidate("amb" + i, time));
                if (time < bestTime) {
                    bestTime = time;
                    best = "amb" + i;
                }
            }
            Collections.shuffle(candidates, random);
            assertEquals(Optional.of(best), select(candidates));
        }
    }

    @Test
    void tiesGoToSmallestId() {
        assertEquals(Optional.of("a"), select(Arrays.asList(candidate("b", 4), candidate("a", 4), candidate("c", 9))));
    }

    @Test
    void neverPicksUnreachableUnits() {
        assertFalse(select(Arrays.asList(candidate("a", Double.POSITIVE_INFINITY))).isPresent());
        assertEquals(Optional.of("b"), select(Arrays.asList(
                candidate("a", Double.POSITIVE_INFINITY), candidate("b", 100))));
    }

    @Test
    void noCandidatesMeansNoChoice() {
        assertFalse(select(Collections.emptyList()).isPresent());
    }
}
