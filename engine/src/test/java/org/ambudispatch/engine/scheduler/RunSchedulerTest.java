package org.ambudispatch.engine.scheduler;

import org.ambudispatch.engine.config.EngineConfig;
import org.ambudispatch.engine.domain.exception.SimulationException;
import org.ambudispatch.engine.domain.model.Scenario;
import org.ambudispatch.engine.domain.service.PolicyType;
import org.ambudispatch.engine.network.RoadNetwork;
import org.ambudispatch.engine.network.RoutingMode;
import org.ambudispatch.engine.network.TravelTimes;
import org.ambudispatch.engine.sim.RunStatus;
import org.ambudispatch.engine.sim.SimulationEngine;
import org.ambudispatch.engine.sim.SimulationResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RunSchedulerTest {

    private final RunScheduler scheduler = new RunScheduler(2);

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    private static Scenario scenario() {
        Scenario.Builder builder = new Scenario.Builder()
                .network(new RoadNetwork.Builder().addEdge("B", "A", 3).addEdge("A", "B", 3).build())
                .ambulance("amb1", "B")
                .ambulance("amb2", "A");
        for (int i = 0; i < 10; i++) {
            builder.call("c" + i, i * 4, i % 2 == 0 ? "A" : "B", "any");
        }
        return builder.build();
    }

    @Test
    // Runs share the scenario and travel times, nothing else
    void runsEveryPolicyAndKeepsOrder() {
        Scenario scenario = scenario();
        TravelTimes times = RoutingMode.ON_DEMAND.create(scenario.getNetwork());
        Map<String, SimulationEngine> runs = new LinkedHashMap<>();
        for (PolicyType type : PolicyType.values()) {
            EngineConfig config = EngineConfig.defaults().toBuilder().policyType(type).build();
            runs.put(type.create().name(), new SimulationEngine(scenario, times, config));
        }

        Map<String, SimulationResult> results = scheduler.runAll(runs, Duration.ofSeconds(30));

        assertEquals(new ArrayList<>(runs.keySet()), new ArrayList<>(results.keySet()));
        for (SimulationResult result : results.values()) {
            assertEquals(RunStatus.COMPLETED, result.getStatus());
            assertEquals(10, result.getCompletedCount());
        }
        SimulationResult sequential = new SimulationEngine(scenario, times, EngineConfig.defaults()).run();
        assertEquals(sequential.getEventLines(), results.get("nearest").getEventLines());
    }

    @Test
    // A run over budget is cancelled and its partial result kept
    void runOverBudgetIsCancelled() throws Exception {
        CountDownLatch cancelled = new CountDownLatch(1);
        SimulationResult partial = mock(SimulationResult.class);
        when(partial.getStatus()).thenReturn(RunStatus.CANCELLED);
        SimulationEngine slow = mock(SimulationEngine.class);
        doAnswer(invocation -> {
            cancelled.countDown();
            return null;
        }).when(slow).cancel();
        when(slow.run()).thenAnswer(invocation -> {
            cancelled.await(10, TimeUnit.SECONDS);
            return partial;
        });
        Map<String, SimulationEngine> runs = new LinkedHashMap<>();
        runs.put("slow", slow);

        Map<String, SimulationResult> results = scheduler.runAll(runs, Duration.ofMillis(50));

        verify(slow).cancel();
        assertSame(partial, results.get("slow"));
        assertEquals(RunStatus.CANCELLED, results.get("slow").getStatus());
    }

    @Test
    void failingRunIsReported() {
        SimulationEngine broken = mock(SimulationEngine.class);
        when(broken.run()).thenThrow(new SimulationException("boom"));
        Map<String, SimulationEngine> runs = new LinkedHashMap<>();
        runs.put("broken", broken);

        SimulationException e = assertThrows(SimulationException.class,
                () -> scheduler.runAll(runs, Duration.ofSeconds(5)));
        assertEquals("boom", e.getMessage());
    }

    @Test
    void stoppedSchedulerRejectsRuns() {
        scheduler.stop();
        assertFalse(scheduler.isRunning());
        assertThrows(IllegalStateException.class,
                () -> scheduler.submit("late", mock(SimulationEngine.class)));
    }

    @Test
    void workerCountMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new RunScheduler(0));
        assertEquals(2, scheduler.getWorkers());
    }
}
