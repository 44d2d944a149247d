package org.ambudispatch.simulation.loader;

import org.ambudispatch.engine.domain.exception.InputException;
import org.ambudispatch.engine.domain.model.CallRecord;
import org.ambudispatch.engine.domain.model.PriorityLevel;
import org.ambudispatch.engine.domain.model.Scenario;
import org.ambudispatch.engine.network.DijkstraTravelTimes;
import org.ambudispatch.simulation.ScenarioFiles;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScenarioLoaderTest {

    @TempDir
    Path dir;

    @Test
    void loadsAllFourFiles() throws IOException {
        Scenario scenario = new ScenarioLoader(ScenarioFiles.write(dir)).load();

        assertEquals(3, scenario.getNetwork().size());
        assertEquals(5, scenario.getNetwork().getEdges().size());
        assertEquals(2, scenario.getAmbulances().size());
        assertEquals(4, scenario.getCalls().size());
        assertEquals(PriorityLevel.CRITICAL, scenario.getPriorities().levelFor("cardiac"));
        assertEquals(PriorityLevel.MEDIUM, scenario.getPriorities().levelFor("fall"));
        assertEquals(PriorityLevel.LOW, scenario.getPriorities().levelFor("minor"));
    }

    @Test
    // Edge cost is travel time plus traffic delay
    void edgeCostIncludesTrafficDelay() throws IOException {
        Scenario scenario = new ScenarioLoader(ScenarioFiles.write(dir)).load();
        DijkstraTravelTimes times = new DijkstraTravelTimes(scenario.getNetwork());

        assertEquals(5.0, times.travelTime("A", "B"));
        assertEquals(7.5, times.travelTime("A", "C"));
        assertEquals(7.5, times.travelTime("C", "A"));
    }

    @Test
    void byteOrderMarkAndSurroundingSpacesAreIgnored() throws IOException {
        ScenarioFiles.write(dir);
        ScenarioFiles.writeFile(dir.resolve(ScenarioLoader.AMBULANCE_FILE),
                "\uFEFFAmbulance Number,Staging Location\n amb1 , A \n\namb2,C\n");

        Scenario scenario = new ScenarioLoader(dir).load();

        assertEquals("amb1", scenario.getAmbulances().get(0).getId());
        assertEquals("A", scenario.getAmbulances().get(0).getBaseLocationId());
        assertEquals(2, scenario.getAmbulances().size());
    }

    @Test
    void blankArrivalTimeMeansTimeZero() throws IOException {
        ScenarioFiles.write(dir);
        ScenarioFiles.writeFile(dir.resolve(ScenarioLoader.CALLS_FILE),
                "Call ID,Location,Call Type,Arrival Time\nc1,B,fall,\nc2,A,minor,3.5\n");

        List<CallRecord> calls = new ScenarioLoader(dir).loadCalls(dir.resolve(ScenarioLoader.CALLS_FILE));

        assertEquals(0.0, calls.get(0).getArrivalTime());
        assertEquals(3.5, calls.get(1).getArrivalTime());
        assertEquals("c1", calls.get(0).getId());
    }

    @Test
    // All bad rows are reported together
    void malformedRowsFailTheWholeFile() throws IOException {
        ScenarioFiles.write(dir);
        Path network = dir.resolve(ScenarioLoader.NETWORK_FILE);
        ScenarioFiles.writeFile(network, "Start,End,Travel Time,Traffic Delay\n"
                + "A,B,4,1\n"
                + "A,C,x,1\n"
                + "B,C,-3,1\n"
                + ",C,1,1\n");

        InputException e = assertThrows(InputException.class, () -> new ScenarioLoader(dir).load());

        assertEquals(3, e.getProblems().size());
        assertTrue(e.getProblems().get(0).startsWith("location_network.csv row 2"));
        assertTrue(e.getProblems().get(1).startsWith("location_network.csv row 3"));
        assertTrue(e.getProblems().get(2).startsWith("location_network.csv row 4"));
    }

    @Test
    void invalidPrioritiesAreRejected() throws IOException {
        Path file = dir.resolve(ScenarioLoader.PRIORITY_FILE);
        ScenarioFiles.writeFile(file, "Call Type,Priority\ncardiac,1\ncardiac,2\nfall,zero\nminor,0\n");

        InputException e = assertThrows(InputException.class, () -> new ScenarioLoader(dir).loadPriorities(file));

        assertEquals(3, e.getProblems().size());
        assertTrue(e.getProblems().get(0).contains("duplicate call type cardiac"));
    }

    @Test
    void callsWithoutLocationAreRejected() throws IOException {
        Path file = dir.resolve(ScenarioLoader.CALLS_FILE);
        ScenarioFiles.writeFile(file, "Call ID,Location,Call Type,Arrival Time\n1,,fall,0\n2,A,fall,soon\n");

        InputException e = assertThrows(InputException.class, () -> new ScenarioLoader(dir).loadCalls(file));

        assertEquals(2, e.getProblems().size());
    }

    @Test
    void missingFileIsAnInputError() throws IOException {
        ScenarioFiles.write(dir);
        Files.delete(dir.resolve(ScenarioLoader.CALLS_FILE));

        InputException e = assertThrows(InputException.class, () -> new ScenarioLoader(dir).load());
        assertTrue(e.getMessage().contains(ScenarioLoader.CALLS_FILE));
    }

    @Test
    void headerOnlyFilesGiveAnEmptyScenario() throws IOException {
        ScenarioFiles.write(dir, "Start,End,Travel Time,Traffic Delay\n", "Call Type,Priority\n",
                "Ambulance Number,Staging Location\n", "Call ID,Location,Call Type,Arrival Time\n");

        Scenario scenario = new ScenarioLoader(dir).load();

        assertEquals(0, scenario.getNetwork().size());
        assertFalse(scenario.getPriorities().contains("cardiac"));
        assertTrue(scenario.getCalls().isEmpty());
    }
}
