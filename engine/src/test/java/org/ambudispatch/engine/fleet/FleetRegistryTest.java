package org.ambudispatch.engine.fleet;

import org.ambudispatch.engine.domain.exception.InputException;
import org.ambudispatch.engine.domain.exception.InvalidTransitionException;
import org.ambudispatch.engine.domain.exception.SimulationException;
import org.ambudispatch.engine.domain.exception.UnknownAmbulanceException;
import org.ambudispatch.engine.domain.exception.UnknownLocationException;
import org.ambudispatch.engine.domain.model.Ambulance;
import org.ambudispatch.engine.domain.model.AmbulanceState;
import org.ambudispatch.engine.domain.model.Candidate;
import org.ambudispatch.engine.network.DijkstraTravelTimes;
import org.ambudispatch.engine.network.RoadNetwork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FleetRegistryTest {

    private FleetRegistry fleet;

    @BeforeEach
    void setUp() {
        RoadNetwork network = new RoadNetwork.Builder()
                .addEdge("N1", "X", 3)
                .addEdge("N2", "X", 3)
                .addEdge("N3", "X", 1)
                .addEdge("X", "N1", 3)
                .addLocation("ISLAND")
                .build();
        fleet = new FleetRegistry(new DijkstraTravelTimes(network));
        fleet.register(new Ambulance("b", "N1"));
        fleet.register(new Ambulance("a", "N2"));
        fleet.register(new Ambulance("c", "N3"));
        fleet.register(new Ambulance("z", "ISLAND"));
    }

    private static List<String> ids(List<Ambulance> ambulances) {
        List<String> ids = new ArrayList<>();
        for (Ambulance ambulance : ambulances) {
            ids.add(ambulance.getId());
        }
        return ids;
    }

    @Test
    // Nearest first, equal travel times by id, unreachable units left out
    void availableNearOrdersByTravelTimeThenId() {
        assertEquals(List.of("c", "a", "b"), ids(fleet.availableNear("X")));

        List<Candidate> candidates = fleet.candidatesFor("X");
        assertEquals(1.0, candidates.get(0).getTravelTime());
        assertEquals(3.0, candidates.get(1).getTravelTime());
    }

    @Test
    void busyAmbulancesAreNotAvailable() {
        fleet.markDispatched("c", "call-1", 0);
        assertEquals(List.of("a", "b"), ids(fleet.availableNear("X")));
        assertEquals(3, fleet.idleCount());
    }

    @Test
    void fullCycleReturnsToIdleAndTracksBusyTime() {
        fleet.markDispatched("c", "call-1", 2);
        fleet.markEnRoute("c", 2);
        fleet.markOnScene("c", "X", 3);
        assertEquals("X", fleet.get("c").getLocationId());
        fleet.markReturning("c", 33);
        fleet.markReturned("c", "X", 33);

        Ambulance ambulance = fleet.get("c");
        assertEquals(AmbulanceState.IDLE, ambulance.getState());
        assertNull(ambulance.getCallId());
        assertNull(fleet.servingAmbulance("call-1"));
        assertEquals(31.0, ambulance.getBusyTime(100));
    }

    @Test
    void skippingAStateFails() {
        fleet.markDispatched("a", "call-1", 0);
        assertThrows(InvalidTransitionException.class, () -> fleet.markOnScene("a", "X", 1));
        assertThrows(InvalidTransitionException.class, () -> fleet.markReturned("b", "N1", 1));
    }

    @Test
    void unknownAmbulanceFails() {
        UnknownAmbulanceException e = assertThrows(UnknownAmbulanceException.class,
                () -> fleet.markEnRoute("ghost", 0));
        assertEquals("ghost", e.getAmbulanceId());
    }

    @Test
    // One ambulance per call, one call per ambulance
    void callCannotBeServedTwice() {
        fleet.markDispatched("a", "call-1", 0);
        assertThrows(SimulationException.class, () -> fleet.markDispatched("b", "call-1", 0));
        assertThrows(InvalidTransitionException.class, () -> fleet.markDispatched("a", "call-2", 0));
        assertEquals("a", fleet.servingAmbulance("call-1"));
        assertTrue(fleet.activeAssignments().containsKey("call-1"));
    }

    @Test
    void registrationIsValidated() {
        assertThrows(InputException.class, () -> fleet.register(new Ambulance("a", "N1")));
        assertThrows(UnknownLocationException.class, () -> fleet.register(new Ambulance("q", "NOWHERE")));
        assertEquals(4, fleet.size());
    }
}
