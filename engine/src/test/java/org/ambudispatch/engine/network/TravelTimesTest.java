package org.ambudispatch.engine.network;

import org.ambudispatch.engine.domain.exception.InputException;
import org.ambudispatch.engine.domain.exception.UnknownLocationException;
import org.ambudispatch.engine.domain.model.Location;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TravelTimesTest {

    private static RoadNetwork network() {
        return new RoadNetwork.Builder()
                .addEdge("A", "B", 5)
                .addEdge("B", "C", 2)
                .addEdge("A", "C", 10)
                .addEdge("C", "A", 1)
                .addEdge("B", "B", 0)
                .addLocation("D")
                .build();
    }

    @Test
    // Both routing modes must agree on every pair
    void dijkstraMatchesFloydWarshall() {
        RoadNetwork network = network();
        TravelTimes onDemand = new DijkstraTravelTimes(network);
        TravelTimes precomputed = new FloydWarshallTravelTimes(network);
        for (Location from : network.getLocations()) {
            for (Location to : network.getLocations()) {
                assertEquals(precomputed.travelTime(from.getId(), to.getId()),
                        onDemand.travelTime(from.getId(), to.getId()),
                        from.getId() + " -> " + to.getId());
            }
        }
    }

    @Test
    void shortestPathUsesIntermediateNodes() {
        TravelTimes times = RoutingMode.ON_DEMAND.create(network());
        assertEquals(7.0, times.travelTime("A", "C"));
        assertEquals(0.0, times.travelTime("A", "A"));
    }

    @Test
    // Directed edges: C -> A is cheaper than A -> C
    void costsAreAsymmetric() {
        TravelTimes times = RoutingMode.PRECOMPUTED.create(network());
        assertEquals(1.0, times.travelTime("C", "A"));
        assertEquals(7.0, times.travelTime("A", "C"));
        assertEquals(6.0, times.travelTime("C", "B"));
    }

    @Test
    void unreachablePairIsInfinite() {
        for (RoutingMode mode : RoutingMode.values()) {
            TravelTimes times = mode.create(network());
            assertEquals(Double.POSITIVE_INFINITY, times.travelTime("A", "D"), mode.name());
            assertEquals(Double.POSITIVE_INFINITY, times.travelTime("D", "A"), mode.name());
            assertFalse(times.isReachable("A", "D"));
            assertTrue(times.isReachable("D", "D"));
        }
    }

    @Test
    void unknownLocationFails() {
        for (RoutingMode mode : RoutingMode.values()) {
            TravelTimes times = mode.create(network());
            UnknownLocationException e = assertThrows(UnknownLocationException.class,
                    () -> times.travelTime("A", "Z"));
            assertEquals("Z", e.getLocationId());
        }
    }

    @Test
    // The LRU cache keeps at most the configured number of source rows
    void onDemandCacheIsBounded() {
        DijkstraTravelTimes times = new DijkstraTravelTimes(network(), 2);
        times.travelTime("A", "C");
        times.travelTime("B", "C");
        times.travelTime("C", "A");
        times.travelTime("A", "B");
        assertEquals(2, times.cachedRows());
        assertEquals(4, times.getStats().getQueries());
        assertEquals(7.0, times.travelTime("A", "C"));
    }

    @Test
    void precomputationIsMeasured() {
        FloydWarshallTravelTimes times = new FloydWarshallTravelTimes(network());
        assertTrue(times.getStats().getPrecomputationNanos() >= 0);
        assertEquals(0, times.getStats().getQueries());
        times.travelTime("A", "B");
        assertEquals(1, times.getStats().getQueries());
    }

    @Test
    void parallelEdgesKeepTheCheapest() {
        RoadNetwork network = new RoadNetwork.Builder()
                .addEdge("A", "B", 9)
                .addEdge("A", "B", 4)
                .build();
        assertEquals(4.0, new DijkstraTravelTimes(network).travelTime("A", "B"));
        assertEquals(4.0, new FloydWarshallTravelTimes(network).travelTime("A", "B"));
    }

    @Test
    void negativeOrNonFiniteCostIsRejected() {
        assertThrows(InputException.class, () -> new NetworkEdge("A", "B", -1));
        assertThrows(InputException.class, () -> new NetworkEdge("A", "B", Double.NaN));
        assertThrows(InputException.class, () -> new NetworkEdge("A", "B", Double.POSITIVE_INFINITY));
    }

    @Test
    // An explicit node set is authoritative: edges may not invent nodes
    void explicitNodeSetRejectsUnknownEndpoints() {
        InputException e = assertThrows(InputException.class, () -> RoadNetwork.of(
                Arrays.asList(new Location("A"), new Location("B")),
                Arrays.asList(new NetworkEdge("A", "B", 1), new NetworkEdge("B", "X", 1))));
        assertEquals(1, e.getProblems().size());
        assertTrue(e.getProblems().get(0).contains("X"));
    }

    @Test
    void emptyNetworkIsAllowed() {
        RoadNetwork network = RoadNetwork.of(Collections.emptyList(), Collections.emptyList());
        assertEquals(0, network.size());
        assertFalse(network.contains("A"));
    }
}
