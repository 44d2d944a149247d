package org.ambudispatch.engine.network;

/**
 * Shortest-path travel cost between two locations of a {@link RoadNetwork}.
 * Implementations must be safe to share between concurrent runs.
 */
public interface TravelTimes {

    /**
     * @return the shortest-path cost, or {@link Double#POSITIVE_INFINITY} when
     *         {@code toId} cannot be reached from {@code fromId}
     * @throws org.ambudispatch.engine.domain.exception.UnknownLocationException
     *         if either endpoint is not in the network
     */
    double travelTime(String fromId, String toId);

    default boolean isReachable(String fromId, String toId) {
        return travelTime(fromId, toId) < Double.POSITIVE_INFINITY;
    }

    RoadNetwork getNetwork();

    RoutingStats getStats();
}
