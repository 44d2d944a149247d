package org.ambudispatch.engine.network;

/**
 * How travel times are computed for a run.
 */
public enum RoutingMode {
    /** Single-source Dijkstra per query source, rows cached. */
    ON_DEMAND,
    /** Floyd-Warshall all-pairs matrix computed up front. */
    PRECOMPUTED;

    public TravelTimes create(RoadNetwork network) {
        switch (this) {
            case PRECOMPUTED:
                return new FloydWarshallTravelTimes(network);
            case ON_DEMAND:
            default:
                return new DijkstraTravelTimes(network);
        }
    }

    public static RoutingMode fromString(String value) {
        return valueOf(value.trim().toUpperCase().replace('-', '_'));
    }
}
