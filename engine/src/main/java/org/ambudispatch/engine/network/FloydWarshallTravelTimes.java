package org.ambudispatch.engine.network;

import java.util.Arrays;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * All-pairs shortest paths computed once with Floyd-Warshall (O(V^3)),
 * then answered by matrix lookup. The matrix is never written after
 * construction, so concurrent reads need no locking.
 */
public final class FloydWarshallTravelTimes implements TravelTimes {

    private static final Logger LOG = Logger.getLogger(FloydWarshallTravelTimes.class.getName());

    private final RoadNetwork network;
    private final RoutingStats stats = new RoutingStats();
    private final double[][] matrix;

    public FloydWarshallTravelTimes(RoadNetwork network) {
        this.network = Objects.requireNonNull(network, "network must not be null");
        long start = System.nanoTime();
        this.matrix = precompute(network);
        long elapsed = System.nanoTime() - start;
        stats.recordPrecomputation(elapsed);
        LOG.info(() -> String.format("Floyd-Warshall precomputation for %d locations took %.6fs",
                network.size(), elapsed / 1e9));
    }

    private static double[][] precompute(RoadNetwork network) {
        int n = network.size();
        double[][] dist = new double[n][n];
        for (int i = 0; i < n; i++) {
            Arrays.fill(dist[i], Double.POSITIVE_INFINITY);
            dist[i][i] = 0.0;
        }
        // Parallel edges keep the cheapest cost.
        for (NetworkEdge edge : network.getEdges()) {
            int from = network.indexOf(edge.getFromId());
            int to = network.indexOf(edge.getToId());
            if (edge.getCost() < dist[from][to]) {
                dist[from][to] = edge.getCost();
            }
        }
        for (int k = 0; k < n; k++) {
            double[] viaK = dist[k];
            for (int i = 0; i < n; i++) {
                double ik = dist[i][k];
                if (ik == Double.POSITIVE_INFINITY) {
                    continue;
                }
                double[] row = dist[i];
                for (int j = 0; j < n; j++) {
                    double candidate = ik + viaK[j];
                    if (candidate < row[j]) {
                        row[j] = candidate;
                    }
                }
            }
        }
        return dist;
    }

    @Override
    public double travelTime(String fromId, String toId) {
        int from = network.indexOf(fromId);
        int to = network.indexOf(toId);
        long start = System.nanoTime();
        double result = matrix[from][to];
        stats.recordQuery(System.nanoTime() - start);
        return result;
    }

    @Override
    public RoadNetwork getNetwork() {
        return network;
    }

    @Override
    public RoutingStats getStats() {
        return stats;
    }
}
