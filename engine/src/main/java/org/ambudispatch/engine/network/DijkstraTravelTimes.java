package org.ambudispatch.engine.network;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.logging.Logger;

/**
 * On-demand shortest paths. Each query source gets one Dijkstra run over the
 * whole graph; the resulting distance row is kept in a bounded LRU cache so
 * repeated queries from the same ambulance location are lookups.
 */
public final class DijkstraTravelTimes implements TravelTimes {

    private static final Logger LOG = Logger.getLogger(DijkstraTravelTimes.class.getName());

    public static final int DEFAULT_CACHE_SIZE = 256;

    private final RoadNetwork network;
    private final RoutingStats stats = new RoutingStats();
    private final Map<Integer, double[]> rowCache;

    public DijkstraTravelTimes(RoadNetwork network) {
        this(network, DEFAULT_CACHE_SIZE);
    }

    public DijkstraTravelTimes(RoadNetwork network, int maxCachedRows) {
        this.network = Objects.requireNonNull(network, "network must not be null");
        if (maxCachedRows < 1) {
            throw new IllegalArgumentException("maxCachedRows must be at least 1");
        }
        this.rowCache = new LinkedHashMap<Integer, double[]>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Integer, double[]> eldest) {
                return size() > maxCachedRows;
            }
        };
        LOG.fine(() -> "On-demand routing over " + network + ", cache size " + maxCachedRows);
    }

    @Override
    public double travelTime(String fromId, String toId) {
        int from = network.indexOf(fromId);
        int to = network.indexOf(toId);
        long start = System.nanoTime();
        double[] row;
        synchronized (rowCache) {
            row = rowCache.get(from);
            if (row == null) {
                row = shortestPathsFrom(from);
                rowCache.put(from, row);
            }
        }
        double result = row[to];
        stats.recordQuery(System.nanoTime() - start);
        return result;
    }

    private double[] shortestPathsFrom(int source) {
        double[] distances = new double[network.size()];
        Arrays.fill(distances, Double.POSITIVE_INFINITY);
        distances[source] = 0.0;

        // Ties on distance resolve by node index so that the visit order is stable.
        PriorityQueue<double[]> frontier = new PriorityQueue<>((a, b) -> {
            int byCost = Double.compare(a[0], b[0]);
            return byCost != 0 ? byCost : Double.compare(a[1], b[1]);
        });
        frontier.add(new double[]{0.0, source});

        while (!frontier.isEmpty()) {
            double[] head = frontier.poll();
            double cost = head[0];
            int node = (int) head[1];
            if (cost > distances[node]) {
                continue;
            }
            for (NetworkEdge edge : network.outgoing(node)) {
                int neighbor = network.indexOf(edge.getToId());
                double candidate = cost + edge.getCost();
                if (candidate < distances[neighbor]) {
                    distances[neighbor] = candidate;
                    frontier.add(new double[]{candidate, neighbor});
                }
            }
        }
        return distances;
    }

    public int cachedRows() {
        synchronized (rowCache) {
            return rowCache.size();
        }
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
