package org.ambudispatch.engine.network;

import org.ambudispatch.engine.domain.exception.InputException;
import org.ambudispatch.engine.domain.exception.UnknownLocationException;
import org.ambudispatch.engine.domain.model.Location;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable directed graph of locations. Every location gets a dense index
 * in insertion order, which keeps shortest-path computations deterministic.
 */
public final class RoadNetwork {

    private final List<Location> locations;
    private final Map<String, Integer> indexById;
    private final List<NetworkEdge> edges;
    private final List<List<NetworkEdge>> outgoing;

    private RoadNetwork(Builder builder) {
        this.locations = Collections.unmodifiableList(new ArrayList<>(builder.locations.values()));
        Map<String, Integer> index = new LinkedHashMap<>();
        for (int i = 0; i < locations.size(); i++) {
            index.put(locations.get(i).getId(), i);
        }
        this.indexById = Collections.unmodifiableMap(index);
        this.edges = Collections.unmodifiableList(new ArrayList<>(builder.edges));

        List<List<NetworkEdge>> adjacency = new ArrayList<>(locations.size());
        for (int i = 0; i < locations.size(); i++) {
            adjacency.add(new ArrayList<>());
        }
        for (NetworkEdge edge : edges) {
            adjacency.get(index.get(edge.getFromId())).add(edge);
        }
        List<List<NetworkEdge>> frozen = new ArrayList<>(adjacency.size());
        for (List<NetworkEdge> list : adjacency) {
            frozen.add(Collections.unmodifiableList(list));
        }
        this.outgoing = Collections.unmodifiableList(frozen);
    }

    /**
     * Builds a network from an explicit node set. Edges that reference a
     * location outside {@code locations} are rejected.
     */
    public static RoadNetwork of(Collection<Location> locations, Collection<NetworkEdge> edges) {
        Builder builder = new Builder();
        locations.forEach(builder::addLocation);
        List<String> problems = new ArrayList<>();
        for (NetworkEdge edge : edges) {
            if (!builder.locations.containsKey(edge.getFromId())) {
                problems.add("Edge " + edge + " starts at unknown location " + edge.getFromId());
            } else if (!builder.locations.containsKey(edge.getToId())) {
                problems.add("Edge " + edge + " ends at unknown location " + edge.getToId());
            } else {
                builder.addEdge(edge);
            }
        }
        if (!problems.isEmpty()) {
            throw new InputException(problems.size() + " invalid network edge(s)", problems);
        }
        return builder.build();
    }

    public int size() {
        return locations.size();
    }

    public boolean contains(String locationId) {
        return indexById.containsKey(locationId);
    }

    public int indexOf(String locationId) {
        Integer index = indexById.get(locationId);
        if (index == null) {
            throw new UnknownLocationException(locationId);
        }
        return index;
    }

    public Location location(String locationId) {
        return locations.get(indexOf(locationId));
    }

    public Location locationAt(int index) {
        return locations.get(index);
    }

    public List<Location> getLocations() {
        return locations;
    }

    public List<NetworkEdge> getEdges() {
        return edges;
    }

    public List<NetworkEdge> outgoing(int index) {
        return outgoing.get(index);
    }

    @Override
    public String toString() {
        return "RoadNetwork{" + locations.size() + " locations, " + edges.size() + " edges}";
    }

    /**
     * Builder for RoadNetwork. {@link #addEdge(String, String, double)} adds
     * unseen endpoints to the node set, the same way edge lists are loaded.
     */
    public static final class Builder {
        private final Map<String, Location> locations = new LinkedHashMap<>();
        private final List<NetworkEdge> edges = new ArrayList<>();

        public Builder addLocation(Location location) {
            Objects.requireNonNull(location, "location must not be null");
            Location existing = locations.get(location.getId());
            if (existing == null || (!existing.hasCoordinate() && location.hasCoordinate())) {
                locations.put(location.getId(), location);
            }
            return this;
        }

        public Builder addLocation(String locationId) {
            locations.putIfAbsent(locationId, new Location(locationId));
            return this;
        }

        public Builder addEdge(String fromId, String toId, double cost) {
            return addEdge(new NetworkEdge(fromId, toId, cost));
        }

        public Builder addEdge(NetworkEdge edge) {
            addLocation(edge.getFromId());
            addLocation(edge.getToId());
            edges.add(edge);
            return this;
        }

        public RoadNetwork build() {
            return new RoadNetwork(this);
        }
    }
}
