package org.ambudispatch.engine.network;

import org.ambudispatch.engine.domain.exception.InputException;

import java.util.Objects;

/**
 * Directed, weighted link between two locations.
 */
public final class NetworkEdge {

    private final String fromId;
    private final String toId;
    private final double cost;

    public NetworkEdge(String fromId, String toId, double cost) {
        this.fromId = Objects.requireNonNull(fromId, "fromId must not be null");
        this.toId = Objects.requireNonNull(toId, "toId must not be null");
        if (Double.isNaN(cost) || Double.isInfinite(cost) || cost < 0) {
            throw new InputException(String.format("Edge %s -> %s has invalid cost %s", fromId, toId, cost));
        }
        this.cost = cost;
    }

    public String getFromId() {
        return fromId;
    }

    public String getToId() {
        return toId;
    }

    public double getCost() {
        return cost;
    }

    public boolean isSelfLoop() {
        return fromId.equals(toId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NetworkEdge)) {
            return false;
        }
        NetworkEdge that = (NetworkEdge) o;
        return Double.compare(cost, that.cost) == 0 && fromId.equals(that.fromId) && toId.equals(that.toId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromId, toId, cost);
    }

    @Override
    public String toString() {
        return fromId + " -> " + toId + " (" + cost + ")";
    }
}
