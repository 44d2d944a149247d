package org.ambudispatch.engine.domain.model;

import org.ambudispatch.engine.network.RoadNetwork;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Everything a run needs as input: the network, the fleet, the call log and
 * the priority table. Immutable, so one scenario can feed many runs.
 */
public final class Scenario {

    private final RoadNetwork network;
    private final List<AmbulanceRecord> ambulances;
    private final List<CallRecord> calls;
    private final PriorityTable priorities;

    private Scenario(Builder builder) {
        this.network = Objects.requireNonNull(builder.network, "network must not be null");
        this.priorities = Objects.requireNonNull(builder.priorities, "priorities must not be null");
        this.ambulances = Collections.unmodifiableList(new ArrayList<>(builder.ambulances));
        this.calls = Collections.unmodifiableList(new ArrayList<>(builder.calls));
    }

    public RoadNetwork getNetwork() {
        return network;
    }

    public List<AmbulanceRecord> getAmbulances() {
        return ambulances;
    }

    public List<CallRecord> getCalls() {
        return calls;
    }

    public PriorityTable getPriorities() {
        return priorities;
    }

    /**
     * Same network, fleet and priorities with a different call log.
     */
    public Scenario withCalls(List<CallRecord> replacement) {
        return new Builder()
                .network(network)
                .priorities(priorities)
                .ambulances(ambulances)
                .calls(replacement)
                .build();
    }

    @Override
    public String toString() {
        return "Scenario{" + network + ", " + ambulances.size() + " ambulances, "
                + calls.size() + " calls, " + priorities.size() + " call types}";
    }

    public static final class Builder {
        private RoadNetwork network;
        private PriorityTable priorities = PriorityTable.empty();
        private final List<AmbulanceRecord> ambulances = new ArrayList<>();
        private final List<CallRecord> calls = new ArrayList<>();

        public Builder network(RoadNetwork network) {
            this.network = network;
            return this;
        }

        public Builder priorities(PriorityTable priorities) {
            this.priorities = priorities;
            return this;
        }

        public Builder ambulance(String id, String baseLocationId) {
            ambulances.add(new AmbulanceRecord(id, baseLocationId));
            return this;
        }

        public Builder ambulances(List<AmbulanceRecord> records) {
            ambulances.addAll(records);
            return this;
        }

        public Builder call(String id, double arrivalTime, String originLocationId, String callTypeCode) {
            calls.add(new CallRecord(id, arrivalTime, originLocationId, callTypeCode));
            return this;
        }

        public Builder calls(List<CallRecord> records) {
            calls.addAll(records);
            return this;
        }

        public Scenario build() {
            return new Scenario(this);
        }
    }
}
