package org.ambudispatch.engine.sim;

import org.ambudispatch.engine.config.EngineConfig;
import org.ambudispatch.engine.domain.exception.SimulationException;
import org.ambudispatch.engine.domain.model.Ambulance;
import org.ambudispatch.engine.domain.model.AmbulanceRecord;
import org.ambudispatch.engine.domain.model.Call;
import org.ambudispatch.engine.domain.model.CallRecord;
import org.ambudispatch.engine.domain.model.Scenario;
import org.ambudispatch.engine.domain.service.DispatchPolicy;
import org.ambudispatch.engine.fleet.FleetRegistry;
import org.ambudispatch.engine.network.TravelTimes;
import org.ambudispatch.engine.queue.CallQueue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * All mutable state of a single run. Nothing in here is shared with another
 * run; the scenario and the travel-time provider are read-only.
 */
public final class RunContext {

    private final Scenario scenario;
    private final TravelTimes travelTimes;
    private final EngineConfig config;
    private final DispatchPolicy policy;

    private final SimulationClock clock = new SimulationClock();
    private final FleetRegistry fleet;
    private final CallQueue queue = new CallQueue();
    private final EventLog eventLog = new EventLog();
    private final Map<String, CallRecord> callRecords = new LinkedHashMap<>();
    private final Map<String, Call> calls = new LinkedHashMap<>();
    private final Map<String, String> returnDestinations = new HashMap<>();
    private final List<DispatchRecord> dispatchRecords = new ArrayList<>();

    RunContext(Scenario scenario, TravelTimes travelTimes, EngineConfig config, DispatchPolicy policy) {
        this.scenario = Objects.requireNonNull(scenario, "scenario must not be null");
        this.travelTimes = Objects.requireNonNull(travelTimes, "travelTimes must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.fleet = new FleetRegistry(travelTimes);

        for (AmbulanceRecord record : scenario.getAmbulances()) {
            fleet.register(Ambulance.fromRecord(record));
        }
        for (CallRecord record : scenario.getCalls()) {
            callRecords.put(record.getId(), record);
        }
    }

    /**
     * Creates the Pending call for an arrival. A call exists only from its
     * arrival on.
     *
     * @throws SimulationException if the call is unknown or already arrived
     */
    public Call arrive(String callId) {
        CallRecord record = callId == null ? null : callRecords.get(callId);
        if (record == null) {
            throw new SimulationException("Arrival of unknown call: " + callId);
        }
        if (calls.containsKey(callId)) {
            throw new SimulationException("Call arrived twice: " + callId);
        }
        Call call = Call.fromRecord(record, scenario.getPriorities());
        calls.put(callId, call);
        return call;
    }

    public Call call(String callId) {
        Call call = callId == null ? null : calls.get(callId);
        if (call == null) {
            throw new SimulationException("Event references unknown call: " + callId);
        }
        return call;
    }

    /**
     * Calls that have arrived so far, in arrival order.
     */
    public Collection<Call> getCalls() {
        return Collections.unmodifiableCollection(calls.values());
    }

    /**
     * Ids of calls in the log whose arrival has not been processed, in log order.
     */
    public List<String> getNotArrivedCallIds() {
        List<String> ids = new ArrayList<>();
        for (String callId : callRecords.keySet()) {
            if (!calls.containsKey(callId)) {
                ids.add(callId);
            }
        }
        return ids;
    }

    void recordReturnDestination(String ambulanceId, String locationId) {
        returnDestinations.put(ambulanceId, locationId);
    }

    String takeReturnDestination(String ambulanceId) {
        String destination = returnDestinations.remove(ambulanceId);
        if (destination == null) {
            throw new SimulationException("No return trip recorded for ambulance " + ambulanceId);
        }
        return destination;
    }

    void recordDispatch(DispatchRecord record) {
        dispatchRecords.add(record);
    }

    public List<DispatchRecord> getDispatchRecords() {
        return Collections.unmodifiableList(dispatchRecords);
    }

    public Scenario getScenario() {
        return scenario;
    }

    public TravelTimes getTravelTimes() {
        return travelTimes;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public DispatchPolicy getPolicy() {
        return policy;
    }

    public SimulationClock getClock() {
        return clock;
    }

    public FleetRegistry getFleet() {
        return fleet;
    }

    public CallQueue getQueue() {
        return queue;
    }

    public EventLog getEventLog() {
        return eventLog;
    }
}
