package org.ambudispatch.engine.sim;

import org.ambudispatch.engine.domain.model.Ambulance;
import org.ambudispatch.engine.domain.model.AmbulanceState;
import org.ambudispatch.engine.domain.model.Call;
import org.ambudispatch.engine.domain.model.CallState;
import org.ambudispatch.engine.domain.model.PriorityLevel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one run: the event log and the aggregates a reporter needs.
 * Detached from the run state, so it can be kept after the run is gone.
 */
public final class SimulationResult {

    private final String policyName;
    private final RunStatus status;
    private final List<EventLogEntry> events;
    private final List<DispatchRecord> dispatchRecords;
    private final Map<String, CallState> callStates;
    private final Map<String, Double> responseTimes;
    private final Map<PriorityLevel, ResponseTimeSummary> responseTimesByPriority;
    private final Map<String, AmbulanceState> ambulanceStates;
    private final Map<String, Double> busyTimes;
    private final Map<String, Double> utilization;
    private final List<String> strandedCallIds;
    private final List<String> notArrivedCallIds;
    private final double startTime;
    private final double endTime;

    private SimulationResult(RunContext context, RunStatus status, double startTime) {
        this.policyName = context.getPolicy().name();
        this.status = status;
        this.events = Collections.unmodifiableList(new ArrayList<>(context.getEventLog().getEntries()));
        this.dispatchRecords = Collections.unmodifiableList(new ArrayList<>(context.getDispatchRecords()));
        this.startTime = startTime;
        this.endTime = context.getClock().now();

        Map<String, CallState> states = new LinkedHashMap<>();
        Map<String, Double> responses = new LinkedHashMap<>();
        Map<PriorityLevel, List<Double>> byPriority = new EnumMap<>(PriorityLevel.class);
        List<String> stranded = new ArrayList<>();
        for (Call call : context.getCalls()) {
            states.put(call.getId(), call.getState());
            if (!Double.isNaN(call.getResponseTime())) {
                responses.put(call.getId(), call.getResponseTime());
                byPriority.computeIfAbsent(call.getPriority(), k -> new ArrayList<>()).add(call.getResponseTime());
            }
            if (!call.getState().isTerminal()) {
                stranded.add(call.getId());
            }
        }
        this.callStates = Collections.unmodifiableMap(states);
        this.responseTimes = Collections.unmodifiableMap(responses);
        this.strandedCallIds = Collections.unmodifiableList(stranded);
        this.notArrivedCallIds = Collections.unmodifiableList(new ArrayList<>(context.getNotArrivedCallIds()));

        Map<PriorityLevel, ResponseTimeSummary> summaries = new EnumMap<>(PriorityLevel.class);
        byPriority.forEach((level, samples) -> summaries.put(level, ResponseTimeSummary.of(samples)));
        this.responseTimesByPriority = Collections.unmodifiableMap(summaries);

        double duration = getDuration();
        Map<String, AmbulanceState> fleetStates = new LinkedHashMap<>();
        Map<String, Double> busy = new LinkedHashMap<>();
        Map<String, Double> usage = new LinkedHashMap<>();
        for (Ambulance ambulance : context.getFleet().all()) {
            double busyTime = ambulance.getBusyTime(endTime);
            fleetStates.put(ambulance.getId(), ambulance.getState());
            busy.put(ambulance.getId(), busyTime);
            usage.put(ambulance.getId(), duration > 0 ? busyTime / duration : 0.0);
        }
        this.ambulanceStates = Collections.unmodifiableMap(fleetStates);
        this.busyTimes = Collections.unmodifiableMap(busy);
        this.utilization = Collections.unmodifiableMap(usage);
    }

    static SimulationResult from(RunContext context, RunStatus status, double startTime) {
        return new SimulationResult(context, status, startTime);
    }

    public String getPolicyName() {
        return policyName;
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isComplete() {
        return status == RunStatus.COMPLETED;
    }

    public List<EventLogEntry> getEvents() {
        return events;
    }

    public List<String> getEventLines() {
        List<String> lines = new ArrayList<>(events.size());
        for (EventLogEntry entry : events) {
            lines.add(entry.toLine());
        }
        return lines;
    }

    public List<DispatchRecord> getDispatchRecords() {
        return dispatchRecords;
    }

    /**
     * States of the calls that arrived during the run, in arrival order.
     */
    public Map<String, CallState> getCallStates() {
        return callStates;
    }

    /**
     * Arrival to on-scene time per call, in arrival order. Calls that never
     * had an ambulance on scene are absent.
     */
    public Map<String, Double> getResponseTimes() {
        return responseTimes;
    }

    public ResponseTimeSummary getResponseTimeSummary() {
        return ResponseTimeSummary.of(responseTimes.values());
    }

    public Map<PriorityLevel, ResponseTimeSummary> getResponseTimesByPriority() {
        return responseTimesByPriority;
    }

    public Map<String, AmbulanceState> getAmbulanceStates() {
        return ambulanceStates;
    }

    public Map<String, Double> getBusyTimes() {
        return busyTimes;
    }

    /**
     * Busy time divided by run duration, per ambulance.
     */
    public Map<String, Double> getUtilization() {
        return utilization;
    }

    public long getCompletedCount() {
        return countCalls(CallState.COMPLETED);
    }

    public long getAbandonedCount() {
        return countCalls(CallState.ABANDONED);
    }

    private long countCalls(CallState state) {
        return callStates.values().stream().filter(s -> s == state).count();
    }

    /**
     * Arrived calls that ended the run neither Completed nor Abandoned.
     */
    public List<String> getStrandedCallIds() {
        return strandedCallIds;
    }

    /**
     * Calls of the log the run stopped before reaching; empty unless cancelled.
     */
    public List<String> getNotArrivedCallIds() {
        return notArrivedCallIds;
    }

    public double getStartTime() {
        return startTime;
    }

    public double getEndTime() {
        return endTime;
    }

    public double getDuration() {
        return Math.max(0.0, endTime - startTime);
    }

    @Override
    public String toString() {
        return "SimulationResult{" + policyName + " " + status
                + ", calls=" + callStates.size()
                + ", completed=" + getCompletedCount()
                + ", abandoned=" + getAbandonedCount()
                + ", stranded=" + strandedCallIds.size()
                + ", notArrived=" + notArrivedCallIds.size()
                + ", events=" + events.size() + "}";
    }
}
