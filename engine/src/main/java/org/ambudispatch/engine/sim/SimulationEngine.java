package org.ambudispatch.engine.sim;

import org.ambudispatch.engine.config.EngineConfig;
import org.ambudispatch.engine.domain.model.Ambulance;
import org.ambudispatch.engine.domain.model.Call;
import org.ambudispatch.engine.domain.model.CallRecord;
import org.ambudispatch.engine.domain.model.CallState;
import org.ambudispatch.engine.domain.model.Candidate;
import org.ambudispatch.engine.domain.model.DispatchSnapshot;
import org.ambudispatch.engine.domain.model.PriorityLevel;
import org.ambudispatch.engine.domain.model.Scenario;
import org.ambudispatch.engine.domain.service.DispatchPolicy;
import org.ambudispatch.engine.domain.service.ScenarioValidator;
import org.ambudispatch.engine.network.TravelTimes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Discrete-event dispatch simulation.
 *
 * Responsibilities:
 * - Release calls into the queue when the clock reaches their arrival time
 * - Ask the dispatch policy for an ambulance whenever calls wait and units are Idle
 * - Move ambulances through dispatch, travel, service and return
 * - Abandon calls that wait longer than the configured maximum
 *
 * Events sharing a timestamp are applied as one batch, in scheduling order,
 * before a single dispatch pass. Abandonment checks of the batch run after
 * that pass. Identical input and configuration always produce an identical
 * event log.
 */
public final class SimulationEngine {

    private static final Logger LOG = Logger.getLogger(SimulationEngine.class.getName());

    private final Scenario scenario;
    private final TravelTimes travelTimes;
    private final EngineConfig config;
    private final DispatchPolicy policy;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public SimulationEngine(Scenario scenario, TravelTimes travelTimes, EngineConfig config) {
        this(scenario, travelTimes, config, config.getPolicyType().create());
    }

    public SimulationEngine(Scenario scenario, TravelTimes travelTimes, EngineConfig config, DispatchPolicy policy) {
        this.scenario = Objects.requireNonNull(scenario, "scenario must not be null");
        this.travelTimes = Objects.requireNonNull(travelTimes, "travelTimes must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        if (travelTimes.getNetwork() != scenario.getNetwork()) {
            throw new IllegalArgumentException("travelTimes must be built on the scenario network");
        }
    }

    /**
     * Requests the current run to stop. The loop checks the flag between
     * event batches, so an event is never half applied. A cancelled engine
     * stays cancelled.
     */
    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs the whole scenario in a fresh run context.
     *
     * @throws org.ambudispatch.engine.domain.exception.InputException if the scenario fails validation
     * @throws org.ambudispatch.engine.domain.exception.SimulationException on a fatal engine or policy defect
     */
    public SimulationResult run() {
        if (config.isValidateScenario()) {
            new ScenarioValidator().validate(scenario, travelTimes);
        }

        RunContext context = new RunContext(scenario, travelTimes, config, policy);
        double startTime = scheduleArrivals(context);
        LOG.info(() -> String.format("Starting run: policy=%s, %d calls, %d ambulances",
                policy.name(), scenario.getCalls().size(), scenario.getAmbulances().size()));

        SimulationClock clock = context.getClock();
        RunStatus status = null;
        while (clock.hasPending()) {
            if (cancelled.get()) {
                status = RunStatus.CANCELLED;
                LOG.warning(() -> String.format("Run cancelled at t=%.3f with %d events pending",
                        clock.now(), clock.pendingCount()));
                break;
            }
            double batchTime = clock.peekTime();
            List<SimulationEvent> abandonChecks = new ArrayList<>();
            while (clock.hasPending() && clock.peekTime() == batchTime) {
                SimulationEvent event = clock.next();
                if (event.getKind() == EventKind.ABANDON_CHECK) {
                    abandonChecks.add(event);
                } else {
                    apply(context, event);
                }
            }
            dispatchPass(context);
            // A call reaching its wait limit can still take a unit freed at that instant
            for (SimulationEvent check : abandonChecks) {
                onAbandonCheck(context, check);
            }
        }

        if (status == null) {
            status = allCallsClosed(context) ? RunStatus.COMPLETED : RunStatus.INCOMPLETE;
        }
        SimulationResult result = SimulationResult.from(context, status, startTime);
        if (result.getStatus() == RunStatus.INCOMPLETE) {
            LOG.warning(() -> "Run incomplete, calls left open: " + result.getStrandedCallIds());
        }
        LOG.info(() -> "Run finished: " + result);
        return result;
    }

    /**
     * Schedules one arrival per call, ordered by arrival time and then by
     * position in the call log.
     *
     * @return the start of the run
     */
    private double scheduleArrivals(RunContext context) {
        List<CallRecord> ordered = new ArrayList<>(scenario.getCalls());
        ordered.sort(Comparator.comparingDouble(CallRecord::getArrivalTime));
        double startTime = ordered.isEmpty() ? 0.0 : Math.min(0.0, ordered.get(0).getArrivalTime());
        context.getClock().reset(startTime);
        for (CallRecord record : ordered) {
            context.getClock().schedule(EventKind.CALL_ARRIVAL, record.getArrivalTime(), record.getId(), null);
        }
        return ordered.isEmpty() ? 0.0 : ordered.get(0).getArrivalTime();
    }

    private void apply(RunContext context, SimulationEvent event) {
        if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest("Applying " + event);
        }
        switch (event.getKind()) {
            case CALL_ARRIVAL:
                onCallArrival(context, event);
                break;
            case DEPARTURE:
                onDeparture(context, event);
                break;
            case ARRIVAL_ON_SCENE:
                onArrivalOnScene(context, event);
                break;
            case SERVICE_COMPLETE:
                onServiceComplete(context, event);
                break;
            case RETURN_COMPLETE:
                onReturnComplete(context, event);
                break;
            default:
                throw new IllegalStateException("Unexpected scheduled event " + event);
        }
    }

    private void onCallArrival(RunContext context, SimulationEvent event) {
        Call call = context.arrive(event.getCallId());
        double now = context.getClock().now();
        context.getEventLog().append(now, EventKind.CALL_ARRIVAL, call.getId(), null);
        context.getQueue().enqueue(call);
        if (config.isAbandonmentEnabled()) {
            context.getClock().schedule(EventKind.ABANDON_CHECK,
                    call.getArrivalTime() + config.getMaxWaitTime(), call.getId(), null);
        }
    }

    private void onAbandonCheck(RunContext context, SimulationEvent event) {
        Call call = context.call(event.getCallId());
        if (!call.isPending()) {
            return;
        }
        double now = context.getClock().now();
        for (Call expired : context.getQueue().abandonExpired(now, config.getMaxWaitTime())) {
            expired.transitionTo(CallState.ABANDONED, now);
            context.getEventLog().append(now, EventKind.CALL_ABANDONED, expired.getId(), null);
            LOG.info(() -> String.format("Call %s (%s) abandoned after waiting %.2f",
                    expired.getId(), expired.getPriority(), now - expired.getArrivalTime()));
        }
    }

    private void onDeparture(RunContext context, SimulationEvent event) {
        Call call = context.call(event.getCallId());
        double now = context.getClock().now();
        context.getFleet().markEnRoute(event.getAmbulanceId(), now);
        call.transitionTo(CallState.EN_ROUTE, now);
        context.getEventLog().append(now, EventKind.DEPARTURE, call.getId(), event.getAmbulanceId());
        context.getClock().schedule(EventKind.ARRIVAL_ON_SCENE, now + call.getTravelTime(),
                call.getId(), event.getAmbulanceId());
    }

    private void onArrivalOnScene(RunContext context, SimulationEvent event) {
        Call call = context.call(event.getCallId());
        double now = context.getClock().now();
        context.getFleet().markOnScene(event.getAmbulanceId(), call.getOriginLocationId(), now);
        call.transitionTo(CallState.ON_SCENE, now);
        context.getEventLog().append(now, EventKind.ARRIVAL_ON_SCENE, call.getId(), event.getAmbulanceId());
        context.getClock().schedule(EventKind.SERVICE_COMPLETE, now + config.getServiceTime(),
                call.getId(), event.getAmbulanceId());
    }

    private void onServiceComplete(RunContext context, SimulationEvent event) {
        Call call = context.call(event.getCallId());
        double now = context.getClock().now();
        Ambulance ambulance = context.getFleet().get(event.getAmbulanceId());
        call.transitionTo(CallState.COMPLETED, now);
        context.getFleet().markReturning(ambulance.getId(), now);
        context.getEventLog().append(now, EventKind.SERVICE_COMPLETE, call.getId(), ambulance.getId());

        String destination = call.getOriginLocationId();
        double tripTime = 0.0;
        if (config.isReturnToBase()) {
            double toBase = travelTimes.travelTime(call.getOriginLocationId(), ambulance.getBaseLocationId());
            if (toBase < Double.POSITIVE_INFINITY) {
                destination = ambulance.getBaseLocationId();
                tripTime = toBase;
            } else {
                LOG.warning(() -> String.format("No route from %s back to base %s for %s, staying on scene",
                        call.getOriginLocationId(), ambulance.getBaseLocationId(), ambulance.getId()));
            }
        }
        context.recordReturnDestination(ambulance.getId(), destination);
        context.getClock().schedule(EventKind.RETURN_COMPLETE, now + tripTime, call.getId(), ambulance.getId());
    }

    private void onReturnComplete(RunContext context, SimulationEvent event) {
        double now = context.getClock().now();
        String destination = context.takeReturnDestination(event.getAmbulanceId());
        context.getFleet().markReturned(event.getAmbulanceId(), destination, now);
        context.getEventLog().append(now, EventKind.RETURN_COMPLETE, event.getCallId(), event.getAmbulanceId());
    }

    /**
     * Offers every Pending call, in queue order, to the policy until no
     * ambulance is Idle. The pending view handed to the policy is built once
     * per pass and loses each call as it is assigned.
     */
    private void dispatchPass(RunContext context) {
        if (context.getQueue().isEmpty() || context.getFleet().idleCount() == 0) {
            return;
        }
        double now = context.getClock().now();
        List<Call> queued = context.getQueue().snapshot();
        Map<String, PriorityLevel> pending = new LinkedHashMap<>();
        Map<PriorityLevel, Integer> pendingCounts = new EnumMap<>(PriorityLevel.class);
        for (Call call : queued) {
            pending.put(call.getId(), call.getPriority());
            pendingCounts.merge(call.getPriority(), 1, Integer::sum);
        }

        for (Call call : queued) {
            if (context.getFleet().idleCount() == 0) {
                break;
            }
            List<Candidate> candidates = context.getFleet().candidatesFor(call.getOriginLocationId());
            if (candidates.isEmpty()) {
                continue;
            }
            DispatchSnapshot snapshot = DispatchSnapshot.view(now, candidates, pending, pendingCounts);
            Optional<String> choice = policy.select(call, snapshot, config.getDispatchConfig());
            if (!choice.isPresent()) {
                continue;
            }
            String ambulanceId = choice.get();
            Optional<Candidate> chosen = candidates.stream()
                    .filter(c -> c.getAmbulanceId().equals(ambulanceId))
                    .findFirst();
            if (!chosen.isPresent()) {
                reject(context, call, ambulanceId);
                continue;
            }
            assign(context, call, chosen.get());
            pending.remove(call.getId());
            pendingCounts.merge(call.getPriority(), -1, Integer::sum);
        }
    }

    private void reject(RunContext context, Call call, String ambulanceId) {
        double now = context.getClock().now();
        context.getEventLog().append(now, EventKind.POLICY_REJECTED, call.getId(), ambulanceId);
        String state = context.getFleet().contains(ambulanceId)
                ? context.getFleet().get(ambulanceId).getState().toString()
                : "unknown";
        LOG.warning(() -> String.format("Policy %s chose ineligible ambulance %s (%s) for call %s, call stays Pending",
                policy.name(), ambulanceId, state, call.getId()));
    }

    private void assign(RunContext context, Call call, Candidate candidate) {
        double now = context.getClock().now();
        String ambulanceId = candidate.getAmbulanceId();
        context.getFleet().markDispatched(ambulanceId, call.getId(), now);
        context.getQueue().dequeueAssigned(call.getId());
        call.setAmbulanceId(ambulanceId);
        call.setTravelTime(candidate.getTravelTime());
        call.transitionTo(CallState.ASSIGNED, now);
        context.getEventLog().append(now, EventKind.ASSIGNMENT_MADE, call.getId(), ambulanceId);
        context.recordDispatch(new DispatchRecord(call.getId(), call.getCallTypeCode(), call.getPriority(),
                call.getOriginLocationId(), ambulanceId, now, candidate.getTravelTime()));
        context.getClock().schedule(EventKind.DEPARTURE, now + config.getTurnoutDelay(), call.getId(), ambulanceId);

        LOG.fine(() -> String.format("Dispatched %s to call %s (%s) at t=%.2f, ETA=%.2f",
                ambulanceId, call.getId(), call.getPriority(), now, candidate.getTravelTime()));
    }

    private static boolean allCallsClosed(RunContext context) {
        if (!context.getNotArrivedCallIds().isEmpty()) {
            return false;
        }
        for (Call call : context.getCalls()) {
            if (!call.getState().isTerminal()) {
                return false;
            }
        }
        return true;
    }

    public Scenario getScenario() {
        return scenario;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public DispatchPolicy getPolicy() {
        return policy;
    }
}
