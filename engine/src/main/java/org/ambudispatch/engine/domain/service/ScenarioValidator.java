package org.ambudispatch.engine.domain.service;

import org.ambudispatch.engine.domain.exception.InputException;
import org.ambudispatch.engine.domain.model.AmbulanceRecord;
import org.ambudispatch.engine.domain.model.CallRecord;
import org.ambudispatch.engine.domain.model.Scenario;
import org.ambudispatch.engine.network.RoadNetwork;
import org.ambudispatch.engine.network.TravelTimes;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Checks a scenario before any run touches it. All problems are collected
 * and reported together in one {@link InputException}.
 */
public final class ScenarioValidator {

    private static final Logger LOG = Logger.getLogger(ScenarioValidator.class.getName());

    private final boolean requireReachableCalls;

    public ScenarioValidator() {
        this(true);
    }

    /**
     * @param requireReachableCalls reject calls whose origin no ambulance base can reach
     */
    public ScenarioValidator(boolean requireReachableCalls) {
        this.requireReachableCalls = requireReachableCalls;
    }

    public void validate(Scenario scenario, TravelTimes travelTimes) {
        RoadNetwork network = scenario.getNetwork();
        List<String> problems = new ArrayList<>();

        Set<String> ambulanceIds = new HashSet<>();
        for (AmbulanceRecord ambulance : scenario.getAmbulances()) {
            if (!ambulanceIds.add(ambulance.getId())) {
                problems.add("Duplicate ambulance id " + ambulance.getId());
            }
            if (!network.contains(ambulance.getBaseLocationId())) {
                problems.add("Ambulance " + ambulance.getId() + " is based at unknown location "
                        + ambulance.getBaseLocationId());
            }
        }

        if (scenario.getAmbulances().isEmpty() && !scenario.getCalls().isEmpty()) {
            problems.add("Scenario has " + scenario.getCalls().size() + " calls but no ambulances");
        }

        Set<String> callIds = new HashSet<>();
        for (CallRecord call : scenario.getCalls()) {
            if (!callIds.add(call.getId())) {
                problems.add("Duplicate call id " + call.getId());
            }
            if (!network.contains(call.getOriginLocationId())) {
                problems.add("Call " + call.getId() + " originates at unknown location " + call.getOriginLocationId());
            } else if (requireReachableCalls && !scenario.getAmbulances().isEmpty()
                    && !reachableFromAnyBase(call, scenario, travelTimes)) {
                problems.add("Call " + call.getId() + " at " + call.getOriginLocationId()
                        + " cannot be reached from any ambulance base");
            }
            if (!scenario.getPriorities().contains(call.getCallTypeCode())) {
                LOG.warning(() -> "Call " + call.getId() + " has unmapped call type " + call.getCallTypeCode());
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(p -> LOG.warning(p));
            throw new InputException("Scenario rejected with " + problems.size() + " problem(s): "
                    + problems.get(0) + (problems.size() > 1 ? " ..." : ""), problems);
        }
        LOG.fine(() -> "Scenario validated: " + scenario);
    }

    private static boolean reachableFromAnyBase(CallRecord call, Scenario scenario, TravelTimes travelTimes) {
        for (AmbulanceRecord ambulance : scenario.getAmbulances()) {
            if (scenario.getNetwork().contains(ambulance.getBaseLocationId())
                    && travelTimes.isReachable(ambulance.getBaseLocationId(), call.getOriginLocationId())) {
                return true;
            }
        }
        return false;
    }
}
