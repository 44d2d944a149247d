package org.ambudispatch.engine.fleet;

import org.ambudispatch.engine.domain.exception.InputException;
import org.ambudispatch.engine.domain.exception.SimulationException;
import org.ambudispatch.engine.domain.exception.UnknownAmbulanceException;
import org.ambudispatch.engine.domain.model.Ambulance;
import org.ambudispatch.engine.domain.model.AmbulanceState;
import org.ambudispatch.engine.domain.model.Candidate;
import org.ambudispatch.engine.network.TravelTimes;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Owns the ambulances of one run and enforces their state machine.
 * Also guarantees the one-to-one pairing between an ambulance and the call
 * it serves.
 */
public final class FleetRegistry {

    private static final Logger LOG = Logger.getLogger(FleetRegistry.class.getName());

    private final TravelTimes travelTimes;
    private final Map<String, Ambulance> ambulances = new LinkedHashMap<>();
    private final Map<String, String> ambulanceByCall = new LinkedHashMap<>();

    public FleetRegistry(TravelTimes travelTimes) {
        this.travelTimes = Objects.requireNonNull(travelTimes, "travelTimes must not be null");
    }

    public void register(Ambulance ambulance) {
        Objects.requireNonNull(ambulance, "ambulance must not be null");
        if (ambulances.containsKey(ambulance.getId())) {
            throw new InputException("Ambulance registered twice: " + ambulance.getId());
        }
        // Fails with UnknownLocationException for a base outside the network.
        travelTimes.getNetwork().indexOf(ambulance.getBaseLocationId());
        ambulances.put(ambulance.getId(), ambulance);
        LOG.fine(() -> "Registered " + ambulance);
    }

    public Ambulance get(String ambulanceId) {
        Ambulance ambulance = ambulances.get(ambulanceId);
        if (ambulance == null) {
            throw new UnknownAmbulanceException(ambulanceId);
        }
        return ambulance;
    }

    public boolean contains(String ambulanceId) {
        return ambulances.containsKey(ambulanceId);
    }

    /**
     * Idle ambulances that can reach {@code locationId}, nearest first, ties by id.
     */
    public List<Ambulance> availableNear(String locationId) {
        List<Candidate> candidates = candidatesFor(locationId);
        List<Ambulance> result = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            result.add(ambulances.get(candidate.getAmbulanceId()));
        }
        return result;
    }

    /**
     * Same ordering as {@link #availableNear(String)}, with travel times attached.
     */
    public List<Candidate> candidatesFor(String locationId) {
        List<Candidate> candidates = new ArrayList<>();
        for (Ambulance ambulance : ambulances.values()) {
            if (!ambulance.isIdle()) {
                continue;
            }
            double travelTime = travelTimes.travelTime(ambulance.getLocationId(), locationId);
            if (travelTime < Double.POSITIVE_INFINITY) {
                candidates.add(new Candidate(ambulance.getId(), ambulance.getLocationId(),
                        ambulance.getBaseLocationId(), travelTime));
            }
        }
        candidates.sort(Comparator.naturalOrder());
        return candidates;
    }

    public void markDispatched(String ambulanceId, String callId, double now) {
        Ambulance ambulance = get(ambulanceId);
        String servedBy = ambulanceByCall.get(callId);
        if (servedBy != null) {
            throw new SimulationException("Call " + callId + " is already served by " + servedBy);
        }
        ambulance.transitionTo(AmbulanceState.DISPATCHED, now);
        ambulance.assignCall(callId);
        ambulanceByCall.put(callId, ambulanceId);
    }

    public void markEnRoute(String ambulanceId, double now) {
        get(ambulanceId).transitionTo(AmbulanceState.EN_ROUTE, now);
    }

    public void markOnScene(String ambulanceId, String locationId, double now) {
        Ambulance ambulance = get(ambulanceId);
        ambulance.transitionTo(AmbulanceState.ON_SCENE, now);
        ambulance.moveTo(locationId);
    }

    public void markReturning(String ambulanceId, double now) {
        get(ambulanceId).transitionTo(AmbulanceState.RETURNING, now);
    }

    public void markReturned(String ambulanceId, String locationId, double now) {
        Ambulance ambulance = get(ambulanceId);
        String callId = ambulance.getCallId();
        ambulance.transitionTo(AmbulanceState.IDLE, now);
        ambulance.moveTo(locationId);
        if (callId != null) {
            ambulanceByCall.remove(callId);
        }
    }

    /**
     * The ambulance currently serving {@code callId}, or null.
     */
    public String servingAmbulance(String callId) {
        return ambulanceByCall.get(callId);
    }

    public Map<String, String> activeAssignments() {
        return Collections.unmodifiableMap(ambulanceByCall);
    }

    public int idleCount() {
        int count = 0;
        for (Ambulance ambulance : ambulances.values()) {
            if (ambulance.isIdle()) {
                count++;
            }
        }
        return count;
    }

    /**
     * All ambulances in registration order.
     */
    public Collection<Ambulance> all() {
        return Collections.unmodifiableCollection(ambulances.values());
    }

    public int size() {
        return ambulances.size();
    }

    public TravelTimes getTravelTimes() {
        return travelTimes;
    }
}
