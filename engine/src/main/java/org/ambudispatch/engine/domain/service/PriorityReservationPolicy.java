package org.ambudispatch.engine.domain.service;

import org.ambudispatch.engine.domain.model.Call;
import org.ambudispatch.engine.domain.model.Candidate;
import org.ambudispatch.engine.domain.model.DispatchConfig;
import org.ambudispatch.engine.domain.model.DispatchSnapshot;
import org.ambudispatch.engine.domain.model.PriorityLevel;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Holds a reserve of Idle units back for urgent calls.
 *
 * Calls at or above {@link DispatchConfig#getReservationMinPriority()} pick
 * from the whole Idle fleet. Lower-priority calls pick from the unreserved
 * units only, unless no eligible call is Pending and the reserve is not
 * strict. The reserve is the first {@link DispatchConfig#getReservedUnits()}
 * Idle units by ambulance id, so it does not depend on the call being served.
 * Within the allowed pool the choice is the nearest unit.
 */
public final class PriorityReservationPolicy implements DispatchPolicy {

    private static final Logger LOG = Logger.getLogger(PriorityReservationPolicy.class.getName());

    @Override
    public Optional<String> select(Call call, DispatchSnapshot snapshot, DispatchConfig config) {
        PriorityLevel threshold = config.getReservationMinPriority();
        if (call.getPriority().isAtLeast(threshold)) {
            return NearestAvailablePolicy.nearest(snapshot.getCandidates()).map(Candidate::getAmbulanceId);
        }

        boolean eligibleWaiting = snapshot.hasOtherPendingAtLeast(call.getId(), threshold);
        if (!eligibleWaiting && !config.isStrictReserve()) {
            return NearestAvailablePolicy.nearest(snapshot.getCandidates()).map(Candidate::getAmbulanceId);
        }

        Set<String> reserved = reservedIds(snapshot.getCandidates(), config.getReservedUnits());
        List<Candidate> pool = new ArrayList<>();
        for (Candidate candidate : snapshot.getCandidates()) {
            if (!reserved.contains(candidate.getAmbulanceId())) {
                pool.add(candidate);
            }
        }

        Optional<Candidate> choice = NearestAvailablePolicy.nearest(pool);
        if (!choice.isPresent()) {
            LOG.fine(() -> String.format("Deferring %s (%s): only reserved units %s are Idle",
                    call.getId(), call.getPriority(), reserved));
        }
        return choice.map(Candidate::getAmbulanceId);
    }

    static Set<String> reservedIds(List<Candidate> candidates, int reservedUnits) {
        return candidates.stream()
                .map(Candidate::getAmbulanceId)
                .sorted(Comparator.naturalOrder())
                .limit(reservedUnits)
                .collect(Collectors.toCollection(HashSet::new));
    }

    @Override
    public String name() {
        return "reservation";
    }
}
