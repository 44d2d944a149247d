package org.ambudispatch.engine.domain.service;

import org.ambudispatch.engine.domain.model.Call;
import org.ambudispatch.engine.domain.model.Candidate;
import org.ambudispatch.engine.domain.model.DispatchConfig;
import org.ambudispatch.engine.domain.model.DispatchSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Sends the Idle ambulance with the shortest travel time to the call origin.
 * Ties go to the smallest ambulance id.
 */
public final class NearestAvailablePolicy implements DispatchPolicy {

    private static final Logger LOG = Logger.getLogger(NearestAvailablePolicy.class.getName());

    @Override
    public Optional<String> select(Call call, DispatchSnapshot snapshot, DispatchConfig config) {
        return nearest(snapshot.getCandidates()).map(candidate -> {
            LOG.fine(() -> String.format("Nearest for %s: %s (travel=%.2f)",
                    call.getId(), candidate.getAmbulanceId(), candidate.getTravelTime()));
            return candidate.getAmbulanceId();
        });
    }

    /**
     * First reachable candidate of an already sorted list.
     */
    static Optional<Candidate> nearest(List<Candidate> sortedCandidates) {
        for (Candidate candidate : sortedCandidates) {
            if (candidate.isReachable()) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    @Override
    public String name() {
        return "nearest";
    }
}
