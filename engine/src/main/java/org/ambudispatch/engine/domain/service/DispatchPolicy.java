package org.ambudispatch.engine.domain.service;

import org.ambudispatch.engine.domain.model.Call;
import org.ambudispatch.engine.domain.model.DispatchConfig;
import org.ambudispatch.engine.domain.model.DispatchSnapshot;

import java.util.Optional;

/**
 * Decides which ambulance answers a Pending call.
 * Implementations hold no state between calls.
 */
public interface DispatchPolicy {

    /**
     * Select an ambulance for a call.
     *
     * @param call the Pending call
     * @param snapshot Idle candidates and the other Pending calls
     * @param config the dispatch configuration
     * @return the selected ambulance id, or empty to leave the call Pending
     */
    Optional<String> select(Call call, DispatchSnapshot snapshot, DispatchConfig config);

    /**
     * Short name used in logs and report file names.
     */
    String name();
}
