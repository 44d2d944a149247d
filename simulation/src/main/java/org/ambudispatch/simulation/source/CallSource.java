package org.ambudispatch.simulation.source;

import org.ambudispatch.engine.domain.model.CallRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Interface for call sources.
 * Implementations can provide the call log from different sources:
 * - A recorded CSV log
 * - Seeded random generation (Monte-Carlo sweeps)
 */
public interface CallSource {

    /**
     * @return true if another call is available from this source
     */
    boolean hasNextCall();

    /**
     * Should only be called when {@link #hasNextCall()} returns true.
     *
     * @return the next call, in non-decreasing arrival order
     */
    CallRecord nextCall();

    /**
     * Consumes the source into a call log.
     */
    default List<CallRecord> drain() {
        List<CallRecord> calls = new ArrayList<>();
        while (hasNextCall()) {
            calls.add(nextCall());
        }
        return calls;
    }
}
