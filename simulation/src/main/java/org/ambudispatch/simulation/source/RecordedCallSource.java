package org.ambudispatch.simulation.source;

import org.ambudispatch.engine.domain.model.CallRecord;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Replays a loaded call log in arrival order. Calls with equal arrival times
 * keep their position in the log.
 */
public final class RecordedCallSource implements CallSource {

    private final List<CallRecord> calls;
    private int position = 0;

    public RecordedCallSource(List<CallRecord> calls) {
        this.calls = new ArrayList<>(calls);
        this.calls.sort(Comparator.comparingDouble(CallRecord::getArrivalTime));
    }

    @Override
    public boolean hasNextCall() {
        return position < calls.size();
    }

    @Override
    public CallRecord nextCall() {
        if (!hasNextCall()) {
            throw new NoSuchElementException("Call log exhausted after " + calls.size() + " calls");
        }
        return calls.get(position++);
    }
}
