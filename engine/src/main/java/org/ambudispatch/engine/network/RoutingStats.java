package org.ambudispatch.engine.network;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Performance counters for a travel-time provider: time spent precomputing,
 * number of lookups and cumulative lookup time.
 */
public final class RoutingStats {

    private final AtomicLong precomputationNanos = new AtomicLong();
    private final AtomicLong queries = new AtomicLong();
    private final AtomicLong queryNanos = new AtomicLong();

    void recordPrecomputation(long nanos) {
        precomputationNanos.addAndGet(nanos);
    }

    void recordQuery(long nanos) {
        queries.incrementAndGet();
        queryNanos.addAndGet(nanos);
    }

    public long getPrecomputationNanos() {
        return precomputationNanos.get();
    }

    public long getQueries() {
        return queries.get();
    }

    public long getQueryNanos() {
        return queryNanos.get();
    }

    @Override
    public String toString() {
        return String.format("RoutingStats{precomputation=%.6fs, queries=%d, queryTime=%.6fs}",
                precomputationNanos.get() / 1e9, queries.get(), queryNanos.get() / 1e9);
    }
}
