package org.ambudispatch.simulation.source;

import org.ambudispatch.engine.domain.model.CallRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Random;

/**
 * Random call generator for Monte-Carlo runs.
 * Inter-arrival times are exponential (a Poisson arrival process); origin
 * and call type are drawn uniformly from the given lists. The same seed and
 * parameters always produce the same call log.
 */
public final class CallGenerator implements CallSource {

    private static final Logger log = LoggerFactory.getLogger(CallGenerator.class);

    private final Random random;
    private final int count;
    private final double meanInterArrival;
    private final List<String> locationIds;
    private final List<String> callTypes;

    private int callSequence = 0;
    private double clock = 0.0;

    /**
     * @param seed random seed
     * @param count number of calls to generate
     * @param meanInterArrival mean time between two calls; 0 puts every call at time 0
     * @param locationIds candidate call origins
     * @param callTypes candidate call type codes
     */
    public CallGenerator(long seed, int count, double meanInterArrival,
                         List<String> locationIds, List<String> callTypes) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative");
        }
        if (Double.isNaN(meanInterArrival) || Double.isInfinite(meanInterArrival) || meanInterArrival < 0) {
            throw new IllegalArgumentException("meanInterArrival must be a finite non-negative number");
        }
        Objects.requireNonNull(locationIds, "locationIds must not be null");
        Objects.requireNonNull(callTypes, "callTypes must not be null");
        if (count > 0 && (locationIds.isEmpty() || callTypes.isEmpty())) {
            throw new IllegalArgumentException("locationIds and callTypes must not be empty");
        }
        this.random = new Random(seed);
        this.count = count;
        this.meanInterArrival = meanInterArrival;
        this.locationIds = new ArrayList<>(locationIds);
        this.callTypes = new ArrayList<>(callTypes);
    }

    @Override
    public boolean hasNextCall() {
        return callSequence < count;
    }

    @Override
    public CallRecord nextCall() {
        if (!hasNextCall()) {
            throw new NoSuchElementException("Generator exhausted after " + count + " calls");
        }
        if (callSequence > 0 && meanInterArrival > 0) {
            clock += -meanInterArrival * Math.log(1.0 - random.nextDouble());
        }
        String location = locationIds.get(random.nextInt(locationIds.size()));
        String callType = callTypes.get(random.nextInt(callTypes.size()));
        int number = ++callSequence;

        CallRecord call = new CallRecord(String.valueOf(number), clock, location, callType);
        log.debug("Generated call #{}: type={}, location={}, arrival={}", number, callType, location,
                String.format("%.3f", clock));
        return call;
    }

    /**
     * @return the number of calls generated so far
     */
    public int getCallSequence() {
        return callSequence;
    }
}
