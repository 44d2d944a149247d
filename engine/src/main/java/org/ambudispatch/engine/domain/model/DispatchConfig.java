package org.ambudispatch.engine.domain.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable tuning values for dispatch policies.
 * Policies read it, never write it.
 */
public final class DispatchConfig {

    private final Map<String, Double> values;

    // Reservation keys
    public static final String RESERVED_UNITS = "reserved_units";
    public static final String RESERVATION_MIN_PRIORITY = "reservation_min_priority";
    public static final String STRICT_RESERVE = "strict_reserve";

    private DispatchConfig(Map<String, Double> values) {
        this.values = Collections.unmodifiableMap(new HashMap<>(values));
    }

    /**
     * Creates a DispatchConfig from a map of key-value pairs.
     */
    public static DispatchConfig fromMap(Map<String, Double> values) {
        Objects.requireNonNull(values, "values must not be null");
        return new DispatchConfig(values);
    }

    /**
     * Creates a default configuration.
     */
    public static DispatchConfig defaults() {
        Map<String, Double> defaults = new HashMap<>();
        defaults.put(RESERVED_UNITS, 1.0);
        defaults.put(RESERVATION_MIN_PRIORITY, (double) PriorityLevel.HIGH.getRank());
        defaults.put(STRICT_RESERVE, 0.0);
        return new DispatchConfig(defaults);
    }

    /**
     * Copy of this configuration with one value replaced.
     */
    public DispatchConfig with(String key, double value) {
        Map<String, Double> copy = new HashMap<>(values);
        copy.put(key, value);
        return new DispatchConfig(copy);
    }

    public double get(String key) {
        Double value = values.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Unknown config key: " + key);
        }
        return value;
    }

    public double getOrDefault(String key, double defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    /**
     * Number of Idle units held back for reservation-eligible calls.
     */
    public int getReservedUnits() {
        return Math.max(0, (int) getOrDefault(RESERVED_UNITS, 1.0));
    }

    /**
     * Lowest priority that may draw on the reserve.
     */
    public PriorityLevel getReservationMinPriority() {
        int rank = (int) getOrDefault(RESERVATION_MIN_PRIORITY, PriorityLevel.HIGH.getRank());
        for (PriorityLevel level : PriorityLevel.values()) {
            if (level.getRank() == rank) {
                return level;
            }
        }
        return rank > PriorityLevel.CRITICAL.getRank() ? PriorityLevel.CRITICAL : PriorityLevel.LOW;
    }

    /**
     * When set, reserved units never go to lower-priority calls, even if no
     * eligible call is waiting.
     */
    public boolean isStrictReserve() {
        return getOrDefault(STRICT_RESERVE, 0.0) != 0.0;
    }

    @Override
    public String toString() {
        return "DispatchConfig" + values;
    }
}
