package org.ambudispatch.engine.config;

import org.ambudispatch.engine.domain.model.DispatchConfig;
import org.ambudispatch.engine.domain.service.PolicyType;
import org.ambudispatch.engine.network.RoutingMode;

import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Immutable configuration for one simulation run.
 * Values can be read from environment variables with sensible defaults.
 */
public final class EngineConfig {

    private static final Logger LOG = Logger.getLogger(EngineConfig.class.getName());

    public static final PolicyType DEFAULT_POLICY = PolicyType.NEAREST_AVAILABLE;
    public static final RoutingMode DEFAULT_ROUTING_MODE = RoutingMode.PRECOMPUTED;
    public static final double DEFAULT_SERVICE_TIME = 30.0;
    public static final double DEFAULT_TURNOUT_DELAY = 0.0;
    public static final double NO_ABANDONMENT = 0.0;

    // Policy
    private final PolicyType policyType;
    private final DispatchConfig dispatchConfig;

    // Routing
    private final RoutingMode routingMode;

    // Timings, in the time unit of the network costs
    private final double serviceTime;
    private final double turnoutDelay;
    private final double maxWaitTime;

    // Behaviour
    private final boolean returnToBase;
    private final boolean validateScenario;

    private EngineConfig(Builder builder) {
        this.policyType = builder.policyType;
        this.dispatchConfig = builder.dispatchConfig;
        this.routingMode = builder.routingMode;
        this.serviceTime = builder.serviceTime;
        this.turnoutDelay = builder.turnoutDelay;
        this.maxWaitTime = builder.maxWaitTime;
        this.returnToBase = builder.returnToBase;
        this.validateScenario = builder.validateScenario;
    }

    public static EngineConfig defaults() {
        return new Builder().build();
    }

    /**
     * Creates configuration from environment variables.
     */
    public static EngineConfig fromEnvironment() {
        return fromSource(System::getenv);
    }

    /**
     * Creates configuration from any key lookup, e.g. environment with a
     * dotenv fallback. Missing or blank keys keep their defaults.
     */
    public static EngineConfig fromSource(UnaryOperator<String> source) {
        DispatchConfig dispatch = DispatchConfig.defaults()
                .with(DispatchConfig.RESERVED_UNITS,
                        getDouble(source, "RESERVED_UNITS", DispatchConfig.defaults().getReservedUnits()))
                .with(DispatchConfig.RESERVATION_MIN_PRIORITY,
                        getDouble(source, "RESERVATION_MIN_PRIORITY",
                                DispatchConfig.defaults().getReservationMinPriority().getRank()))
                .with(DispatchConfig.STRICT_RESERVE, getBoolean(source, "STRICT_RESERVE", false) ? 1.0 : 0.0);

        return new Builder()
                .policyType(getPolicy(source, "DISPATCH_POLICY", DEFAULT_POLICY))
                .routingMode(getRoutingMode(source, "ROUTING_MODE", DEFAULT_ROUTING_MODE))
                .serviceTime(getDouble(source, "SERVICE_TIME", DEFAULT_SERVICE_TIME))
                .turnoutDelay(getDouble(source, "TURNOUT_DELAY", DEFAULT_TURNOUT_DELAY))
                .maxWaitTime(getDouble(source, "MAX_WAIT_TIME", NO_ABANDONMENT))
                .returnToBase(getBoolean(source, "RETURN_TO_BASE", true))
                .validateScenario(getBoolean(source, "VALIDATE_SCENARIO", true))
                .dispatchConfig(dispatch)
                .build();
    }

    // Getters
    public PolicyType getPolicyType() {
        return policyType;
    }

    public DispatchConfig getDispatchConfig() {
        return dispatchConfig;
    }

    public RoutingMode getRoutingMode() {
        return routingMode;
    }

    public double getServiceTime() {
        return serviceTime;
    }

    public double getTurnoutDelay() {
        return turnoutDelay;
    }

    /**
     * Longest a call may stay Pending before it is abandoned. Zero disables abandonment.
     */
    public double getMaxWaitTime() {
        return maxWaitTime;
    }

    public boolean isAbandonmentEnabled() {
        return maxWaitTime > 0;
    }

    public boolean isReturnToBase() {
        return returnToBase;
    }

    public boolean isValidateScenario() {
        return validateScenario;
    }

    public Builder toBuilder() {
        return new Builder()
                .policyType(policyType)
                .dispatchConfig(dispatchConfig)
                .routingMode(routingMode)
                .serviceTime(serviceTime)
                .turnoutDelay(turnoutDelay)
                .maxWaitTime(maxWaitTime)
                .returnToBase(returnToBase)
                .validateScenario(validateScenario);
    }

    // Lookup helpers
    private static String get(UnaryOperator<String> source, String key) {
        String value = source.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        return value.trim();
    }

    private static double getDouble(UnaryOperator<String> source, String key, double defaultValue) {
        String value = get(source, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            LOG.warning(() -> String.format("Invalid number for %s: %s, using default: %s", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static boolean getBoolean(UnaryOperator<String> source, String key, boolean defaultValue) {
        String value = get(source, key);
        if (value == null) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value) || "1".equals(value) || "yes".equalsIgnoreCase(value);
    }

    private static PolicyType getPolicy(UnaryOperator<String> source, String key, PolicyType defaultValue) {
        String value = get(source, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return PolicyType.fromString(value);
        } catch (IllegalArgumentException e) {
            LOG.warning(() -> String.format("Unknown policy for %s: %s, using default: %s", key, value, defaultValue));
            return defaultValue;
        }
    }

    private static RoutingMode getRoutingMode(UnaryOperator<String> source, String key, RoutingMode defaultValue) {
        String value = get(source, key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return RoutingMode.fromString(value);
        } catch (IllegalArgumentException e) {
            LOG.warning(() -> String.format("Unknown routing mode for %s: %s, using default: %s", key, value, defaultValue));
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "policyType=" + policyType +
                ", routingMode=" + routingMode +
                ", serviceTime=" + serviceTime +
                ", turnoutDelay=" + turnoutDelay +
                ", maxWaitTime=" + maxWaitTime +
                ", returnToBase=" + returnToBase +
                ", validateScenario=" + validateScenario +
                ", dispatchConfig=" + dispatchConfig +
                '}';
    }

    /**
     * Builder for EngineConfig.
     */
    public static final class Builder {
        private PolicyType policyType = DEFAULT_POLICY;
        private DispatchConfig dispatchConfig = DispatchConfig.defaults();
        private RoutingMode routingMode = DEFAULT_ROUTING_MODE;
        private double serviceTime = DEFAULT_SERVICE_TIME;
        private double turnoutDelay = DEFAULT_TURNOUT_DELAY;
        private double maxWaitTime = NO_ABANDONMENT;
        private boolean returnToBase = true;
        private boolean validateScenario = true;

        public Builder policyType(PolicyType policyType) {
            this.policyType = Objects.requireNonNull(policyType, "policyType must not be null");
            return this;
        }

        public Builder dispatchConfig(DispatchConfig dispatchConfig) {
            this.dispatchConfig = Objects.requireNonNull(dispatchConfig, "dispatchConfig must not be null");
            return this;
        }

        public Builder routingMode(RoutingMode routingMode) {
            this.routingMode = Objects.requireNonNull(routingMode, "routingMode must not be null");
            return this;
        }

        public Builder serviceTime(double serviceTime) {
            requireNonNegative("serviceTime", serviceTime);
            this.serviceTime = serviceTime;
            return this;
        }

        public Builder turnoutDelay(double turnoutDelay) {
            requireNonNegative("turnoutDelay", turnoutDelay);
            this.turnoutDelay = turnoutDelay;
            return this;
        }

        public Builder maxWaitTime(double maxWaitTime) {
            requireNonNegative("maxWaitTime", maxWaitTime);
            this.maxWaitTime = maxWaitTime;
            return this;
        }

        public Builder returnToBase(boolean returnToBase) {
            this.returnToBase = returnToBase;
            return this;
        }

        public Builder validateScenario(boolean validateScenario) {
            this.validateScenario = validateScenario;
            return this;
        }

        private static void requireNonNegative(String name, double value) {
            if (Double.isNaN(value) || Double.isInfinite(value) || value < 0) {
                throw new IllegalArgumentException(name + " must be a finite non-negative number");
            }
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
