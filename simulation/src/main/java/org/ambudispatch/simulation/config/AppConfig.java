package org.ambudispatch.simulation.config;

import io.github.cdimascio.dotenv.Dotenv;
import org.ambudispatch.engine.config.EngineConfig;
import org.ambudispatch.engine.domain.service.PolicyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Settings of the command-line application.
 *
 * Every key is looked up in the process environment first, then in a
 * {@code .env} file in the working directory, then in one in the parent
 * directory. Engine settings are read from the same lookup.
 */
public final class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    public static final String DATA_DIR_ENV = "SIM_DATA_DIR";
    public static final String OUTPUT_DIR_ENV = "SIM_OUTPUT_DIR";
    public static final String POLICIES_ENV = "SIM_POLICIES";
    public static final String WORKERS_ENV = "SIM_WORKERS";
    public static final String RUN_BUDGET_ENV = "SIM_RUN_BUDGET_SECONDS";
    public static final String SYNTHETIC_CALLS_ENV = "SIM_SYNTHETIC_CALLS";
    public static final String SYNTHETIC_SEED_ENV = "SIM_SYNTHETIC_SEED";
    public static final String SYNTHETIC_INTERVAL_ENV = "SIM_SYNTHETIC_MEAN_INTERVAL";
    public static final String FILE_LOGGING_ENABLED_ENV = "SIM_FILE_LOGGING_ENABLED";
    public static final String LOG_FILE_ENV = "SIM_LOG_FILE";

    private static final String DEFAULT_LOG_FILE = "logs/simulation.log";
    private static final long DEFAULT_RUN_BUDGET_SECONDS = 300;
    private static final long DEFAULT_SEED = 42L;
    private static final double DEFAULT_SYNTHETIC_INTERVAL = 10.0;

    private final Path dataDir;
    private final Path outputDir;
    private final List<PolicyType> policies;
    private final int workers;
    private final Duration runBudget;
    private final int syntheticCalls;
    private final long syntheticSeed;
    private final double syntheticMeanInterval;
    private final boolean fileLoggingEnabled;
    private final Path logFile;
    private final EngineConfig engineConfig;

    private AppConfig(UnaryOperator<String> source) {
        this.dataDir = Paths.get(getString(source, DATA_DIR_ENV, "data"));
        this.outputDir = Paths.get(getString(source, OUTPUT_DIR_ENV, "."));
        this.policies = parsePolicies(getString(source, POLICIES_ENV, "nearest,reservation"));
        this.workers = (int) Math.max(1, getLong(source, WORKERS_ENV, policies.size()));
        this.runBudget = Duration.ofSeconds(Math.max(1, getLong(source, RUN_BUDGET_ENV, DEFAULT_RUN_BUDGET_SECONDS)));
        this.syntheticCalls = (int) Math.max(0, getLong(source, SYNTHETIC_CALLS_ENV, 0));
        this.syntheticSeed = getLong(source, SYNTHETIC_SEED_ENV, DEFAULT_SEED);
        this.syntheticMeanInterval = getDouble(source, SYNTHETIC_INTERVAL_ENV, DEFAULT_SYNTHETIC_INTERVAL);
        this.fileLoggingEnabled = getFlag(source, FILE_LOGGING_ENABLED_ENV, true);
        this.logFile = Paths.get(getString(source, LOG_FILE_ENV, DEFAULT_LOG_FILE));
        this.engineConfig = EngineConfig.fromSource(source);
    }

    /**
     * Resolves settings from the environment and {@code .env} files.
     */
    public static AppConfig fromEnvironment() {
        return fromSource(environmentLookup());
    }

    public static AppConfig fromSource(UnaryOperator<String> source) {
        return new AppConfig(source);
    }

    /**
     * Environment first, then {@code ./.env}, then {@code ../.env}.
     */
    public static UnaryOperator<String> environmentLookup() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();
        Dotenv parentDotenv = Dotenv.configure()
                .directory("../")
                .ignoreIfMissing()
                .load();
        return key -> {
            String fromEnv = System.getenv(key);
            if (fromEnv != null && !fromEnv.trim().isEmpty()) {
                return fromEnv.trim();
            }
            String fromDotEnv = dotenv.get(key);
            if (fromDotEnv != null && !fromDotEnv.trim().isEmpty()) {
                return fromDotEnv.trim();
            }
            String fromParent = parentDotenv.get(key);
            if (fromParent != null && !fromParent.trim().isEmpty()) {
                return fromParent.trim();
            }
            return null;
        };
    }

    /**
     * Copy with data and output directories replaced, e.g. from command-line arguments.
     */
    public AppConfig withDirectories(Path dataDir, Path outputDir) {
        return new AppConfig(this, dataDir, outputDir);
    }

    private AppConfig(AppConfig other, Path dataDir, Path outputDir) {
        this.dataDir = dataDir;
        this.outputDir = outputDir;
        this.policies = other.policies;
        this.workers = other.workers;
        this.runBudget = other.runBudget;
        this.syntheticCalls = other.syntheticCalls;
        this.syntheticSeed = other.syntheticSeed;
        this.syntheticMeanInterval = other.syntheticMeanInterval;
        this.fileLoggingEnabled = other.fileLoggingEnabled;
        this.logFile = other.logFile;
        this.engineConfig = other.engineConfig;
    }

    static List<PolicyType> parsePolicies(String raw) {
        Set<PolicyType> policies = new LinkedHashSet<>();
        for (String part : raw.split(",")) {
            if (part.trim().isEmpty()) {
                continue;
            }
            try {
                policies.add(PolicyType.fromString(part));
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring unknown policy '{}'", part.trim());
            }
        }
        if (policies.isEmpty()) {
            log.warn("No valid policy in '{}', using {}", raw, EngineConfig.DEFAULT_POLICY);
            policies.add(EngineConfig.DEFAULT_POLICY);
        }
        return Collections.unmodifiableList(new ArrayList<>(policies));
    }

    private static String getString(UnaryOperator<String> source, String key, String defaultValue) {
        String value = source.apply(key);
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        return value.trim();
    }

    private static long getLong(UnaryOperator<String> source, String key, long defaultValue) {
        String raw = source.apply(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for {}: {}, using default: {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private static double getDouble(UnaryOperator<String> source, String key, double defaultValue) {
        String raw = source.apply(key);
        if (raw == null || raw.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for {}: {}, using default: {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private static boolean getFlag(UnaryOperator<String> source, String key, boolean defaultValue) {
        String val = source.apply(key);
        if (val == null || val.trim().isEmpty()) {
            return defaultValue;
        }
        String normalized = val.trim().toLowerCase();
        return !(normalized.equals("false") || normalized.equals("0") || normalized.equals("no"));
    }

    public Path getDataDir() {
        return dataDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public List<PolicyType> getPolicies() {
        return policies;
    }

    public int getWorkers() {
        return workers;
    }

    public Duration getRunBudget() {
        return runBudget;
    }

    public int getSyntheticCalls() {
        return syntheticCalls;
    }

    public boolean isSyntheticCallsEnabled() {
        return syntheticCalls > 0;
    }

    public long getSyntheticSeed() {
        return syntheticSeed;
    }

    public double getSyntheticMeanInterval() {
        return syntheticMeanInterval;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public Path getLogFile() {
        return logFile;
    }

    public EngineConfig getEngineConfig() {
        return engineConfig;
    }

    @Override
    public String toString() {
        return "AppConfig{" +
                "dataDir=" + dataDir +
                ", outputDir=" + outputDir +
                ", policies=" + policies +
                ", workers=" + workers +
                ", runBudget=" + runBudget +
                ", syntheticCalls=" + syntheticCalls +
                ", syntheticSeed=" + syntheticSeed +
                ", engineConfig=" + engineConfig +
                '}';
    }
}
