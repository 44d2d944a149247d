package org.ambudispatch.simulation;

import org.ambudispatch.engine.config.EngineConfig;
import org.ambudispatch.engine.domain.exception.SimulationException;
import org.ambudispatch.engine.domain.model.AmbulanceRecord;
import org.ambudispatch.engine.domain.model.CallRecord;
import org.ambudispatch.engine.domain.model.Location;
import org.ambudispatch.engine.domain.model.Scenario;
import org.ambudispatch.engine.domain.service.PolicyType;
import org.ambudispatch.engine.network.TravelTimes;
import org.ambudispatch.engine.scheduler.RunScheduler;
import org.ambudispatch.engine.sim.SimulationEngine;
import org.ambudispatch.engine.sim.SimulationResult;
import org.ambudispatch.simulation.config.AppConfig;
import org.ambudispatch.simulation.loader.ScenarioLoader;
import org.ambudispatch.simulation.report.RunReporter;
import org.ambudispatch.simulation.source.CallGenerator;
import org.ambudispatch.simulation.source.CallSource;
import org.ambudispatch.simulation.source.RecordedCallSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.SimpleFormatter;

/**
 * Command-line entry point: loads a scenario, runs every configured policy
 * in parallel and writes one report per policy.
 *
 * Usage: {@code SimulationApp [dataDir [outputDir]]}. Arguments override
 * {@code SIM_DATA_DIR} and {@code SIM_OUTPUT_DIR}.
 */
public class SimulationApp {

    private static final Logger log = LoggerFactory.getLogger(SimulationApp.class);

    public static void main(String[] args) {
        AppConfig config = AppConfig.fromEnvironment();
        if (args.length > 0) {
            Path dataDir = Paths.get(args[0]);
            Path outputDir = args.length > 1 ? Paths.get(args[1]) : config.getOutputDir();
            config = config.withDirectories(dataDir, outputDir);
        }
        configureFileLogging(config);

        try {
            run(config);
        } catch (SimulationException e) {
            java.util.logging.Logger.getLogger(SimulationApp.class.getName())
                    .log(Level.SEVERE, "Simulation failed: " + e.getMessage(), e);
            System.exit(1);
        } catch (IOException e) {
            java.util.logging.Logger.getLogger(SimulationApp.class.getName())
                    .log(Level.SEVERE, "Failed to read or write simulation files", e);
            System.exit(1);
        }
    }

    /**
     * Loads, runs and reports. Separate from {@link #main} so it can be driven
     * without exiting the JVM.
     *
     * @return the results by policy name
     */
    public static Map<String, SimulationResult> run(AppConfig config) throws IOException {
        log.info("Starting simulation with {}", config);
        EngineConfig engineConfig = config.getEngineConfig();

        Scenario loaded = new ScenarioLoader(config.getDataDir()).load();
        TravelTimes travelTimes = engineConfig.getRoutingMode().create(loaded.getNetwork());

        CallSource source = config.isSyntheticCallsEnabled()
                ? generator(config, loaded, travelTimes)
                : new RecordedCallSource(loaded.getCalls());
        Scenario scenario = loaded.withCalls(source.drain());

        Map<String, SimulationEngine> runs = new LinkedHashMap<>();
        for (PolicyType policyType : config.getPolicies()) {
            EngineConfig runConfig = engineConfig.toBuilder().policyType(policyType).build();
            SimulationEngine engine = new SimulationEngine(scenario, travelTimes, runConfig);
            runs.put(engine.getPolicy().name(), engine);
        }

        RunScheduler scheduler = new RunScheduler(Math.min(config.getWorkers(), runs.size()));
        Map<String, SimulationResult> results;
        try {
            results = scheduler.runAll(runs, config.getRunBudget());
        } finally {
            scheduler.stop();
        }

        RunReporter reporter = new RunReporter(config.getOutputDir());
        for (SimulationResult result : results.values()) {
            reporter.logSummary(result);
            reporter.write(result);
        }
        reporter.logRoutingStats(engineConfig.getRoutingMode().name(), travelTimes.getStats());
        return results;
    }

    /**
     * Generated calls originate only at locations some ambulance base can
     * reach, and use the call types of the priority table.
     */
    private static CallSource generator(AppConfig config, Scenario scenario, TravelTimes travelTimes) {
        List<String> origins = new ArrayList<>();
        for (Location location : scenario.getNetwork().getLocations()) {
            for (AmbulanceRecord ambulance : scenario.getAmbulances()) {
                if (scenario.getNetwork().contains(ambulance.getBaseLocationId())
                        && travelTimes.isReachable(ambulance.getBaseLocationId(), location.getId())) {
                    origins.add(location.getId());
                    break;
                }
            }
        }
        List<String> callTypes = new ArrayList<>(scenario.getPriorities().asMap().keySet());
        if (callTypes.isEmpty()) {
            for (CallRecord call : scenario.getCalls()) {
                if (!callTypes.contains(call.getCallTypeCode())) {
                    callTypes.add(call.getCallTypeCode());
                }
            }
        }
        log.info("Generating {} synthetic calls (seed={}, mean interval={}) over {} locations",
                config.getSyntheticCalls(), config.getSyntheticSeed(), config.getSyntheticMeanInterval(),
                origins.size());
        try {
            return new CallGenerator(config.getSyntheticSeed(), config.getSyntheticCalls(),
                    config.getSyntheticMeanInterval(), origins, callTypes);
        } catch (IllegalArgumentException e) {
            throw new SimulationException("Cannot generate calls: " + e.getMessage(), e);
        }
    }

    private static void configureFileLogging(AppConfig config) {
        java.util.logging.Logger root = java.util.logging.Logger.getLogger("");
        root.setLevel(Level.INFO);

        if (!config.isFileLoggingEnabled()) {
            return;
        }

        Path target = config.getLogFile().toAbsolutePath();
        try {
            Files.createDirectories(target.getParent());
            FileHandler handler = new FileHandler(target.toString(), 5 * 1024 * 1024, 3, true);
            handler.setFormatter(new SimpleFormatter());
            root.addHandler(handler);
        } catch (IOException e) {
            root.log(Level.WARNING, "Failed to setup file logging", e);
        }
    }
}
