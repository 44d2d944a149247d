package org.ambudispatch.simulation.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.ambudispatch.engine.domain.model.PriorityLevel;
import org.ambudispatch.engine.network.RoutingStats;
import org.ambudispatch.engine.sim.DispatchRecord;
import org.ambudispatch.engine.sim.EventLogEntry;
import org.ambudispatch.engine.sim.ResponseTimeSummary;
import org.ambudispatch.engine.sim.SimulationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Writes the outputs of a run: the dispatch log, the event log and a JSON
 * summary, one set of files per policy.
 */
public final class RunReporter {

    private static final Logger log = LoggerFactory.getLogger(RunReporter.class);

    private static final CsvMapper CSV = new CsvMapper();
    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path outputDir;

    public RunReporter(Path outputDir) {
        this.outputDir = Objects.requireNonNull(outputDir, "outputDir must not be null");
    }

    /**
     * Writes all three files for one result.
     *
     * @return the written files
     */
    public List<Path> write(SimulationResult result) throws IOException {
        Files.createDirectories(outputDir);
        List<Path> written = new ArrayList<>();
        written.add(writeDispatchLog(result));
        written.add(writeEventLog(result));
        written.add(writeSummary(result));
        log.info("Wrote {} report files for policy {} to {}", written.size(), result.getPolicyName(), outputDir);
        return written;
    }

    public Path writeDispatchLog(SimulationResult result) throws IOException {
        Path target = outputDir.resolve("ambulance_call_log_" + result.getPolicyName() + ".csv");
        List<DispatchRow> rows = new ArrayList<>();
        for (DispatchRecord record : result.getDispatchRecords()) {
            rows.add(new DispatchRow(record));
        }
        writeCsv(target, CSV.schemaFor(DispatchRow.class).withHeader(), rows);
        return target;
    }

    public Path writeEventLog(SimulationResult result) throws IOException {
        Path target = outputDir.resolve("event_log_" + result.getPolicyName() + ".csv");
        List<EventRow> rows = new ArrayList<>();
        for (EventLogEntry entry : result.getEvents()) {
            rows.add(new EventRow(entry));
        }
        writeCsv(target, CSV.schemaFor(EventRow.class).withHeader(), rows);
        return target;
    }

    private static void writeCsv(Path target, CsvSchema schema, List<?> rows) throws IOException {
        CSV.writer(schema).writeValue(target.toFile(), rows);
    }

    public Path writeSummary(SimulationResult result) throws IOException {
        Path target = outputDir.resolve("summary_" + result.getPolicyName() + ".json");
        JSON.writeValue(target.toFile(), summarize(result));
        return target;
    }

    /**
     * The aggregates of a run as an ordered map, as written to the JSON summary.
     */
    public static Map<String, Object> summarize(SimulationResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("policy", result.getPolicyName());
        summary.put("status", result.getStatus().name());
        summary.put("calls", result.getCallStates().size() + result.getNotArrivedCallIds().size());
        summary.put("completed", result.getCompletedCount());
        summary.put("abandoned", result.getAbandonedCount());
        summary.put("stranded", result.getStrandedCallIds());
        summary.put("not_arrived", result.getNotArrivedCallIds());
        summary.put("start_time", result.getStartTime());
        summary.put("end_time", result.getEndTime());
        summary.put("duration", result.getDuration());
        summary.put("response_time", toMap(result.getResponseTimeSummary()));

        Map<String, Object> byPriority = new LinkedHashMap<>();
        for (Map.Entry<PriorityLevel, ResponseTimeSummary> entry : result.getResponseTimesByPriority().entrySet()) {
            byPriority.put(entry.getKey().name(), toMap(entry.getValue()));
        }
        summary.put("response_time_by_priority", byPriority);
        summary.put("utilization", new LinkedHashMap<>(result.getUtilization()));
        summary.put("events", result.getEvents().size());
        return summary;
    }

    private static Map<String, Object> toMap(ResponseTimeSummary summary) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("count", summary.getCount());
        values.put("mean", finiteOrNull(summary.getMean()));
        values.put("median", finiteOrNull(summary.getMedian()));
        values.put("p90", finiteOrNull(summary.getP90()));
        values.put("max", finiteOrNull(summary.getMax()));
        return values;
    }

    private static Double finiteOrNull(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
    }

    /**
     * Prints the outcome of a run to the log.
     */
    public void logSummary(SimulationResult result) {
        log.info("--- Policy {}: {} ---", result.getPolicyName(), result.getStatus());
        log.info("Calls: {} completed, {} abandoned, {} stranded, {} not arrived",
                result.getCompletedCount(), result.getAbandonedCount(), result.getStrandedCallIds().size(),
                result.getNotArrivedCallIds().size());
        log.info("Response time: {}", result.getResponseTimeSummary());
        result.getResponseTimesByPriority().forEach((level, summary) ->
                log.info("  {}: {}", level, summary));
        result.getUtilization().forEach((ambulanceId, usage) ->
                log.info("  Ambulance {} utilization: {}", ambulanceId, String.format(Locale.ROOT, "%.1f%%", usage * 100)));
    }

    /**
     * Prints the routing performance counters.
     */
    public void logRoutingStats(String mode, RoutingStats stats) {
        log.info("--- Routing performance ({}) ---", mode);
        log.info("Initial precomputation time: {} seconds",
                String.format(Locale.ROOT, "%.8f", stats.getPrecomputationNanos() / 1e9));
        log.info("Total time spent in {} lookups: {} seconds", stats.getQueries(),
                String.format(Locale.ROOT, "%.8f", stats.getQueryNanos() / 1e9));
    }

    public Path getOutputDir() {
        return outputDir;
    }

    // =========================================================================
    // Row DTOs
    // =========================================================================

    @JsonPropertyOrder({"Call ID", "Call Type", "Call Location", "Selected Ambulance", "Time to Call Location"})
    static final class DispatchRow {
        @JsonProperty("Call ID")
        private final String callId;
        @JsonProperty("Call Type")
        private final String callType;
        @JsonProperty("Call Location")
        private final String callLocation;
        @JsonProperty("Selected Ambulance")
        private final String selectedAmbulance;
        @JsonProperty("Time to Call Location")
        private final double timeToCallLocation;

        DispatchRow(DispatchRecord record) {
            this.callId = record.getCallId();
            this.callType = record.getCallTypeCode();
            this.callLocation = record.getLocationId();
            this.selectedAmbulance = record.getAmbulanceId();
            this.timeToCallLocation = Math.round(record.getTravelTime() * 100.0) / 100.0;
        }
    }

    @JsonPropertyOrder({"Timestamp", "Event", "Call ID", "Ambulance ID"})
    static final class EventRow {
        @JsonProperty("Timestamp")
        private final String timestamp;
        @JsonProperty("Event")
        private final String event;
        @JsonProperty("Call ID")
        private final String callId;
        @JsonProperty("Ambulance ID")
        private final String ambulanceId;

        EventRow(EventLogEntry entry) {
            this.timestamp = String.format(Locale.ROOT, "%.4f", entry.getTime());
            this.event = entry.getKind().name();
            this.callId = entry.getCallId();
            this.ambulanceId = entry.getAmbulanceId();
        }
    }
}
