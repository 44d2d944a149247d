package org.ambudispatch.simulation.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.ambudispatch.engine.domain.exception.InputException;
import org.ambudispatch.engine.domain.model.AmbulanceRecord;
import org.ambudispatch.engine.domain.model.CallRecord;
import org.ambudispatch.engine.domain.model.PriorityLevel;
import org.ambudispatch.engine.domain.model.PriorityTable;
import org.ambudispatch.engine.domain.model.Scenario;
import org.ambudispatch.engine.network.RoadNetwork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a scenario from the four CSV files of a data directory.
 *
 * Files are UTF-8 with a header row; a leading byte-order mark is ignored.
 * Any malformed row makes the whole load fail with an {@link InputException}
 * naming every bad row, so a run never starts on partial input.
 */
public final class ScenarioLoader {

    private static final Logger log = LoggerFactory.getLogger(ScenarioLoader.class);

    public static final String NETWORK_FILE = "location_network.csv";
    public static final String PRIORITY_FILE = "call_priority.csv";
    public static final String AMBULANCE_FILE = "ambulance.csv";
    public static final String CALLS_FILE = "calls.csv";

    private static final char BOM = '\uFEFF';

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
    private static final CsvSchema HEADER_SCHEMA = CsvSchema.emptySchema().withHeader();

    private final Path dataDir;

    public ScenarioLoader(Path dataDir) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir must not be null");
    }

    /**
     * Loads network, priority table, fleet and call log.
     *
     * @throws IOException if a file cannot be read
     * @throws InputException if a file is malformed
     */
    public Scenario load() throws IOException {
        RoadNetwork network = loadNetwork(dataDir.resolve(NETWORK_FILE));
        PriorityTable priorities = loadPriorities(dataDir.resolve(PRIORITY_FILE));
        List<AmbulanceRecord> ambulances = loadAmbulances(dataDir.resolve(AMBULANCE_FILE));
        List<CallRecord> calls = loadCalls(dataDir.resolve(CALLS_FILE));

        log.info("Loaded {} calls, {} ambulances and {} locations from {}",
                calls.size(), ambulances.size(), network.size(), dataDir);

        return new Scenario.Builder()
                .network(network)
                .priorities(priorities)
                .ambulances(ambulances)
                .calls(calls)
                .build();
    }

    /**
     * Each row is a directed edge whose cost is travel time plus traffic delay.
     */
    public RoadNetwork loadNetwork(Path file) throws IOException {
        List<EdgeRow> rows = readRows(file, EdgeRow.class);
        List<String> problems = new ArrayList<>();
        RoadNetwork.Builder builder = new RoadNetwork.Builder();
        for (int i = 0; i < rows.size(); i++) {
            EdgeRow row = rows.get(i);
            String where = file.getFileName() + " row " + (i + 1);
            if (isBlank(row.start) || isBlank(row.end)) {
                problems.add(where + ": Start and End are required");
                continue;
            }
            Double travelTime = parseNumber(row.travelTime, where, "Travel Time", problems);
            Double trafficDelay = parseNumber(row.trafficDelay, where, "Traffic Delay", problems);
            if (travelTime == null || trafficDelay == null) {
                continue;
            }
            double cost = travelTime + trafficDelay;
            if (Double.isInfinite(cost) || cost < 0) {
                problems.add(where + ": edge cost must be finite and non-negative, got " + cost);
                continue;
            }
            builder.addEdge(row.start, row.end, cost);
        }
        failOnProblems(file, problems);
        return builder.build();
    }

    public PriorityTable loadPriorities(Path file) throws IOException {
        List<PriorityRow> rows = readRows(file, PriorityRow.class);
        List<String> problems = new ArrayList<>();
        Map<String, PriorityLevel> levels = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            PriorityRow row = rows.get(i);
            String where = file.getFileName() + " row " + (i + 1);
            if (isBlank(row.callType)) {
                problems.add(where + ": Call Type is required");
                continue;
            }
            try {
                PriorityLevel level = PriorityLevel.fromCode(Integer.parseInt(row.priority));
                if (levels.put(row.callType, level) != null) {
                    problems.add(where + ": duplicate call type " + row.callType);
                }
            } catch (IllegalArgumentException e) {
                problems.add(where + ": invalid Priority '" + row.priority + "'");
            }
        }
        failOnProblems(file, problems);
        return PriorityTable.of(levels);
    }

    public List<AmbulanceRecord> loadAmbulances(Path file) throws IOException {
        List<AmbulanceRow> rows = readRows(file, AmbulanceRow.class);
        List<String> problems = new ArrayList<>();
        List<AmbulanceRecord> ambulances = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            AmbulanceRow row = rows.get(i);
            if (isBlank(row.number) || isBlank(row.stagingLocation)) {
                problems.add(file.getFileName() + " row " + (i + 1)
                        + ": Ambulance Number and Staging Location are required");
                continue;
            }
            ambulances.add(new AmbulanceRecord(row.number, row.stagingLocation));
        }
        failOnProblems(file, problems);
        return ambulances;
    }

    /**
     * A missing or blank Arrival Time means the call is present at time 0.
     */
    public List<CallRecord> loadCalls(Path file) throws IOException {
        List<CallRow> rows = readRows(file, CallRow.class);
        List<String> problems = new ArrayList<>();
        List<CallRecord> calls = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            CallRow row = rows.get(i);
            String where = file.getFileName() + " row " + (i + 1);
            if (isBlank(row.callId) || isBlank(row.location) || isBlank(row.callType)) {
                problems.add(where + ": Call ID, Location and Call Type are required");
                continue;
            }
            double arrival = 0.0;
            if (!isBlank(row.arrivalTime)) {
                Double parsed = parseNumber(row.arrivalTime, where, "Arrival Time", problems);
                if (parsed == null) {
                    continue;
                }
                if (Double.isInfinite(parsed)) {
                    problems.add(where + ": Arrival Time must be finite");
                    continue;
                }
                arrival = parsed;
            }
            calls.add(new CallRecord(row.callId, arrival, row.location, row.callType));
        }
        failOnProblems(file, problems);
        return calls;
    }

    private static <T> List<T> readRows(Path file, Class<T> type) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new InputException("Input file not found: " + file);
        }
        String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        if (!content.isEmpty() && content.charAt(0) == BOM) {
            content = content.substring(1);
        }
        ObjectReader reader = MAPPER.readerFor(type).with(HEADER_SCHEMA);
        try (MappingIterator<T> it = reader.readValues(content)) {
            return it.readAll();
        } catch (RuntimeJsonMappingException e) {
            throw new InputException("Malformed CSV in " + file + ": " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new InputException("Malformed CSV in " + file + ": " + e.getOriginalMessage(), e);
        }
    }

    private static Double parseNumber(String raw, String where, String column, List<String> problems) {
        if (isBlank(raw)) {
            problems.add(where + ": " + column + " is required");
            return null;
        }
        try {
            double value = Double.parseDouble(raw);
            if (Double.isNaN(value)) {
                problems.add(where + ": " + column + " is not a number");
                return null;
            }
            return value;
        } catch (NumberFormatException e) {
            problems.add(where + ": invalid " + column + " '" + raw + "'");
            return null;
        }
    }

    private static void failOnProblems(Path file, List<String> problems) {
        if (problems.isEmpty()) {
            return;
        }
        problems.forEach(p -> log.warn("Invalid input: {}", p));
        throw new InputException(problems.size() + " invalid row(s) in " + file, problems);
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public Path getDataDir() {
        return dataDir;
    }

    // =========================================================================
    // Row DTOs
    // =========================================================================

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class EdgeRow {
        @JsonProperty("Start")
        private String start;
        @JsonProperty("End")
        private String end;
        @JsonProperty("Travel Time")
        private String travelTime;
        @JsonProperty("Traffic Delay")
        private String trafficDelay;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class PriorityRow {
        @JsonProperty("Call Type")
        private String callType;
        @JsonProperty("Priority")
        private String priority;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class AmbulanceRow {
        @JsonProperty("Ambulance Number")
        private String number;
        @JsonProperty("Staging Location")
        private String stagingLocation;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class CallRow {
        @JsonProperty("Call ID")
        private String callId;
        @JsonProperty("Location")
        private String location;
        @JsonProperty("Call Type")
        private String callType;
        @JsonProperty("Arrival Time")
        private String arrivalTime;
    }
}
