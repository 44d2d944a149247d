package org.ambudispatch.engine.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Immutable mapping from call-type code to priority level.
 * Unknown call types fall back to {@link PriorityLevel#LOW}.
 */
public final class PriorityTable {

    private static final Logger LOG = Logger.getLogger(PriorityTable.class.getName());

    public static final PriorityLevel DEFAULT_LEVEL = PriorityLevel.LOW;

    private final Map<String, PriorityLevel> levels;

    private PriorityTable(Map<String, PriorityLevel> levels) {
        this.levels = Collections.unmodifiableMap(new LinkedHashMap<>(levels));
    }

    public static PriorityTable of(Map<String, PriorityLevel> levels) {
        Objects.requireNonNull(levels, "levels must not be null");
        return new PriorityTable(levels);
    }

    public static PriorityTable empty() {
        return new PriorityTable(Collections.emptyMap());
    }

    public PriorityLevel levelFor(String callTypeCode) {
        PriorityLevel level = levels.get(callTypeCode);
        if (level == null) {
            LOG.warning(() -> "No priority for call type '" + callTypeCode + "', using " + DEFAULT_LEVEL);
            return DEFAULT_LEVEL;
        }
        return level;
    }

    public boolean contains(String callTypeCode) {
        return levels.containsKey(callTypeCode);
    }

    public Map<String, PriorityLevel> asMap() {
        return levels;
    }

    public int size() {
        return levels.size();
    }

    @Override
    public String toString() {
        return "PriorityTable" + levels;
    }
}
