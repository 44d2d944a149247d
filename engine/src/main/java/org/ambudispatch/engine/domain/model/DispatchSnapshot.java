package org.ambudispatch.engine.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view handed to a dispatch policy for one decision: the Idle
 * candidates for the call, nearest first, and the calls still waiting.
 */
public final class DispatchSnapshot {

    private final double now;
    private final List<Candidate> candidates;
    private final Map<String, PriorityLevel> pendingCalls;
    private final Map<PriorityLevel, Integer> pendingCounts;

    /**
     * @param candidates   Idle candidates; sorted here into their natural order
     * @param pendingCalls Pending call ids to priority, in queue order
     */
    public DispatchSnapshot(double now, List<Candidate> candidates, Map<String, PriorityLevel> pendingCalls) {
        this(now, candidates, new LinkedHashMap<>(pendingCalls), countByPriority(pendingCalls));
    }

    private DispatchSnapshot(double now, List<Candidate> candidates, Map<String, PriorityLevel> pendingCalls,
                             Map<PriorityLevel, Integer> pendingCounts) {
        this.now = now;
        List<Candidate> sorted = new ArrayList<>(candidates);
        Collections.sort(sorted);
        this.candidates = Collections.unmodifiableList(sorted);
        this.pendingCalls = Collections.unmodifiableMap(pendingCalls);
        this.pendingCounts = Collections.unmodifiableMap(pendingCounts);
    }

    /**
     * Snapshot over live pending data, without copying it. Only valid for the
     * decision it is built for; {@code pendingCounts} must hold the number of
     * entries of {@code pendingCalls} per priority.
     */
    public static DispatchSnapshot view(double now, List<Candidate> candidates,
                                        Map<String, PriorityLevel> pendingCalls,
                                        Map<PriorityLevel, Integer> pendingCounts) {
        return new DispatchSnapshot(now, candidates, pendingCalls, pendingCounts);
    }

    private static Map<PriorityLevel, Integer> countByPriority(Map<String, PriorityLevel> pendingCalls) {
        Map<PriorityLevel, Integer> counts = new EnumMap<>(PriorityLevel.class);
        for (PriorityLevel level : pendingCalls.values()) {
            counts.merge(level, 1, Integer::sum);
        }
        return counts;
    }

    public double getNow() {
        return now;
    }

    public List<Candidate> getCandidates() {
        return candidates;
    }

    public Map<String, PriorityLevel> getPendingCalls() {
        return pendingCalls;
    }

    /**
     * Whether any Pending call other than {@code callId} has at least the given priority.
     */
    public boolean hasOtherPendingAtLeast(String callId, PriorityLevel level) {
        int atLeast = 0;
        for (Map.Entry<PriorityLevel, Integer> entry : pendingCounts.entrySet()) {
            if (entry.getKey().isAtLeast(level)) {
                atLeast += entry.getValue();
            }
        }
        PriorityLevel own = pendingCalls.get(callId);
        if (own != null && own.isAtLeast(level)) {
            atLeast--;
        }
        return atLeast > 0;
    }

    @Override
    public String toString() {
        return "DispatchSnapshot{t=" + now + ", candidates=" + candidates.size() + ", pending=" + pendingCalls.size() + "}";
    }
}
