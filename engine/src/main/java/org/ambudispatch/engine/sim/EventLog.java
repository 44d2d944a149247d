package org.ambudispatch.engine.sim;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Append-only, in-memory record of what happened during a run.
 */
public final class EventLog {

    private final List<EventLogEntry> entries = new ArrayList<>();

    void append(double time, EventKind kind, String callId, String ambulanceId) {
        if (!kind.isLogged()) {
            throw new IllegalArgumentException(kind + " is not a logged event kind");
        }
        entries.add(new EventLogEntry(time, kind, callId, ambulanceId));
    }

    public List<EventLogEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<EventLogEntry> ofKind(EventKind kind) {
        return entries.stream().filter(e -> e.getKind() == kind).collect(Collectors.toList());
    }

    public List<EventLogEntry> forCall(String callId) {
        return entries.stream().filter(e -> callId.equals(e.getCallId())).collect(Collectors.toList());
    }

    public List<String> toLines() {
        return entries.stream().map(EventLogEntry::toLine).collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }
}
