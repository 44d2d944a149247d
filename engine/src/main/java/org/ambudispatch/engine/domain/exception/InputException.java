package org.ambudispatch.engine.domain.exception;

import java.util.Collections;
import java.util.List;

/**
 * Malformed, missing or inconsistent input records.
 * Always raised before a run starts.
 */
public class InputException extends SimulationException {

    private final List<String> problems;

    public InputException(String message) {
        this(message, Collections.singletonList(message));
    }

    public InputException(String message, List<String> problems) {
        super(message);
        this.problems = Collections.unmodifiableList(problems);
    }

    public InputException(String message, Throwable cause) {
        super(message, cause);
        this.problems = Collections.singletonList(message);
    }

    public List<String> getProblems() {
        return problems;
    }
}
