package org.ambudispatch.engine.domain.exception;

/**
 * Base type for every failure raised by the dispatch engine.
 * A SimulationException that escapes a run means the run is unusable.
 */
public class SimulationException extends RuntimeException {

    public SimulationException(String message) {
        super(message);
    }

    public SimulationException(String message, Throwable cause) {
        super(message, cause);
    }
}
