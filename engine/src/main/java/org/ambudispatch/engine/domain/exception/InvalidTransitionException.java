package org.ambudispatch.engine.domain.exception;

/**
 * A state change that the ambulance or call state machine does not allow.
 * Indicates a defect in a policy or in the engine itself.
 */
public class InvalidTransitionException extends SimulationException {

    public InvalidTransitionException(String subject, Enum<?> from, Enum<?> to) {
        super(String.format("Invalid transition for %s: %s -> %s", subject, from, to));
    }
}
