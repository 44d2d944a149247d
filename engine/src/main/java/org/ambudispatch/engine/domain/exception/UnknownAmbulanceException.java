package org.ambudispatch.engine.domain.exception;

public class UnknownAmbulanceException extends SimulationException {

    private final String ambulanceId;

    public UnknownAmbulanceException(String ambulanceId) {
        super("Unknown ambulance: " + ambulanceId);
        this.ambulanceId = ambulanceId;
    }

    public String getAmbulanceId() {
        return ambulanceId;
    }
}
