package org.ambudispatch.engine.domain.exception;

/**
 * A location id that is not part of the network node set.
 */
public class UnknownLocationException extends InputException {

    private final String locationId;

    public UnknownLocationException(String locationId) {
        super("Unknown location: " + locationId);
        this.locationId = locationId;
    }

    public String getLocationId() {
        return locationId;
    }
}
