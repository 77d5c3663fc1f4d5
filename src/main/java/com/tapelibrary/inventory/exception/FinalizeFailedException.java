package com.tapelibrary.inventory.exception;

import com.tapelibrary.inventory.domain.Location;

/**
 * The changer completed the move but recording the result failed. The physical state is
 * authoritative; the volume stays marked as in transit until an audit reconciles it.
 */
public class FinalizeFailedException extends InventoryException {

    private final String serial;
    private final Location destination;

    public FinalizeFailedException(String operation, String serial, Location destination, Throwable cause) {
        super(operation, "Volume " + serial + " was moved to " + destination
            + " but the inventory could not be updated; run an audit to reconcile", cause);
        this.serial = serial;
        this.destination = destination;
    }

    public String getSerial() {
        return serial;
    }

    public Location getDestination() {
        return destination;
    }
}
