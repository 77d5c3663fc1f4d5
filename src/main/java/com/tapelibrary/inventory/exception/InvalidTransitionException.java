package com.tapelibrary.inventory.exception;

/**
 * The requested move or category change does not fit the volume's current state.
 * Nothing was changed; the caller must re-read the volume before trying again.
 */
public class InvalidTransitionException extends InventoryException {

    public InvalidTransitionException(String operation, String serial, String reason) {
        super(operation, "Volume " + serial + ": " + reason);
    }
}
