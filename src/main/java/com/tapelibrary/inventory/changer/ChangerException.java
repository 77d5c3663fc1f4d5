package com.tapelibrary.inventory.changer;

import com.tapelibrary.inventory.exception.InventoryException;

/**
 * The changer could not perform the requested operation. The message carries the
 * device's own description of the fault and is passed to the caller unchanged.
 */
public class ChangerException extends InventoryException {

    public ChangerException(String operation, String message) {
        super(operation, message);
    }

    public ChangerException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}
