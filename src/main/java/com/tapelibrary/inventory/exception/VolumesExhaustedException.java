package com.tapelibrary.inventory.exception;

/**
 * No filling or scratch volume is idle in a storage slot. An operational condition
 * (the library needs more scratch media), not a defect.
 */
public class VolumesExhaustedException extends InventoryException {

    public VolumesExhaustedException(String operation) {
        super(operation, "No filling or scratch volume available in storage");
    }
}
