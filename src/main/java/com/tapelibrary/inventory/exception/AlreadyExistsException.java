package com.tapelibrary.inventory.exception;

public class AlreadyExistsException extends InventoryException {

    public AlreadyExistsException(String operation, String entityName, String id) {
        super(operation, entityName + " already exists: " + id);
    }
}
