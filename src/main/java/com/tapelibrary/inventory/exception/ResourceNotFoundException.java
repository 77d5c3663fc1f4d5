package com.tapelibrary.inventory.exception;

public class ResourceNotFoundException extends InventoryException {

    public ResourceNotFoundException(String operation, String entityName, String id) {
        super(operation, entityName + " not found: " + id);
    }
}
