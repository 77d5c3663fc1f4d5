package com.tapelibrary.inventory.exception;

/**
 * Base class for inventory failures. Every instance names the operation that failed so
 * the caller gets a single structured error, e.g. {@code inventory.load: ...}.
 */
public abstract class InventoryException extends RuntimeException {

    private final String operation;

    protected InventoryException(String operation, String message) {
        super(message);
        this.operation = operation;
    }

    protected InventoryException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public String toString() {
        return operation + ": " + getMessage();
    }
}
