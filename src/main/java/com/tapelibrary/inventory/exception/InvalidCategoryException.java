package com.tapelibrary.inventory.exception;

public class InvalidCategoryException extends InventoryException {

    public InvalidCategoryException(String kind, String label) {
        super("category.parse", "Unknown " + kind + " category '" + label + "'");
    }
}
