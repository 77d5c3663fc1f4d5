package com.tapelibrary.inventory.domain;

import com.tapelibrary.inventory.exception.InvalidCategoryException;

/**
 * Kind of physical position inside the library.
 *
 * <p>The label is the persisted and externally visible name. It never changes once
 * rows exist, so new categories must get new labels rather than reuse old ones.
 */
public enum SlotCategory {
    STORAGE("storage"),
    TRANSFER("transfer"),
    IMPORT_EXPORT("import-export"),
    CLEANING("cleaning");

    private final String label;

    SlotCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static SlotCategory fromLabel(String label) {
        for (SlotCategory category : values()) {
            if (category.label.equals(label)) {
                return category;
            }
        }
        throw new InvalidCategoryException("slot", label);
    }

    @Override
    public String toString() {
        return label;
    }
}
