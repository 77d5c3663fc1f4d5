package com.tapelibrary.inventory.domain;

import java.util.Objects;

/**
 * Addressed slot or drive position inside the library.
 *
 * <p>Two locations are the same slot iff both {@code addr} and {@code category} match;
 * the storage slot 1 and the transfer slot 1 are different positions.
 */
public record Location(int addr, SlotCategory category) {

    public Location {
        if (addr < 0) {
            throw new IllegalArgumentException("Slot address must not be negative: " + addr);
        }
        Objects.requireNonNull(category, "category");
    }

    public static Location storage(int addr) {
        return new Location(addr, SlotCategory.STORAGE);
    }

    public static Location transfer(int addr) {
        return new Location(addr, SlotCategory.TRANSFER);
    }

    public static Location importExport(int addr) {
        return new Location(addr, SlotCategory.IMPORT_EXPORT);
    }

    public boolean isTransfer() {
        return category == SlotCategory.TRANSFER;
    }

    @Override
    public String toString() {
        return "(" + addr + ", " + category.label() + ")";
    }
}
