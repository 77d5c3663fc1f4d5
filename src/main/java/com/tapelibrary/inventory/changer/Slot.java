package com.tapelibrary.inventory.changer;

import com.tapelibrary.inventory.domain.Location;
import com.tapelibrary.inventory.domain.SlotCategory;

import java.util.Objects;

/**
 * One slot as reported by the changer. {@code serial} is {@code null} when the slot is empty.
 */
public record Slot(int addr, SlotCategory category, String serial) {

    public Slot {
        Objects.requireNonNull(category, "category");
    }

    public static Slot empty(Location location) {
        return new Slot(location.addr(), location.category(), null);
    }

    public static Slot occupied(Location location, String serial) {
        return new Slot(location.addr(), location.category(), Objects.requireNonNull(serial, "serial"));
    }

    public Location location() {
        return new Location(addr, category);
    }
}
