package com.tapelibrary.inventory.changer;

import com.tapelibrary.inventory.domain.SlotCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time occupancy snapshot produced by {@link Changer#status()}.
 *
 * <p>Used for audit only; the inventory database remains the bookkeeping record.
 */
public record SlotStatus(Map<SlotCategory, List<Slot>> slots) {

    public SlotStatus {
        EnumMap<SlotCategory, List<Slot>> copy = new EnumMap<>(SlotCategory.class);
        slots.forEach((category, list) -> copy.put(category, List.copyOf(list)));
        slots = Collections.unmodifiableMap(copy);
    }

    public List<Slot> slots(SlotCategory category) {
        return slots.getOrDefault(category, List.of());
    }

    /** Occupied slots in category order, then in the order the device reported them. */
    public List<Slot> occupied() {
        return slots.values().stream()
            .flatMap(List::stream)
            .filter(slot -> slot.serial() != null)
            .toList();
    }
}
