package com.tapelibrary.inventory.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * The three physical moves the changer performs, with the slot categories each one
 * accepts at either end.
 *
 * <pre>
 *   LOAD      storage | import-export  ->  transfer
 *   UNLOAD    transfer                 ->  storage | import-export
 *   TRANSFER  storage | import-export  ->  storage | import-export
 * </pre>
 */
public enum MoveKind {
    LOAD("load",
        EnumSet.of(SlotCategory.STORAGE, SlotCategory.IMPORT_EXPORT),
        EnumSet.of(SlotCategory.TRANSFER)),
    UNLOAD("unload",
        EnumSet.of(SlotCategory.TRANSFER),
        EnumSet.of(SlotCategory.STORAGE, SlotCategory.IMPORT_EXPORT)),
    TRANSFER("transfer",
        EnumSet.of(SlotCategory.STORAGE, SlotCategory.IMPORT_EXPORT),
        EnumSet.of(SlotCategory.STORAGE, SlotCategory.IMPORT_EXPORT));

    private final String verb;
    private final Set<SlotCategory> sources;
    private final Set<SlotCategory> destinations;

    MoveKind(String verb, Set<SlotCategory> sources, Set<SlotCategory> destinations) {
        this.verb = verb;
        this.sources = sources;
        this.destinations = destinations;
    }

    public String verb() {
        return verb;
    }

    public boolean allowsSource(SlotCategory category) {
        return sources.contains(category);
    }

    public boolean allowsDestination(SlotCategory category) {
        return destinations.contains(category);
    }
}
