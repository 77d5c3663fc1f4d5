package com.tapelibrary.inventory.domain;

/**
 * Named bits of {@link VolumeFlags}. Declaration order is the display order.
 */
public enum VolumeFlag {
    /** A move has committed its intent but the changer has not confirmed it yet. */
    TRANSFERING(1, "transfering"),
    MOUNTED(1 << 1, "mounted"),
    NEEDS_CLEANING(1 << 2, "needs-cleaning"),
    /** The volume already carries a tape format and must not be formatted again. */
    FORMATTED(1 << 3, "formatted");

    private final int bit;
    private final String label;

    VolumeFlag(int bit, String label) {
        this.bit = bit;
        this.label = label;
    }

    int bit() {
        return bit;
    }

    public String label() {
        return label;
    }
}
