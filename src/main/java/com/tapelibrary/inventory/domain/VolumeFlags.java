package com.tapelibrary.inventory.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable set of {@link VolumeFlag}s backed by the persisted bitmask.
 *
 * <p>This is the only place that knows the bit layout. Everything else asks for named
 * flags, which keeps the set of combinations that can reach the database auditable.
 */
public final class VolumeFlags {

    private static final int KNOWN_BITS;

    static {
        int mask = 0;
        for (VolumeFlag flag : VolumeFlag.values()) {
            mask |= flag.bit();
        }
        KNOWN_BITS = mask;
    }

    private static final VolumeFlags NONE = new VolumeFlags(0);

    private final int bits;

    private VolumeFlags(int bits) {
        this.bits = bits;
    }

    public static VolumeFlags none() {
        return NONE;
    }

    public static VolumeFlags of(int bits) {
        if ((bits & ~KNOWN_BITS) != 0) {
            throw new IllegalArgumentException("Unknown volume flag bits: 0x" + Integer.toHexString(bits & ~KNOWN_BITS));
        }
        return bits == 0 ? NONE : new VolumeFlags(bits);
    }

    public static VolumeFlags of(VolumeFlag... flags) {
        VolumeFlags result = NONE;
        for (VolumeFlag flag : flags) {
            result = result.with(flag);
        }
        return result;
    }

    public VolumeFlags with(VolumeFlag flag) {
        return has(flag) ? this : new VolumeFlags(bits | flag.bit());
    }

    public VolumeFlags without(VolumeFlag flag) {
        return has(flag) ? of(bits & ~flag.bit()) : this;
    }

    /** Sets or clears {@code flag} depending on {@code present}. */
    public VolumeFlags with(VolumeFlag flag, boolean present) {
        return present ? with(flag) : without(flag);
    }

    public boolean has(VolumeFlag flag) {
        return (bits & flag.bit()) != 0;
    }

    public boolean isEmpty() {
        return bits == 0;
    }

    public int bits() {
        return bits;
    }

    public List<String> labels() {
        List<String> labels = new ArrayList<>();
        for (VolumeFlag flag : VolumeFlag.values()) {
            if (has(flag)) {
                labels.add(flag.label());
            }
        }
        return Collections.unmodifiableList(labels);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VolumeFlags other && other.bits == bits;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(bits);
    }

    /** Human readable form, e.g. {@code transfering,mounted} or {@code none}. */
    @Override
    public String toString() {
        return isEmpty() ? "none" : String.join(",", labels());
    }
}
