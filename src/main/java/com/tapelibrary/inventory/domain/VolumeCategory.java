package com.tapelibrary.inventory.domain;

import com.tapelibrary.inventory.exception.InvalidCategoryException;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle state of a volume.
 *
 * <p>Persisted by label. Allocation orders candidates by the stored label, so
 * {@code filling} sorts before {@code scratch} and partly written media is reused first.
 *
 * <p>Allowed transitions:
 * <pre>
 *   unknown  -> scratch
 *   scratch  -> allocating
 *   filling  -> allocating | full
 *   allocating -> allocated
 *   allocated  -> filling | full
 *   missing | damaged -> unknown
 *   any      -> missing | damaged | cleaning
 * </pre>
 *
 * <p>The allocation path only needs {@code scratch|filling -> allocating -> allocated}. The
 * other edges are the operator's: admitting new media as scratch, recording that an
 * allocated volume received data or was closed, and re-admitting missing or damaged media
 * as unknown so the next audit can classify it again.
 */
public enum VolumeCategory {
    UNKNOWN("unknown"),
    ALLOCATING("allocating"),
    ALLOCATED("allocated"),
    SCRATCH("scratch"),
    FILLING("filling"),
    FULL("full"),
    MISSING("missing"),
    DAMAGED("damaged"),
    CLEANING("cleaning");

    private static final Set<VolumeCategory> OPERATOR_TARGETS = EnumSet.of(MISSING, DAMAGED, CLEANING);

    private final String label;

    VolumeCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean canTransitionTo(VolumeCategory target) {
        if (target == this || OPERATOR_TARGETS.contains(target)) {
            return true;
        }
        return switch (this) {
            case UNKNOWN -> target == SCRATCH;
            case SCRATCH -> target == ALLOCATING;
            case FILLING -> target == ALLOCATING || target == FULL;
            case ALLOCATING -> target == ALLOCATED;
            case ALLOCATED -> target == FILLING || target == FULL;
            case MISSING, DAMAGED -> target == UNKNOWN;
            case FULL, CLEANING -> false;
        };
    }

    public static VolumeCategory fromLabel(String label) {
        for (VolumeCategory category : values()) {
            if (category.label.equals(label)) {
                return category;
            }
        }
        throw new InvalidCategoryException("volume", label);
    }

    @Override
    public String toString() {
        return label;
    }
}
