package com.tapelibrary.inventory.changer;

import com.tapelibrary.inventory.domain.Location;

/**
 * A media changer: the robot that moves cartridges between slots.
 *
 * <p>Every call blocks for the duration of the physical move, which can take tens of
 * seconds for a drive load. A failed call leaves the media where it was; implementations
 * must not report failure after a partial move.
 *
 * <p>Implementations are not expected to serialize moves themselves. Callers must ensure
 * that at most one move is in flight per physical device.
 */
public interface Changer {

    /**
     * Reads the current occupancy of every slot from the device. Never cached.
     *
     * @throws ChangerException if the device cannot be queried
     */
    SlotStatus status();

    /**
     * Moves media from a storage or import/export slot into a drive.
     *
     * @throws ChangerException on a mechanical or communication fault
     */
    void load(Location src, Location dst);

    /**
     * Moves media out of a drive back to a storage or import/export slot.
     *
     * @throws ChangerException on a mechanical or communication fault
     */
    void unload(Location src, Location dst);

    /**
     * Moves media between two non-transfer slots without involving a drive.
     *
     * @throws ChangerException on a mechanical or communication fault
     */
    void transfer(Location src, Location dst);
}
