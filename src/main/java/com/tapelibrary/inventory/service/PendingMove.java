package com.tapelibrary.inventory.service;

import com.tapelibrary.inventory.domain.Location;
import com.tapelibrary.inventory.domain.MoveKind;

/**
 * Intent committed by the first phase of a move: the volume has been marked as in transit
 * and the changer may now be asked to carry it from {@code source} to {@code destination}.
 */
public record PendingMove(MoveKind kind, String serial, Location source, Location destination) {

    public String operation() {
        return "inventory." + kind.verb();
    }
}
