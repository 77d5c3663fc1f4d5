package com.tapelibrary.inventory.dto.response;

import java.util.List;

/**
 * Outcome of one audit pass.
 *
 * @param examined   occupied slots in the changer snapshot
 * @param registered serials seen for the first time
 * @param relocated  known volumes whose location or flags were corrected
 * @param unchanged  known volumes that already matched the snapshot
 * @param displaced  volumes whose recorded slot held another cartridge and that the
 *                   snapshot did not show anywhere else; their location is now absent
 */
public record AuditReport(
    int examined,
    int registered,
    int relocated,
    int unchanged,
    List<String> displaced
) {

    public boolean changedAnything() {
        return registered > 0 || relocated > 0 || !displaced.isEmpty();
    }
}
