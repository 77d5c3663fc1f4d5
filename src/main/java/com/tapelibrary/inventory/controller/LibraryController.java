package com.tapelibrary.inventory.controller;

import com.tapelibrary.inventory.changer.Changer;
import com.tapelibrary.inventory.domain.Location;
import com.tapelibrary.inventory.dto.response.AuditReport;
import com.tapelibrary.inventory.dto.response.LoadedResponse;
import com.tapelibrary.inventory.dto.response.SlotStatusResponse;
import com.tapelibrary.inventory.service.InventoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/library")
@RequiredArgsConstructor
@Tag(name = "Library", description = "Changer status and inventory reconciliation")
public class LibraryController {

    private final InventoryService inventoryService;
    private final Changer changer;

    @GetMapping("/status")
    @Operation(summary = "Live slot occupancy", description = "Queried from the changer on every call.")
    @ApiResponse(responseCode = "200", description = "Snapshot returned")
    @ApiResponse(responseCode = "502", description = "Changer could not be queried")
    public ResponseEntity<SlotStatusResponse> status() {
        return ResponseEntity.ok(inventoryService.status(changer));
    }

    @PostMapping("/audit")
    @Operation(summary = "Audit the inventory", description = "Reconciles volume records with the changer's "
        + "physical snapshot. Registers unknown cartridges and clears stuck in-transit markers.")
    @ApiResponse(responseCode = "200", description = "Audit completed")
    @ApiResponse(responseCode = "502", description = "Changer could not be queried")
    public ResponseEntity<AuditReport> audit() {
        return ResponseEntity.ok(inventoryService.audit(changer));
    }

    @GetMapping("/transfer-slots/{addr}")
    @Operation(summary = "Which volume is loaded in a drive")
    @ApiResponse(responseCode = "200", description = "Answer returned, including for empty drives")
    public ResponseEntity<LoadedResponse> loaded(@PathVariable int addr) {
        String serial = inventoryService.loaded(Location.transfer(addr)).orElse(null);
        return ResponseEntity.ok(new LoadedResponse(addr, serial != null, serial));
    }
}
