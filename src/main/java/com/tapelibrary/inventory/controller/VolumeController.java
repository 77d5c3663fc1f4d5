package com.tapelibrary.inventory.controller;

import com.tapelibrary.inventory.changer.Changer;
import com.tapelibrary.inventory.dto.request.LocationRequest;
import com.tapelibrary.inventory.dto.request.RegisterVolumeRequest;
import com.tapelibrary.inventory.dto.request.UpdateVolumeRequest;
import com.tapelibrary.inventory.dto.response.AllocResponse;
import com.tapelibrary.inventory.dto.response.PagedResponse;
import com.tapelibrary.inventory.dto.response.VolumeResponse;
import com.tapelibrary.inventory.mapper.VolumeMapper;
import com.tapelibrary.inventory.service.InventoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/volumes")
@RequiredArgsConstructor
@Tag(name = "Volumes", description = "Volume lifecycle and media movement")
public class VolumeController {

    private final InventoryService inventoryService;
    private final Changer changer;

    @GetMapping
    @Operation(summary = "List volumes", description = "Returns a paginated list of volumes ordered by serial.")
    public ResponseEntity<PagedResponse<VolumeResponse>> findAll(@PageableDefault(sort = "serial") Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(inventoryService.findAll(pageable)));
    }

    @GetMapping("/{serial}")
    @Operation(summary = "Get volume by serial")
    @ApiResponse(responseCode = "200", description = "Volume found")
    @ApiResponse(responseCode = "404", description = "Volume not found")
    public ResponseEntity<VolumeResponse> info(@PathVariable String serial) {
        return ResponseEntity.ok(inventoryService.info(serial));
    }

    @PostMapping
    @Operation(summary = "Register a volume", description = "Records a cartridge placed into the library by hand. "
        + "New volumes start as scratch (default) or unknown.")
    @ApiResponse(responseCode = "201", description = "Volume registered")
    @ApiResponse(responseCode = "400", description = "Validation error or unknown category")
    @ApiResponse(responseCode = "409", description = "Serial already known or slot occupied")
    public ResponseEntity<VolumeResponse> register(@Valid @RequestBody RegisterVolumeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(inventoryService.register(request));
    }

    @PatchMapping("/{serial}")
    @Operation(summary = "Update a volume", description = "Changes the category along the allowed transitions "
        + "and sets or clears the needs-cleaning and formatted flags. Null fields are ignored.")
    @ApiResponse(responseCode = "200", description = "Volume updated")
    @ApiResponse(responseCode = "404", description = "Volume not found")
    @ApiResponse(responseCode = "409", description = "Category transition not allowed")
    public ResponseEntity<VolumeResponse> update(@PathVariable String serial,
                                                 @RequestBody UpdateVolumeRequest request) {
        return ResponseEntity.ok(inventoryService.update(serial, request));
    }

    @PostMapping("/alloc")
    @Operation(summary = "Allocate a volume for writing",
        description = "Returns the first filling volume, else the first scratch volume, idle in a storage slot.")
    @ApiResponse(responseCode = "200", description = "Volume allocated")
    @ApiResponse(responseCode = "503", description = "No volume available; add scratch media")
    public ResponseEntity<AllocResponse> alloc() {
        return ResponseEntity.ok(new AllocResponse(inventoryService.alloc()));
    }

    @PostMapping("/{serial}/load")
    @Operation(summary = "Load a volume into a drive")
    @ApiResponse(responseCode = "200", description = "Volume loaded")
    @ApiResponse(responseCode = "409", description = "Volume or destination in the wrong state")
    @ApiResponse(responseCode = "502", description = "Changer fault; volume left in transit until audited")
    public ResponseEntity<VolumeResponse> load(@PathVariable String serial,
                                               @Valid @RequestBody LocationRequest destination) {
        return ResponseEntity.ok(inventoryService.load(serial, VolumeMapper.toLocation(destination), changer));
    }

    @PostMapping("/{serial}/unload")
    @Operation(summary = "Unload a volume from a drive", description = "Without a body the volume returns to its home slot.")
    @ApiResponse(responseCode = "200", description = "Volume unloaded")
    @ApiResponse(responseCode = "409", description = "Volume not in a drive or destination in the wrong state")
    @ApiResponse(responseCode = "502", description = "Changer fault; volume left in transit until audited")
    public ResponseEntity<VolumeResponse> unload(@PathVariable String serial,
                                                 @Valid @RequestBody(required = false) LocationRequest destination) {
        return ResponseEntity.ok(inventoryService.unload(serial, VolumeMapper.toLocation(destination), changer));
    }

    @PostMapping("/{serial}/transfer")
    @Operation(summary = "Move a volume between storage and import/export slots")
    @ApiResponse(responseCode = "200", description = "Volume transferred")
    @ApiResponse(responseCode = "409", description = "Volume or destination in the wrong state")
    @ApiResponse(responseCode = "502", description = "Changer fault; volume left in transit until audited")
    public ResponseEntity<VolumeResponse> transfer(@PathVariable String serial,
                                                   @Valid @RequestBody LocationRequest destination) {
        return ResponseEntity.ok(inventoryService.transfer(serial, VolumeMapper.toLocation(destination), changer));
    }
}
