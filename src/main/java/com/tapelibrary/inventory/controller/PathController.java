package com.tapelibrary.inventory.controller;

import com.tapelibrary.inventory.dto.request.CreatePathRequest;
import com.tapelibrary.inventory.dto.response.PathResponse;
import com.tapelibrary.inventory.service.InventoryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/paths")
@RequiredArgsConstructor
@Tag(name = "Paths", description = "Logical path to volume index")
public class PathController {

    private final InventoryService inventoryService;

    @PostMapping
    @Operation(summary = "Map a path to a volume")
    @ApiResponse(responseCode = "201", description = "Mapping created")
    @ApiResponse(responseCode = "404", description = "Volume not found")
    @ApiResponse(responseCode = "409", description = "Path already mapped")
    public ResponseEntity<PathResponse> create(@Valid @RequestBody CreatePathRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(inventoryService.create(request));
    }

    @GetMapping
    @Operation(summary = "Resolve a path", description = "Returns the full record of the volume holding the path.")
    @ApiResponse(responseCode = "200", description = "Path found")
    @ApiResponse(responseCode = "404", description = "Path not mapped")
    public ResponseEntity<PathResponse> lookup(
            @Parameter(description = "Absolute logical path, e.g. /backup/2024/db.tar") @RequestParam String path) {
        return ResponseEntity.ok(inventoryService.lookup(path));
    }
}
