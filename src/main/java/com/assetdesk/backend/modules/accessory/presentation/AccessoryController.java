package com.assetdesk.backend.modules.accessory.presentation;

import com.assetdesk.backend.global.error.BusinessErrors;
import com.assetdesk.backend.global.error.EntityNotFoundError;
import com.assetdesk.backend.global.web.ActingUser;
import com.assetdesk.backend.modules.accessory.application.AccessoryService;
import com.assetdesk.backend.modules.accessory.presentation.dto.AccessoryCheckoutRequest;
import com.assetdesk.backend.modules.accessory.presentation.dto.AccessoryRequest;
import com.assetdesk.backend.modules.accessory.presentation.dto.AccessoryResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/accessories")
public class AccessoryController {

    private final AccessoryService accessoryService;

    public AccessoryController(AccessoryService accessoryService) {
        this.accessoryService = accessoryService;
    }

    @Operation(summary = "Register an accessory")
    @PostMapping
    public ResponseEntity<AccessoryResponse> create(@Valid @RequestBody AccessoryRequest request, @Parameter(hidden = true) ActingUser actor) {
        AccessoryResponse created = BusinessErrors.unwrap(accessoryService.create(request, actor.id()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Accessory detail", description = "Includes the free quantity and the users holding a unit.")
    @GetMapping("/{accessoryId}")
    public ResponseEntity<AccessoryResponse> get(@PathVariable long accessoryId) {
        return accessoryService.getAccessory(accessoryId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> BusinessErrors.toProblem(new EntityNotFoundError("Accessory", accessoryId)));
    }

    @Operation(summary = "Update an accessory", description = "The quantity cannot drop below the assigned units.")
    @PutMapping("/{accessoryId}")
    public ResponseEntity<AccessoryResponse> update(
            @PathVariable long accessoryId,
            @Valid @RequestBody AccessoryRequest request,
            @Parameter(hidden = true) ActingUser actor
    ) {
        return ResponseEntity.ok(BusinessErrors.unwrap(accessoryService.update(accessoryId, request, actor.id())));
    }

    @Operation(summary = "Delete an accessory", description = "Refused while any unit is assigned.")
    @DeleteMapping("/{accessoryId}")
    public ResponseEntity<Void> delete(@PathVariable long accessoryId, @Parameter(hidden = true) ActingUser actor) {
        BusinessErrors.unwrap(accessoryService.delete(accessoryId, actor.id()));
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Assign one unit to a user", description = "Refused when no unit is left.")
    @PostMapping("/{accessoryId}/assignments")
    public ResponseEntity<AccessoryResponse> checkout(
            @PathVariable long accessoryId,
            @Valid @RequestBody AccessoryCheckoutRequest request,
            @Parameter(hidden = true) ActingUser actor
    ) {
        AccessoryResponse updated = BusinessErrors.unwrap(accessoryService.checkout(accessoryId, request, actor.id()));
        return ResponseEntity.status(HttpStatus.CREATED).body(updated);
    }

    @Operation(summary = "Release one assigned unit")
    @PostMapping("/{accessoryId}/assignments/{assignmentId}/release")
    public ResponseEntity<AccessoryResponse> checkin(
            @PathVariable long accessoryId,
            @PathVariable long assignmentId,
            @Parameter(hidden = true) ActingUser actor
    ) {
        return ResponseEntity.ok(BusinessErrors.unwrap(accessoryService.checkin(accessoryId, assignmentId, actor.id())));
    }
}
