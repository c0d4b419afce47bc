package com.assetdesk.backend.modules.license.presentation;

import com.assetdesk.backend.global.error.BusinessErrors;
import com.assetdesk.backend.global.error.EntityNotFoundError;
import com.assetdesk.backend.global.web.ActingUser;
import com.assetdesk.backend.modules.license.application.LicenseService;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseCopyRequest;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseRequest;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseResponse;

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
@RequestMapping("/api/licenses")
public class LicenseController {

    private final LicenseService licenseService;

    public LicenseController(LicenseService licenseService) {
        this.licenseService = licenseService;
    }

    @Operation(summary = "Create a license", description = "Creates the license and one free seat per purchased seat.")
    @PostMapping
    public ResponseEntity<LicenseResponse> create(@Valid @RequestBody LicenseRequest request, @Parameter(hidden = true) ActingUser actor) {
        LicenseResponse created = BusinessErrors.unwrap(licenseService.create(request, actor.id()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "Copy a license", description = "Creates a license with the source's fields and seat count; the serial is not copied.")
    @PostMapping("/{licenseId}/copy")
    public ResponseEntity<LicenseResponse> copy(
            @PathVariable long licenseId,
            @RequestBody(required = false) LicenseCopyRequest request,
            @Parameter(hidden = true) ActingUser actor
    ) {
        LicenseResponse created = BusinessErrors.unwrap(licenseService.copy(licenseId, request, actor.id()));
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(summary = "License detail", description = "Lists the seats as Seat 1..n with their state and assignee.")
    @GetMapping("/{licenseId}")
    public ResponseEntity<LicenseResponse> get(@PathVariable long licenseId) {
        return licenseService.getLicense(licenseId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> BusinessErrors.toProblem(new EntityNotFoundError("License", licenseId)));
    }

    @Operation(summary = "Update a license", description = "Saving a new seat count grows or shrinks the seat pool in the same transaction.")
    @PutMapping("/{licenseId}")
    public ResponseEntity<LicenseResponse> update(
            @PathVariable long licenseId,
            @Valid @RequestBody LicenseRequest request,
            @Parameter(hidden = true) ActingUser actor
    ) {
        return ResponseEntity.ok(BusinessErrors.unwrap(licenseService.update(licenseId, request, actor.id())));
    }

    @Operation(summary = "Delete a license", description = "Refused while any seat is assigned.")
    @DeleteMapping("/{licenseId}")
    public ResponseEntity<Void> delete(@PathVariable long licenseId, @Parameter(hidden = true) ActingUser actor) {
        BusinessErrors.unwrap(licenseService.delete(licenseId, actor.id()));
        return ResponseEntity.noContent().build();
    }
}
