package com.assetdesk.backend.modules.assignment.presentation;

import com.assetdesk.backend.global.error.BusinessErrors;
import com.assetdesk.backend.global.error.EntityNotFoundError;
import com.assetdesk.backend.global.web.ActingUser;
import com.assetdesk.backend.modules.assignment.application.AssignmentView;
import com.assetdesk.backend.modules.assignment.application.AssignmentWorkflow;
import com.assetdesk.backend.modules.assignment.application.TargetFieldController;
import com.assetdesk.backend.modules.assignment.domain.AssignmentChannel;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTarget;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTargetKind;
import com.assetdesk.backend.modules.assignment.domain.FieldAccess;
import com.assetdesk.backend.modules.assignment.presentation.dto.AssignmentRequest;
import com.assetdesk.backend.modules.assignment.presentation.dto.CheckinRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class AssignmentController {

    private final AssignmentWorkflow assignmentWorkflow;
    private final TargetFieldController targetFieldController;

    public AssignmentController(AssignmentWorkflow assignmentWorkflow, TargetFieldController targetFieldController) {
        this.assignmentWorkflow = assignmentWorkflow;
        this.targetFieldController = targetFieldController;
    }

    @Operation(summary = "Check out an asset", description = "Assigns the asset to a user, a location or another asset.")
    @PostMapping("/api/assets/{assetId}/checkout")
    public ResponseEntity<AssignmentView> checkoutAsset(
            @PathVariable long assetId,
            @Valid @RequestBody AssignmentRequest request,
            @Parameter(hidden = true) ActingUser actor
    ) {
        AssignmentTarget target = resolveTarget(AssignmentChannel.ASSET, request);
        return ResponseEntity.ok(BusinessErrors.unwrap(assignmentWorkflow.assignAsset(
                assetId, target, request.assignedAt(), request.expectedCheckin(), actor.id())));
    }

    @Operation(summary = "Check in an asset", description = "Clears the assignment; optionally sets a new status and location.")
    @PostMapping("/api/assets/{assetId}/checkin")
    public ResponseEntity<AssignmentView> checkinAsset(
            @PathVariable long assetId,
            @Valid @RequestBody(required = false) CheckinRequest request,
            @Parameter(hidden = true) ActingUser actor
    ) {
        Long statusId = request == null ? null : request.statusId();
        Long locationId = request == null ? null : request.locationId();
        return ResponseEntity.ok(BusinessErrors.unwrap(
                assignmentWorkflow.releaseAsset(assetId, actor.id(), statusId, locationId)));
    }

    @Operation(summary = "Assign the next free seat of a license")
    @PostMapping("/api/licenses/{licenseId}/seats/assign")
    public ResponseEntity<AssignmentView> assignAnySeat(
            @PathVariable long licenseId,
            @Valid @RequestBody AssignmentRequest request,
            @Parameter(hidden = true) ActingUser actor
    ) {
        AssignmentTarget target = resolveTarget(AssignmentChannel.SEAT, request);
        return ResponseEntity.ok(BusinessErrors.unwrap(assignmentWorkflow.assignAnySeat(
                licenseId, target, request.assignedAt(), request.expectedCheckin(), actor.id())));
    }

    @Operation(summary = "Assign a specific license seat", description = "Seats accept a user or an asset, never a location.")
    @PostMapping("/api/licenses/{licenseId}/seats/{seatId}/assign")
    public ResponseEntity<AssignmentView> assignSeat(
            @PathVariable long licenseId,
            @PathVariable long seatId,
            @Valid @RequestBody AssignmentRequest request,
            @Parameter(hidden = true) ActingUser actor
    ) {
        requireSeatOfLicense(licenseId, seatId);
        AssignmentTarget target = resolveTarget(AssignmentChannel.SEAT, request);
        return ResponseEntity.ok(BusinessErrors.unwrap(assignmentWorkflow.assignSeat(
                seatId, target, request.assignedAt(), request.expectedCheckin(), actor.id())));
    }

    @Operation(summary = "Release a license seat")
    @PostMapping("/api/licenses/{licenseId}/seats/{seatId}/release")
    public ResponseEntity<AssignmentView> releaseSeat(
            @PathVariable long licenseId,
            @PathVariable long seatId,
            @Parameter(hidden = true) ActingUser actor
    ) {
        requireSeatOfLicense(licenseId, seatId);
        return ResponseEntity.ok(BusinessErrors.unwrap(assignmentWorkflow.releaseSeat(seatId, actor.id())));
    }

    @Operation(summary = "Target field access", description = "Which target fields are enabled, required and cleared for a kind.")
    @GetMapping("/api/assignment-fields")
    public FieldAccess fieldAccess(
            @Parameter(description = "ASSET or SEAT")
            @RequestParam AssignmentChannel channel,
            @Parameter(description = "Selected target kind; omit for the initial state")
            @RequestParam(required = false) AssignmentTargetKind kind
    ) {
        return targetFieldController.fieldsFor(channel, kind);
    }

    private AssignmentTarget resolveTarget(AssignmentChannel channel, AssignmentRequest request) {
        return BusinessErrors.unwrap(targetFieldController.toTarget(channel, request.toForm()));
    }

    private void requireSeatOfLicense(long licenseId, long seatId) {
        boolean matches = assignmentWorkflow.licenseOfSeat(seatId)
                .map(owner -> owner == licenseId)
                .orElse(false);
        if (!matches) {
            throw BusinessErrors.toProblem(new EntityNotFoundError("LicenseSeat", seatId));
        }
    }
}
