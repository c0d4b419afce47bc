package com.assetdesk.backend.modules.assignment.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.assetdesk.backend.modules.assignment.domain.AssignmentTargetKind;
import com.assetdesk.backend.modules.assignment.domain.TargetForm;

import jakarta.validation.constraints.NotNull;

/**
 * Checkout form. Only the id field matching {@code kind} is read.
 */
public record AssignmentRequest(
        @NotNull(message = "kind is required")
        AssignmentTargetKind kind,
        Long userId,
        Long locationId,
        Long assetId,
        OffsetDateTime assignedAt,
        LocalDate expectedCheckin
) {

    public TargetForm toForm() {
        return new TargetForm(kind, userId, locationId, assetId);
    }
}
