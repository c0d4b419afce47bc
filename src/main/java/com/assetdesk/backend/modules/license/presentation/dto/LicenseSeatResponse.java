package com.assetdesk.backend.modules.license.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.assetdesk.backend.modules.assignment.domain.AssignmentTargetKind;

public record LicenseSeatResponse(
        Long id,
        String label,
        SeatState state,
        AssignmentTargetKind assignedKind,
        Long assignedToUser,
        Long assetId,
        String assigneeLabel,
        Long custodianUserId,
        String locationLabel,
        OffsetDateTime assignedAt,
        LocalDate expectedCheckin
) {

    public enum SeatState {
        AVAILABLE,
        ASSIGNED
    }
}
