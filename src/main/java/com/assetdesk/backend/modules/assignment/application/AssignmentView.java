package com.assetdesk.backend.modules.assignment.application;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.assetdesk.backend.modules.assignment.domain.AssignmentTargetKind;

/**
 * Assignment state of an asset or seat right after an assign or release.
 * All target fields are null once released.
 */
public record AssignmentView(
        String entityType,
        long entityId,
        AssignmentTargetKind targetKind,
        Long targetId,
        String targetLabel,
        OffsetDateTime assignedAt,
        LocalDate expectedCheckin,
        Long custodianUserId,
        Long locationId
) {
}
