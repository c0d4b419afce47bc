package com.assetdesk.backend.modules.asset.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

import com.assetdesk.backend.modules.assignment.domain.AssignmentTargetKind;

public record AssetResponse(
        Long id,
        String tag,
        String name,
        String serial,
        Long modelId,
        Long statusId,
        Long companyId,
        Long locationId,
        String locationLabel,
        AssignmentTargetKind assignedType,
        Long assignedTo,
        String assigneeLabel,
        Long custodianUserId,
        OffsetDateTime assignedAt,
        LocalDate expectedCheckin,
        int checkoutCounter,
        int checkinCounter,
        String orderNumber,
        LocalDate purchaseDate,
        BigDecimal purchaseCost,
        Long supplierId,
        String notes,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        Long modifiedBy,
        List<AttachedSeatResponse> licenseSeats
) {

    public record AttachedSeatResponse(Long seatId, Long licenseId, String licenseName, OffsetDateTime assignedAt) {
    }
}
