package com.assetdesk.backend.modules.accessory.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * @param availableQuantity units not held by any user
 * @param belowMinimum whether the free units dropped under {@code minQuantity}
 */
public record AccessoryResponse(
        Long id,
        String name,
        Long categoryId,
        Long companyId,
        Long supplierId,
        Long manufacturerId,
        Long locationId,
        String locationLabel,
        String modelNumber,
        String orderNumber,
        LocalDate purchaseDate,
        BigDecimal purchaseCost,
        int quantity,
        Integer minQuantity,
        int availableQuantity,
        boolean belowMinimum,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        Long modifiedBy,
        List<AssignedUnitResponse> assignments
) {

    public record AssignedUnitResponse(
            Long id,
            Long userId,
            String userLabel,
            String note,
            OffsetDateTime assignedAt
    ) {
    }
}
