package com.assetdesk.backend.modules.license.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

public record LicenseResponse(
        Long id,
        String name,
        String serial,
        int seats,
        int availableSeats,
        boolean reassignable,
        String licensedToName,
        String licensedToEmail,
        Long categoryId,
        Long manufacturerId,
        Long supplierId,
        Long companyId,
        String orderNumber,
        BigDecimal purchaseCost,
        LocalDate purchaseDate,
        LocalDate expirationDate,
        String notes,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        Long modifiedBy,
        List<LicenseSeatResponse> seatDetails
) {
}
