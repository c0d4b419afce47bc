package com.assetdesk.backend.modules.asset.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record AssetRequest(
        @NotBlank(message = "tag is required")
        @Size(max = 63, message = "tag must be at most 63 characters")
        String tag,
        @Size(max = 120)
        String name,
        @Size(max = 120)
        String serial,
        Long modelId,
        Long statusId,
        Long companyId,
        @Positive(message = "locationId must be positive")
        Long locationId,
        @Size(max = 50)
        String orderNumber,
        LocalDate purchaseDate,
        @DecimalMin(value = "0.00", message = "purchaseCost must not be negative")
        BigDecimal purchaseCost,
        Long supplierId,
        String notes
) {
}
