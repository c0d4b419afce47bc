package com.assetdesk.backend.modules.accessory.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record AccessoryRequest(
        @NotBlank(message = "name is required")
        @Size(max = 100, message = "name must be at most 100 characters")
        String name,
        @NotNull(message = "categoryId is required")
        Long categoryId,
        Long companyId,
        Long supplierId,
        Long manufacturerId,
        @Positive(message = "locationId must be positive")
        Long locationId,
        @Size(max = 100)
        String modelNumber,
        @Size(max = 100)
        String orderNumber,
        LocalDate purchaseDate,
        @DecimalMin(value = "0.00", message = "purchaseCost must not be negative")
        BigDecimal purchaseCost,
        @NotNull(message = "quantity is required")
        @Min(value = 0, message = "quantity must not be negative")
        Integer quantity,
        @Min(value = 0, message = "minQuantity must not be negative")
        Integer minQuantity
) {
}
