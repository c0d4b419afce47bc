package com.assetdesk.backend.modules.license.presentation.dto;

import java.math.BigDecimal;
import java.time.LocalDate;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record LicenseRequest(
        @NotBlank(message = "name is required")
        @Size(max = 120, message = "name must be at most 120 characters")
        String name,
        String serial,
        @NotNull(message = "seats is required")
        @Min(value = 0, message = "seats must not be negative")
        Integer seats,
        @NotNull(message = "reassignable is required")
        Boolean reassignable,
        @Size(max = 120)
        String licensedToName,
        @Email(message = "licensedToEmail must be an email address")
        String licensedToEmail,
        Long categoryId,
        Long manufacturerId,
        Long supplierId,
        Long companyId,
        @Size(max = 50)
        String orderNumber,
        @DecimalMin(value = "0.00", message = "purchaseCost must not be negative")
        BigDecimal purchaseCost,
        LocalDate purchaseDate,
        LocalDate expirationDate,
        String notes
) {
}
