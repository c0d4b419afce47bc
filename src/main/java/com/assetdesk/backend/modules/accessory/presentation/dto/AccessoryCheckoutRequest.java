package com.assetdesk.backend.modules.accessory.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

public record AccessoryCheckoutRequest(
        @NotNull(message = "userId is required")
        @Positive(message = "userId must be positive")
        Long userId,
        @Size(max = 2000)
        String note
) {
}
