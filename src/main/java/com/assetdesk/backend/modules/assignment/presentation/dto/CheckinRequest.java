package com.assetdesk.backend.modules.assignment.presentation.dto;

import jakarta.validation.constraints.Positive;

public record CheckinRequest(
        @Positive(message = "statusId must be positive")
        Long statusId,
        @Positive(message = "locationId must be positive")
        Long locationId
) {
}
