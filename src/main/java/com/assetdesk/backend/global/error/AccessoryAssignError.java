package com.assetdesk.backend.global.error;

public sealed interface AccessoryAssignError extends BusinessError
        permits ValidationError, EntityNotFoundError, NoAvailableQuantityError {
}
