package com.assetdesk.backend.global.error;

public sealed interface AccessorySaveError extends BusinessError
        permits ValidationError, EntityNotFoundError, QuantityBelowAssignedError {
}
