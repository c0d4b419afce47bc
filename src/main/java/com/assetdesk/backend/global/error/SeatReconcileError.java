package com.assetdesk.backend.global.error;

public sealed interface SeatReconcileError extends BusinessError
        permits ValidationError, EntityNotFoundError, InsufficientAvailableSeatsError {
}
