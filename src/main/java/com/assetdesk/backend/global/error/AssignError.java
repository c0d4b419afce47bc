package com.assetdesk.backend.global.error;

public sealed interface AssignError extends BusinessError
        permits ValidationError, EntityNotFoundError, AlreadyAssignedError, NoAvailableSeatError {
}
