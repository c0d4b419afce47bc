package com.assetdesk.backend.global.error;

public sealed interface ReleaseError extends BusinessError
        permits ValidationError, EntityNotFoundError, AlreadyUnassignedError, NotReassignableError {
}
