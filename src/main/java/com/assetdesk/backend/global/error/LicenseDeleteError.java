package com.assetdesk.backend.global.error;

public sealed interface LicenseDeleteError extends BusinessError
        permits EntityNotFoundError, LicenseHasAssignedSeatsError {
}
