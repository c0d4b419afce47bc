package com.assetdesk.backend.global.error;

public sealed interface AccessoryDeleteError extends BusinessError
        permits EntityNotFoundError, AccessoryHasAssignmentsError {
}
