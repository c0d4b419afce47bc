package com.assetdesk.backend.global.error;

import java.util.Locale;

public record EntityNotFoundError(String entityType, long id)
        implements AssignError, ReleaseError, SeatReconcileError, LicenseDeleteError, AssetSaveError,
        AccessorySaveError, AccessoryAssignError, AccessoryDeleteError {

    @Override
    public String code() {
        return entityType.toUpperCase(Locale.ROOT) + "_NOT_FOUND";
    }

    @Override
    public String detail() {
        return "%s %d does not exist".formatted(entityType, id);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.NOT_FOUND;
    }
}
