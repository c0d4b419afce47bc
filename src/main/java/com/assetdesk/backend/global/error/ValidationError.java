package com.assetdesk.backend.global.error;

/**
 * Caller-supplied input is malformed, e.g. a missing target id.
 */
public record ValidationError(String field, String message)
        implements AssignError, ReleaseError, SeatReconcileError, AssetSaveError, AccessorySaveError, AccessoryAssignError {

    @Override
    public String code() {
        return "VALIDATION_FAILED";
    }

    @Override
    public String detail() {
        return field + ": " + message;
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.VALIDATION;
    }
}
