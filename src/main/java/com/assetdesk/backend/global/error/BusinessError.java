package com.assetdesk.backend.global.error;

/**
 * Business-rule violation detected before any write. Every variant carries the structured
 * data (ids, counts) a caller needs to render an actionable message.
 */
public sealed interface BusinessError
        permits AssignError, ReleaseError, SeatReconcileError, LicenseDeleteError, AssetSaveError,
        AccessorySaveError, AccessoryAssignError, AccessoryDeleteError {

    String code();

    String detail();

    ErrorCategory category();
}
