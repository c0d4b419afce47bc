package com.assetdesk.backend.global.error;

/**
 * Coarse grouping of business errors used to pick a response status.
 */
public enum ErrorCategory {
    VALIDATION,
    NOT_FOUND,
    CONFLICT
}
