package com.assetdesk.backend.global.error;

/**
 * A seat-count reduction asked for more free seats than the pool has.
 *
 * @param required number of seats that would have to be retired
 * @param available free seats currently in the pool
 * @param currentlyAssigned seats held by users or assets
 */
public record InsufficientAvailableSeatsError(long licenseId, int required, int available, int currentlyAssigned)
        implements SeatReconcileError {

    @Override
    public String code() {
        return "INSUFFICIENT_AVAILABLE_SEATS";
    }

    @Override
    public String detail() {
        return "License %d needs %d free seats to shrink but only %d are free (%d assigned)"
                .formatted(licenseId, required, available, currentlyAssigned);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }

    public int shortfall() {
        return required - available;
    }
}
