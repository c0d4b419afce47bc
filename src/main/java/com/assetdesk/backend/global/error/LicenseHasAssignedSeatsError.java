package com.assetdesk.backend.global.error;

public record LicenseHasAssignedSeatsError(long licenseId, int assignedSeats) implements LicenseDeleteError {

    @Override
    public String code() {
        return "LICENSE_HAS_ASSIGNED_SEATS";
    }

    @Override
    public String detail() {
        return "License %d still has %d assigned seats".formatted(licenseId, assignedSeats);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
