package com.assetdesk.backend.global.error;

public record NotReassignableError(long licenseId, long seatId) implements ReleaseError {

    @Override
    public String code() {
        return "LICENSE_NOT_REASSIGNABLE";
    }

    @Override
    public String detail() {
        return "License %d does not allow releasing seat %d".formatted(licenseId, seatId);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
