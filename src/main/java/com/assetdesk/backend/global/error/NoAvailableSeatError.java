package com.assetdesk.backend.global.error;

public record NoAvailableSeatError(long licenseId) implements AssignError {

    @Override
    public String code() {
        return "NO_AVAILABLE_SEAT";
    }

    @Override
    public String detail() {
        return "License %d has no free seat".formatted(licenseId);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
