package com.assetdesk.backend.global.error;

public record AlreadyUnassignedError(String entityType, long entityId) implements ReleaseError {

    @Override
    public String code() {
        return "ALREADY_UNASSIGNED";
    }

    @Override
    public String detail() {
        return "%s %d is not assigned".formatted(entityType, entityId);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
