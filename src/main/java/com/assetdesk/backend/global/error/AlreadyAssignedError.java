package com.assetdesk.backend.global.error;

/**
 * The asset or seat is already assigned; it has to be released first.
 *
 * @param currentKind discriminant of the existing assignment, e.g. {@code USER}
 * @param currentTargetId id the entity is currently assigned to
 */
public record AlreadyAssignedError(String entityType, long entityId, String currentKind, Long currentTargetId)
        implements AssignError {

    @Override
    public String code() {
        return "ALREADY_ASSIGNED";
    }

    @Override
    public String detail() {
        return "%s %d is already assigned to %s %d".formatted(entityType, entityId, currentKind, currentTargetId);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
