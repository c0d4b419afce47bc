package com.assetdesk.backend.global.error;

public record AccessoryHasAssignmentsError(long accessoryId, int assignedUnits) implements AccessoryDeleteError {

    @Override
    public String code() {
        return "ACCESSORY_HAS_ASSIGNMENTS";
    }

    @Override
    public String detail() {
        return "Accessory %d still has %d units assigned".formatted(accessoryId, assignedUnits);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
