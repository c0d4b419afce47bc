package com.assetdesk.backend.global.error;

/**
 * Every unit of the accessory is already assigned.
 */
public record NoAvailableQuantityError(long accessoryId, int quantity, int assigned) implements AccessoryAssignError {

    @Override
    public String code() {
        return "NO_AVAILABLE_QUANTITY";
    }

    @Override
    public String detail() {
        return "Accessory %d has no unit left (%d of %d assigned)".formatted(accessoryId, assigned, quantity);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
