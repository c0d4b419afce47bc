package com.assetdesk.backend.global.error;

/**
 * @param requested quantity asked for by the save
 * @param assigned units currently held by users
 */
public record QuantityBelowAssignedError(long accessoryId, int requested, int assigned) implements AccessorySaveError {

    @Override
    public String code() {
        return "QUANTITY_BELOW_ASSIGNED";
    }

    @Override
    public String detail() {
        return "Accessory %d cannot drop to %d units while %d are assigned".formatted(accessoryId, requested, assigned);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
