package com.assetdesk.backend.global.error;

/**
 * The asset cannot be deleted while it is checked out, holds license seats or has other
 * assets checked out to it.
 */
public record AssetInUseError(long assetId, boolean checkedOut, int attachedSeats, int heldAssets)
        implements AssetSaveError {

    @Override
    public String code() {
        return "ASSET_IN_USE";
    }

    @Override
    public String detail() {
        return "Asset %d is still in use (checked out: %s, license seats: %d, assets checked out to it: %d)"
                .formatted(assetId, checkedOut, attachedSeats, heldAssets);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
