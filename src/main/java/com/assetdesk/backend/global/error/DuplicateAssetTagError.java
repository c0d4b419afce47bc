package com.assetdesk.backend.global.error;

public record DuplicateAssetTagError(String tag) implements AssetSaveError {

    @Override
    public String code() {
        return "DUPLICATE_ASSET_TAG";
    }

    @Override
    public String detail() {
        return "Asset tag %s is already in use".formatted(tag);
    }

    @Override
    public ErrorCategory category() {
        return ErrorCategory.CONFLICT;
    }
}
