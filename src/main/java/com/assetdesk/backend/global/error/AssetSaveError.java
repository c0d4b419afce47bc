package com.assetdesk.backend.global.error;

public sealed interface AssetSaveError extends BusinessError
        permits ValidationError, EntityNotFoundError, DuplicateAssetTagError, AssetInUseError {
}
