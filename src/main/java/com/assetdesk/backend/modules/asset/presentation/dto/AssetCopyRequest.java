package com.assetdesk.backend.modules.asset.presentation.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Identity of the copy. Every other descriptive field is taken from the source asset.
 */
public record AssetCopyRequest(
        @NotBlank(message = "tag is required")
        @Size(max = 63, message = "tag must be at most 63 characters")
        String tag,
        @Size(max = 120)
        String serial
) {
}
