package com.assetdesk.backend.modules.license.presentation.dto;

public record LicenseCopyRequest(String serial) {
}
