package com.assetdesk.backend.modules.assignment.domain;

/**
 * Discriminant stored in {@code assets.assigned_type}.
 */
public enum AssignmentTargetKind {
    USER,
    LOCATION,
    ASSET
}
