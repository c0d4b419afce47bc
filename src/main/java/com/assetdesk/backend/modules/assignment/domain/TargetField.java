package com.assetdesk.backend.modules.assignment.domain;

/**
 * Form fields that can carry the assignee of an assignment.
 */
public enum TargetField {
    USER,
    LOCATION,
    ASSET;

    public static TargetField forKind(AssignmentTargetKind kind) {
        return switch (kind) {
            case USER -> USER;
            case LOCATION -> LOCATION;
            case ASSET -> ASSET;
        };
    }
}
