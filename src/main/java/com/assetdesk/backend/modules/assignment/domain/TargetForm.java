package com.assetdesk.backend.modules.assignment.domain;

/**
 * Snapshot of an assignment form: the selected kind plus whatever the three target fields hold.
 * Stale values in inactive fields are ignored when the form is turned into a target.
 */
public record TargetForm(AssignmentTargetKind kind, Long userId, Long locationId, Long assetId) {
}
