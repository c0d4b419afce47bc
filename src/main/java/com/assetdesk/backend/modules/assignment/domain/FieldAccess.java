package com.assetdesk.backend.modules.assignment.domain;

import java.util.Set;

/**
 * Derived access state of the target fields for one assignment kind.
 *
 * @param enabled fields the caller may edit
 * @param required fields that must hold a value before submitting
 * @param cleared fields whose value must be discarded
 */
public record FieldAccess(Set<TargetField> enabled, Set<TargetField> required, Set<TargetField> cleared) {

    public FieldAccess {
        enabled = Set.copyOf(enabled);
        required = Set.copyOf(required);
        cleared = Set.copyOf(cleared);
    }

    public boolean isEnabled(TargetField field) {
        return enabled.contains(field);
    }

    public boolean isRequired(TargetField field) {
        return required.contains(field);
    }
}
