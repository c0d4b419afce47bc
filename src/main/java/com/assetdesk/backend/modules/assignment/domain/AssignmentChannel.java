package com.assetdesk.backend.modules.assignment.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * What is being assigned. Each channel accepts a different set of target kinds.
 */
public enum AssignmentChannel {
    ASSET(EnumSet.allOf(AssignmentTargetKind.class)),
    SEAT(EnumSet.of(AssignmentTargetKind.USER, AssignmentTargetKind.ASSET));

    private final Set<AssignmentTargetKind> allowedKinds;

    AssignmentChannel(Set<AssignmentTargetKind> allowedKinds) {
        this.allowedKinds = allowedKinds;
    }

    public Set<TargetField> fields() {
        EnumSet<TargetField> fields = EnumSet.noneOf(TargetField.class);
        allowedKinds.forEach(kind -> fields.add(TargetField.forKind(kind)));
        return fields;
    }

    public boolean accepts(AssignmentTargetKind kind) {
        return kind != null && allowedKinds.contains(kind);
    }
}
