package com.assetdesk.backend.modules.assignment.application;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import com.assetdesk.backend.global.error.ValidationError;
import com.assetdesk.backend.global.result.Result;
import com.assetdesk.backend.modules.assignment.domain.AssignmentChannel;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTarget;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTargetKind;
import com.assetdesk.backend.modules.assignment.domain.FieldAccess;
import com.assetdesk.backend.modules.assignment.domain.TargetField;
import com.assetdesk.backend.modules.assignment.domain.TargetForm;

import org.springframework.stereotype.Component;

/**
 * Derives which target field is active for the selected kind. Exactly one field is enabled
 * and required per valid kind; every other field of the channel is cleared.
 * Holds no state: callers re-derive on every kind change.
 */
@Component
public class TargetFieldController {

    public FieldAccess fieldsFor(AssignmentChannel channel, AssignmentTargetKind kind) {
        Set<TargetField> channelFields = channel.fields();
        if (!channel.accepts(kind)) {
            return new FieldAccess(Set.of(), Set.of(), channelFields);
        }
        TargetField active = TargetField.forKind(kind);
        Set<TargetField> cleared = EnumSet.noneOf(TargetField.class);
        cleared.addAll(channelFields);
        cleared.remove(active);
        return new FieldAccess(Set.of(active), Set.of(active), cleared);
    }

    /**
     * Builds the target from the single active field of the form.
     */
    public Result<AssignmentTarget, ValidationError> toTarget(AssignmentChannel channel, TargetForm form) {
        if (form == null || form.kind() == null) {
            return Result.err(new ValidationError("kind", "is required"));
        }
        if (!channel.accepts(form.kind())) {
            return Result.err(new ValidationError("kind",
                    "%s is not a valid target for a %s assignment".formatted(form.kind(), channel.name().toLowerCase(Locale.ROOT))));
        }
        TargetField active = TargetField.forKind(form.kind());
        Long value = switch (active) {
            case USER -> form.userId();
            case LOCATION -> form.locationId();
            case ASSET -> form.assetId();
        };
        String fieldName = active.name().toLowerCase(Locale.ROOT) + "Id";
        if (value == null) {
            return Result.err(new ValidationError(fieldName, "is required when assigning to " + form.kind()));
        }
        if (value <= 0) {
            return Result.err(new ValidationError(fieldName, "must be a positive id"));
        }
        return Result.ok(AssignmentTarget.of(form.kind(), value));
    }
}
