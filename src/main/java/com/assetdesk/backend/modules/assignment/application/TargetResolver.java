package com.assetdesk.backend.modules.assignment.application;

import java.util.Optional;

import com.assetdesk.backend.modules.assignment.domain.AssetLookup;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTarget;
import com.assetdesk.backend.modules.assignment.domain.LocationLookup;
import com.assetdesk.backend.modules.assignment.domain.UserLookup;

import org.springframework.stereotype.Component;

/**
 * Turns an assignment target into the label shown next to it. A target whose row is gone or
 * soft-deleted resolves to empty and is rendered blank.
 */
@Component
public class TargetResolver {

    private final UserLookup userLookup;
    private final LocationLookup locationLookup;
    private final AssetLookup assetLookup;

    public TargetResolver(UserLookup userLookup, LocationLookup locationLookup, AssetLookup assetLookup) {
        this.userLookup = userLookup;
        this.locationLookup = locationLookup;
        this.assetLookup = assetLookup;
    }

    public Optional<String> describe(AssignmentTarget target) {
        if (target == null || !target.isAssigned()) {
            return Optional.empty();
        }
        long id = target.id().orElseThrow();
        return switch (target.kind().orElseThrow()) {
            case USER -> userLookup.nameOf(id);
            case LOCATION -> locationLookup.nameOf(id);
            case ASSET -> assetLookup.describe(id);
        };
    }

    public boolean exists(AssignmentTarget target) {
        return describe(target).isPresent();
    }
}
