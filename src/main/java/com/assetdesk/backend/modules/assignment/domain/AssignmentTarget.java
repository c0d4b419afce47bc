package com.assetdesk.backend.modules.assignment.domain;

import java.util.Optional;

/**
 * Who or what an asset or license seat is assigned to.
 * Callers branch on {@link #kind()} with an exhaustive switch; {@link Unassigned} has no kind.
 */
public sealed interface AssignmentTarget
        permits AssignmentTarget.ToUser, AssignmentTarget.ToLocation, AssignmentTarget.ToAsset, AssignmentTarget.Unassigned {

    Unassigned UNASSIGNED = new Unassigned();

    static AssignmentTarget user(long userId) {
        return new ToUser(userId);
    }

    static AssignmentTarget location(long locationId) {
        return new ToLocation(locationId);
    }

    static AssignmentTarget asset(long assetId) {
        return new ToAsset(assetId);
    }

    static AssignmentTarget unassigned() {
        return UNASSIGNED;
    }

    /**
     * Rebuilds a target from its persisted discriminant and id.
     *
     * @throws IllegalArgumentException when only one of the two columns is set
     */
    static AssignmentTarget of(AssignmentTargetKind kind, Long id) {
        if (kind == null) {
            if (id != null) {
                throw new IllegalArgumentException("Target id %d has no target kind".formatted(id));
            }
            return UNASSIGNED;
        }
        if (id == null) {
            throw new IllegalArgumentException("Target kind %s requires an id".formatted(kind));
        }
        return switch (kind) {
            case USER -> new ToUser(id);
            case LOCATION -> new ToLocation(id);
            case ASSET -> new ToAsset(id);
        };
    }

    /**
     * @return the discriminant, empty for {@link Unassigned}
     */
    Optional<AssignmentTargetKind> kind();

    /**
     * @return the referenced id, empty for {@link Unassigned}
     */
    Optional<Long> id();

    default boolean isAssigned() {
        return kind().isPresent();
    }

    record ToUser(long userId) implements AssignmentTarget {

        @Override
        public Optional<AssignmentTargetKind> kind() {
            return Optional.of(AssignmentTargetKind.USER);
        }

        @Override
        public Optional<Long> id() {
            return Optional.of(userId);
        }
    }

    record ToLocation(long locationId) implements AssignmentTarget {

        @Override
        public Optional<AssignmentTargetKind> kind() {
            return Optional.of(AssignmentTargetKind.LOCATION);
        }

        @Override
        public Optional<Long> id() {
            return Optional.of(locationId);
        }
    }

    record ToAsset(long assetId) implements AssignmentTarget {

        @Override
        public Optional<AssignmentTargetKind> kind() {
            return Optional.of(AssignmentTargetKind.ASSET);
        }

        @Override
        public Optional<Long> id() {
            return Optional.of(assetId);
        }
    }

    record Unassigned() implements AssignmentTarget {

        @Override
        public Optional<AssignmentTargetKind> kind() {
            return Optional.empty();
        }

        @Override
        public Optional<Long> id() {
            return Optional.empty();
        }
    }
}
