package com.assetdesk.backend.modules.license.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Optional;

import com.assetdesk.backend.global.jpa.AbstractAuditedEntity;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTarget;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTargetKind;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.SQLRestriction;

/**
 * One slot of a license. At most one of {@code assigned_to_user} and {@code asset_id} is set.
 */
@Entity
@Table(name = "license_seats")
@SQLRestriction("deleted_at is null")
public class LicenseSeat extends AbstractAuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "license_id", nullable = false, updatable = false)
    private License license;

    @Column(name = "assigned_to_user")
    private Long assignedToUser;

    @Column(name = "asset_id")
    private Long assetId;

    @Column(name = "custodian_user_id")
    private Long custodianUserId;

    @Column(name = "assigned_at")
    private OffsetDateTime assignedAt;

    @Column(name = "expected_checkin")
    private LocalDate expectedCheckin;

    protected LicenseSeat() {
    }

    public LicenseSeat(License license) {
        this.license = license;
    }

    public Long getId() {
        return id;
    }

    public License getLicense() {
        return license;
    }

    public Long getAssignedToUser() {
        return assignedToUser;
    }

    public Long getAssetId() {
        return assetId;
    }

    public Optional<Long> getCustodianUserId() {
        return Optional.ofNullable(custodianUserId);
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }

    public LocalDate getExpectedCheckin() {
        return expectedCheckin;
    }

    public boolean isAvailable() {
        return isActive() && assignedToUser == null && assetId == null;
    }

    public AssignmentTarget getAssignment() {
        if (assignedToUser != null) {
            return AssignmentTarget.user(assignedToUser);
        }
        if (assetId != null) {
            return AssignmentTarget.asset(assetId);
        }
        return AssignmentTarget.unassigned();
    }

    public void assign(AssignmentTarget target, OffsetDateTime assignedAt, LocalDate expectedCheckin, Long custodianUserId) {
        if (!isAvailable()) {
            throw new IllegalStateException("Seat %d is not available".formatted(id));
        }
        AssignmentTargetKind kind = target.kind()
                .orElseThrow(() -> new IllegalArgumentException("Use release() to clear a seat"));
        long targetId = target.id().orElseThrow();
        switch (kind) {
            case USER -> this.assignedToUser = targetId;
            case ASSET -> {
                this.assetId = targetId;
                this.custodianUserId = custodianUserId;
            }
            case LOCATION -> throw new IllegalArgumentException("Seats cannot be assigned to a location");
        }
        this.assignedAt = assignedAt;
        this.expectedCheckin = expectedCheckin;
    }

    public void release() {
        if (assignedToUser == null && assetId == null) {
            throw new IllegalStateException("Seat %d is not assigned".formatted(id));
        }
        this.assignedToUser = null;
        this.assetId = null;
        this.custodianUserId = null;
        this.assignedAt = null;
        this.expectedCheckin = null;
    }
}
