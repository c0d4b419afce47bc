package com.assetdesk.backend.global.jpa;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.MappedSuperclass;

/**
 * Shared audit columns of every inventory table: creation/modification time, soft-delete
 * time and the id of the user who last touched the row ({@code user_id}).
 * Values are written only through {@link AuditLedger}.
 */
@MappedSuperclass
public abstract class AbstractAuditedEntity {

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Column(name = "deleted_at")
    private OffsetDateTime deletedAt;

    @Column(name = "user_id")
    private Long modifiedBy;

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public OffsetDateTime getDeletedAt() {
        return deletedAt;
    }

    public Long getModifiedBy() {
        return modifiedBy;
    }

    public boolean isActive() {
        return deletedAt == null;
    }

    void stampCreated(long actorId, OffsetDateTime now) {
        this.createdAt = now;
        this.updatedAt = now;
        this.modifiedBy = actorId;
    }

    void stampModified(long actorId, OffsetDateTime now) {
        if (createdAt == null) {
            createdAt = now;
        }
        this.updatedAt = now;
        this.modifiedBy = actorId;
    }

    void stampDeleted(long actorId, OffsetDateTime now) {
        stampModified(actorId, now);
        this.deletedAt = now;
    }
}
