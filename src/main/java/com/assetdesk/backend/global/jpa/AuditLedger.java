package com.assetdesk.backend.global.jpa;

import java.time.Clock;
import java.time.OffsetDateTime;

import org.springframework.stereotype.Component;

/**
 * Stamps created/modified/soft-deleted timestamps and the acting user on every mutation.
 * All stamps of one call share the same instant taken from the UTC clock.
 */
@Component
public class AuditLedger {

    private final Clock clock;

    public AuditLedger(Clock clock) {
        this.clock = clock;
    }

    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    public <T extends AbstractAuditedEntity> T created(T entity, long actorId) {
        entity.stampCreated(actorId, now());
        return entity;
    }

    public <T extends AbstractAuditedEntity> T modified(T entity, long actorId) {
        entity.stampModified(actorId, now());
        return entity;
    }

    /**
     * Soft-deletes the row. Already deleted rows keep their original deletion time.
     */
    public <T extends AbstractAuditedEntity> T deleted(T entity, long actorId) {
        if (entity.isActive()) {
            entity.stampDeleted(actorId, now());
        }
        return entity;
    }
}
