package com.assetdesk.backend.modules.audit.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.assetdesk.backend.global.jpa.AuditLedger;
import com.assetdesk.backend.modules.audit.domain.AuditLog;
import com.assetdesk.backend.modules.audit.infrastructure.AuditLogRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AuditLogService {

    public static final String RESOURCE_ASSET = "ASSET";
    public static final String RESOURCE_LICENSE = "LICENSE";
    public static final String RESOURCE_LICENSE_SEAT = "LICENSE_SEAT";
    public static final String RESOURCE_ACCESSORY = "ACCESSORY";

    private final AuditLogRepository auditLogRepository;
    private final AuditLedger auditLedger;

    public AuditLogService(AuditLogRepository auditLogRepository, AuditLedger auditLedger) {
        this.auditLogRepository = auditLogRepository;
        this.auditLedger = auditLedger;
    }

    /**
     * Appends an entry inside the caller's transaction so it rolls back with the mutation it describes.
     */
    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setActorUserId(command.actorUserId());
        auditLog.setCreatedAt(auditLedger.now());

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new LinkedHashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public void record(String actionType, String resourceType, Object resourceId, long actorUserId, Map<String, Object> detail) {
        record(new AuditLogCommand(actionType, resourceType, String.valueOf(resourceId), actorUserId, detail));
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            Long actorUserId,
            Map<String, Object> detail
    ) {
    }
}
