package com.assetdesk.backend.modules.audit.infrastructure;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;

import com.assetdesk.backend.modules.audit.domain.AuditLog;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    List<AuditLog> findByResourceTypeAndResourceKeyOrderByIdAsc(String resourceType, String resourceKey);
}
