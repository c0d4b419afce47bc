package com.assetdesk.backend.global.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Audit columns are stamped by {@link com.assetdesk.backend.global.jpa.AuditLedger}, not by Spring Data auditing.
 */
@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(basePackages = "com.assetdesk.backend.modules")
public class JpaConfig {
}
