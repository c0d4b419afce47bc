package com.assetdesk.backend.modules.directory.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import com.assetdesk.backend.modules.directory.domain.AppUser;

public interface AppUserRepository extends JpaRepository<AppUser, Long> {
}
