package com.assetdesk.backend.modules.license.infrastructure.persistence;

import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.assetdesk.backend.modules.license.domain.License;

public interface LicenseRepository extends JpaRepository<License, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select l from License l where l.id = :id")
    Optional<License> findByIdForUpdate(@Param("id") Long id);
}
