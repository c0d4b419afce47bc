package com.assetdesk.backend.modules.accessory.infrastructure.persistence;

import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.assetdesk.backend.modules.accessory.domain.Accessory;

public interface AccessoryRepository extends JpaRepository<Accessory, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Accessory a where a.id = :id")
    Optional<Accessory> findByIdForUpdate(@Param("id") Long id);
}
