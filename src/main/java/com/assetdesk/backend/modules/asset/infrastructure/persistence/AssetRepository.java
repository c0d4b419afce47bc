package com.assetdesk.backend.modules.asset.infrastructure.persistence;

import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.assetdesk.backend.modules.asset.domain.Asset;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTargetKind;

public interface AssetRepository extends JpaRepository<Asset, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from Asset a where a.id = :id")
    Optional<Asset> findByIdForUpdate(@Param("id") Long id);

    boolean existsByTag(String tag);

    boolean existsByTagAndIdNot(String tag, Long id);

    long countByAssignedTypeAndAssignedTo(AssignmentTargetKind assignedType, Long assignedTo);
}
