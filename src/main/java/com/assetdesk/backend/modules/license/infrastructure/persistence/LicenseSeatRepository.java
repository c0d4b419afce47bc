package com.assetdesk.backend.modules.license.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import com.assetdesk.backend.modules.license.domain.LicenseSeat;

/**
 * Soft-deleted seats are filtered by the entity restriction, so every query here sees
 * active seats only.
 */
public interface LicenseSeatRepository extends JpaRepository<LicenseSeat, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from LicenseSeat s join fetch s.license where s.id = :id")
    Optional<LicenseSeat> findByIdForUpdate(@Param("id") Long id);

    @Query("""
            select count(s)
              from LicenseSeat s
             where s.license.id = :licenseId
            """)
    long countActive(@Param("licenseId") Long licenseId);

    @Query("""
            select count(s)
              from LicenseSeat s
             where s.license.id = :licenseId
               and s.assignedToUser is null
               and s.assetId is null
            """)
    long countAvailable(@Param("licenseId") Long licenseId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select s
              from LicenseSeat s
             where s.license.id = :licenseId
               and s.assignedToUser is null
               and s.assetId is null
             order by s.id desc
            """)
    List<LicenseSeat> findAvailableForRetirement(@Param("licenseId") Long licenseId, Pageable pageable);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select s
              from LicenseSeat s
             where s.license.id = :licenseId
               and s.assignedToUser is null
               and s.assetId is null
             order by s.id asc
            """)
    List<LicenseSeat> findAvailableForAssignment(@Param("licenseId") Long licenseId, Pageable pageable);

    @Query("select s.license.id from LicenseSeat s where s.id = :seatId")
    Optional<Long> findLicenseIdBySeatId(@Param("seatId") Long seatId);

    List<LicenseSeat> findByLicenseIdOrderByIdAsc(Long licenseId);

    List<LicenseSeat> findByAssetIdOrderByIdAsc(Long assetId);

    long countByAssetId(Long assetId);
}
