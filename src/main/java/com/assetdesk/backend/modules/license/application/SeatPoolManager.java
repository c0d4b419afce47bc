package com.assetdesk.backend.modules.license.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.assetdesk.backend.global.error.EntityNotFoundError;
import com.assetdesk.backend.global.error.InsufficientAvailableSeatsError;
import com.assetdesk.backend.global.error.SeatReconcileError;
import com.assetdesk.backend.global.error.ValidationError;
import com.assetdesk.backend.global.jpa.AuditLedger;
import com.assetdesk.backend.global.result.Result;
import com.assetdesk.backend.global.result.TransactionOutcomes;
import com.assetdesk.backend.modules.audit.application.AuditLogService;
import com.assetdesk.backend.modules.license.domain.License;
import com.assetdesk.backend.modules.license.domain.LicenseSeat;
import com.assetdesk.backend.modules.license.infrastructure.persistence.LicenseRepository;
import com.assetdesk.backend.modules.license.infrastructure.persistence.LicenseSeatRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps the active seat rows of a license in line with its declared seat count.
 * Joins the caller's transaction so a rejected reduction rolls back the license save too.
 */
@Service
@Transactional
public class SeatPoolManager {

    private static final Logger log = LoggerFactory.getLogger(SeatPoolManager.class);

    private final LicenseRepository licenseRepository;
    private final LicenseSeatRepository licenseSeatRepository;
    private final AuditLedger auditLedger;
    private final AuditLogService auditLogService;

    public SeatPoolManager(
            LicenseRepository licenseRepository,
            LicenseSeatRepository licenseSeatRepository,
            AuditLedger auditLedger,
            AuditLogService auditLogService
    ) {
        this.licenseRepository = licenseRepository;
        this.licenseSeatRepository = licenseSeatRepository;
        this.auditLedger = auditLedger;
        this.auditLogService = auditLogService;
    }

    public Result<Void, SeatReconcileError> reconcile(long licenseId, int previousSeatCount, int newSeatCount, long actorId) {
        return TransactionOutcomes.rollbackOnError(doReconcile(licenseId, previousSeatCount, newSeatCount, actorId));
    }

    private Result<Void, SeatReconcileError> doReconcile(long licenseId, int previousSeatCount, int newSeatCount, long actorId) {
        if (previousSeatCount < 0) {
            return Result.err(new ValidationError("previousSeatCount", "must not be negative"));
        }
        if (newSeatCount < 0) {
            return Result.err(new ValidationError("seats", "must not be negative"));
        }
        License license = licenseRepository.findByIdForUpdate(licenseId).orElse(null);
        if (license == null) {
            return Result.err(new EntityNotFoundError("License", licenseId));
        }

        int delta = newSeatCount - previousSeatCount;
        if (delta > 0) {
            addSeats(license, delta, actorId);
        } else if (delta < 0) {
            int required = -delta;
            int available = (int) licenseSeatRepository.countAvailable(licenseId);
            if (available < required) {
                log.info("Rejected seat reduction of license {} from {} to {}: {} free seats, {} required",
                        licenseId, previousSeatCount, newSeatCount, available, required);
                return Result.err(new InsufficientAvailableSeatsError(
                        licenseId, required, available, previousSeatCount - available));
            }
            int retired = retireSeats(license, required, actorId);
            if (retired < required) {
                log.info("Rejected seat reduction of license {} from {} to {}: only {} free seats could be locked",
                        licenseId, previousSeatCount, newSeatCount, retired);
                return Result.err(new InsufficientAvailableSeatsError(
                        licenseId, required, retired, previousSeatCount - retired));
            }
        } else {
            return Result.success();
        }

        auditLogService.record("SEATS_RECONCILED", AuditLogService.RESOURCE_LICENSE, licenseId, actorId,
                Map.of("previousSeats", previousSeatCount, "seats", newSeatCount));
        log.info("Reconciled seat pool of license {} from {} to {} seats (actor={})",
                licenseId, previousSeatCount, newSeatCount, actorId);
        return Result.success();
    }

    @Transactional(readOnly = true)
    public int assignedSeats(long licenseId) {
        return (int) (licenseSeatRepository.countActive(licenseId) - licenseSeatRepository.countAvailable(licenseId));
    }

    /**
     * Soft-deletes every active seat of the license. Callers check that none is assigned.
     */
    void retireAll(License license, long actorId) {
        List<LicenseSeat> seats = licenseSeatRepository.findByLicenseIdOrderByIdAsc(license.getId());
        seats.forEach(seat -> auditLedger.deleted(seat, actorId));
        licenseSeatRepository.saveAll(seats);
    }

    private void addSeats(License license, int count, long actorId) {
        List<LicenseSeat> created = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            created.add(auditLedger.created(new LicenseSeat(license), actorId));
        }
        licenseSeatRepository.saveAll(created);
    }

    /**
     * Locks up to {@code count} free seats, highest id first, and soft-deletes them only when
     * all of them could be locked. Returns the number of free seats found.
     */
    private int retireSeats(License license, int count, long actorId) {
        List<LicenseSeat> retired = licenseSeatRepository.findAvailableForRetirement(license.getId(), PageRequest.of(0, count));
        if (retired.size() < count) {
            return retired.size();
        }
        retired.forEach(seat -> auditLedger.deleted(seat, actorId));
        licenseSeatRepository.saveAll(retired);
        return retired.size();
    }
}
