package com.assetdesk.backend.modules.license.application;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.assetdesk.backend.global.error.EntityNotFoundError;
import com.assetdesk.backend.global.error.LicenseDeleteError;
import com.assetdesk.backend.global.error.LicenseHasAssignedSeatsError;
import com.assetdesk.backend.global.error.SeatReconcileError;
import com.assetdesk.backend.global.error.ValidationError;
import com.assetdesk.backend.global.jpa.AuditLedger;
import com.assetdesk.backend.global.result.Result;
import com.assetdesk.backend.global.result.TransactionOutcomes;
import com.assetdesk.backend.modules.asset.domain.Asset;
import com.assetdesk.backend.modules.asset.infrastructure.persistence.AssetRepository;
import com.assetdesk.backend.modules.assignment.application.TargetResolver;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTarget;
import com.assetdesk.backend.modules.audit.application.AuditLogService;
import com.assetdesk.backend.modules.license.domain.License;
import com.assetdesk.backend.modules.license.domain.LicenseSeat;
import com.assetdesk.backend.modules.license.infrastructure.persistence.LicenseRepository;
import com.assetdesk.backend.modules.license.infrastructure.persistence.LicenseSeatRepository;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseCopyRequest;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseRequest;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseResponse;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseSeatResponse;
import com.assetdesk.backend.modules.license.presentation.dto.LicenseSeatResponse.SeatState;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class LicenseService {

    private static final Logger log = LoggerFactory.getLogger(LicenseService.class);

    private final LicenseRepository licenseRepository;
    private final LicenseSeatRepository licenseSeatRepository;
    private final AssetRepository assetRepository;
    private final SeatPoolManager seatPoolManager;
    private final TargetResolver targetResolver;
    private final AuditLedger auditLedger;
    private final AuditLogService auditLogService;

    public LicenseService(
            LicenseRepository licenseRepository,
            LicenseSeatRepository licenseSeatRepository,
            AssetRepository assetRepository,
            SeatPoolManager seatPoolManager,
            TargetResolver targetResolver,
            AuditLedger auditLedger,
            AuditLogService auditLogService
    ) {
        this.licenseRepository = licenseRepository;
        this.licenseSeatRepository = licenseSeatRepository;
        this.assetRepository = assetRepository;
        this.seatPoolManager = seatPoolManager;
        this.targetResolver = targetResolver;
        this.auditLedger = auditLedger;
        this.auditLogService = auditLogService;
    }

    public Result<LicenseResponse, SeatReconcileError> create(LicenseRequest request, long actorId) {
        Optional<ValidationError> invalid = validate(request);
        if (invalid.isPresent()) {
            return Result.err(invalid.get());
        }
        License license = new License();
        apply(license, request);
        auditLedger.created(license, actorId);
        License saved = licenseRepository.save(license);
        auditLogService.record("LICENSE_CREATED", AuditLogService.RESOURCE_LICENSE, saved.getId(), actorId,
                Map.of("seats", saved.getSeats()));

        Result<Void, SeatReconcileError> pool = seatPoolManager.reconcile(saved.getId(), 0, saved.getSeats(), actorId);
        log.info("License {} created with {} seats (actor={})", saved.getId(), saved.getSeats(), actorId);
        return TransactionOutcomes.rollbackOnError(pool.map(ignored -> toResponse(saved)));
    }

    /**
     * Creates a license with the fields and seat count of an existing one. The serial comes from
     * the request and the copy starts with a fresh, fully free seat pool.
     */
    public Result<LicenseResponse, SeatReconcileError> copy(long sourceId, LicenseCopyRequest request, long actorId) {
        License source = licenseRepository.findById(sourceId).orElse(null);
        if (source == null) {
            return Result.err(new EntityNotFoundError("License", sourceId));
        }
        LicenseRequest copy = new LicenseRequest(
                source.getName(),
                request == null ? null : request.serial(),
                source.getSeats(),
                source.isReassignable(),
                source.getLicensedToName(),
                source.getLicensedToEmail(),
                source.getCategoryId(),
                source.getManufacturerId(),
                source.getSupplierId(),
                source.getCompanyId(),
                source.getOrderNumber(),
                source.getPurchaseCost(),
                source.getPurchaseDate(),
                source.getExpirationDate(),
                source.getNotes());
        log.info("Copying license {} (actor={})", sourceId, actorId);
        return create(copy, actorId);
    }

    /**
     * Saves the license fields and resizes the seat pool in the same transaction.
     * A rejected resize rolls back the field changes as well.
     */
    public Result<LicenseResponse, SeatReconcileError> update(long licenseId, LicenseRequest request, long actorId) {
        Optional<ValidationError> invalid = validate(request);
        if (invalid.isPresent()) {
            return Result.err(invalid.get());
        }
        License license = licenseRepository.findByIdForUpdate(licenseId).orElse(null);
        if (license == null) {
            return Result.err(new EntityNotFoundError("License", licenseId));
        }

        int previousSeats = (int) licenseSeatRepository.countActive(licenseId);
        apply(license, request);
        auditLedger.modified(license, actorId);
        licenseRepository.save(license);

        Result<Void, SeatReconcileError> pool = seatPoolManager.reconcile(licenseId, previousSeats, request.seats(), actorId);
        if (pool.isErr()) {
            return TransactionOutcomes.rollbackOnError(Result.err(pool.getError()));
        }
        auditLogService.record("LICENSE_UPDATED", AuditLogService.RESOURCE_LICENSE, licenseId, actorId,
                Map.of("seats", license.getSeats(), "reassignable", license.isReassignable()));
        return Result.ok(toResponse(license));
    }

    /**
     * Soft-deletes the license and its seat pool. Refused while any seat is assigned.
     */
    public Result<Void, LicenseDeleteError> delete(long licenseId, long actorId) {
        License license = licenseRepository.findByIdForUpdate(licenseId).orElse(null);
        if (license == null) {
            return Result.err(new EntityNotFoundError("License", licenseId));
        }
        int assigned = seatPoolManager.assignedSeats(licenseId);
        if (assigned > 0) {
            return Result.err(new LicenseHasAssignedSeatsError(licenseId, assigned));
        }
        seatPoolManager.retireAll(license, actorId);
        auditLedger.deleted(license, actorId);
        licenseRepository.save(license);
        auditLogService.record("LICENSE_DELETED", AuditLogService.RESOURCE_LICENSE, licenseId, actorId, Map.of());
        log.info("License {} soft-deleted (actor={})", licenseId, actorId);
        return Result.success();
    }

    @Transactional(readOnly = true)
    public Optional<LicenseResponse> getLicense(long licenseId) {
        return licenseRepository.findById(licenseId).map(this::toResponse);
    }

    private Optional<ValidationError> validate(LicenseRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            return Optional.of(new ValidationError("name", "is required"));
        }
        if (request.seats() == null || request.seats() < 0) {
            return Optional.of(new ValidationError("seats", "must be zero or more"));
        }
        if (request.purchaseDate() != null && request.expirationDate() != null
                && request.expirationDate().isBefore(request.purchaseDate())) {
            return Optional.of(new ValidationError("expirationDate", "must not be before purchaseDate"));
        }
        return Optional.empty();
    }

    private void apply(License license, LicenseRequest request) {
        license.setName(request.name().trim());
        license.setSerial(request.serial());
        license.setSeats(request.seats());
        license.setReassignable(!Boolean.FALSE.equals(request.reassignable()));
        license.setLicensedToName(request.licensedToName());
        license.setLicensedToEmail(request.licensedToEmail());
        license.setCategoryId(request.categoryId());
        license.setManufacturerId(request.manufacturerId());
        license.setSupplierId(request.supplierId());
        license.setCompanyId(request.companyId());
        license.setOrderNumber(request.orderNumber());
        license.setPurchaseCost(request.purchaseCost());
        license.setPurchaseDate(request.purchaseDate());
        license.setExpirationDate(request.expirationDate());
        license.setNotes(request.notes());
    }

    private LicenseResponse toResponse(License license) {
        List<LicenseSeat> seats = licenseSeatRepository.findByLicenseIdOrderByIdAsc(license.getId());
        List<LicenseSeatResponse> seatDetails = new ArrayList<>(seats.size());
        int available = 0;
        for (int i = 0; i < seats.size(); i++) {
            LicenseSeat seat = seats.get(i);
            if (seat.isAvailable()) {
                available++;
            }
            seatDetails.add(toSeatResponse(seat, i + 1));
        }
        return new LicenseResponse(
                license.getId(),
                license.getName(),
                license.getSerial(),
                license.getSeats(),
                available,
                license.isReassignable(),
                license.getLicensedToName(),
                license.getLicensedToEmail(),
                license.getCategoryId(),
                license.getManufacturerId(),
                license.getSupplierId(),
                license.getCompanyId(),
                license.getOrderNumber(),
                license.getPurchaseCost(),
                license.getPurchaseDate(),
                license.getExpirationDate(),
                license.getNotes(),
                license.getCreatedAt(),
                license.getUpdatedAt(),
                license.getModifiedBy(),
                seatDetails
        );
    }

    private LicenseSeatResponse toSeatResponse(LicenseSeat seat, int position) {
        AssignmentTarget target = seat.getAssignment();
        String locationLabel = Optional.ofNullable(seat.getAssetId())
                .flatMap(assetRepository::findById)
                .map(Asset::getLocationId)
                .flatMap(locationId -> targetResolver.describe(AssignmentTarget.location(locationId)))
                .orElse(null);
        return new LicenseSeatResponse(
                seat.getId(),
                "Seat " + position,
                seat.isAvailable() ? SeatState.AVAILABLE : SeatState.ASSIGNED,
                target.kind().orElse(null),
                seat.getAssignedToUser(),
                seat.getAssetId(),
                targetResolver.describe(target).orElse(null),
                seat.getCustodianUserId().orElse(null),
                locationLabel,
                seat.getAssignedAt(),
                seat.getExpectedCheckin()
        );
    }
}
