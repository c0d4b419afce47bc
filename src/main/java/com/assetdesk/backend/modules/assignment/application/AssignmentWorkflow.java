package com.assetdesk.backend.modules.assignment.application;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.assetdesk.backend.global.error.AlreadyAssignedError;
import com.assetdesk.backend.global.error.AlreadyUnassignedError;
import com.assetdesk.backend.global.error.AssignError;
import com.assetdesk.backend.global.error.EntityNotFoundError;
import com.assetdesk.backend.global.error.NoAvailableSeatError;
import com.assetdesk.backend.global.error.NotReassignableError;
import com.assetdesk.backend.global.error.ReleaseError;
import com.assetdesk.backend.global.error.ValidationError;
import com.assetdesk.backend.global.jpa.AuditLedger;
import com.assetdesk.backend.global.result.Result;
import com.assetdesk.backend.global.result.TransactionOutcomes;
import com.assetdesk.backend.modules.asset.domain.Asset;
import com.assetdesk.backend.modules.asset.infrastructure.persistence.AssetRepository;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTarget;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTargetKind;
import com.assetdesk.backend.modules.assignment.domain.LocationLookup;
import com.assetdesk.backend.modules.assignment.domain.UserLookup;
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
 * Assigns and releases assets and license seats.
 *
 * <p>Every operation locks the rows it changes, re-checks its precondition on the locked
 * state and reports rule violations as {@link Result} errors before writing anything.
 * The assignment columns, the checkout/checkin counters and the audit stamps change
 * together or not at all.
 *
 * <p>Seat operations lock the owning license before the seat, the same order the license
 * save uses when it reconciles the seat pool.
 */
@Service
@Transactional
public class AssignmentWorkflow {

    private static final Logger log = LoggerFactory.getLogger(AssignmentWorkflow.class);

    static final String ENTITY_ASSET = "Asset";
    static final String ENTITY_SEAT = "LicenseSeat";

    private final AssetRepository assetRepository;
    private final LicenseRepository licenseRepository;
    private final LicenseSeatRepository licenseSeatRepository;
    private final UserLookup userLookup;
    private final LocationLookup locationLookup;
    private final TargetResolver targetResolver;
    private final AuditLedger auditLedger;
    private final AuditLogService auditLogService;

    public AssignmentWorkflow(
            AssetRepository assetRepository,
            LicenseRepository licenseRepository,
            LicenseSeatRepository licenseSeatRepository,
            UserLookup userLookup,
            LocationLookup locationLookup,
            TargetResolver targetResolver,
            AuditLedger auditLedger,
            AuditLogService auditLogService
    ) {
        this.assetRepository = assetRepository;
        this.licenseRepository = licenseRepository;
        this.licenseSeatRepository = licenseSeatRepository;
        this.userLookup = userLookup;
        this.locationLookup = locationLookup;
        this.targetResolver = targetResolver;
        this.auditLedger = auditLedger;
        this.auditLogService = auditLogService;
    }

    public Result<AssignmentView, AssignError> assignAsset(
            long assetId,
            AssignmentTarget target,
            OffsetDateTime assignedAt,
            LocalDate expectedCheckin,
            long actorId
    ) {
        return TransactionOutcomes.rollbackOnError(doAssignAsset(assetId, target, assignedAt, expectedCheckin, actorId));
    }

    public Result<AssignmentView, ReleaseError> releaseAsset(long assetId, long actorId, Long newStatusId, Long newLocationId) {
        return TransactionOutcomes.rollbackOnError(doReleaseAsset(assetId, actorId, newStatusId, newLocationId));
    }

    public Result<AssignmentView, AssignError> assignSeat(
            long seatId,
            AssignmentTarget target,
            OffsetDateTime assignedAt,
            LocalDate expectedCheckin,
            long actorId
    ) {
        return TransactionOutcomes.rollbackOnError(doAssignSeat(seatId, target, assignedAt, expectedCheckin, actorId));
    }

    /**
     * Assigns the lowest-numbered free seat of the license.
     */
    public Result<AssignmentView, AssignError> assignAnySeat(
            long licenseId,
            AssignmentTarget target,
            OffsetDateTime assignedAt,
            LocalDate expectedCheckin,
            long actorId
    ) {
        return TransactionOutcomes.rollbackOnError(doAssignAnySeat(licenseId, target, assignedAt, expectedCheckin, actorId));
    }

    public Result<AssignmentView, ReleaseError> releaseSeat(long seatId, long actorId) {
        return TransactionOutcomes.rollbackOnError(doReleaseSeat(seatId, actorId));
    }

    @Transactional(readOnly = true)
    public Optional<Long> licenseOfSeat(long seatId) {
        return licenseSeatRepository.findLicenseIdBySeatId(seatId);
    }

    private Result<AssignmentView, AssignError> doAssignAsset(
            long assetId,
            AssignmentTarget target,
            OffsetDateTime assignedAt,
            LocalDate expectedCheckin,
            long actorId
    ) {
        Optional<ValidationError> invalid = validateRequest(target, assignedAt, expectedCheckin);
        if (invalid.isPresent()) {
            return Result.err(invalid.get());
        }
        if (target instanceof AssignmentTarget.ToAsset toAsset && toAsset.assetId() == assetId) {
            return Result.err(new ValidationError("assetId", "an asset cannot be assigned to itself"));
        }

        Asset asset = assetRepository.findByIdForUpdate(assetId).orElse(null);
        if (asset == null) {
            return Result.err(new EntityNotFoundError(ENTITY_ASSET, assetId));
        }
        if (asset.isAssigned()) {
            return Result.err(alreadyAssigned(ENTITY_ASSET, assetId, asset.getAssignment()));
        }

        long targetId = target.id().orElseThrow();
        Long newLocationId;
        Long custodianUserId = null;
        switch (target.kind().orElseThrow()) {
            case USER -> {
                if (userLookup.nameOf(targetId).isEmpty()) {
                    return Result.err(new EntityNotFoundError("User", targetId));
                }
                newLocationId = null;
            }
            case LOCATION -> {
                if (locationLookup.nameOf(targetId).isEmpty()) {
                    return Result.err(new EntityNotFoundError("Location", targetId));
                }
                newLocationId = targetId;
            }
            case ASSET -> {
                Asset custodianAsset = assetRepository.findById(targetId).orElse(null);
                if (custodianAsset == null) {
                    return Result.err(new EntityNotFoundError(ENTITY_ASSET, targetId));
                }
                if (custodianAsset.getAssignment().equals(AssignmentTarget.asset(assetId))) {
                    return Result.err(new ValidationError("assetId",
                            "asset %d is itself assigned to asset %d".formatted(targetId, assetId)));
                }
                newLocationId = custodianAsset.getLocationId();
                custodianUserId = custodianAsset.getHoldingUserId().orElse(null);
            }
            default -> throw new IllegalStateException("Unexpected target " + target);
        }

        OffsetDateTime effectiveAssignedAt = assignedAt != null ? assignedAt : auditLedger.now();
        asset.assign(target, effectiveAssignedAt, expectedCheckin, custodianUserId);
        asset.setLocationId(newLocationId);
        auditLedger.modified(asset, actorId);
        assetRepository.save(asset);

        auditLogService.record("ASSET_CHECKOUT", AuditLogService.RESOURCE_ASSET, assetId, actorId,
                targetDetail(target, custodianUserId));
        log.info("Asset {} assigned to {} (actor={}, checkouts={})",
                assetId, target, actorId, asset.getCheckoutCounter());
        return Result.ok(toView(asset));
    }

    private Result<AssignmentView, ReleaseError> doReleaseAsset(long assetId, long actorId, Long newStatusId, Long newLocationId) {
        Asset asset = assetRepository.findByIdForUpdate(assetId).orElse(null);
        if (asset == null) {
            return Result.err(new EntityNotFoundError(ENTITY_ASSET, assetId));
        }
        if (!asset.isAssigned()) {
            return Result.err(new AlreadyUnassignedError(ENTITY_ASSET, assetId));
        }
        if (newLocationId != null && locationLookup.nameOf(newLocationId).isEmpty()) {
            return Result.err(new EntityNotFoundError("Location", newLocationId));
        }

        AssignmentTarget previous = asset.getAssignment();
        asset.release();
        if (newStatusId != null) {
            asset.setStatusId(newStatusId);
        }
        if (newLocationId != null) {
            asset.setLocationId(newLocationId);
        }
        auditLedger.modified(asset, actorId);
        assetRepository.save(asset);

        Map<String, Object> detail = targetDetail(previous, null);
        if (newStatusId != null) {
            detail.put("statusId", newStatusId);
        }
        if (newLocationId != null) {
            detail.put("locationId", newLocationId);
        }
        auditLogService.record("ASSET_CHECKIN", AuditLogService.RESOURCE_ASSET, assetId, actorId, detail);
        log.info("Asset {} released from {} (actor={}, checkins={})",
                assetId, previous, actorId, asset.getCheckinCounter());
        return Result.ok(toView(asset));
    }

    private Result<AssignmentView, AssignError> doAssignSeat(
            long seatId,
            AssignmentTarget target,
            OffsetDateTime assignedAt,
            LocalDate expectedCheckin,
            long actorId
    ) {
        Optional<ValidationError> invalid = validateSeatRequest(target, assignedAt, expectedCheckin);
        if (invalid.isPresent()) {
            return Result.err(invalid.get());
        }
        Optional<Long> licenseId = licenseSeatRepository.findLicenseIdBySeatId(seatId);
        if (licenseId.isEmpty() || licenseRepository.findByIdForUpdate(licenseId.get()).isEmpty()) {
            return Result.err(new EntityNotFoundError(ENTITY_SEAT, seatId));
        }
        LicenseSeat seat = licenseSeatRepository.findByIdForUpdate(seatId).orElse(null);
        if (seat == null) {
            return Result.err(new EntityNotFoundError(ENTITY_SEAT, seatId));
        }
        return assignLockedSeat(seat, target, assignedAt, expectedCheckin, actorId);
    }

    private Result<AssignmentView, AssignError> doAssignAnySeat(
            long licenseId,
            AssignmentTarget target,
            OffsetDateTime assignedAt,
            LocalDate expectedCheckin,
            long actorId
    ) {
        Optional<ValidationError> invalid = validateSeatRequest(target, assignedAt, expectedCheckin);
        if (invalid.isPresent()) {
            return Result.err(invalid.get());
        }
        if (licenseRepository.findByIdForUpdate(licenseId).isEmpty()) {
            return Result.err(new EntityNotFoundError("License", licenseId));
        }
        List<LicenseSeat> free = licenseSeatRepository.findAvailableForAssignment(licenseId, PageRequest.of(0, 1));
        if (free.isEmpty()) {
            return Result.err(new NoAvailableSeatError(licenseId));
        }
        return assignLockedSeat(free.get(0), target, assignedAt, expectedCheckin, actorId);
    }

    private Result<AssignmentView, AssignError> assignLockedSeat(
            LicenseSeat seat,
            AssignmentTarget target,
            OffsetDateTime assignedAt,
            LocalDate expectedCheckin,
            long actorId
    ) {
        if (!seat.isAvailable()) {
            return Result.err(alreadyAssigned(ENTITY_SEAT, seat.getId(), seat.getAssignment()));
        }

        long targetId = target.id().orElseThrow();
        Long custodianUserId = null;
        if (target instanceof AssignmentTarget.ToUser) {
            if (userLookup.nameOf(targetId).isEmpty()) {
                return Result.err(new EntityNotFoundError("User", targetId));
            }
        } else {
            Asset holder = assetRepository.findById(targetId).orElse(null);
            if (holder == null) {
                return Result.err(new EntityNotFoundError(ENTITY_ASSET, targetId));
            }
            custodianUserId = holder.getHoldingUserId().orElse(null);
        }

        OffsetDateTime effectiveAssignedAt = assignedAt != null ? assignedAt : auditLedger.now();
        seat.assign(target, effectiveAssignedAt, expectedCheckin, custodianUserId);
        auditLedger.modified(seat, actorId);
        licenseSeatRepository.save(seat);

        Map<String, Object> detail = targetDetail(target, custodianUserId);
        detail.put("licenseId", seat.getLicense().getId());
        auditLogService.record("SEAT_CHECKOUT", AuditLogService.RESOURCE_LICENSE_SEAT, seat.getId(), actorId, detail);
        log.info("Seat {} of license {} assigned to {} (actor={})",
                seat.getId(), seat.getLicense().getId(), target, actorId);
        return Result.ok(toView(seat));
    }

    private Result<AssignmentView, ReleaseError> doReleaseSeat(long seatId, long actorId) {
        Optional<Long> licenseId = licenseSeatRepository.findLicenseIdBySeatId(seatId);
        if (licenseId.isEmpty()) {
            return Result.err(new EntityNotFoundError(ENTITY_SEAT, seatId));
        }
        License license = licenseRepository.findByIdForUpdate(licenseId.get()).orElse(null);
        LicenseSeat seat = licenseSeatRepository.findByIdForUpdate(seatId).orElse(null);
        if (license == null || seat == null) {
            return Result.err(new EntityNotFoundError(ENTITY_SEAT, seatId));
        }
        if (seat.isAvailable()) {
            return Result.err(new AlreadyUnassignedError(ENTITY_SEAT, seatId));
        }
        if (!license.isReassignable()) {
            log.info("Release of seat {} rejected: license {} is not reassignable", seatId, license.getId());
            return Result.err(new NotReassignableError(license.getId(), seatId));
        }

        AssignmentTarget previous = seat.getAssignment();
        seat.release();
        auditLedger.modified(seat, actorId);
        licenseSeatRepository.save(seat);

        Map<String, Object> detail = targetDetail(previous, null);
        detail.put("licenseId", license.getId());
        auditLogService.record("SEAT_CHECKIN", AuditLogService.RESOURCE_LICENSE_SEAT, seatId, actorId, detail);
        log.info("Seat {} of license {} released from {} (actor={})", seatId, license.getId(), previous, actorId);
        return Result.ok(toView(seat));
    }

    private Optional<ValidationError> validateRequest(AssignmentTarget target, OffsetDateTime assignedAt, LocalDate expectedCheckin) {
        if (target == null || !target.isAssigned()) {
            return Optional.of(new ValidationError("target", "must name a user, location or asset"));
        }
        if (target.id().orElseThrow() <= 0) {
            return Optional.of(new ValidationError("targetId", "must be a positive id"));
        }
        LocalDate checkoutDate = (assignedAt != null ? assignedAt : auditLedger.now()).toLocalDate();
        if (expectedCheckin != null && expectedCheckin.isBefore(checkoutDate)) {
            return Optional.of(new ValidationError("expectedCheckin", "must not be before the assignment date"));
        }
        return Optional.empty();
    }

    private Optional<ValidationError> validateSeatRequest(AssignmentTarget target, OffsetDateTime assignedAt, LocalDate expectedCheckin) {
        if (target instanceof AssignmentTarget.ToLocation) {
            return Optional.of(new ValidationError("target", "license seats cannot be assigned to a location"));
        }
        return validateRequest(target, assignedAt, expectedCheckin);
    }

    private AlreadyAssignedError alreadyAssigned(String entityType, long entityId, AssignmentTarget current) {
        return new AlreadyAssignedError(
                entityType,
                entityId,
                current.kind().map(AssignmentTargetKind::name).orElse(null),
                current.id().orElse(null)
        );
    }

    private Map<String, Object> targetDetail(AssignmentTarget target, Long custodianUserId) {
        Map<String, Object> detail = new LinkedHashMap<>();
        target.kind().ifPresent(kind -> detail.put("targetKind", kind.name()));
        target.id().ifPresent(id -> detail.put("targetId", id));
        if (custodianUserId != null) {
            detail.put("custodianUserId", custodianUserId);
        }
        return detail;
    }

    private AssignmentView toView(Asset asset) {
        AssignmentTarget target = asset.getAssignment();
        return new AssignmentView(
                ENTITY_ASSET,
                asset.getId(),
                target.kind().orElse(null),
                target.id().orElse(null),
                targetResolver.describe(target).orElse(null),
                asset.getAssignedAt(),
                asset.getExpectedCheckin(),
                asset.getCustodianUserId().orElse(null),
                asset.getLocationId()
        );
    }

    private AssignmentView toView(LicenseSeat seat) {
        AssignmentTarget target = seat.getAssignment();
        return new AssignmentView(
                ENTITY_SEAT,
                seat.getId(),
                target.kind().orElse(null),
                target.id().orElse(null),
                targetResolver.describe(target).orElse(null),
                seat.getAssignedAt(),
                seat.getExpectedCheckin(),
                seat.getCustodianUserId().orElse(null),
                null
        );
    }
}
