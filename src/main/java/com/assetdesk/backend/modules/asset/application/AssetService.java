package com.assetdesk.backend.modules.asset.application;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.assetdesk.backend.global.error.AssetInUseError;
import com.assetdesk.backend.global.error.AssetSaveError;
import com.assetdesk.backend.global.error.DuplicateAssetTagError;
import com.assetdesk.backend.global.error.EntityNotFoundError;
import com.assetdesk.backend.global.error.ValidationError;
import com.assetdesk.backend.global.jpa.AuditLedger;
import com.assetdesk.backend.global.result.Result;
import com.assetdesk.backend.modules.asset.domain.Asset;
import com.assetdesk.backend.modules.asset.infrastructure.persistence.AssetRepository;
import com.assetdesk.backend.modules.asset.presentation.dto.AssetCopyRequest;
import com.assetdesk.backend.modules.asset.presentation.dto.AssetRequest;
import com.assetdesk.backend.modules.asset.presentation.dto.AssetResponse;
import com.assetdesk.backend.modules.asset.presentation.dto.AssetResponse.AttachedSeatResponse;
import com.assetdesk.backend.modules.assignment.application.TargetResolver;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTarget;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTargetKind;
import com.assetdesk.backend.modules.assignment.domain.LocationLookup;
import com.assetdesk.backend.modules.audit.application.AuditLogService;
import com.assetdesk.backend.modules.license.infrastructure.persistence.LicenseSeatRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class AssetService {

    private static final Logger log = LoggerFactory.getLogger(AssetService.class);

    private final AssetRepository assetRepository;
    private final LicenseSeatRepository licenseSeatRepository;
    private final LocationLookup locationLookup;
    private final TargetResolver targetResolver;
    private final AuditLedger auditLedger;
    private final AuditLogService auditLogService;

    public AssetService(
            AssetRepository assetRepository,
            LicenseSeatRepository licenseSeatRepository,
            LocationLookup locationLookup,
            TargetResolver targetResolver,
            AuditLedger auditLedger,
            AuditLogService auditLogService
    ) {
        this.assetRepository = assetRepository;
        this.licenseSeatRepository = licenseSeatRepository;
        this.locationLookup = locationLookup;
        this.targetResolver = targetResolver;
        this.auditLedger = auditLedger;
        this.auditLogService = auditLogService;
    }

    public Result<AssetResponse, AssetSaveError> create(AssetRequest request, long actorId) {
        Optional<AssetSaveError> rejected = check(request, null);
        if (rejected.isPresent()) {
            return Result.err(rejected.get());
        }
        Asset asset = new Asset();
        apply(asset, request);
        auditLedger.created(asset, actorId);
        Asset saved = assetRepository.save(asset);
        auditLogService.record("ASSET_CREATED", AuditLogService.RESOURCE_ASSET, saved.getId(), actorId,
                Map.of("tag", saved.getTag()));
        log.info("Asset {} created with tag {} (actor={})", saved.getId(), saved.getTag(), actorId);
        return Result.ok(toResponse(saved));
    }

    /**
     * Registers a new asset with the descriptive fields of an existing one. Tag and serial come
     * from the request; assignment, counters and attached seats start empty.
     */
    public Result<AssetResponse, AssetSaveError> copy(long sourceId, AssetCopyRequest request, long actorId) {
        Asset source = assetRepository.findById(sourceId).orElse(null);
        if (source == null) {
            return Result.err(new EntityNotFoundError("Asset", sourceId));
        }
        AssetRequest copy = new AssetRequest(
                request.tag(),
                source.getName(),
                request.serial(),
                source.getModelId(),
                source.getStatusId(),
                source.getCompanyId(),
                source.getLocationId(),
                source.getOrderNumber(),
                source.getPurchaseDate(),
                source.getPurchaseCost(),
                source.getSupplierId(),
                source.getNotes());
        log.info("Copying asset {} (actor={})", sourceId, actorId);
        return create(copy, actorId);
    }

    /**
     * Updates the descriptive fields. The assignment columns are left to the checkout and checkin operations.
     */
    public Result<AssetResponse, AssetSaveError> update(long assetId, AssetRequest request, long actorId) {
        Asset asset = assetRepository.findByIdForUpdate(assetId).orElse(null);
        if (asset == null) {
            return Result.err(new EntityNotFoundError("Asset", assetId));
        }
        Optional<AssetSaveError> rejected = check(request, assetId);
        if (rejected.isPresent()) {
            return Result.err(rejected.get());
        }
        apply(asset, request);
        auditLedger.modified(asset, actorId);
        assetRepository.save(asset);
        auditLogService.record("ASSET_UPDATED", AuditLogService.RESOURCE_ASSET, assetId, actorId,
                Map.of("tag", asset.getTag()));
        return Result.ok(toResponse(asset));
    }

    /**
     * Soft-deletes the asset. Refused while it is checked out, holds license seats or has
     * assets checked out to it.
     */
    public Result<Void, AssetSaveError> delete(long assetId, long actorId) {
        Asset asset = assetRepository.findByIdForUpdate(assetId).orElse(null);
        if (asset == null) {
            return Result.err(new EntityNotFoundError("Asset", assetId));
        }
        int attachedSeats = (int) licenseSeatRepository.countByAssetId(assetId);
        int heldAssets = (int) assetRepository.countByAssignedTypeAndAssignedTo(AssignmentTargetKind.ASSET, assetId);
        if (asset.isAssigned() || attachedSeats > 0 || heldAssets > 0) {
            log.info("Rejected deletion of asset {}: checked out={}, seats={}, held assets={}",
                    assetId, asset.isAssigned(), attachedSeats, heldAssets);
            return Result.err(new AssetInUseError(assetId, asset.isAssigned(), attachedSeats, heldAssets));
        }
        auditLedger.deleted(asset, actorId);
        assetRepository.save(asset);
        auditLogService.record("ASSET_DELETED", AuditLogService.RESOURCE_ASSET, assetId, actorId,
                Map.of("tag", asset.getTag()));
        log.info("Asset {} soft-deleted (actor={})", assetId, actorId);
        return Result.success();
    }

    @Transactional(readOnly = true)
    public Optional<AssetResponse> getAsset(long assetId) {
        return assetRepository.findById(assetId).map(this::toResponse);
    }

    private Optional<AssetSaveError> check(AssetRequest request, Long currentId) {
        String tag = Asset.normalizeTag(request.tag());
        if (tag == null || tag.isEmpty()) {
            return Optional.of(new ValidationError("tag", "is required"));
        }
        boolean taken = currentId == null
                ? assetRepository.existsByTag(tag)
                : assetRepository.existsByTagAndIdNot(tag, currentId);
        if (taken) {
            return Optional.of(new DuplicateAssetTagError(tag));
        }
        if (request.locationId() != null && locationLookup.nameOf(request.locationId()).isEmpty()) {
            return Optional.of(new EntityNotFoundError("Location", request.locationId()));
        }
        return Optional.empty();
    }

    private void apply(Asset asset, AssetRequest request) {
        asset.setTag(request.tag());
        asset.setName(request.name());
        asset.setSerial(request.serial());
        asset.setModelId(request.modelId());
        asset.setStatusId(request.statusId());
        asset.setCompanyId(request.companyId());
        asset.setLocationId(request.locationId());
        asset.setOrderNumber(request.orderNumber());
        asset.setPurchaseDate(request.purchaseDate());
        asset.setPurchaseCost(request.purchaseCost());
        asset.setSupplierId(request.supplierId());
        asset.setNotes(request.notes());
    }

    private AssetResponse toResponse(Asset asset) {
        AssignmentTarget assignment = asset.getAssignment();
        List<AttachedSeatResponse> seats = licenseSeatRepository.findByAssetIdOrderByIdAsc(asset.getId()).stream()
                .map(seat -> new AttachedSeatResponse(
                        seat.getId(),
                        seat.getLicense().getId(),
                        seat.getLicense().getName(),
                        seat.getAssignedAt()))
                .toList();
        return new AssetResponse(
                asset.getId(),
                asset.getTag(),
                asset.getName(),
                asset.getSerial(),
                asset.getModelId(),
                asset.getStatusId(),
                asset.getCompanyId(),
                asset.getLocationId(),
                asset.getLocationId() == null ? null : locationLookup.nameOf(asset.getLocationId()).orElse(null),
                assignment.kind().orElse(null),
                assignment.id().orElse(null),
                targetResolver.describe(assignment).orElse(null),
                asset.getCustodianUserId().orElse(null),
                asset.getAssignedAt(),
                asset.getExpectedCheckin(),
                asset.getCheckoutCounter(),
                asset.getCheckinCounter(),
                asset.getOrderNumber(),
                asset.getPurchaseDate(),
                asset.getPurchaseCost(),
                asset.getSupplierId(),
                asset.getNotes(),
                asset.getCreatedAt(),
                asset.getUpdatedAt(),
                asset.getModifiedBy(),
                seats
        );
    }
}
