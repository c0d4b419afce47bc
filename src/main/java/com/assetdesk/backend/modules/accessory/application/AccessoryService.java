package com.assetdesk.backend.modules.accessory.application;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.assetdesk.backend.global.error.AccessoryAssignError;
import com.assetdesk.backend.global.error.AccessoryDeleteError;
import com.assetdesk.backend.global.error.AccessoryHasAssignmentsError;
import com.assetdesk.backend.global.error.AccessorySaveError;
import com.assetdesk.backend.global.error.EntityNotFoundError;
import com.assetdesk.backend.global.error.NoAvailableQuantityError;
import com.assetdesk.backend.global.error.QuantityBelowAssignedError;
import com.assetdesk.backend.global.error.ReleaseError;
import com.assetdesk.backend.global.error.ValidationError;
import com.assetdesk.backend.global.jpa.AuditLedger;
import com.assetdesk.backend.global.result.Result;
import com.assetdesk.backend.modules.accessory.domain.Accessory;
import com.assetdesk.backend.modules.accessory.domain.AccessoryAssignment;
import com.assetdesk.backend.modules.accessory.infrastructure.persistence.AccessoryAssignmentRepository;
import com.assetdesk.backend.modules.accessory.infrastructure.persistence.AccessoryRepository;
import com.assetdesk.backend.modules.accessory.presentation.dto.AccessoryCheckoutRequest;
import com.assetdesk.backend.modules.accessory.presentation.dto.AccessoryRequest;
import com.assetdesk.backend.modules.accessory.presentation.dto.AccessoryResponse;
import com.assetdesk.backend.modules.accessory.presentation.dto.AccessoryResponse.AssignedUnitResponse;
import com.assetdesk.backend.modules.assignment.domain.LocationLookup;
import com.assetdesk.backend.modules.assignment.domain.UserLookup;
import com.assetdesk.backend.modules.audit.application.AuditLogService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Accessory stock and its per-user assignments. Every mutation locks the accessory row so the
 * assigned count read under the lock cannot exceed the quantity.
 */
@Service
@Transactional
public class AccessoryService {

    private static final Logger log = LoggerFactory.getLogger(AccessoryService.class);

    private final AccessoryRepository accessoryRepository;
    private final AccessoryAssignmentRepository assignmentRepository;
    private final UserLookup userLookup;
    private final LocationLookup locationLookup;
    private final AuditLedger auditLedger;
    private final AuditLogService auditLogService;

    public AccessoryService(
            AccessoryRepository accessoryRepository,
            AccessoryAssignmentRepository assignmentRepository,
            UserLookup userLookup,
            LocationLookup locationLookup,
            AuditLedger auditLedger,
            AuditLogService auditLogService
    ) {
        this.accessoryRepository = accessoryRepository;
        this.assignmentRepository = assignmentRepository;
        this.userLookup = userLookup;
        this.locationLookup = locationLookup;
        this.auditLedger = auditLedger;
        this.auditLogService = auditLogService;
    }

    public Result<AccessoryResponse, AccessorySaveError> create(AccessoryRequest request, long actorId) {
        Optional<AccessorySaveError> rejected = check(request);
        if (rejected.isPresent()) {
            return Result.err(rejected.get());
        }
        Accessory accessory = new Accessory();
        apply(accessory, request);
        auditLedger.created(accessory, actorId);
        Accessory saved = accessoryRepository.save(accessory);
        auditLogService.record("ACCESSORY_CREATED", AuditLogService.RESOURCE_ACCESSORY, saved.getId(), actorId,
                Map.of("quantity", saved.getQuantity()));
        log.info("Accessory {} created with {} units (actor={})", saved.getId(), saved.getQuantity(), actorId);
        return Result.ok(toResponse(saved));
    }

    public Result<AccessoryResponse, AccessorySaveError> update(long accessoryId, AccessoryRequest request, long actorId) {
        Accessory accessory = accessoryRepository.findByIdForUpdate(accessoryId).orElse(null);
        if (accessory == null) {
            return Result.err(new EntityNotFoundError("Accessory", accessoryId));
        }
        Optional<AccessorySaveError> rejected = check(request);
        if (rejected.isPresent()) {
            return Result.err(rejected.get());
        }
        int assigned = (int) assignmentRepository.countByAccessoryId(accessoryId);
        if (request.quantity() < assigned) {
            return Result.err(new QuantityBelowAssignedError(accessoryId, request.quantity(), assigned));
        }
        apply(accessory, request);
        auditLedger.modified(accessory, actorId);
        accessoryRepository.save(accessory);
        auditLogService.record("ACCESSORY_UPDATED", AuditLogService.RESOURCE_ACCESSORY, accessoryId, actorId,
                Map.of("quantity", accessory.getQuantity()));
        return Result.ok(toResponse(accessory));
    }

    /**
     * Soft-deletes the accessory. Refused while any unit is assigned.
     */
    public Result<Void, AccessoryDeleteError> delete(long accessoryId, long actorId) {
        Accessory accessory = accessoryRepository.findByIdForUpdate(accessoryId).orElse(null);
        if (accessory == null) {
            return Result.err(new EntityNotFoundError("Accessory", accessoryId));
        }
        int assigned = (int) assignmentRepository.countByAccessoryId(accessoryId);
        if (assigned > 0) {
            return Result.err(new AccessoryHasAssignmentsError(accessoryId, assigned));
        }
        auditLedger.deleted(accessory, actorId);
        accessoryRepository.save(accessory);
        auditLogService.record("ACCESSORY_DELETED", AuditLogService.RESOURCE_ACCESSORY, accessoryId, actorId, Map.of());
        log.info("Accessory {} soft-deleted (actor={})", accessoryId, actorId);
        return Result.success();
    }

    /**
     * Hands one unit to a user. Fails when every unit is already assigned.
     */
    public Result<AccessoryResponse, AccessoryAssignError> checkout(long accessoryId, AccessoryCheckoutRequest request, long actorId) {
        Accessory accessory = accessoryRepository.findByIdForUpdate(accessoryId).orElse(null);
        if (accessory == null) {
            return Result.err(new EntityNotFoundError("Accessory", accessoryId));
        }
        if (request.userId() == null || request.userId() <= 0) {
            return Result.err(new ValidationError("userId", "must be a positive id"));
        }
        if (userLookup.nameOf(request.userId()).isEmpty()) {
            return Result.err(new EntityNotFoundError("User", request.userId()));
        }
        int assigned = (int) assignmentRepository.countByAccessoryId(accessoryId);
        if (assigned >= accessory.getQuantity()) {
            log.info("Rejected checkout of accessory {}: {} of {} units assigned", accessoryId, assigned, accessory.getQuantity());
            return Result.err(new NoAvailableQuantityError(accessoryId, accessory.getQuantity(), assigned));
        }

        AccessoryAssignment unit = auditLedger.created(
                new AccessoryAssignment(accessory, request.userId(), request.note()), actorId);
        AccessoryAssignment saved = assignmentRepository.save(unit);
        auditLogService.record("ACCESSORY_CHECKOUT", AuditLogService.RESOURCE_ACCESSORY, accessoryId, actorId,
                Map.of("assignmentId", saved.getId(), "userId", request.userId()));
        log.info("Accessory {} unit {} assigned to user {} (actor={})", accessoryId, saved.getId(), request.userId(), actorId);
        return Result.ok(toResponse(accessory));
    }

    /**
     * Takes one unit back from its user by deleting the assignment row.
     */
    public Result<AccessoryResponse, ReleaseError> checkin(long accessoryId, long assignmentId, long actorId) {
        Accessory accessory = accessoryRepository.findByIdForUpdate(accessoryId).orElse(null);
        if (accessory == null) {
            return Result.err(new EntityNotFoundError("Accessory", accessoryId));
        }
        AccessoryAssignment unit = assignmentRepository.findById(assignmentId)
                .filter(found -> found.getAccessory().getId().equals(accessoryId))
                .orElse(null);
        if (unit == null) {
            return Result.err(new EntityNotFoundError("AccessoryAssignment", assignmentId));
        }
        assignmentRepository.delete(unit);
        auditLogService.record("ACCESSORY_CHECKIN", AuditLogService.RESOURCE_ACCESSORY, accessoryId, actorId,
                Map.of("assignmentId", assignmentId, "userId", unit.getAssignedTo()));
        log.info("Accessory {} unit {} returned by user {} (actor={})", accessoryId, assignmentId, unit.getAssignedTo(), actorId);
        return Result.ok(toResponse(accessory));
    }

    @Transactional(readOnly = true)
    public Optional<AccessoryResponse> getAccessory(long accessoryId) {
        return accessoryRepository.findById(accessoryId).map(this::toResponse);
    }

    private Optional<AccessorySaveError> check(AccessoryRequest request) {
        String name = Accessory.normalizeName(request.name());
        if (name == null || name.isEmpty()) {
            return Optional.of(new ValidationError("name", "is required"));
        }
        if (request.categoryId() == null) {
            return Optional.of(new ValidationError("categoryId", "is required"));
        }
        if (request.quantity() == null || request.quantity() < 0) {
            return Optional.of(new ValidationError("quantity", "must be zero or more"));
        }
        if (request.locationId() != null && locationLookup.nameOf(request.locationId()).isEmpty()) {
            return Optional.of(new EntityNotFoundError("Location", request.locationId()));
        }
        return Optional.empty();
    }

    private void apply(Accessory accessory, AccessoryRequest request) {
        accessory.setName(request.name());
        accessory.setCategoryId(request.categoryId());
        accessory.setCompanyId(request.companyId());
        accessory.setSupplierId(request.supplierId());
        accessory.setManufacturerId(request.manufacturerId());
        accessory.setLocationId(request.locationId());
        accessory.setModelNumber(request.modelNumber());
        accessory.setOrderNumber(request.orderNumber());
        accessory.setPurchaseDate(request.purchaseDate());
        accessory.setPurchaseCost(request.purchaseCost());
        accessory.setQuantity(request.quantity());
        accessory.setMinQuantity(request.minQuantity());
    }

    private AccessoryResponse toResponse(Accessory accessory) {
        List<AssignedUnitResponse> units = assignmentRepository.findByAccessoryIdOrderByIdAsc(accessory.getId()).stream()
                .map(unit -> new AssignedUnitResponse(
                        unit.getId(),
                        unit.getAssignedTo(),
                        userLookup.nameOf(unit.getAssignedTo()).orElse(null),
                        unit.getNote(),
                        unit.getCreatedAt()))
                .toList();
        int available = accessory.getQuantity() - units.size();
        boolean belowMinimum = accessory.getMinQuantity() != null && available < accessory.getMinQuantity();
        return new AccessoryResponse(
                accessory.getId(),
                accessory.getName(),
                accessory.getCategoryId(),
                accessory.getCompanyId(),
                accessory.getSupplierId(),
                accessory.getManufacturerId(),
                accessory.getLocationId(),
                accessory.getLocationId() == null ? null : locationLookup.nameOf(accessory.getLocationId()).orElse(null),
                accessory.getModelNumber(),
                accessory.getOrderNumber(),
                accessory.getPurchaseDate(),
                accessory.getPurchaseCost(),
                accessory.getQuantity(),
                accessory.getMinQuantity(),
                available,
                belowMinimum,
                accessory.getCreatedAt(),
                accessory.getUpdatedAt(),
                accessory.getModifiedBy(),
                units
        );
    }
}
