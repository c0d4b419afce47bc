package com.assetdesk.backend.modules.asset.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Optional;

import com.assetdesk.backend.global.jpa.AbstractAuditedEntity;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTarget;
import com.assetdesk.backend.modules.assignment.domain.AssignmentTargetKind;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.SQLRestriction;

/**
 * Physical inventory item. The assignment columns change only through
 * {@link #assign(AssignmentTarget, OffsetDateTime, LocalDate, Long)} and {@link #release()}.
 */
@Entity
@Table(name = "assets")
@SQLRestriction("deleted_at is null")
public class Asset extends AbstractAuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "tag", nullable = false, length = 63)
    private String tag;

    @Column(name = "serial", length = 120)
    private String serial;

    @Column(name = "name", length = 120)
    private String name;

    @Column(name = "model_id")
    private Long modelId;

    @Column(name = "status_id")
    private Long statusId;

    @Column(name = "company_id")
    private Long companyId;

    @Column(name = "location_id")
    private Long locationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "assigned_type", length = 16)
    private AssignmentTargetKind assignedType;

    @Column(name = "assigned_to")
    private Long assignedTo;

    @Column(name = "assigned_at")
    private OffsetDateTime assignedAt;

    @Column(name = "expected_checkin")
    private LocalDate expectedCheckin;

    @Column(name = "custodian_user_id")
    private Long custodianUserId;

    @Column(name = "checkout_counter", nullable = false)
    private int checkoutCounter;

    @Column(name = "checkin_counter", nullable = false)
    private int checkinCounter;

    @Column(name = "order_number", length = 50)
    private String orderNumber;

    @Column(name = "purchase_date")
    private LocalDate purchaseDate;

    @Column(name = "purchase_cost", precision = 20, scale = 2)
    private BigDecimal purchaseCost;

    @Column(name = "supplier_id")
    private Long supplierId;

    @Column(name = "notes")
    private String notes;

    public static String normalizeTag(String rawTag) {
        return rawTag == null ? null : rawTag.trim().toUpperCase(Locale.ROOT);
    }

    public Long getId() {
        return id;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = normalizeTag(tag);
    }

    public String getSerial() {
        return serial;
    }

    public void setSerial(String serial) {
        this.serial = serial;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public Long getModelId() {
        return modelId;
    }

    public void setModelId(Long modelId) {
        this.modelId = modelId;
    }

    public Long getStatusId() {
        return statusId;
    }

    public void setStatusId(Long statusId) {
        this.statusId = statusId;
    }

    public Long getCompanyId() {
        return companyId;
    }

    public void setCompanyId(Long companyId) {
        this.companyId = companyId;
    }

    public Long getLocationId() {
        return locationId;
    }

    public void setLocationId(Long locationId) {
        this.locationId = locationId;
    }

    public String getOrderNumber() {
        return orderNumber;
    }

    public void setOrderNumber(String orderNumber) {
        this.orderNumber = orderNumber;
    }

    public LocalDate getPurchaseDate() {
        return purchaseDate;
    }

    public void setPurchaseDate(LocalDate purchaseDate) {
        this.purchaseDate = purchaseDate;
    }

    public BigDecimal getPurchaseCost() {
        return purchaseCost;
    }

    public void setPurchaseCost(BigDecimal purchaseCost) {
        this.purchaseCost = purchaseCost;
    }

    public Long getSupplierId() {
        return supplierId;
    }

    public void setSupplierId(Long supplierId) {
        this.supplierId = supplierId;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public AssignmentTarget getAssignment() {
        return AssignmentTarget.of(assignedType, assignedTo);
    }

    public boolean isAssigned() {
        return assignedType != null;
    }

    public OffsetDateTime getAssignedAt() {
        return assignedAt;
    }

    public LocalDate getExpectedCheckin() {
        return expectedCheckin;
    }

    public Optional<Long> getCustodianUserId() {
        return Optional.ofNullable(custodianUserId);
    }

    /**
     * @return the user holding this asset: the direct user assignee, or the custodian
     * recorded when the asset was assigned to another asset
     */
    public Optional<Long> getHoldingUserId() {
        if (assignedType == AssignmentTargetKind.USER) {
            return Optional.of(assignedTo);
        }
        return getCustodianUserId();
    }

    public int getCheckoutCounter() {
        return checkoutCounter;
    }

    public int getCheckinCounter() {
        return checkinCounter;
    }

    public void assign(AssignmentTarget target, OffsetDateTime assignedAt, LocalDate expectedCheckin, Long custodianUserId) {
        if (!target.isAssigned()) {
            throw new IllegalArgumentException("Use release() to clear an assignment");
        }
        if (isAssigned()) {
            throw new IllegalStateException("Asset %d is already assigned".formatted(id));
        }
        this.assignedType = target.kind().orElseThrow();
        this.assignedTo = target.id().orElseThrow();
        this.assignedAt = assignedAt;
        this.expectedCheckin = expectedCheckin;
        this.custodianUserId = custodianUserId;
        this.checkoutCounter++;
    }

    public void release() {
        if (!isAssigned()) {
            throw new IllegalStateException("Asset %d is not assigned".formatted(id));
        }
        this.assignedType = null;
        this.assignedTo = null;
        this.assignedAt = null;
        this.expectedCheckin = null;
        this.custodianUserId = null;
        this.checkinCounter++;
    }
}
