package com.assetdesk.backend.modules.license.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.assetdesk.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.SQLRestriction;

/**
 * Software license owning a pool of {@link LicenseSeat} rows. The pool always holds exactly
 * {@link #getSeats()} active seats once a save has committed.
 */
@Entity
@Table(name = "licenses")
@SQLRestriction("deleted_at is null")
public class License extends AbstractAuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "name", nullable = false, length = 120)
    private String name;

    @Column(name = "serial")
    private String serial;

    @Column(name = "seats", nullable = false)
    private int seats;

    @Column(name = "reassignable", nullable = false)
    private boolean reassignable = true;

    @Column(name = "licensed_to_name", length = 120)
    private String licensedToName;

    @Column(name = "licensed_to_email", length = 120)
    private String licensedToEmail;

    @Column(name = "category_id")
    private Long categoryId;

    @Column(name = "manufacturer_id")
    private Long manufacturerId;

    @Column(name = "supplier_id")
    private Long supplierId;

    @Column(name = "company_id")
    private Long companyId;

    @Column(name = "order_number", length = 50)
    private String orderNumber;

    @Column(name = "purchase_cost", precision = 20, scale = 2)
    private BigDecimal purchaseCost;

    @Column(name = "purchase_date")
    private LocalDate purchaseDate;

    @Column(name = "expiration_date")
    private LocalDate expirationDate;

    @Column(name = "notes")
    private String notes;

    public Long getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSerial() {
        return serial;
    }

    public void setSerial(String serial) {
        this.serial = serial;
    }

    public int getSeats() {
        return seats;
    }

    public void setSeats(int seats) {
        this.seats = seats;
    }

    public boolean isReassignable() {
        return reassignable;
    }

    public void setReassignable(boolean reassignable) {
        this.reassignable = reassignable;
    }

    public String getLicensedToName() {
        return licensedToName;
    }

    public void setLicensedToName(String licensedToName) {
        this.licensedToName = licensedToName;
    }

    public String getLicensedToEmail() {
        return licensedToEmail;
    }

    public void setLicensedToEmail(String licensedToEmail) {
        this.licensedToEmail = licensedToEmail;
    }

    public Long getCategoryId() {
        return categoryId;
    }

    public void setCategoryId(Long categoryId) {
        this.categoryId = categoryId;
    }

    public Long getManufacturerId() {
        return manufacturerId;
    }

    public void setManufacturerId(Long manufacturerId) {
        this.manufacturerId = manufacturerId;
    }

    public Long getSupplierId() {
        return supplierId;
    }

    public void setSupplierId(Long supplierId) {
        this.supplierId = supplierId;
    }

    public Long getCompanyId() {
        return companyId;
    }

    public void setCompanyId(Long companyId) {
        this.companyId = companyId;
    }

    public String getOrderNumber() {
        return orderNumber;
    }

    public void setOrderNumber(String orderNumber) {
        this.orderNumber = orderNumber;
    }

    public BigDecimal getPurchaseCost() {
        return purchaseCost;
    }

    public void setPurchaseCost(BigDecimal purchaseCost) {
        this.purchaseCost = purchaseCost;
    }

    public LocalDate getPurchaseDate() {
        return purchaseDate;
    }

    public void setPurchaseDate(LocalDate purchaseDate) {
        this.purchaseDate = purchaseDate;
    }

    public LocalDate getExpirationDate() {
        return expirationDate;
    }

    public void setExpirationDate(LocalDate expirationDate) {
        this.expirationDate = expirationDate;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
