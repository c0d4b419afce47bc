package com.assetdesk.backend.modules.accessory.domain;

import com.assetdesk.backend.global.jpa.AbstractAuditedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

/**
 * One unit of an accessory held by a user. Releasing the unit deletes the row.
 */
@Entity
@Table(name = "accessories_users")
public class AccessoryAssignment extends AbstractAuditedEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "accessory_id", nullable = false, updatable = false)
    private Accessory accessory;

    @Column(name = "assigned_to", nullable = false, updatable = false)
    private Long assignedTo;

    @Column(name = "note")
    private String note;

    protected AccessoryAssignment() {
    }

    public AccessoryAssignment(Accessory accessory, long assignedTo, String note) {
        this.accessory = accessory;
        this.assignedTo = assignedTo;
        this.note = note;
    }

    public Long getId() {
        return id;
    }

    public Accessory getAccessory() {
        return accessory;
    }

    public Long getAssignedTo() {
        return assignedTo;
    }

    public String getNote() {
        return note;
    }
}
