package com.certchaperone.backend.modules.transfer.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A request by another user to take over a registration number that is already on file.
 * Once resolved, rejected or expired the claim no longer changes.
 */
@Entity
@Table(name = "ownership_claims")
public class OwnershipClaim {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "vehicle_id", columnDefinition = "uuid")
    private UUID vehicleId;

    @Column(name = "claimant_id", nullable = false, columnDefinition = "uuid")
    private UUID claimantId;

    @Column(name = "claimant_email")
    private String claimantEmail;

    @Column(name = "claimant_phone")
    private String claimantPhone;

    @Column(name = "current_owner_id", nullable = false, columnDefinition = "uuid")
    private UUID currentOwnerId;

    @Column(name = "registration_number", nullable = false)
    private String registrationNumber;

    @Column(name = "message")
    private String message;

    @Column(name = "status", nullable = false)
    private OwnershipClaimStatus status;

    @Column(name = "expires_at")
    private OffsetDateTime expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
        if (status == null) {
            status = OwnershipClaimStatus.PENDING;
        }
    }

    public UUID getId() {
        return id;
    }

    public UUID getVehicleId() {
        return vehicleId;
    }

    public void setVehicleId(UUID vehicleId) {
        this.vehicleId = vehicleId;
    }

    public UUID getClaimantId() {
        return claimantId;
    }

    public void setClaimantId(UUID claimantId) {
        this.claimantId = claimantId;
    }

    public String getClaimantEmail() {
        return claimantEmail;
    }

    public void setClaimantEmail(String claimantEmail) {
        this.claimantEmail = claimantEmail;
    }

    public String getClaimantPhone() {
        return claimantPhone;
    }

    public void setClaimantPhone(String claimantPhone) {
        this.claimantPhone = claimantPhone;
    }

    public UUID getCurrentOwnerId() {
        return currentOwnerId;
    }

    public void setCurrentOwnerId(UUID currentOwnerId) {
        this.currentOwnerId = currentOwnerId;
    }

    public String getRegistrationNumber() {
        return registrationNumber;
    }

    public void setRegistrationNumber(String registrationNumber) {
        this.registrationNumber = registrationNumber;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public OwnershipClaimStatus getStatus() {
        return status;
    }

    public void setStatus(OwnershipClaimStatus status) {
        this.status = status;
    }

    public OffsetDateTime getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(OffsetDateTime expiresAt) {
        this.expiresAt = expiresAt;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
