package com.certchaperone.backend.modules.marketplace.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.certchaperone.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "vehicle_listings")
public class VehicleListing extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "vehicle_id", nullable = false, columnDefinition = "uuid")
    private UUID vehicleId;

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "ai_estimated_price")
    private BigDecimal aiEstimatedPrice;

    @Column(name = "expected_price", nullable = false)
    private BigDecimal expectedPrice;

    @Column(name = "additional_notes")
    private String additionalNotes;

    @Column(name = "status", nullable = false)
    private ListingStatus status;

    @Column(name = "admin_notes")
    private String adminNotes;

    @Column(name = "reviewed_by", columnDefinition = "uuid")
    private UUID reviewedBy;

    @Column(name = "reviewed_at")
    private OffsetDateTime reviewedAt;

    @PrePersist
    protected void onCreate() {
        if (status == null) {
            status = ListingStatus.PENDING;
        }
    }

    public void review(ListingStatus decision, String adminNotes, UUID reviewer, OffsetDateTime reviewedAt) {
        this.status = decision;
        this.adminNotes = adminNotes;
        this.reviewedBy = reviewer;
        this.reviewedAt = reviewedAt;
        markUpdated(reviewedAt);
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

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(UUID userId) {
        this.userId = userId;
    }

    public BigDecimal getAiEstimatedPrice() {
        return aiEstimatedPrice;
    }

    public void setAiEstimatedPrice(BigDecimal aiEstimatedPrice) {
        this.aiEstimatedPrice = aiEstimatedPrice;
    }

    public BigDecimal getExpectedPrice() {
        return expectedPrice;
    }

    public void setExpectedPrice(BigDecimal expectedPrice) {
        this.expectedPrice = expectedPrice;
    }

    public String getAdditionalNotes() {
        return additionalNotes;
    }

    public void setAdditionalNotes(String additionalNotes) {
        this.additionalNotes = additionalNotes;
    }

    public ListingStatus getStatus() {
        return status;
    }

    public void setStatus(ListingStatus status) {
        this.status = status;
    }

    public String getAdminNotes() {
        return adminNotes;
    }

    public UUID getReviewedBy() {
        return reviewedBy;
    }

    public OffsetDateTime getReviewedAt() {
        return reviewedAt;
    }
}
