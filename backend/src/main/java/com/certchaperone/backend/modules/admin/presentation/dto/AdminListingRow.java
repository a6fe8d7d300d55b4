package com.certchaperone.backend.modules.admin.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.certchaperone.backend.modules.marketplace.domain.VehicleListing;
import com.fasterxml.jackson.annotation.JsonProperty;

public record AdminListingRow(
        UUID id,
        @JsonProperty("vehicle_id") UUID vehicleId,
        @JsonProperty("user_id") UUID userId,
        @JsonProperty("ai_estimated_price") BigDecimal aiEstimatedPrice,
        @JsonProperty("expected_price") BigDecimal expectedPrice,
        @JsonProperty("additional_notes") String additionalNotes,
        String status,
        @JsonProperty("admin_notes") String adminNotes,
        @JsonProperty("reviewed_by") UUID reviewedBy,
        @JsonProperty("reviewed_at") OffsetDateTime reviewedAt,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt,
        String userEmail,
        String registrationNumber,
        String makerModel,
        String manufacturer
) {

    public static AdminListingRow from(VehicleListing listing, String userEmail, String registrationNumber,
                                       String makerModel, String manufacturer) {
        return new AdminListingRow(
                listing.getId(),
                listing.getVehicleId(),
                listing.getUserId(),
                listing.getAiEstimatedPrice(),
                listing.getExpectedPrice(),
                listing.getAdditionalNotes(),
                listing.getStatus().getCode(),
                listing.getAdminNotes(),
                listing.getReviewedBy(),
                listing.getReviewedAt(),
                listing.getCreatedAt(),
                listing.getUpdatedAt(),
                userEmail,
                registrationNumber,
                makerModel,
                manufacturer
        );
    }
}
