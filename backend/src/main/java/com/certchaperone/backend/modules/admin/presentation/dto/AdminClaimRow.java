package com.certchaperone.backend.modules.admin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.certchaperone.backend.modules.transfer.domain.OwnershipClaim;
import com.fasterxml.jackson.annotation.JsonProperty;

public record AdminClaimRow(
        UUID id,
        @JsonProperty("vehicle_id") UUID vehicleId,
        @JsonProperty("claimant_id") UUID claimantId,
        @JsonProperty("claimant_email") String storedClaimantEmail,
        @JsonProperty("claimant_phone") String claimantPhone,
        @JsonProperty("current_owner_id") UUID currentOwnerId,
        @JsonProperty("registration_number") String registrationNumber,
        String message,
        String status,
        @JsonProperty("expires_at") OffsetDateTime expiresAt,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        String claimantEmail,
        String ownerEmail,
        String makerModel
) {

    public static AdminClaimRow from(OwnershipClaim claim, String claimantEmail, String ownerEmail, String makerModel) {
        return new AdminClaimRow(
                claim.getId(),
                claim.getVehicleId(),
                claim.getClaimantId(),
                claim.getClaimantEmail(),
                claim.getClaimantPhone(),
                claim.getCurrentOwnerId(),
                claim.getRegistrationNumber(),
                claim.getMessage(),
                claim.getStatus().getCode(),
                claim.getExpiresAt(),
                claim.getCreatedAt(),
                claimantEmail,
                ownerEmail,
                makerModel
        );
    }
}
