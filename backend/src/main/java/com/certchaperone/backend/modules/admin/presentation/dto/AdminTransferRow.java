package com.certchaperone.backend.modules.admin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.certchaperone.backend.modules.transfer.domain.VehicleTransfer;
import com.fasterxml.jackson.annotation.JsonProperty;

public record AdminTransferRow(
        UUID id,
        @JsonProperty("vehicle_id") UUID vehicleId,
        @JsonProperty("sender_id") UUID senderId,
        @JsonProperty("recipient_email") String recipientEmail,
        @JsonProperty("recipient_phone") String recipientPhone,
        @JsonProperty("recipient_id") UUID recipientId,
        String status,
        @JsonProperty("expires_at") OffsetDateTime expiresAt,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt,
        String senderEmail,
        String registrationNumber,
        String makerModel
) {

    public static AdminTransferRow from(VehicleTransfer transfer, String senderEmail,
                                        String registrationNumber, String makerModel) {
        return new AdminTransferRow(
                transfer.getId(),
                transfer.getVehicleId(),
                transfer.getSenderId(),
                transfer.getRecipientEmail(),
                transfer.getRecipientPhone(),
                transfer.getRecipientId(),
                transfer.getStatus(),
                transfer.getExpiresAt(),
                transfer.getCreatedAt(),
                transfer.getUpdatedAt(),
                senderEmail,
                registrationNumber,
                makerModel
        );
    }
}
