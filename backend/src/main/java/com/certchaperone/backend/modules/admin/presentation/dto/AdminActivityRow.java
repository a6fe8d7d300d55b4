package com.certchaperone.backend.modules.admin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

import com.certchaperone.backend.modules.audit.domain.VehicleHistoryEvent;
import com.fasterxml.jackson.annotation.JsonProperty;

public record AdminActivityRow(
        UUID id,
        @JsonProperty("event_type") String eventType,
        @JsonProperty("event_description") String eventDescription,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("user_id") UUID userId,
        @JsonProperty("vehicle_id") UUID vehicleId,
        Map<String, Object> metadata,
        String userEmail,
        String registrationNumber
) {

    public static AdminActivityRow from(VehicleHistoryEvent event, String userEmail, String registrationNumber) {
        return new AdminActivityRow(
                event.getId(),
                event.getEventType(),
                event.getEventDescription(),
                event.getCreatedAt(),
                event.getUserId(),
                event.getVehicleId(),
                event.getMetadata(),
                userEmail,
                registrationNumber
        );
    }
}
