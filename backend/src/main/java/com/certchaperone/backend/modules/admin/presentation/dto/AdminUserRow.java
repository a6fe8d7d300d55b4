package com.certchaperone.backend.modules.admin.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AdminUserRow(
        UUID userId,
        String email,
        long vehicleCount,
        long documentCount,
        OffsetDateTime joinDate,
        @JsonProperty("isSuspended") boolean isSuspended,
        OffsetDateTime suspendedAt,
        String suspensionReason
) {
}
