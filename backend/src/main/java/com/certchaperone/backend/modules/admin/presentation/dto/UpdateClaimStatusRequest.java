package com.certchaperone.backend.modules.admin.presentation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdateClaimStatusRequest(
        @NotNull(message = "Invalid claim ID format")
        @Pattern(regexp = RequestPatterns.UUID, message = "Invalid claim ID format")
        String claimId,

        @NotNull(message = "Status must be one of: resolved, rejected, expired")
        @Pattern(regexp = "resolved|rejected|expired", message = "Status must be one of: resolved, rejected, expired")
        String status
) {
}
