package com.certchaperone.backend.modules.admin.presentation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SetVehicleVerificationRequest(
        @NotNull(message = "Invalid vehicle ID format")
        @Pattern(regexp = RequestPatterns.UUID, message = "Invalid vehicle ID format")
        String vehicleId,

        @JsonProperty("isVerified")
        @NotNull(message = "isVerified must be a boolean")
        Boolean isVerified
) {
}
