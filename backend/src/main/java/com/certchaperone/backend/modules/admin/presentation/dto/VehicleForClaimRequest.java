package com.certchaperone.backend.modules.admin.presentation.dto;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public record VehicleForClaimRequest(
        @NotNull(message = "Registration number is required")
        @Size(min = 1, max = 20, message = "Registration number must be 1 to 20 characters")
        String registrationNumber
) {

    public String normalizedRegistrationNumber() {
        return registrationNumber.trim().toUpperCase(Locale.ROOT);
    }
}
