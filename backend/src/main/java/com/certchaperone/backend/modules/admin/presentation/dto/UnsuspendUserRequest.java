package com.certchaperone.backend.modules.admin.presentation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UnsuspendUserRequest(
        @NotNull(message = "Invalid user ID format")
        @Pattern(regexp = RequestPatterns.UUID, message = "Invalid user ID format")
        String userId
) {
}
