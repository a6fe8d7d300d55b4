package com.certchaperone.backend.modules.admin.presentation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SuspendUserRequest(
        @NotNull(message = "Invalid user ID format")
        @Pattern(regexp = RequestPatterns.UUID, message = "Invalid user ID format")
        String userId,

        @Size(max = 500, message = "Reason must be at most 500 characters")
        String reason
) {
}
