package com.certchaperone.backend.modules.admin.presentation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UpdateListingStatusRequest(
        @NotNull(message = "Invalid listing ID format")
        @Pattern(regexp = RequestPatterns.UUID, message = "Invalid listing ID format")
        String listingId,

        @NotNull(message = "Status must be one of: approved, rejected, on_hold")
        @Pattern(regexp = "approved|rejected|on_hold", message = "Status must be one of: approved, rejected, on_hold")
        String status,

        @Size(max = 1000, message = "Admin notes must be at most 1000 characters")
        String adminNotes
) {
}
