package com.certchaperone.backend.modules.admin.presentation.dto;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.certchaperone.backend.modules.vehicle.domain.Vehicle;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Vehicle columns as stored plus the owner's e-mail.
 */
public record AdminVehicleRow(
        UUID id,
        @JsonProperty("user_id") UUID userId,
        @JsonProperty("registration_number") String registrationNumber,
        @JsonProperty("owner_name") String ownerName,
        @JsonProperty("maker_model") String makerModel,
        String manufacturer,
        @JsonProperty("vehicle_class") String vehicleClass,
        @JsonProperty("fuel_type") String fuelType,
        @JsonProperty("registration_date") LocalDate registrationDate,
        @JsonProperty("insurance_company") String insuranceCompany,
        @JsonProperty("insurance_expiry") LocalDate insuranceExpiry,
        @JsonProperty("pucc_valid_upto") LocalDate puccValidUpto,
        @JsonProperty("fitness_valid_upto") LocalDate fitnessValidUpto,
        @JsonProperty("road_tax_valid_upto") LocalDate roadTaxValidUpto,
        @JsonProperty("rc_status") String rcStatus,
        @JsonProperty("is_verified") boolean verified,
        @JsonProperty("verified_at") OffsetDateTime verifiedAt,
        @JsonProperty("created_at") OffsetDateTime createdAt,
        @JsonProperty("updated_at") OffsetDateTime updatedAt,
        String userEmail
) {

    public static AdminVehicleRow from(Vehicle vehicle, String userEmail) {
        return new AdminVehicleRow(
                vehicle.getId(),
                vehicle.getUserId(),
                vehicle.getRegistrationNumber(),
                vehicle.getOwnerName(),
                vehicle.getMakerModel(),
                vehicle.getManufacturer(),
                vehicle.getVehicleClass(),
                vehicle.getFuelType(),
                vehicle.getRegistrationDate(),
                vehicle.getInsuranceCompany(),
                vehicle.getInsuranceExpiry(),
                vehicle.getPuccValidUpto(),
                vehicle.getFitnessValidUpto(),
                vehicle.getRoadTaxValidUpto(),
                vehicle.getRcStatus(),
                vehicle.isVerified(),
                vehicle.getVerifiedAt(),
                vehicle.getCreatedAt(),
                vehicle.getUpdatedAt(),
                userEmail
        );
    }
}
