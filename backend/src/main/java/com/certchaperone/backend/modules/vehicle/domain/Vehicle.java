package com.certchaperone.backend.modules.vehicle.domain;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

import com.certchaperone.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

@Entity
@Table(name = "vehicles")
public class Vehicle extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "user_id", nullable = false, columnDefinition = "uuid")
    private UUID userId;

    @Column(name = "registration_number", nullable = false)
    private String registrationNumber;

    @Column(name = "owner_name")
    private String ownerName;

    @Column(name = "vehicle_class")
    private String vehicleClass;

    @Column(name = "fuel_type")
    private String fuelType;

    @Column(name = "maker_model")
    private String makerModel;

    @Column(name = "manufacturer")
    private String manufacturer;

    @Column(name = "registration_date")
    private LocalDate registrationDate;

    @Column(name = "insurance_company")
    private String insuranceCompany;

    @Column(name = "insurance_expiry")
    private LocalDate insuranceExpiry;

    @Column(name = "pucc_valid_upto")
    private LocalDate puccValidUpto;

    @Column(name = "fitness_valid_upto")
    private LocalDate fitnessValidUpto;

    @Column(name = "road_tax_valid_upto")
    private LocalDate roadTaxValidUpto;

    @Column(name = "rc_status")
    private String rcStatus;

    @Column(name = "is_verified")
    private Boolean verified;

    @Column(name = "verified_at")
    private OffsetDateTime verifiedAt;

    /**
     * Sets the verification flag. Verifying stamps {@code verifiedAt}; un-verifying clears it.
     */
    public void applyVerification(boolean verified, OffsetDateTime now) {
        this.verified = verified;
        this.verifiedAt = verified ? now : null;
        markUpdated(now);
    }

    public boolean isVerified() {
        return Boolean.TRUE.equals(verified);
    }

    public UUID getId() {
        return id;
    }

    public UUID getUserId() {
        return userId;
    }

    public void setUserId(UUID userId) {
        this.userId = userId;
    }

    public String getRegistrationNumber() {
        return registrationNumber;
    }

    public void setRegistrationNumber(String registrationNumber) {
        this.registrationNumber = registrationNumber;
    }

    public String getOwnerName() {
        return ownerName;
    }

    public void setOwnerName(String ownerName) {
        this.ownerName = ownerName;
    }

    public String getVehicleClass() {
        return vehicleClass;
    }

    public void setVehicleClass(String vehicleClass) {
        this.vehicleClass = vehicleClass;
    }

    public String getFuelType() {
        return fuelType;
    }

    public void setFuelType(String fuelType) {
        this.fuelType = fuelType;
    }

    public String getMakerModel() {
        return makerModel;
    }

    public void setMakerModel(String makerModel) {
        this.makerModel = makerModel;
    }

    public String getManufacturer() {
        return manufacturer;
    }

    public void setManufacturer(String manufacturer) {
        this.manufacturer = manufacturer;
    }

    public LocalDate getRegistrationDate() {
        return registrationDate;
    }

    public void setRegistrationDate(LocalDate registrationDate) {
        this.registrationDate = registrationDate;
    }

    public String getInsuranceCompany() {
        return insuranceCompany;
    }

    public void setInsuranceCompany(String insuranceCompany) {
        this.insuranceCompany = insuranceCompany;
    }

    public LocalDate getInsuranceExpiry() {
        return insuranceExpiry;
    }

    public void setInsuranceExpiry(LocalDate insuranceExpiry) {
        this.insuranceExpiry = insuranceExpiry;
    }

    public LocalDate getPuccValidUpto() {
        return puccValidUpto;
    }

    public void setPuccValidUpto(LocalDate puccValidUpto) {
        this.puccValidUpto = puccValidUpto;
    }

    public LocalDate getFitnessValidUpto() {
        return fitnessValidUpto;
    }

    public void setFitnessValidUpto(LocalDate fitnessValidUpto) {
        this.fitnessValidUpto = fitnessValidUpto;
    }

    public LocalDate getRoadTaxValidUpto() {
        return roadTaxValidUpto;
    }

    public void setRoadTaxValidUpto(LocalDate roadTaxValidUpto) {
        this.roadTaxValidUpto = roadTaxValidUpto;
    }

    public String getRcStatus() {
        return rcStatus;
    }

    public void setRcStatus(String rcStatus) {
        this.rcStatus = rcStatus;
    }

    public OffsetDateTime getVerifiedAt() {
        return verifiedAt;
    }
}
