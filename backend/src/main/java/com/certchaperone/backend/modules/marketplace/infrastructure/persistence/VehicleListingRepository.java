package com.certchaperone.backend.modules.marketplace.infrastructure.persistence;

import java.util.UUID;

import com.certchaperone.backend.modules.marketplace.domain.VehicleListing;

import org.springframework.data.jpa.repository.JpaRepository;

public interface VehicleListingRepository extends JpaRepository<VehicleListing, UUID> {
}
