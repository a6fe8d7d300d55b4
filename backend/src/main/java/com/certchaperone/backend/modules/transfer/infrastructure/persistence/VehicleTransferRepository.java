package com.certchaperone.backend.modules.transfer.infrastructure.persistence;

import java.util.UUID;

import com.certchaperone.backend.modules.transfer.domain.VehicleTransfer;

import org.springframework.data.jpa.repository.JpaRepository;

public interface VehicleTransferRepository extends JpaRepository<VehicleTransfer, UUID> {
}
