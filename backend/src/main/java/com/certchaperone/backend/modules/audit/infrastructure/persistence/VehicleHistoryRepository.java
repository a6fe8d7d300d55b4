package com.certchaperone.backend.modules.audit.infrastructure.persistence;

import java.util.UUID;

import com.certchaperone.backend.modules.audit.domain.VehicleHistoryEvent;

import org.springframework.data.jpa.repository.JpaRepository;

public interface VehicleHistoryRepository extends JpaRepository<VehicleHistoryEvent, UUID> {
}
