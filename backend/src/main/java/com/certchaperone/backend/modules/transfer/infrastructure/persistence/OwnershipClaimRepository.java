package com.certchaperone.backend.modules.transfer.infrastructure.persistence;

import java.util.UUID;

import com.certchaperone.backend.modules.transfer.domain.OwnershipClaim;

import org.springframework.data.jpa.repository.JpaRepository;

public interface OwnershipClaimRepository extends JpaRepository<OwnershipClaim, UUID> {
}
