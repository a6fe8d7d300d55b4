package com.certchaperone.backend.modules.auth.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.certchaperone.backend.modules.auth.domain.AppRole;
import com.certchaperone.backend.modules.auth.domain.UserRole;

import org.springframework.data.jpa.repository.JpaRepository;

public interface UserRoleRepository extends JpaRepository<UserRole, UUID> {

    boolean existsByUserIdAndRole(UUID userId, AppRole role);

    List<UserRole> findByUserId(UUID userId);
}
