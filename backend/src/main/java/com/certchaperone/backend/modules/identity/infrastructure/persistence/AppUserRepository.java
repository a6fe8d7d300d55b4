package com.certchaperone.backend.modules.identity.infrastructure.persistence;

import java.util.UUID;

import com.certchaperone.backend.modules.identity.domain.AppUser;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AppUserRepository extends JpaRepository<AppUser, UUID> {
}
