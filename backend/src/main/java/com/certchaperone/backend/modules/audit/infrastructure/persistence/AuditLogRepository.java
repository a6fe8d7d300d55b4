package com.certchaperone.backend.modules.audit.infrastructure.persistence;

import java.util.UUID;

import com.certchaperone.backend.modules.audit.domain.AuditLog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {
}
