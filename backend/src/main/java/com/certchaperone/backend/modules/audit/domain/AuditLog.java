package com.certchaperone.backend.modules.audit.domain;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

/**
 * Admin action against a principal or a claim with no vehicle attached. Rows are only ever
 * inserted, through {@link #of}.
 */
@Entity
@Immutable
@EntityListeners(AuditingEntityListener.class)
@Table(name = "audit_log")
public class AuditLog {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "action_type", nullable = false, updatable = false, length = 64)
    private String actionType;

    @Column(name = "resource_type", nullable = false, updatable = false, length = 64)
    private String resourceType;

    @Column(name = "resource_key", nullable = false, updatable = false, length = 128)
    private String resourceKey;

    @Column(name = "actor_user_id", updatable = false, columnDefinition = "uuid")
    private UUID actorUserId;

    @Column(name = "correlation_id", updatable = false, columnDefinition = "uuid")
    private UUID correlationId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "detail", updatable = false, columnDefinition = "jsonb")
    private Map<String, Object> detail;

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    protected AuditLog() {
    }

    /**
     * Empty detail maps are stored as {@code NULL}.
     */
    public static AuditLog of(String actionType,
                              String resourceType,
                              String resourceKey,
                              UUID actorUserId,
                              UUID correlationId,
                              Map<String, Object> detail) {
        AuditLog entry = new AuditLog();
        entry.actionType = Objects.requireNonNull(actionType, "actionType is required");
        entry.resourceType = Objects.requireNonNull(resourceType, "resourceType is required");
        entry.resourceKey = Objects.requireNonNull(resourceKey, "resourceKey is required");
        entry.actorUserId = actorUserId;
        entry.correlationId = correlationId;
        entry.detail = detail == null || detail.isEmpty() ? null : new HashMap<>(detail);
        return entry;
    }

    public UUID getId() {
        return id;
    }

    public String getActionType() {
        return actionType;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceKey() {
        return resourceKey;
    }

    public UUID getActorUserId() {
        return actorUserId;
    }

    public UUID getCorrelationId() {
        return correlationId;
    }

    public Map<String, Object> getDetail() {
        return detail;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
