package com.certchaperone.backend.global.jpa;

import java.time.OffsetDateTime;

import jakarta.persistence.Column;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;

import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

/**
 * Base for tables carrying {@code created_at} / {@code updated_at}. {@code created_at} comes from JPA
 * auditing on insert. {@code updated_at} moves only when a domain method calls {@link #markUpdated},
 * so it matches the timestamp recorded for the admin decision.
 */
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class AbstractTimestampedEntity {

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @PrePersist
    void initializeUpdatedAt() {
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    protected void markUpdated(OffsetDateTime at) {
        this.updatedAt = at;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
