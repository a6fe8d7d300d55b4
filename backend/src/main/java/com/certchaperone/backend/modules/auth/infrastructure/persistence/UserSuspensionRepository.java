package com.certchaperone.backend.modules.auth.infrastructure.persistence;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.certchaperone.backend.modules.auth.domain.UserSuspension;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserSuspensionRepository extends JpaRepository<UserSuspension, UUID> {

    /**
     * Inserts a suspension unless one already exists for the user.
     *
     * @return 1 when the row was inserted, 0 when the user was already suspended
     */
    @Modifying
    @Query(value = """
            INSERT INTO user_suspensions (id, user_id, suspended_at, suspended_by, reason, created_at)
            VALUES (:id, :userId, :suspendedAt, :suspendedBy, :reason, :suspendedAt)
            ON CONFLICT (user_id) DO NOTHING
            """, nativeQuery = true)
    int insertIfAbsent(
            @Param("id") UUID id,
            @Param("userId") UUID userId,
            @Param("suspendedBy") UUID suspendedBy,
            @Param("reason") String reason,
            @Param("suspendedAt") OffsetDateTime suspendedAt
    );

    @Modifying
    @Query("delete from UserSuspension s where s.userId = :userId")
    int deleteByUserId(@Param("userId") UUID userId);

    List<UserSuspension> findByUserIdIn(Collection<UUID> userIds);
}
