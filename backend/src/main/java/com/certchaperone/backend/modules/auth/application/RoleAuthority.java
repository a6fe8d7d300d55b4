package com.certchaperone.backend.modules.auth.application;

import java.util.Objects;
import java.util.UUID;

import com.certchaperone.backend.global.error.ErrorCode;
import com.certchaperone.backend.global.error.ProblemException;
import com.certchaperone.backend.modules.auth.domain.AppRole;
import com.certchaperone.backend.modules.auth.infrastructure.persistence.UserRoleRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Answers whether a principal holds a role. Every call reads {@code user_role}; nothing is cached
 * between requests.
 *
 * <p>A failed lookup is never read as "no role": it surfaces as {@link ErrorCode#ROLE_CHECK_FAILED}.
 */
@Service
public class RoleAuthority {

    private static final Logger log = LoggerFactory.getLogger(RoleAuthority.class);

    private final UserRoleRepository userRoleRepository;

    public RoleAuthority(UserRoleRepository userRoleRepository) {
        this.userRoleRepository = userRoleRepository;
    }

    @Transactional(readOnly = true)
    public boolean hasRole(UUID principalId, AppRole role) {
        Objects.requireNonNull(principalId, "principalId");
        Objects.requireNonNull(role, "role");
        try {
            return userRoleRepository.existsByUserIdAndRole(principalId, role);
        } catch (DataAccessException ex) {
            log.error("Role check error for principal {} and role {}", principalId, role.getCode(), ex);
            throw new ProblemException(ErrorCode.ROLE_CHECK_FAILED, "Authorization check failed", null, ex);
        }
    }

    public void requireRole(UUID principalId, AppRole role) {
        if (!hasRole(principalId, role)) {
            throw new ProblemException(ErrorCode.FORBIDDEN, "Forbidden - Admin access required");
        }
    }
}
