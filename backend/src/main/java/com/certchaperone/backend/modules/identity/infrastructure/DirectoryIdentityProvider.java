package com.certchaperone.backend.modules.identity.infrastructure;

import java.util.Optional;
import java.util.UUID;

import com.certchaperone.backend.modules.identity.application.IdentityLookupException;
import com.certchaperone.backend.modules.identity.application.IdentityProfile;
import com.certchaperone.backend.modules.identity.application.IdentityProvider;
import com.certchaperone.backend.modules.identity.infrastructure.persistence.AppUserRepository;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Reads profiles from the local {@code app_user} directory table.
 */
@Component
@ConditionalOnProperty(name = "app.identity.provider", havingValue = "directory", matchIfMissing = true)
public class DirectoryIdentityProvider implements IdentityProvider {

    private final AppUserRepository appUserRepository;

    public DirectoryIdentityProvider(AppUserRepository appUserRepository) {
        this.appUserRepository = appUserRepository;
    }

    @Override
    public Optional<IdentityProfile> findById(UUID principalId) {
        try {
            return appUserRepository.findById(principalId)
                    .map(user -> new IdentityProfile(user.getId(), user.getEmail(), user.getDisplayName()));
        } catch (DataAccessException ex) {
            throw new IdentityLookupException("Directory lookup failed for " + principalId, ex);
        }
    }
}
