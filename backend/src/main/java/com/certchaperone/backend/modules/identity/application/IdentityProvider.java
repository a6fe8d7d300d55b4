package com.certchaperone.backend.modules.identity.application;

import java.util.Optional;
import java.util.UUID;

/**
 * Looks up account profiles by principal id.
 *
 * <p>Used to make admin listings readable. Results must never feed an authorization decision.
 * Implementations return {@link Optional#empty()} for unknown accounts and throw
 * {@link IdentityLookupException} when the backing service cannot answer.
 */
public interface IdentityProvider {

    Optional<IdentityProfile> findById(UUID principalId);
}
