package com.certchaperone.backend.modules.admin.application.enrichment;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.certchaperone.backend.modules.admin.application.AdminRequestContext;
import com.certchaperone.backend.modules.identity.application.IdentityProfile;
import com.certchaperone.backend.modules.identity.application.IdentityProvider;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Maps principal ids to e-mail addresses through the configured {@link IdentityProvider}.
 */
@Component
public class PrincipalEmailResolver {

    public static final String UNKNOWN_EMAIL = "Unknown";

    private final IdentityProvider identityProvider;
    private final BatchEnricher batchEnricher;

    public PrincipalEmailResolver(IdentityProvider identityProvider, BatchEnricher batchEnricher) {
        this.identityProvider = identityProvider;
        this.batchEnricher = batchEnricher;
    }

    /**
     * @return e-mails for the ids that resolved; unresolved ids are absent
     */
    public Map<UUID, String> resolveEmails(Collection<UUID> principalIds, AdminRequestContext context) {
        return batchEnricher.resolve(principalIds, this::lookupEmail, context);
    }

    private Optional<String> lookupEmail(UUID principalId) {
        return identityProvider.findById(principalId)
                .map(IdentityProfile::email)
                .filter(StringUtils::hasText);
    }
}
