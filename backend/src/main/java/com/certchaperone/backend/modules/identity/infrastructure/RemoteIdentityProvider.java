package com.certchaperone.backend.modules.identity.infrastructure;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.certchaperone.backend.modules.identity.application.IdentityLookupException;
import com.certchaperone.backend.modules.identity.application.IdentityProfile;
import com.certchaperone.backend.modules.identity.application.IdentityProvider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Resolves profiles through the identity service admin API ({@code GET /auth/v1/admin/users/{id}}).
 */
@Component
@ConditionalOnProperty(name = "app.identity.provider", havingValue = "remote")
public class RemoteIdentityProvider implements IdentityProvider {

    private final RestClient restClient;

    public RemoteIdentityProvider(@Qualifier(IdentityClientConfig.IDENTITY_REST_CLIENT) RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public Optional<IdentityProfile> findById(UUID principalId) {
        try {
            AdminUserPayload payload = restClient.get()
                    .uri("/auth/v1/admin/users/{id}", principalId)
                    .retrieve()
                    .body(AdminUserPayload.class);
            if (payload == null || payload.email() == null) {
                return Optional.empty();
            }
            return Optional.of(new IdentityProfile(principalId, payload.email(), payload.displayName()));
        } catch (HttpClientErrorException ex) {
            if (ex.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                return Optional.empty();
            }
            throw new IdentityLookupException("Identity service rejected lookup for " + principalId, ex);
        } catch (RestClientException ex) {
            throw new IdentityLookupException("Identity service lookup failed for " + principalId, ex);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record AdminUserPayload(
            String id,
            String email,
            @JsonProperty("user_metadata") Map<String, Object> userMetadata
    ) {
        String displayName() {
            if (userMetadata == null) {
                return null;
            }
            Object name = userMetadata.get("full_name");
            return name != null ? name.toString() : null;
        }
    }
}
