package com.certchaperone.backend.modules.identity.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.util.Optional;
import java.util.UUID;

import com.certchaperone.backend.modules.identity.application.IdentityLookupException;
import com.certchaperone.backend.modules.identity.application.IdentityProfile;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class RemoteIdentityProviderTest {

    private static final String BASE_URL = "http://identity.test";
    private static final UUID USER_ID = UUID.fromString("3f0c2f3a-1d0b-4c55-9f0e-6a1f1f2b7d10");

    private MockRestServiceServer server;
    private RemoteIdentityProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader("apikey", "service-key");
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new RemoteIdentityProvider(builder.build());
    }

    @Test
    void returnsProfileFromAdminUserEndpoint() {
        server.expect(requestTo(BASE_URL + "/auth/v1/admin/users/" + USER_ID))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("apikey", "service-key"))
                .andRespond(withSuccess("""
                        {"id":"%s","email":"owner@example.com","user_metadata":{"full_name":"Asha Rao"},"phone":""}
                        """.formatted(USER_ID), MediaType.APPLICATION_JSON));

        Optional<IdentityProfile> profile = provider.findById(USER_ID);

        assertThat(profile).contains(new IdentityProfile(USER_ID, "owner@example.com", "Asha Rao"));
        server.verify();
    }

    @Test
    void unknownUserIsEmpty() {
        server.expect(requestTo(BASE_URL + "/auth/v1/admin/users/" + USER_ID))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThat(provider.findById(USER_ID)).isEmpty();
    }

    @Test
    void userWithoutEmailIsEmpty() {
        server.expect(requestTo(BASE_URL + "/auth/v1/admin/users/" + USER_ID))
                .andRespond(withSuccess("{\"id\":\"" + USER_ID + "\"}", MediaType.APPLICATION_JSON));

        assertThat(provider.findById(USER_ID)).isEmpty();
    }

    @Test
    void serverErrorBecomesLookupException() {
        server.expect(requestTo(BASE_URL + "/auth/v1/admin/users/" + USER_ID))
                .andRespond(withStatus(HttpStatus.BAD_GATEWAY));

        assertThatThrownBy(() -> provider.findById(USER_ID))
                .isInstanceOf(IdentityLookupException.class)
                .hasMessageContaining(USER_ID.toString());
    }

    @Test
    void unauthorizedBecomesLookupException() {
        server.expect(requestTo(BASE_URL + "/auth/v1/admin/users/" + USER_ID))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        assertThatThrownBy(() -> provider.findById(USER_ID)).isInstanceOf(IdentityLookupException.class);
    }
}
