package com.certchaperone.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void completeEnvironmentHasNoProblems() {
        MockEnvironment environment = baseEnvironment();

        assertThat(new EnvironmentValidator(environment).findProblems()).isEmpty();
    }

    @Test
    void reportsMissingAndShortSecrets() {
        MockEnvironment missing = baseEnvironment().withProperty("jwt.secret", "  ");
        MockEnvironment tooShort = baseEnvironment().withProperty("jwt.secret", "short-secret");

        assertThat(new EnvironmentValidator(missing).findProblems()).containsExactly("jwt.secret is missing");
        assertThat(new EnvironmentValidator(tooShort).findProblems())
                .containsExactly("jwt.secret must be at least 32 characters");
    }

    @Test
    void remoteIdentityProviderRequiresEndpointAndKey() {
        MockEnvironment environment = baseEnvironment()
                .withProperty("app.identity.provider", "remote")
                .withProperty("app.identity.remote.base-url", "https://identity.example.com");

        assertThat(new EnvironmentValidator(environment).findProblems())
                .containsExactly("app.identity.remote.service-key is required when app.identity.provider=remote");
    }

    private static MockEnvironment baseEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/certchaperone")
                .withProperty("jwt.secret", "0123456789abcdef0123456789abcdef")
                .withProperty("app.cors.allowed-origins", "http://localhost:5173");
    }
}
