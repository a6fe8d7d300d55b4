package com.certchaperone.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.AfterEach;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Shared PostgreSQL container for DB-backed integration tests. Flyway migrates the schema when the
 * application context starts; every table is emptied after each test.
 */
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractPostgresIntegrationTest {

    @Container
    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("certchaperone_test")
            .withUsername("certchaperone")
            .withPassword("certchaperone");

    private static final String TRUNCATE_ALL = """
            TRUNCATE TABLE
                vehicle_listings,
                ownership_claims,
                vehicle_transfers,
                audit_log,
                vehicle_history,
                documents,
                vehicles,
                user_suspensions,
                user_role,
                app_user
            """;

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("jwt.secret", () -> TestTokens.SECRET);
        registry.add("app.identity.provider", () -> "directory");
    }

    @AfterEach
    void truncateTables() {
        try (Connection connection = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
             Statement stmt = connection.createStatement()) {
            stmt.execute(TRUNCATE_ALL);
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to reset tables after test", ex);
        }
    }
}
