package com.certchaperone.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Checks required configuration once the application is ready.
 *
 * <p>A missing signing secret does not stop the application: requests are answered with
 * {@code CONFIG_ERROR} until it is supplied. Everything reported here is logged at error level.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "app.cors.allowed-origins"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = findProblems();
        if (problems.isEmpty()) {
            log.info("Environment validation passed");
            return;
        }
        problems.forEach(problem -> log.error("Environment validation failed: {}", problem));
    }

    List<String> findProblems() {
        List<String> problems = new ArrayList<>();
        for (String key : REQUIRED_KEYS) {
            String value = Optional.ofNullable(environment.getProperty(key)).map(String::trim).orElse("");
            if (value.isEmpty()) {
                problems.add(key + " is missing");
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .map(String::trim)
                .filter(secret -> !secret.isEmpty() && secret.length() < 32)
                .ifPresent(secret -> problems.add("jwt.secret must be at least 32 characters"));

        String provider = environment.getProperty("app.identity.provider", "directory");
        if ("remote".equalsIgnoreCase(provider)) {
            for (String key : List.of("app.identity.remote.base-url", "app.identity.remote.service-key")) {
                if (Optional.ofNullable(environment.getProperty(key)).map(String::isBlank).orElse(true)) {
                    problems.add(key + " is required when app.identity.provider=remote");
                }
            }
        }
        return problems;
    }
}
