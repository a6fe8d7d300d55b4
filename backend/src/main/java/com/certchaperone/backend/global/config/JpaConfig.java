package com.certchaperone.backend.global.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repositories live under {@code modules}; audit timestamps come from {@link TimeConfig}.
 */
@Configuration
@EnableJpaRepositories(basePackages = "com.certchaperone.backend.modules")
@EnableJpaAuditing(dateTimeProviderRef = TimeConfig.AUDITING_TIME_PROVIDER)
public class JpaConfig {
}
