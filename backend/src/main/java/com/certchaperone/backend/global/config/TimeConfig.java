package com.certchaperone.backend.global.config;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.auditing.DateTimeProvider;

/**
 * One UTC clock for request deadlines, expiry windows, moderation timestamps and JPA auditing.
 */
@Configuration
public class TimeConfig {

    public static final String AUDITING_TIME_PROVIDER = "auditingTimeProvider";

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }

    @Bean(name = AUDITING_TIME_PROVIDER)
    public DateTimeProvider auditingTimeProvider(Clock utcClock) {
        return () -> Optional.of(OffsetDateTime.now(utcClock));
    }
}
