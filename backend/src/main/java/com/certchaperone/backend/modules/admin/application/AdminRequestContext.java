package com.certchaperone.backend.modules.admin.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Per-request facts every admin handler may need: who is acting, under which correlation id and
 * until when the request may keep working.
 */
public record AdminRequestContext(
        UUID requestId,
        UUID actorId,
        String actorEmail,
        Instant startedAt,
        Instant deadline
) {

    public AdminRequestContext {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(actorId, "actorId");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(deadline, "deadline");
    }

    public static AdminRequestContext start(UUID requestId, UUID actorId, String actorEmail,
                                            Clock clock, Duration timeout) {
        Instant now = clock.instant();
        return new AdminRequestContext(requestId, actorId, actorEmail, now, now.plus(timeout));
    }

    public Duration remaining(Clock clock) {
        Duration left = Duration.between(clock.instant(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isExpired(Clock clock) {
        return !clock.instant().isBefore(deadline);
    }

    public long elapsedMillis(Clock clock) {
        return Duration.between(startedAt, clock.instant()).toMillis();
    }
}
