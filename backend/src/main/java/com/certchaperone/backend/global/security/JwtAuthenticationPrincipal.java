package com.certchaperone.backend.global.security;

import java.util.Objects;
import java.util.UUID;

/**
 * The verified caller: token subject and the e-mail claim, which may be absent.
 */
public record JwtAuthenticationPrincipal(UUID userId, String email) {

    public JwtAuthenticationPrincipal {
        Objects.requireNonNull(userId, "userId");
    }
}
