package com.certchaperone.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.certchaperone.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Verifies access tokens issued by the identity service. Tokens are HS256 signed and carry the
 * principal id in {@code sub} and the address in {@code email}.
 */
@Service
public class JwtTokenService {

    private final JwtTokenProvider tokenProvider;
    private final Duration allowedClockSkew;
    private final Clock clock;

    public JwtTokenService(
            JwtTokenProvider tokenProvider,
            @Value("${jwt.allowed-clock-skew:PT30S}") Duration allowedClockSkew,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.allowedClockSkew = allowedClockSkew;
        this.clock = clock;
    }

    public boolean isConfigured() {
        return tokenProvider.getSecretKey().isPresent();
    }

    public ParsedToken parseAccessToken(String token) {
        SecretKey key = tokenProvider.getSecretKey()
                .orElseThrow(() -> new IllegalStateException("jwt.secret is not configured"));
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Access token is empty", null);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .clockSkewSeconds(allowedClockSkew.toSeconds())
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (claims.getSubject() == null) {
                throw new InvalidTokenException("Access token has no subject", null);
            }
            UUID userId = UUID.fromString(claims.getSubject());
            String email = claims.get("email", String.class);
            Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : clock.instant();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : issuedAt;

            return new ParsedToken(
                    userId,
                    email,
                    OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                    OffsetDateTime.ofInstant(expiresAt, clock.getZone())
            );
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(UUID userId, String email, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
