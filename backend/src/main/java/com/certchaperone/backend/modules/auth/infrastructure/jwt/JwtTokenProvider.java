package com.certchaperone.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the HMAC key shared with the identity service that issues access tokens.
 * An empty secret leaves the provider unconfigured instead of failing startup.
 */
@Component
public class JwtTokenProvider {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret:}") String secretString) {
        this.secretKey = toKey(secretString);
    }

    public Optional<SecretKey> getSecretKey() {
        return Optional.ofNullable(secretKey);
    }

    private static SecretKey toKey(String secretString) {
        if (secretString == null || secretString.isBlank()) {
            return null;
        }
        String trimmed = secretString.trim();
        byte[] keyBytes;
        try {
            keyBytes = Base64.getDecoder().decode(trimmed);
        } catch (IllegalArgumentException ex) {
            keyBytes = trimmed.getBytes(StandardCharsets.UTF_8);
        }
        return new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }
}
