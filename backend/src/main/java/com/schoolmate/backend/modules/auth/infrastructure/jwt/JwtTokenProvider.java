package com.schoolmate.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * HMAC key shared with the identity service that signs administrator and platform access tokens.
 * <p>
 * The secret may be Base64 or plain text. Either way it must yield at least 256 bits, the HS256
 * minimum; a shorter key stops the application at startup instead of failing every request.
 */
@Component
public class JwtTokenProvider {

    static final int MIN_KEY_BYTES = 32;
    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKey secretKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secretString) {
        if (secretString == null || secretString.isBlank()) {
            throw new IllegalStateException("jwt.secret must be set");
        }
        byte[] keyBytes = decode(secretString.trim());
        if (keyBytes.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must provide at least " + MIN_KEY_BYTES
                    + " bytes of key material, got " + keyBytes.length);
        }
        this.secretKey = new SecretKeySpec(keyBytes, HMAC_SHA_256);
    }

    private static byte[] decode(String secret) {
        try {
            return Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            return secret.getBytes(StandardCharsets.UTF_8);
        }
    }

    public SecretKey getSecretKey() {
        return secretKey;
    }
}
