package com.givehub.backend.modules.auth.infrastructure.jwt;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Holds the HS256 signing key for GiveHub access tokens.
 *
 * <p>{@code jwt.secret} is read as Base64 when it decodes to at least 256 bits. Any other value
 * is used as raw UTF-8 bytes. Secrets shorter than 256 bits fail startup.
 */
@Component
public class JwtTokenProvider {

    static final int MIN_KEY_BYTES = 32;
    private static final String ALGORITHM = "HmacSHA256";

    private final SecretKey signingKey;

    public JwtTokenProvider(@Value("${jwt.secret}") String secret) {
        this.signingKey = new SecretKeySpec(resolveKeyMaterial(secret), ALGORITHM);
    }

    public SecretKey getSecretKey() {
        return signingKey;
    }

    private static byte[] resolveKeyMaterial(String secret) {
        byte[] decoded = decodeBase64(secret);
        if (decoded != null && decoded.length >= MIN_KEY_BYTES) {
            return decoded;
        }
        byte[] raw = secret.getBytes(StandardCharsets.UTF_8);
        if (raw.length < MIN_KEY_BYTES) {
            throw new IllegalStateException("jwt.secret must provide at least 256 bits of key material");
        }
        return raw;
    }

    private static byte[] decodeBase64(String secret) {
        try {
            return Base64.getDecoder().decode(secret);
        } catch (IllegalArgumentException ex) {
            // not Base64; raw bytes are used
            return null;
        }
    }
}
