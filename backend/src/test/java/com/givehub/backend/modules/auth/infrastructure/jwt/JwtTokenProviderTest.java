package com.givehub.backend.modules.auth.infrastructure.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.junit.jupiter.api.Test;

class JwtTokenProviderTest {

    @Test
    void base64SecretIsDecoded() {
        byte[] key = new byte[JwtTokenProvider.MIN_KEY_BYTES];
        for (int i = 0; i < key.length; i++) {
            key[i] = (byte) i;
        }

        JwtTokenProvider provider = new JwtTokenProvider(Base64.getEncoder().encodeToString(key));

        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(key);
        assertThat(provider.getSecretKey().getAlgorithm()).isEqualTo("HmacSHA256");
    }

    @Test
    void plainSecretUsesUtf8Bytes() {
        String secret = "plain-text-secret-that-is-long-enough!";

        JwtTokenProvider provider = new JwtTokenProvider(secret);

        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void base64SecretDecodingToShortKeyFallsBackToRawBytes() {
        String secret = Base64.getEncoder().encodeToString(new byte[24]);

        JwtTokenProvider provider = new JwtTokenProvider(secret);

        assertThat(secret).hasSize(32);
        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(secret.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void secretShorterThan256BitsIsRefused() {
        assertThrows(IllegalStateException.class, () -> new JwtTokenProvider("too-short"));
    }
}
