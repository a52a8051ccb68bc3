package org.example.playerapi.security;

import org.example.playerapi.exception.InvalidTokenException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JwtTokenServiceTest {

    private static final String SECRET = "test-signing-key-that-is-at-least-32-bytes-long";

    private final JwtTokenService tokens = new JwtTokenService(SECRET, 30);

    @Test
    void issuedTokenVerifiesToItsSubject() {
        String token = tokens.issueToken("alice");

        assertThat(tokens.verifyToken(token)).isEqualTo("alice");
    }

    @Test
    void defaultLifetimeComesFromConfiguration() {
        assertThat(new JwtTokenService(SECRET, 45).getDefaultTtl()).isEqualTo(Duration.ofMinutes(45));
    }

    @Test
    void expiredTokenIsRejected() {
        String token = tokens.issueToken("alice", Duration.ofMinutes(-1));

        assertThatThrownBy(() -> tokens.verifyToken(token))
                .isInstanceOf(InvalidTokenException.class)
                .hasMessageContaining("expired");
    }

    @Test
    void tamperedPayloadIsRejected() {
        String token = tokens.issueToken("alice");
        String[] parts = token.split("\\.");
        String payload = parts[1];
        int i = payload.length() / 2;
        String tampered = parts[0] + "." + payload.substring(0, i) + flip(payload.charAt(i))
                + payload.substring(i + 1) + "." + parts[2];

        assertThatThrownBy(() -> tokens.verifyToken(tampered)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tamperedSignatureIsRejected() {
        String token = tokens.issueToken("alice");
        int i = token.lastIndexOf('.') + 1;
        String tampered = token.substring(0, i) + flip(token.charAt(i)) + token.substring(i + 1);

        assertThatThrownBy(() -> tokens.verifyToken(tampered)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        JwtTokenService other = new JwtTokenService("another-signing-key-that-is-also-32-bytes", 30);
        String token = other.issueToken("alice");

        assertThatThrownBy(() -> tokens.verifyToken(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void malformedAndBlankTokensAreRejected() {
        assertThatThrownBy(() -> tokens.verifyToken("not-a-jwt")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> tokens.verifyToken("")).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> tokens.verifyToken(null)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void shortSecretFailsFast() {
        assertThatThrownBy(() -> new JwtTokenService("too-short", 30))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("at least 32 bytes");
    }

    private static char flip(char c) {
        return c == 'A' ? 'B' : 'A';
    }
}
