package org.example.playerapi.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import org.example.playerapi.exception.InvalidTokenException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Duration;
import java.util.Date;

/**
 * Issues and verifies the HS256 bearer tokens handed out at login.
 * Tokens are stateless: validity depends only on the signature and the expiry claim.
 */
@Component
public class JwtTokenService {

    // HS256 needs a key of at least 256 bits
    private static final int MIN_SECRET_BYTES = 32;

    private final Key signingKey;
    private final Duration defaultTtl;

    public JwtTokenService(@Value("${player-api.security.jwt.secret}") String secret,
                           @Value("${player-api.security.jwt.expire-minutes:30}") long expireMinutes) {
        byte[] keyBytes = secret == null ? new byte[0] : secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "player-api.security.jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes. Set PLAYER_API_JWT_SECRET.");
        }
        if (expireMinutes <= 0) {
            throw new IllegalStateException("player-api.security.jwt.expire-minutes must be positive");
        }
        this.signingKey = Keys.hmacShaKeyFor(keyBytes);
        this.defaultTtl = Duration.ofMinutes(expireMinutes);
    }

    /**
     * Generate a token for the given subject using the configured lifetime.
     *
     * @param subject the username to embed
     * @return a signed compact JWT
     */
    public String issueToken(String subject) {
        return issueToken(subject, defaultTtl);
    }

    /**
     * Generate a token for the given subject, valid for {@code ttl} from now.
     *
     * @param subject the username to embed
     * @param ttl     lifetime of the token
     * @return a signed compact JWT
     */
    public String issueToken(String subject, Duration ttl) {
        long now = System.currentTimeMillis();
        return Jwts.builder()
                .setSubject(subject)
                .setIssuedAt(new Date(now))
                .setExpiration(new Date(now + ttl.toMillis())) // absolute expiry
                .signWith(signingKey, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Verify a token and return its subject.
     *
     * @param token the compact JWT presented by the client
     * @return the username embedded in the token
     * @throws InvalidTokenException if the signature does not match, the token is malformed or expired,
     *                               or it carries no subject
     */
    public String verifyToken(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Token is empty");
        }
        Claims claims;
        try {
            claims = Jwts.parserBuilder()
                    .setSigningKey(signingKey)
                    .build()
                    .parseClaimsJws(token)
                    .getBody();
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException("Token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token: " + e.getMessage(), e);
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new InvalidTokenException("Token has no subject");
        }
        return subject;
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }
}
