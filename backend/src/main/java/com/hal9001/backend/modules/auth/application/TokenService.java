package com.hal9001.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import com.hal9001.backend.modules.auth.infrastructure.jwt.SigningKeyProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Issues and validates stateless HS256 bearer tokens. Nothing is persisted; a token is
 * valid while its signature checks out and the clock is strictly before its expiry.
 */
@Service
public class TokenService {

    private final SigningKeyProvider keyProvider;
    private final Duration defaultTtl;
    private final Clock clock;

    public TokenService(
            SigningKeyProvider keyProvider,
            @Value("${jwt.expiration:30m}") Duration defaultTtl,
            Clock clock
    ) {
        requirePositive(defaultTtl);
        this.keyProvider = keyProvider;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    public IssuedToken issue(String subject) {
        return issue(subject, defaultTtl);
    }

    public IssuedToken issue(String subject, Duration ttl) {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be blank");
        }
        requirePositive(ttl);

        // JWT NumericDate has second precision
        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = now.plus(ttl).truncatedTo(ChronoUnit.SECONDS);

        String token = Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiresAt))
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(token, subject, now, expiresAt);
    }

    /**
     * @return the subject carried by the token
     * @throws InvalidTokenException for any bad signature, malformed or expired token
     */
    public String validate(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("Invalid access token", null);
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .clock(this::now)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            Date expiration = claims.getExpiration();
            if (subject == null || subject.isBlank() || expiration == null) {
                throw new InvalidTokenException("Invalid access token", null);
            }
            if (!clock.instant().isBefore(expiration.toInstant())) {
                throw new InvalidTokenException("Invalid access token", null);
            }
            return subject;
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    private Date now() {
        return Date.from(clock.instant());
    }

    private static void requirePositive(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("token ttl must be positive");
        }
    }

    public record IssuedToken(String token, String subject, Instant issuedAt, Instant expiresAt) {

        public long expiresInSeconds() {
            return Duration.between(issuedAt, expiresAt).getSeconds();
        }
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
