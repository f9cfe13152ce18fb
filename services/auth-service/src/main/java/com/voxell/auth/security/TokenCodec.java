package com.voxell.auth.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * TokenCodec - Issues and verifies the bearer tokens handed to players.
 *
 * JWT Structure (RFC 7519):
 * - Header: Algorithm (HS256) and token type (JWT)
 * - Payload: Subject (player email), issued at, and expiration when enabled
 * - Signature: HMAC-SHA256 using the server secret
 *
 * Clients must treat the token as opaque. Verification checks the signature
 * and, if the token carries one, the exp claim. There is no server-side
 * session: anyone holding the secret can mint a token for any player, so the
 * secret is a trust boundary.
 *
 * Expiration:
 * - A positive {@code expiration} adds exp = iat + expiration
 * - Zero or negative issues tokens without exp; they never expire
 *
 * @see com.voxell.auth.config.SecurityConfig for how the secret is resolved
 */
@Slf4j
public class TokenCodec {

    /** HS256 requires a key of at least 256 bits. */
    public static final int MIN_SECRET_BYTES = 32;

    private final Key signingKey;
    private final Duration expiration;
    private final Clock clock;
    private final JwtParser parser;

    public TokenCodec(String secret, Duration expiration) {
        this(secret, expiration, Clock.systemUTC());
    }

    /**
     * @param secret     HMAC secret, at least {@value #MIN_SECRET_BYTES} bytes in UTF-8
     * @param expiration token lifetime; zero, negative or null disables expiry
     * @param clock      time source for iat/exp and for expiry checks
     * @throws IllegalArgumentException if the secret is too short
     */
    public TokenCodec(String secret, Duration expiration, Clock clock) {
        byte[] keyBytes = secret.getBytes(StandardCharsets.UTF_8);
        if (keyBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalArgumentException(
                    "Token secret must be at least " + MIN_SECRET_BYTES + " bytes, got " + keyBytes.length);
        }
        this.signingKey = Keys.hmacShaKeyFor(keyBytes);
        this.expiration = expiration;
        this.clock = clock;
        this.parser = Jwts.parserBuilder()
                .setSigningKey(signingKey)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    /**
     * Issue a signed token for a player.
     *
     * @param subjectEmail Normalized email of the authenticated player
     * @return Compact JWT string (header.payload.signature)
     */
    public String issue(String subjectEmail) {
        Instant now = clock.instant();
        JwtBuilder builder = Jwts.builder()
                .setSubject(subjectEmail)
                .setIssuedAt(Date.from(now));
        if (expiresTokens()) {
            builder.setExpiration(Date.from(now.plus(expiration)));
        }
        return builder.signWith(signingKey, SignatureAlgorithm.HS256).compact();
    }

    /**
     * Verify a token and extract its subject.
     *
     * Rejected tokens: bad signature, malformed structure, unsigned tokens,
     * elapsed exp, missing or blank subject. Never throws.
     *
     * @param token Compact JWT string as presented by the client
     * @return Subject email, or empty if the token is not acceptable
     */
    public Optional<String> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = parser.parseClaimsJws(token).getBody();
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                log.debug("Rejected token without subject");
                return Optional.empty();
            }
            return Optional.of(subject);
        } catch (RuntimeException e) {
            log.debug("Token verification failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public boolean expiresTokens() {
        return expiration != null && !expiration.isZero() && !expiration.isNegative();
    }
}
