package com.openforge.taskmanager.auth;

import com.openforge.taskmanager.auth.dto.TokenResponse;
import com.openforge.taskmanager.domain.User;
import com.openforge.taskmanager.error.UnauthenticatedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and validates HS256 bearer tokens.
 *
 * Payload: sub = user id, iat, exp. Tokens are never stored or revoked;
 * expiry is the only way one stops working.
 */
@Slf4j
@Component
public class TokenService {

    public static final String TOKEN_TYPE = "bearer";

    private final SecretKey key;
    private final Duration  lifetime;
    private final Clock     clock;
    private final JwtParser parser;

    public TokenService(JwtProperties properties, Clock clock) {
        this.key      = Keys.hmacShaKeyFor(properties.secret().getBytes(StandardCharsets.UTF_8));
        this.lifetime = Duration.ofMinutes(properties.expireMinutes());
        this.clock    = clock;
        this.parser   = Jwts.parser()
                .verifyWith(key)
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    /** Mint a signed token for the user. */
    public TokenResponse issue(User user) {
        Instant now = clock.instant();
        String token = Jwts.builder()
                .subject(String.valueOf(user.getId()))
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(lifetime)))
                .signWith(key)
                .compact();
        log.debug("[JWT] Issued token for userId={} ttl={}m", user.getId(), lifetime.toMinutes());
        return new TokenResponse(token, TOKEN_TYPE, lifetime.toSeconds());
    }

    /**
     * Verify signature and expiry and return the user id carried in sub.
     *
     * @throws UnauthenticatedException when the signature is wrong, the token
     *         is expired, or the payload lacks a numeric sub / an exp
     */
    public long validate(String rawToken) {
        Claims claims;
        try {
            claims = parser.parseSignedClaims(rawToken).getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("[JWT] Invalid token: {}", e.getMessage());
            throw invalid();
        }

        if (claims.getExpiration() == null || claims.getSubject() == null) {
            log.debug("[JWT] Token without sub/exp rejected");
            throw invalid();
        }
        try {
            return Long.parseLong(claims.getSubject());
        } catch (NumberFormatException e) {
            log.debug("[JWT] Non-numeric subject: {}", claims.getSubject());
            throw invalid();
        }
    }

    public Duration lifetime() {
        return lifetime;
    }

    private static UnauthenticatedException invalid() {
        return new UnauthenticatedException("Could not validate credentials");
    }
}
