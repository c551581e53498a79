package com.openforge.taskmanager.auth;

import com.openforge.taskmanager.auth.dto.TokenResponse;
import com.openforge.taskmanager.domain.User;
import com.openforge.taskmanager.error.ErrorKind;
import com.openforge.taskmanager.error.UnauthenticatedException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

class TokenServiceTest {

    private static final String  SECRET = "unit-test-secret-key-that-is-long-enough-for-hs256";
    private static final Instant NOW    = Instant.parse("2026-03-01T12:00:00Z");

    private static TokenService service(String secret, Instant at, int minutes) {
        return new TokenService(new JwtProperties(secret, minutes), Clock.fixed(at, ZoneOffset.UTC));
    }

    private static User user(long id) {
        User user = new User();
        user.setId(id);
        return user;
    }

    @Test
    void issuedTokenValidatesToItsUser() {
        TokenService tokens = service(SECRET, NOW, 30);
        TokenResponse issued = tokens.issue(user(42));

        assertEquals("bearer", issued.tokenType());
        assertEquals(30 * 60, issued.expiresIn());
        assertEquals(42L, tokens.validate(issued.accessToken()));
    }

    @Test
    void tokenStillValidJustBeforeExpiry() {
        String token = service(SECRET, NOW, 30).issue(user(7)).accessToken();
        TokenService later = service(SECRET, NOW.plus(Duration.ofMinutes(29)), 30);
        assertEquals(7L, later.validate(token));
    }

    @Test
    void expiredTokenIsRejected() {
        String token = service(SECRET, NOW, 30).issue(user(7)).accessToken();
        TokenService later = service(SECRET, NOW.plus(Duration.ofMinutes(30)).plusSeconds(1), 30);

        UnauthenticatedException ex = assertThrows(UnauthenticatedException.class, () -> later.validate(token));
        assertEquals(ErrorKind.UNAUTHENTICATED, ex.getKind());
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        String token = service("another-secret-key-that-is-also-long-enough-!!", NOW, 30)
                .issue(user(7)).accessToken();
        assertThrows(UnauthenticatedException.class, () -> service(SECRET, NOW, 30).validate(token));
    }

    @Test
    void garbageIsRejected() {
        TokenService tokens = service(SECRET, NOW, 30);
        assertThrows(UnauthenticatedException.class, () -> tokens.validate("invalid_token"));
        assertThrows(UnauthenticatedException.class, () -> tokens.validate(""));
    }

    @Test
    void tokenWithoutNumericSubjectIsRejected() {
        String token = Jwts.builder()
                .subject("alice")
                .issuedAt(Date.from(NOW))
                .expiration(Date.from(NOW.plusSeconds(600)))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
        assertThrows(UnauthenticatedException.class, () -> service(SECRET, NOW, 30).validate(token));
    }

    @Test
    void tokenWithoutExpiryIsRejected() {
        String token = Jwts.builder()
                .subject("7")
                .issuedAt(Date.from(NOW))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)))
                .compact();
        assertThrows(UnauthenticatedException.class, () -> service(SECRET, NOW, 30).validate(token));
    }
}
