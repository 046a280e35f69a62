package com.teamchat.auth.service;

import com.teamchat.auth.config.AuthProperties;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.IncorrectClaimException;
import io.jsonwebtoken.security.SignatureException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JwtServiceTest {

    private static final String SECRET = "change-me-please-change-me-please-change-me";
    private final Instant now = Instant.parse("2026-03-01T08:00:00Z");

    @Test
    void issuedToken_ShouldYieldSubject() {
        JwtService jwt = new JwtService(new AuthProperties("team-chat-idp", SECRET, 600), Clock.fixed(now, ZoneOffset.UTC));

        String token = jwt.issueAccessToken("auth0|alice");

        assertEquals("auth0|alice", jwt.subjectOf(token));
    }

    @Test
    void expiredToken_ShouldBeRejected() {
        AuthProperties props = new AuthProperties("team-chat-idp", SECRET, 60);
        String token = new JwtService(props, Clock.fixed(now, ZoneOffset.UTC)).issueAccessToken("auth0|alice");
        JwtService later = new JwtService(props, Clock.fixed(now.plus(Duration.ofMinutes(5)), ZoneOffset.UTC));

        assertThrows(ExpiredJwtException.class, () -> later.subjectOf(token));
    }

    @Test
    void tokenFromOtherIssuer_ShouldBeRejected() {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        String token = new JwtService(new AuthProperties("someone-else", SECRET, 600), clock).issueAccessToken("x");
        JwtService jwt = new JwtService(new AuthProperties("team-chat-idp", SECRET, 600), clock);

        assertThrows(IncorrectClaimException.class, () -> jwt.subjectOf(token));
    }

    @Test
    void tokenSignedWithOtherKey_ShouldBeRejected() {
        Clock clock = Clock.fixed(now, ZoneOffset.UTC);
        String token = new JwtService(new AuthProperties("team-chat-idp", SECRET + "-other", 600), clock)
                .issueAccessToken("x");
        JwtService jwt = new JwtService(new AuthProperties("team-chat-idp", SECRET, 600), clock);

        assertThrows(SignatureException.class, () -> jwt.subjectOf(token));
    }
}
