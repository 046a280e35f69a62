package com.teamchat.auth.service;

import com.teamchat.auth.config.AuthProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * 校验身份提供方签发的 accessToken，并取出 subject。
 *
 * <p>消息核心本身不负责登录；{@link #issueAccessToken(String)} 只给测试和运维工具用。</p>
 */
@Service
public class JwtService {

    private final AuthProperties props;
    private final SecretKey key;
    private final Clock clock;

    public JwtService(AuthProperties props, Clock clock) {
        this.props = props;
        this.key = Keys.hmacShaKeyFor(props.jwtSecret().getBytes(StandardCharsets.UTF_8));
        this.clock = clock;
    }

    public String issueAccessToken(String subject) {
        Instant now = clock.instant();
        Instant exp = now.plusSeconds(props.accessTokenTtlSecondsEffective());
        return Jwts.builder()
                .issuer(props.issuer())
                .subject(subject)
                .id(UUID.randomUUID().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(exp))
                .signWith(key)
                .compact();
    }

    /**
     * 校验签名、issuer、过期时间。
     */
    public Jws<Claims> parseAccessToken(String token) {
        JwtParser parser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(props.issuer())
                .clock(() -> Date.from(clock.instant()))
                .build();
        return parser.parseSignedClaims(token);
    }

    public String getSubject(Claims claims) {
        String sub = claims.getSubject();
        if (sub == null || sub.isBlank()) {
            throw new JwtException("missing_subject");
        }
        return sub;
    }

    /**
     * parse + getSubject。
     */
    public String subjectOf(String token) {
        return getSubject(parseAccessToken(token).getPayload());
    }
}
