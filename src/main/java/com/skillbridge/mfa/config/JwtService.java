package com.skillbridge.mfa.config;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;

/**
 * Issues and reads the bearer access tokens handed out once a login reaches SESSION_ESTABLISHED.
 */
@Component
public class JwtService {

    private static final Logger log = LoggerFactory.getLogger(JwtService.class);

    private final Key key;
    private final long ttlSeconds;
    private final Clock clock;

    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.ttl-seconds:3600}") long ttlSeconds,
            Clock clock) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.ttlSeconds = ttlSeconds;
        this.clock = clock;
        log.info("JWT service initialized with TTL: {} seconds", ttlSeconds);
    }

    public long getTtlSeconds() {
        return ttlSeconds;
    }

    /* ------------------------ token creation ------------------------ */

    public String generateToken(String userId, String email) {
        Instant now = clock.instant();

        log.debug("Generating access token for user: {}", userId);

        return Jwts.builder()
                .setSubject(userId)
                .setIssuedAt(Date.from(now))
                .setExpiration(Date.from(now.plusSeconds(ttlSeconds)))
                .claim("email", email)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /* ------------------------ token parsing ------------------------ */

    public Jws<Claims> parse(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(key)
                .setClock(() -> Date.from(clock.instant()))
                .build()
                .parseClaimsJws(token);
    }

    public Optional<String> getSubject(String token) {
        try {
            return Optional.ofNullable(parse(token).getBody().getSubject());
        } catch (Exception e) {
            log.warn("Failed to extract subject from token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<String> getEmail(String token) {
        try {
            return Optional.ofNullable(parse(token).getBody().get("email", String.class));
        } catch (Exception e) {
            log.debug("Failed to extract email from token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
