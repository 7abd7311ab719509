package com.skillbridge.mfa.infrastructure.identity;

import com.skillbridge.mfa.domain.mfa.VerifiedIdentity;
import com.skillbridge.mfa.domain.ports.IdentityTokenVerifier;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;
import java.util.Optional;

/**
 * Verifies identity tokens minted by the upstream identity provider: HS256 JWTs signed with a
 * shared secret whose subject is the stable user id.
 */
@Component
public class JwtIdentityTokenVerifier implements IdentityTokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtIdentityTokenVerifier.class);

    private final JwtParser parser;

    public JwtIdentityTokenVerifier(
            @Value("${security.identity.secret}") String secret,
            @Value("${security.identity.issuer}") String issuer,
            Clock clock) {
        this.parser = Jwts.parserBuilder()
                .setSigningKey(Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8)))
                .requireIssuer(issuer)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public Optional<VerifiedIdentity> verify(String idToken) {
        if (idToken == null || idToken.isBlank()) {
            return Optional.empty();
        }
        try {
            Claims claims = parser.parseClaimsJws(idToken).getBody();
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                log.warn("Identity token without subject rejected");
                return Optional.empty();
            }
            return Optional.of(new VerifiedIdentity(
                    subject,
                    claims.get("email", String.class),
                    claims.get("name", String.class)));
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Identity token rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
