package com.skillbridge.mfa.infrastructure.mfa;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbridge.mfa.config.MfaProperties;
import com.skillbridge.mfa.domain.mfa.ChallengePurpose;
import com.skillbridge.mfa.infrastructure.encryption.SecretCipher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.Optional;

/**
 * Stateless challenge tokens bridging the two login steps.
 * <p>
 * The token is the encrypted payload itself; nothing is stored server-side, so a captured token
 * stays usable until it expires. Validity is bounded by age only.
 */
@Service
public class ChallengeTokenService {

    private static final Logger log = LoggerFactory.getLogger(ChallengeTokenService.class);

    private static final int NONCE_BYTES = 32;

    private final SecretCipher cipher;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration defaultMaxAge;
    private final SecureRandom secureRandom;

    public ChallengeTokenService(SecretCipher cipher, ObjectMapper objectMapper, Clock clock, MfaProperties properties) {
        this.cipher = cipher;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultMaxAge = Duration.ofMinutes(properties.getChallenge().getMaxAgeMinutes());
        this.secureRandom = new SecureRandom();
    }

    public String issueToken(String userId, ChallengePurpose purpose) {
        return issueToken(userId, null, purpose);
    }

    /**
     * Issues a token that also carries the email of the verified identity, so the session minted
     * after step two can be labelled with it.
     */
    public String issueToken(String userId, String email, ChallengePurpose purpose) {
        byte[] nonce = new byte[NONCE_BYTES];
        secureRandom.nextBytes(nonce);

        ChallengePayload payload = new ChallengePayload(
                userId,
                email,
                purpose.name(),
                clock.instant().getEpochSecond(),
                Base64.getUrlEncoder().withoutPadding().encodeToString(nonce));
        try {
            // SecretCipher output is already URL-safe
            return cipher.encrypt(objectMapper.writeValueAsBytes(payload));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize challenge payload", e);
        }
    }

    public Optional<String> verifyToken(String token, ChallengePurpose purpose) {
        return verifyToken(token, purpose, defaultMaxAge);
    }

    /**
     * Returns the user id the token was issued to, or empty if it is malformed, tampered with,
     * issued for another purpose or older than {@code maxAge}.
     */
    public Optional<String> verifyToken(String token, ChallengePurpose purpose, Duration maxAge) {
        return readToken(token, purpose, maxAge).map(ChallengePayload::userId);
    }

    public Optional<ChallengePayload> readToken(String token, ChallengePurpose purpose) {
        return readToken(token, purpose, defaultMaxAge);
    }

    public Optional<ChallengePayload> readToken(String token, ChallengePurpose purpose, Duration maxAge) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        ChallengePayload payload;
        try {
            payload = objectMapper.readValue(cipher.decrypt(token), ChallengePayload.class);
        } catch (SecretCipher.InvalidCiphertextException | IOException e) {
            log.debug("Rejected challenge token: {}", e.getMessage());
            return Optional.empty();
        }

        if (payload == null || payload.userId() == null || payload.userId().isBlank()
                || !purpose.name().equals(payload.purpose())) {
            return Optional.empty();
        }

        long age = clock.instant().getEpochSecond() - payload.issuedAt();
        if (age > maxAge.getSeconds()) {
            log.debug("Challenge token for user {} expired {}s ago", payload.userId(), age - maxAge.getSeconds());
            return Optional.empty();
        }
        return Optional.of(payload);
    }

    public record ChallengePayload(String userId, String email, String purpose, long issuedAt, String nonce) {}
}
