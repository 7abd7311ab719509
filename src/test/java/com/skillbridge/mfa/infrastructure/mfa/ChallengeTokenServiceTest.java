package com.skillbridge.mfa.infrastructure.mfa;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbridge.mfa.config.MfaProperties;
import com.skillbridge.mfa.domain.mfa.ChallengePurpose;
import com.skillbridge.mfa.infrastructure.encryption.SecretCipher;
import com.skillbridge.mfa.support.MutableClock;
import com.skillbridge.mfa.support.TestFixtures;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ChallengeTokenServiceTest {

    private static MfaProperties properties;
    private static SecretCipher cipher;

    private MutableClock clock;
    private ChallengeTokenService tokens;

    @BeforeAll
    static void setUpCipher() {
        properties = TestFixtures.properties();
        cipher = TestFixtures.cipher(properties);
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        tokens = new ChallengeTokenService(cipher, new ObjectMapper(), clock, properties);
    }

    @Test
    void shouldReturnUserIdRightAfterIssue() {
        String token = tokens.issueToken("u1", ChallengePurpose.LOGIN);

        assertThat(token).doesNotContain("+", "/", "=");
        assertThat(tokens.verifyToken(token, ChallengePurpose.LOGIN)).contains("u1");
    }

    @Test
    void shouldCarryEmailOfVerifiedIdentity() {
        String token = tokens.issueToken("u1", "u1@example.com", ChallengePurpose.LOGIN);

        assertThat(tokens.readToken(token, ChallengePurpose.LOGIN))
                .hasValueSatisfying(payload -> {
                    assertThat(payload.userId()).isEqualTo("u1");
                    assertThat(payload.email()).isEqualTo("u1@example.com");
                });
        assertThat(tokens.readToken(tokens.issueToken("u2", ChallengePurpose.SETUP), ChallengePurpose.SETUP))
                .hasValueSatisfying(payload -> assertThat(payload.email()).isNull());
    }

    @Test
    void shouldIssueDistinctTokensForSameUser() {
        assertThat(tokens.issueToken("u1", ChallengePurpose.LOGIN))
                .isNotEqualTo(tokens.issueToken("u1", ChallengePurpose.LOGIN));
    }

    @Test
    void shouldExpireAfterMaxAge() {
        String token = tokens.issueToken("u1", ChallengePurpose.LOGIN);

        clock.advance(Duration.ofMinutes(10));
        assertThat(tokens.verifyToken(token, ChallengePurpose.LOGIN)).contains("u1");

        clock.advance(Duration.ofSeconds(1));
        assertThat(tokens.verifyToken(token, ChallengePurpose.LOGIN)).isEmpty();
    }

    @Test
    void shouldHonourExplicitMaxAge() {
        String token = tokens.issueToken("u1", ChallengePurpose.LOGIN);
        clock.advance(Duration.ofMinutes(3));

        assertThat(tokens.verifyToken(token, ChallengePurpose.LOGIN, Duration.ofMinutes(2))).isEmpty();
        assertThat(tokens.verifyToken(token, ChallengePurpose.LOGIN, Duration.ofMinutes(5))).contains("u1");
    }

    @Test
    void shouldRejectTokenIssuedForAnotherPurpose() {
        String setupToken = tokens.issueToken("u1", ChallengePurpose.SETUP);

        assertThat(tokens.verifyToken(setupToken, ChallengePurpose.LOGIN)).isEmpty();
        assertThat(tokens.verifyToken(setupToken, ChallengePurpose.SETUP)).contains("u1");
    }

    @Test
    void shouldFailClosedOnMalformedTokens() {
        assertThat(tokens.verifyToken(null, ChallengePurpose.LOGIN)).isEmpty();
        assertThat(tokens.verifyToken("", ChallengePurpose.LOGIN)).isEmpty();
        assertThat(tokens.verifyToken("garbage", ChallengePurpose.LOGIN)).isEmpty();
        // Valid ciphertext, wrong payload shape
        assertThat(tokens.verifyToken(cipher.encryptString("{\"hello\":\"world\"}"), ChallengePurpose.LOGIN)).isEmpty();
        assertThat(tokens.verifyToken(cipher.encryptString("not json"), ChallengePurpose.LOGIN)).isEmpty();
    }
}
