package com.skillbridge.mfa.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jayway.jsonpath.JsonPath;
import com.skillbridge.mfa.config.JwtService;
import com.skillbridge.mfa.domain.ports.MfaCredentialRepository;
import com.skillbridge.mfa.infrastructure.encryption.SecretCipher;
import com.skillbridge.mfa.infrastructure.mfa.TotpService;
import com.skillbridge.mfa.support.MutableClock;
import com.skillbridge.mfa.support.TestClockConfig;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Map;
import java.util.UUID;

import static com.skillbridge.mfa.support.TotpTestSupport.currentCode;
import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class MfaControllerTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MfaCredentialRepository credentials;

    @Autowired
    private SecretCipher cipher;

    @Autowired
    private TotpService totp;

    @Autowired
    private MutableClock clock;

    @Autowired
    private JwtService jwt;

    @Value("${security.identity.secret}")
    private String identitySecret;

    @Value("${security.identity.issuer}")
    private String identityIssuer;

    private String userId;

    @BeforeEach
    void setUp() {
        userId = "http-" + UUID.randomUUID();
    }

    private String idToken(String issuer) {
        return Jwts.builder()
                .setSubject(userId)
                .setIssuer(issuer)
                .setIssuedAt(Date.from(clock.instant()))
                .setExpiration(Date.from(clock.instant().plusSeconds(300)))
                .claim("email", "http@example.com")
                .signWith(Keys.hmacShaKeyFor(identitySecret.getBytes(StandardCharsets.UTF_8)), SignatureAlgorithm.HS256)
                .compact();
    }

    private String json(Object body) throws Exception {
        return objectMapper.writeValueAsString(body);
    }

    private String loginForAccessToken() throws Exception {
        String body = mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("idToken", idToken(identityIssuer)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mfaRequired").value(false))
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(body, "$.accessToken");
    }

    private String storedSecret() {
        return cipher.decryptString(credentials.findByUserId(userId).orElseThrow().getSecretCiphertext());
    }

    @Test
    void loginRejectsForeignIdentityToken() throws Exception {
        mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("idToken", idToken("someone-else")))))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("AUTH_TOKEN_INVALID"));
    }

    @Test
    void loginRequiresIdToken() throws Exception {
        mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void everyResponseCarriesARequestId() throws Exception {
        mvc.perform(get("/mfa/status"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().exists("X-Request-Id"));

        mvc.perform(post("/auth/login")
                        .header("X-Request-Id", "trace-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("idToken", idToken(identityIssuer)))))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "trace-42"));
    }

    @Test
    void protectedEndpointsRequireBearerToken() throws Exception {
        mvc.perform(post("/mfa/setup"))
                .andExpect(status().isUnauthorized());
        mvc.perform(get("/mfa/status"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void statusForUserWithoutMfa() throws Exception {
        String accessToken = loginForAccessToken();

        mvc.perform(get("/mfa/status").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false))
                .andExpect(jsonPath("$.setupRequired").value(true))
                .andExpect(jsonPath("$.recoveryCodesCount").value(0));
    }

    @Test
    void verifySetupRejectsMissingFields() throws Exception {
        mvc.perform(post("/mfa/verify-setup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("setupToken", "x"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void stepTwoWithInvalidTokenIsRejected() throws Exception {
        mvc.perform(post("/auth/login/mfa")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("mfaToken", "bogus", "code", "123456", "isRecoveryCode", false))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_MFA_TOKEN"));
    }

    @Test
    void fullEnrollmentAndTwoStepLogin() throws Exception {
        String accessToken = loginForAccessToken();

        String setupBody = mvc.perform(post("/mfa/setup").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.qrCode").value(startsWith("data:image/png;base64,")))
                .andExpect(jsonPath("$.recoveryCodes", hasSize(10)))
                .andReturn().getResponse().getContentAsString();
        String setupToken = JsonPath.read(setupBody, "$.setupToken");
        String secret = storedSecret();

        mvc.perform(post("/mfa/verify-setup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("setupToken", setupToken, "totpCode", currentCode(totp, secret, clock)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(true));

        String loginBody = mvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("idToken", idToken(identityIssuer)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.mfaRequired").value(true))
                .andExpect(jsonPath("$.recoveryCodesAvailable").value(10))
                .andReturn().getResponse().getContentAsString();
        assertThat(loginBody).doesNotContain("accessToken");
        String mfaToken = JsonPath.read(loginBody, "$.mfaToken");

        String stepTwoBody = mvc.perform(post("/auth/login/mfa")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("mfaToken", mfaToken, "code", currentCode(totp, secret, clock),
                                "isRecoveryCode", false))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verified").value(true))
                .andExpect(jsonPath("$.remainingRecoveryCodes").value(10))
                .andExpect(jsonPath("$.accessToken").isNotEmpty())
                .andReturn().getResponse().getContentAsString();
        String steppedUpToken = JsonPath.read(stepTwoBody, "$.accessToken");
        assertThat(jwt.getSubject(steppedUpToken)).contains(userId);
        assertThat(jwt.getEmail(steppedUpToken)).contains("http@example.com");

        mvc.perform(get("/mfa/status").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(true))
                .andExpect(jsonPath("$.lastUsed").isNotEmpty());

        mvc.perform(post("/mfa/setup").header("Authorization", "Bearer " + accessToken))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MFA_ALREADY_ENABLED"));
    }

    @Test
    void regenerateAndDisableOverHttp() throws Exception {
        String accessToken = loginForAccessToken();
        String setupBody = mvc.perform(post("/mfa/setup").header("Authorization", "Bearer " + accessToken))
                .andReturn().getResponse().getContentAsString();
        String secret = storedSecret();
        mvc.perform(post("/mfa/verify-setup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("setupToken", JsonPath.read(setupBody, "$.setupToken"),
                                "totpCode", currentCode(totp, secret, clock)))))
                .andExpect(status().isOk());

        String regenerated = mvc.perform(post("/mfa/regenerate-recovery-codes")
                        .header("Authorization", "Bearer " + accessToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("totpCode", currentCode(totp, secret, clock)))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.recoveryCodes", hasSize(10)))
                .andReturn().getResponse().getContentAsString();
        String recoveryCode = JsonPath.read(regenerated, "$.recoveryCodes[0]");

        mvc.perform(post("/mfa/disable")
                        .header("Authorization", "Bearer " + accessToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("verificationCode", "AAAA-AAAA", "isRecoveryCode", true))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_VERIFICATION_CODE"));

        mvc.perform(post("/mfa/disable")
                        .header("Authorization", "Bearer " + accessToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(json(Map.of("verificationCode", recoveryCode, "isRecoveryCode", true))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.enabled").value(false));
    }
}
