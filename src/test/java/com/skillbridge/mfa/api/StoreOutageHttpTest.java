package com.skillbridge.mfa.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbridge.mfa.domain.mfa.ChallengePurpose;
import com.skillbridge.mfa.infrastructure.mfa.ChallengeTokenService;
import com.skillbridge.mfa.support.TestClockConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "app.store.availability=UNAVAILABLE")
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class StoreOutageHttpTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ChallengeTokenService challengeTokens;

    @Test
    void stepTwoReportsServerErrorWhenStoreIsDown() throws Exception {
        String mfaToken = challengeTokens.issueToken("outage-user", "o@example.com", ChallengePurpose.LOGIN);

        mvc.perform(post("/auth/login/mfa")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                Map.of("mfaToken", mfaToken, "code", "123456", "isRecoveryCode", false))))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("MFA_UPDATE_FAILED"))
                .andExpect(jsonPath("$.accessToken").doesNotExist());
    }
}
