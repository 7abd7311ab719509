package com.skillbridge.mfa.api;

import com.skillbridge.mfa.application.MfaService;
import com.skillbridge.mfa.config.JwtService;
import com.skillbridge.mfa.domain.mfa.VerifiedIdentity;
import com.skillbridge.mfa.domain.ports.IdentityTokenVerifier;
import com.skillbridge.mfa.exception.MfaErrorCode;
import com.skillbridge.mfa.exception.MfaException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/auth")
@Tag(name = "Authentication", description = "Two-step login with optional MFA")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    private final IdentityTokenVerifier identityVerifier;
    private final MfaService mfaService;
    private final JwtService jwt;

    public AuthController(IdentityTokenVerifier identityVerifier, MfaService mfaService, JwtService jwt) {
        this.identityVerifier = identityVerifier;
        this.mfaService = mfaService;
        this.jwt = jwt;
    }

    public static class LoginRequest {
        @Schema(description = "Identity token issued by the identity provider")
        @NotBlank
        public String idToken;
    }

    public static class MfaLoginRequest {
        @Schema(description = "Challenge token returned by /auth/login")
        @NotBlank
        public String mfaToken;

        @Schema(description = "TOTP code or recovery code", example = "123456")
        @NotBlank
        public String code;

        @Schema(description = "True when code is a recovery code")
        public boolean isRecoveryCode;
    }

    @PostMapping("/login")
    @Operation(summary = "Login step one", description = "Verifies the identity token and reports whether MFA is required")
    public ResponseEntity<Map<String, Object>> login(@Valid @RequestBody LoginRequest req) {
        VerifiedIdentity identity = identityVerifier.verify(req.idToken)
                .orElseThrow(() -> new MfaException(MfaErrorCode.AUTH_TOKEN_INVALID));

        MfaService.LoginResult result = mfaService.beginLogin(identity);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("mfaRequired", result.mfaRequired());
        response.put("userId", result.userId());
        if (result.mfaRequired()) {
            response.put("mfaToken", result.mfaToken());
            response.put("recoveryCodesAvailable", result.recoveryCodesAvailable());
        } else {
            response.put("accessToken", jwt.generateToken(identity.userId(), identity.email()));
            response.put("tokenType", "Bearer");
            response.put("expiresIn", jwt.getTtlSeconds());
        }
        log.info("Login step one for user {} - mfaRequired: {}", identity.userId(), result.mfaRequired());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/login/mfa")
    @Operation(summary = "Login step two", description = "Completes login with a TOTP or recovery code")
    public ResponseEntity<Map<String, Object>> loginMfa(@Valid @RequestBody MfaLoginRequest req) {
        MfaService.VerificationResult result = mfaService.completeLogin(req.mfaToken, req.code, req.isRecoveryCode);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("verified", result.verified());
        response.put("remainingRecoveryCodes", result.remainingRecoveryCodes());
        response.put("accessToken", jwt.generateToken(result.userId(), result.email()));
        response.put("tokenType", "Bearer");
        response.put("expiresIn", jwt.getTtlSeconds());
        return ResponseEntity.ok(response);
    }
}
