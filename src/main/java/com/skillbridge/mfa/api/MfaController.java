// ==============================================================================
// MFA API Controller - enrollment, verification and management endpoints
// File: src/main/java/com/skillbridge/mfa/api/MfaController.java
// ==============================================================================

package com.skillbridge.mfa.api;

import com.skillbridge.mfa.application.MfaService;
import com.skillbridge.mfa.domain.mfa.VerifiedIdentity;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/mfa")
@Tag(name = "Multi-Factor Authentication", description = "TOTP-based MFA setup, verification, and management")
public class MfaController {

    private static final Logger log = LoggerFactory.getLogger(MfaController.class);

    private final MfaService mfaService;

    public MfaController(MfaService mfaService) {
        this.mfaService = mfaService;
    }

    // ==========================================================================
    // REQUEST DTOs
    // ==========================================================================

    public static class VerifySetupRequest {
        @Schema(description = "Setup token returned by /mfa/setup")
        @NotBlank
        public String setupToken;

        @Schema(description = "Current code from the authenticator app", example = "123456")
        @NotBlank
        public String totpCode;
    }

    public static class VerifyRequest {
        @NotBlank
        public String mfaToken;

        @NotBlank
        public String code;

        public boolean isRecoveryCode;
    }

    public static class DisableRequest {
        @Schema(description = "TOTP code or recovery code")
        @NotBlank
        public String verificationCode;

        public boolean isRecoveryCode;
    }

    public static class RegenerateRequest {
        @NotBlank
        public String totpCode;
    }

    // ==========================================================================
    // SETUP ENDPOINTS
    // ==========================================================================

    @PostMapping("/setup")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Start MFA enrollment",
            description = "Generates a TOTP secret and recovery codes. The recovery codes are shown only once.")
    public ResponseEntity<Map<String, Object>> setup(@AuthenticationPrincipal VerifiedIdentity user) {
        log.info("MFA setup requested by user {}", user.userId());
        MfaService.SetupResult result = mfaService.initiateSetup(user.userId(), user.accountLabel());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("qrCode", "data:image/png;base64," + Base64.getEncoder().encodeToString(result.qrCodeImage()));
        response.put("recoveryCodes", result.recoveryCodes());
        response.put("setupToken", result.setupToken());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/verify-setup")
    @Operation(summary = "Confirm MFA enrollment", description = "Verifies the first TOTP code and enables MFA")
    public ResponseEntity<Map<String, Object>> verifySetup(@Valid @RequestBody VerifySetupRequest req) {
        mfaService.verifySetup(req.setupToken, req.totpCode);
        return ResponseEntity.ok(Map.of("enabled", true, "message", "MFA enabled successfully"));
    }

    // ==========================================================================
    // VERIFICATION / MANAGEMENT ENDPOINTS
    // ==========================================================================

    @PostMapping("/verify")
    @Operation(summary = "Verify an MFA challenge")
    public ResponseEntity<Map<String, Object>> verify(@Valid @RequestBody VerifyRequest req) {
        MfaService.VerificationResult result = mfaService.completeLogin(req.mfaToken, req.code, req.isRecoveryCode);

        Map<String, Object> response = new HashMap<>();
        response.put("verified", result.verified());
        response.put("remainingRecoveryCodes", result.remainingRecoveryCodes());
        return ResponseEntity.ok(response);
    }

    @GetMapping("/status")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Get MFA status")
    public ResponseEntity<Map<String, Object>> status(@AuthenticationPrincipal VerifiedIdentity user) {
        MfaService.StatusResult status = mfaService.getStatus(user.userId());

        Map<String, Object> response = new HashMap<>();
        response.put("enabled", status.enabled());
        response.put("setupRequired", status.setupRequired());
        response.put("recoveryCodesCount", status.recoveryCodesCount());
        response.put("setupDate", status.setupDate());
        response.put("lastUsed", status.lastUsed());
        return ResponseEntity.ok(response);
    }

    @PostMapping("/disable")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Disable MFA", description = "Requires a valid TOTP or recovery code")
    public ResponseEntity<Map<String, Object>> disable(@AuthenticationPrincipal VerifiedIdentity user,
                                                       @Valid @RequestBody DisableRequest req) {
        mfaService.disable(user.userId(), req.verificationCode, req.isRecoveryCode);
        return ResponseEntity.ok(Map.of("enabled", false, "message", "MFA disabled successfully"));
    }

    @PostMapping("/regenerate-recovery-codes")
    @SecurityRequirement(name = "Bearer Authentication")
    @Operation(summary = "Regenerate recovery codes", description = "Invalidates every previously issued recovery code")
    public ResponseEntity<Map<String, Object>> regenerateRecoveryCodes(@AuthenticationPrincipal VerifiedIdentity user,
                                                                       @Valid @RequestBody RegenerateRequest req) {
        List<String> codes = mfaService.regenerateRecoveryCodes(user.userId(), req.totpCode);
        return ResponseEntity.ok(Map.of("recoveryCodes", codes));
    }
}
