// ==============================================================================
// MfaService.java - Login step-up, enrollment and credential management
// File: src/main/java/com/skillbridge/mfa/application/MfaService.java
// ==============================================================================

package com.skillbridge.mfa.application;

import com.skillbridge.mfa.domain.mfa.ActivityType;
import com.skillbridge.mfa.domain.mfa.ChallengePurpose;
import com.skillbridge.mfa.domain.mfa.LoginState;
import com.skillbridge.mfa.domain.mfa.MfaCredential;
import com.skillbridge.mfa.domain.mfa.VerifiedIdentity;
import com.skillbridge.mfa.domain.ports.ActivityLog;
import com.skillbridge.mfa.domain.ports.MfaCredentialRepository;
import com.skillbridge.mfa.exception.DocumentStoreException;
import com.skillbridge.mfa.exception.MfaErrorCode;
import com.skillbridge.mfa.exception.MfaException;
import com.skillbridge.mfa.infrastructure.encryption.SecretCipher;
import com.skillbridge.mfa.infrastructure.mfa.ChallengeTokenService;
import com.skillbridge.mfa.infrastructure.mfa.RecoveryCodeService;
import com.skillbridge.mfa.infrastructure.mfa.TotpService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Drives the two-step login and the credential lifecycle around it.
 * <p>
 * Every mutation of a credential is a conditional write against the version it was read at, so
 * two requests racing on the same recovery code cannot both succeed. Store failures are fatal to
 * the operation and surface as the matching {@code *_FAILED} error code.
 */
@Service
public class MfaService {

    private static final Logger log = LoggerFactory.getLogger(MfaService.class);

    private final MfaCredentialRepository credentials;
    private final TotpService totpService;
    private final RecoveryCodeService recoveryCodeService;
    private final ChallengeTokenService challengeTokens;
    private final SecretCipher cipher;
    private final ActivityLog activityLog;
    private final Clock clock;

    public MfaService(MfaCredentialRepository credentials,
                      TotpService totpService,
                      RecoveryCodeService recoveryCodeService,
                      ChallengeTokenService challengeTokens,
                      SecretCipher cipher,
                      ActivityLog activityLog,
                      Clock clock) {
        this.credentials = credentials;
        this.totpService = totpService;
        this.recoveryCodeService = recoveryCodeService;
        this.challengeTokens = challengeTokens;
        this.cipher = cipher;
        this.activityLog = activityLog;
        this.clock = clock;
    }

    // ==========================================================================
    // LOGIN
    // ==========================================================================

    /**
     * Step one. The primary identity has already been verified by the caller.
     */
    public LoginResult beginLogin(VerifiedIdentity identity) {
        String userId = identity.userId();
        LoginState state = advance(LoginState.UNVERIFIED, LoginState.IDENTITY_VERIFIED);

        Optional<MfaCredential> credential;
        try {
            credential = credentials.findByUserId(userId);
        } catch (DocumentStoreException e) {
            log.error("❌ Failed to load MFA credential for user {}: {}", userId, e.getMessage(), e);
            throw new MfaException(MfaErrorCode.LOGIN_FAILED, e);
        }

        boolean mfaEnabled = credential.isPresent() && credential.get().isEnabled();
        state = advance(state, mfaEnabled ? LoginState.MFA_PENDING : LoginState.SESSION_ESTABLISHED);

        if (state == LoginState.SESSION_ESTABLISHED) {
            activityLog.record(userId, ActivityType.LOGIN, "User logged in");
            return new LoginResult(userId, state, null, 0);
        }

        String mfaToken = challengeTokens.issueToken(userId, identity.email(), ChallengePurpose.LOGIN);
        activityLog.record(userId, ActivityType.MFA_REQUIRED, "MFA verification required for login");
        return new LoginResult(userId, state, mfaToken, credential.get().unusedRecoveryCodeCount());
    }

    /**
     * Step two: proves the second factor against a LOGIN challenge token.
     */
    public VerificationResult completeLogin(String mfaToken, String code, boolean isRecoveryCode) {
        ChallengeTokenService.ChallengePayload challenge = challengeTokens.readToken(mfaToken, ChallengePurpose.LOGIN)
                .orElseThrow(() -> new MfaException(MfaErrorCode.INVALID_MFA_TOKEN));
        String userId = challenge.userId();
        LoginState state = LoginState.MFA_PENDING;

        try {
            MfaCredential credential = credentials.findByUserId(userId)
                    .filter(MfaCredential::isEnabled)
                    .orElseThrow(() -> new MfaException(MfaErrorCode.MFA_NOT_ENABLED));

            Optional<MfaCredential> proven = proveFactor(credential, code, isRecoveryCode);
            if (proven.isEmpty()) {
                advance(state, LoginState.MFA_PENDING);
                activityLog.record(userId, ActivityType.MFA_VERIFICATION_FAILED, "Invalid MFA code during login");
                throw new MfaException(MfaErrorCode.INVALID_MFA_CODE);
            }

            state = advance(state, LoginState.MFA_VERIFIED);
            MfaCredential saved = credentials.update(proven.get().withLastUsedAt(now()));
            state = advance(state, LoginState.SESSION_ESTABLISHED);

            if (isRecoveryCode) {
                activityLog.record(userId, ActivityType.MFA_RECOVERY_CODE_USED, "Recovery code used for login");
            }
            activityLog.record(userId, ActivityType.MFA_SUCCESS, "MFA verification successful");
            log.info("✅ MFA login completed for user {}", userId);

            return new VerificationResult(userId, challenge.email(), state, saved.unusedRecoveryCodeCount());
        } catch (DocumentStoreException e) {
            log.error("❌ Failed to record MFA verification for user {}: {}", userId, e.getMessage(), e);
            throw new MfaException(MfaErrorCode.MFA_UPDATE_FAILED, e);
        }
    }

    // ==========================================================================
    // ENROLLMENT
    // ==========================================================================

    public SetupResult initiateSetup(String userId, String accountLabel) {
        log.info("Initiating MFA setup for user {}", userId);
        try {
            Optional<MfaCredential> existing = credentials.findByUserId(userId);
            if (existing.isPresent() && existing.get().isEnabled()) {
                throw new MfaException(MfaErrorCode.MFA_ALREADY_ENABLED);
            }

            String secret = totpService.generateSecret();
            String ciphertext = cipher.encryptString(secret);
            List<String> recoveryCodes = recoveryCodeService.generateCodes();
            OffsetDateTime now = now();

            if (existing.isPresent()) {
                credentials.update(existing.get().reenroll(ciphertext, recoveryCodeService.toStoredCodes(recoveryCodes), now));
            } else {
                credentials.create(MfaCredential.pending(userId, ciphertext,
                        recoveryCodeService.toStoredCodes(recoveryCodes), now));
            }

            String provisioningUri = totpService.provisioningUri(accountLabel, secret);
            byte[] qrImage = totpService.qrImage(provisioningUri);
            String setupToken = challengeTokens.issueToken(userId, ChallengePurpose.SETUP);

            activityLog.record(userId, ActivityType.MFA_SETUP_INITIATED, "MFA setup initiated");
            return new SetupResult(qrImage, provisioningUri, recoveryCodes, setupToken);
        } catch (DocumentStoreException e) {
            log.error("❌ Failed to initiate MFA setup for user {}: {}", userId, e.getMessage(), e);
            throw new MfaException(MfaErrorCode.MFA_SETUP_FAILED, e);
        }
    }

    /**
     * Confirms enrollment with the first code from the authenticator and turns MFA on.
     */
    public void verifySetup(String setupToken, String totpCode) {
        String userId = challengeTokens.verifyToken(setupToken, ChallengePurpose.SETUP)
                .orElseThrow(() -> new MfaException(MfaErrorCode.INVALID_MFA_TOKEN));

        try {
            MfaCredential credential = credentials.findByUserId(userId)
                    .orElseThrow(() -> new MfaException(MfaErrorCode.MFA_SETUP_NOT_FOUND));
            if (credential.isEnabled()) {
                throw new MfaException(MfaErrorCode.MFA_ALREADY_ENABLED);
            }

            if (!totpService.verifyCode(decryptSecret(credential), totpCode)) {
                activityLog.record(userId, ActivityType.MFA_VERIFICATION_FAILED, "Invalid code during MFA setup");
                throw new MfaException(MfaErrorCode.INVALID_VERIFICATION_CODE);
            }

            credentials.update(credential.enable(now()));
            activityLog.record(userId, ActivityType.MFA_ENABLED, "MFA enabled");
            log.info("✅ MFA enabled for user {}", userId);
        } catch (DocumentStoreException e) {
            log.error("❌ Failed to enable MFA for user {}: {}", userId, e.getMessage(), e);
            throw new MfaException(MfaErrorCode.MFA_ENABLE_FAILED, e);
        }
    }

    // ==========================================================================
    // MANAGEMENT
    // ==========================================================================

    public StatusResult getStatus(String userId) {
        try {
            return credentials.findByUserId(userId)
                    .map(c -> new StatusResult(c.isEnabled(), c.isSetupRequired(), c.unusedRecoveryCodeCount(),
                            c.getVerifiedAt(), c.getLastUsedAt()))
                    .orElseGet(() -> new StatusResult(false, true, 0, null, null));
        } catch (DocumentStoreException e) {
            log.error("❌ Failed to get MFA status for user {}: {}", userId, e.getMessage(), e);
            throw new MfaException(MfaErrorCode.MFA_STATUS_FAILED, e);
        }
    }

    /**
     * Soft-disables MFA. A recovery code used here is consumed like at login.
     */
    public void disable(String userId, String verificationCode, boolean isRecoveryCode) {
        try {
            MfaCredential credential = requireEnabled(userId);

            MfaCredential proven = proveFactor(credential, verificationCode, isRecoveryCode)
                    .orElseThrow(() -> {
                        activityLog.record(userId, ActivityType.MFA_VERIFICATION_FAILED, "Invalid code while disabling MFA");
                        return new MfaException(MfaErrorCode.INVALID_VERIFICATION_CODE);
                    });

            credentials.update(proven.disable(now()));
            activityLog.record(userId, ActivityType.MFA_DISABLED, "MFA disabled");
            log.info("MFA disabled for user {}", userId);
        } catch (DocumentStoreException e) {
            log.error("❌ Failed to disable MFA for user {}: {}", userId, e.getMessage(), e);
            throw new MfaException(MfaErrorCode.MFA_DISABLE_FAILED, e);
        }
    }

    /**
     * Replaces the whole recovery-code batch after a fresh TOTP check. Previous codes stop working.
     */
    public List<String> regenerateRecoveryCodes(String userId, String totpCode) {
        try {
            MfaCredential credential = requireEnabled(userId);

            if (!totpService.verifyCode(decryptSecret(credential), totpCode)) {
                activityLog.record(userId, ActivityType.MFA_VERIFICATION_FAILED,
                        "Invalid code while regenerating recovery codes");
                throw new MfaException(MfaErrorCode.INVALID_VERIFICATION_CODE);
            }

            List<String> recoveryCodes = recoveryCodeService.generateCodes();
            credentials.update(credential.withRegeneratedRecoveryCodes(
                    recoveryCodeService.toStoredCodes(recoveryCodes), now()));
            activityLog.record(userId, ActivityType.MFA_RECOVERY_CODES_REGENERATED, "Recovery codes regenerated");
            return recoveryCodes;
        } catch (DocumentStoreException e) {
            log.error("❌ Failed to regenerate recovery codes for user {}: {}", userId, e.getMessage(), e);
            throw new MfaException(MfaErrorCode.RECOVERY_CODES_REGENERATION_FAILED, e);
        }
    }

    // ==========================================================================
    // HELPERS
    // ==========================================================================

    private MfaCredential requireEnabled(String userId) {
        return credentials.findByUserId(userId)
                .filter(MfaCredential::isEnabled)
                .orElseThrow(() -> new MfaException(MfaErrorCode.MFA_NOT_ENABLED));
    }

    /**
     * Returns the credential to persist when the factor checks out: unchanged for TOTP, with the
     * matching code marked used for a recovery code.
     */
    private Optional<MfaCredential> proveFactor(MfaCredential credential, String code, boolean isRecoveryCode) {
        if (isRecoveryCode) {
            MfaCredential consumed = recoveryCodeService.consumeCode(credential, code);
            return consumed == credential ? Optional.empty() : Optional.of(consumed);
        }
        return totpService.verifyCode(decryptSecret(credential), code) ? Optional.of(credential) : Optional.empty();
    }

    private String decryptSecret(MfaCredential credential) {
        try {
            return cipher.decryptString(credential.getSecretCiphertext());
        } catch (SecretCipher.InvalidCiphertextException e) {
            log.error("❌ Stored TOTP secret for user {} cannot be decrypted", credential.getUserId(), e);
            throw new MfaException(MfaErrorCode.INVALID_CIPHERTEXT, e);
        }
    }

    /**
     * Moves the login from {@code from} to {@code to}, returning the new state.
     *
     * @throws IllegalStateException if the edge is not part of the login state machine
     */
    static LoginState advance(LoginState from, LoginState to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal login transition " + from + " -> " + to);
        }
        log.debug("Login state {} -> {}", from, to);
        return to;
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }

    // ==========================================================================
    // RESULT CLASSES
    // ==========================================================================

    public record LoginResult(String userId, LoginState state, String mfaToken, int recoveryCodesAvailable) {

        public boolean mfaRequired() {
            return state == LoginState.MFA_PENDING;
        }
    }

    public record VerificationResult(String userId, String email, LoginState state, int remainingRecoveryCodes) {

        public boolean verified() {
            return state == LoginState.SESSION_ESTABLISHED;
        }
    }

    public record SetupResult(byte[] qrCodeImage, String provisioningUri, List<String> recoveryCodes,
                              String setupToken) {}

    public record StatusResult(boolean enabled, boolean setupRequired, int recoveryCodesCount,
                               OffsetDateTime setupDate, OffsetDateTime lastUsed) {}
}
