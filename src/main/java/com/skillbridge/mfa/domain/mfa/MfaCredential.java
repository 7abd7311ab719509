// ==============================================================================
// MFA Credential Domain Model
// File: src/main/java/com/skillbridge/mfa/domain/mfa/MfaCredential.java
// ==============================================================================

package com.skillbridge.mfa.domain.mfa;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Domain model representing a user's second-factor enrollment.
 * <p>
 * Instances are immutable; every state change returns a new credential carrying the
 * store version it was read at, so the adapter can write it back conditionally.
 */
public class MfaCredential {
    private final String userId;
    private final String secretCiphertext;
    private final boolean enabled;
    private final boolean setupCompleted;
    private final List<RecoveryCode> recoveryCodes;
    private final OffsetDateTime createdAt;
    private final OffsetDateTime verifiedAt;
    private final OffsetDateTime disabledAt;
    private final OffsetDateTime lastUsedAt;
    private final OffsetDateTime recoveryCodesRegeneratedAt;
    private final OffsetDateTime updatedAt;
    private final long version;

    public MfaCredential(String userId, String secretCiphertext, boolean enabled, boolean setupCompleted,
                         List<RecoveryCode> recoveryCodes, OffsetDateTime createdAt, OffsetDateTime verifiedAt,
                         OffsetDateTime disabledAt, OffsetDateTime lastUsedAt,
                         OffsetDateTime recoveryCodesRegeneratedAt, OffsetDateTime updatedAt, long version) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("User id is required");
        }
        if (enabled && (secretCiphertext == null || secretCiphertext.isBlank() || !setupCompleted)) {
            throw new IllegalStateException("An enabled credential needs a stored secret and a completed setup");
        }
        this.userId = userId;
        this.secretCiphertext = secretCiphertext;
        this.enabled = enabled;
        this.setupCompleted = setupCompleted;
        this.recoveryCodes = recoveryCodes == null ? List.of() : List.copyOf(recoveryCodes);
        this.createdAt = createdAt;
        this.verifiedAt = verifiedAt;
        this.disabledAt = disabledAt;
        this.lastUsedAt = lastUsedAt;
        this.recoveryCodesRegeneratedAt = recoveryCodesRegeneratedAt;
        this.updatedAt = updatedAt;
        this.version = version;
    }

    /**
     * Fresh enrollment: secret generated, awaiting the first TOTP verification.
     */
    public static MfaCredential pending(String userId, String secretCiphertext,
                                        List<RecoveryCode> recoveryCodes, OffsetDateTime now) {
        return new MfaCredential(userId, secretCiphertext, false, false, recoveryCodes,
                now, null, null, null, null, now, 0L);
    }

    /**
     * Restarts enrollment on an existing, not enabled record.
     */
    public MfaCredential reenroll(String newSecretCiphertext, List<RecoveryCode> newCodes, OffsetDateTime now) {
        if (enabled) {
            throw new IllegalStateException("Cannot re-enroll while MFA is enabled");
        }
        return new MfaCredential(userId, newSecretCiphertext, false, false, newCodes,
                createdAt, null, disabledAt, null, null, now, version);
    }

    public MfaCredential enable(OffsetDateTime now) {
        return new MfaCredential(userId, secretCiphertext, true, true, recoveryCodes,
                createdAt, now, null, lastUsedAt, recoveryCodesRegeneratedAt, now, version);
    }

    /** Soft disable: the ciphertext and recovery codes are retained. */
    public MfaCredential disable(OffsetDateTime now) {
        return new MfaCredential(userId, secretCiphertext, false, setupCompleted, recoveryCodes,
                createdAt, verifiedAt, now, lastUsedAt, recoveryCodesRegeneratedAt, now, version);
    }

    public MfaCredential withLastUsedAt(OffsetDateTime now) {
        return new MfaCredential(userId, secretCiphertext, enabled, setupCompleted, recoveryCodes,
                createdAt, verifiedAt, disabledAt, now, recoveryCodesRegeneratedAt, now, version);
    }

    public MfaCredential withRecoveryCodeUsed(int index, OffsetDateTime now) {
        List<RecoveryCode> codes = new ArrayList<>(recoveryCodes);
        codes.set(index, codes.get(index).markUsed(now));
        return new MfaCredential(userId, secretCiphertext, enabled, setupCompleted, codes,
                createdAt, verifiedAt, disabledAt, lastUsedAt, recoveryCodesRegeneratedAt, now, version);
    }

    /** Replaces the whole batch; codes are never appended individually. */
    public MfaCredential withRegeneratedRecoveryCodes(List<RecoveryCode> newCodes, OffsetDateTime now) {
        return new MfaCredential(userId, secretCiphertext, enabled, setupCompleted, newCodes,
                createdAt, verifiedAt, disabledAt, lastUsedAt, now, now, version);
    }

    public MfaCredential withVersion(long newVersion) {
        return new MfaCredential(userId, secretCiphertext, enabled, setupCompleted, recoveryCodes,
                createdAt, verifiedAt, disabledAt, lastUsedAt, recoveryCodesRegeneratedAt, updatedAt, newVersion);
    }

    // Getters
    public String getUserId() { return userId; }
    public String getSecretCiphertext() { return secretCiphertext; }
    public boolean isEnabled() { return enabled; }
    public boolean isSetupCompleted() { return setupCompleted; }
    public List<RecoveryCode> getRecoveryCodes() { return recoveryCodes; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getVerifiedAt() { return verifiedAt; }
    public OffsetDateTime getDisabledAt() { return disabledAt; }
    public OffsetDateTime getLastUsedAt() { return lastUsedAt; }
    public OffsetDateTime getRecoveryCodesRegeneratedAt() { return recoveryCodesRegeneratedAt; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public long getVersion() { return version; }

    // Business logic methods
    public boolean isSetupRequired() {
        return !setupCompleted;
    }

    public int unusedRecoveryCodeCount() {
        return (int) recoveryCodes.stream().filter(code -> !code.isUsed()).count();
    }
}
