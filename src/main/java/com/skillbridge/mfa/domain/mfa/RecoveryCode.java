package com.skillbridge.mfa.domain.mfa;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Single-use backup credential embedded in an {@link MfaCredential}.
 * The hash is fixed at generation time; only the used flag and its timestamp ever change.
 */
public final class RecoveryCode {
    private final String hash;
    private final boolean used;
    private final OffsetDateTime createdAt;
    private final OffsetDateTime usedAt;

    public RecoveryCode(String hash, boolean used, OffsetDateTime createdAt, OffsetDateTime usedAt) {
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("Recovery code hash is required");
        }
        this.hash = hash;
        this.used = used;
        this.createdAt = createdAt;
        this.usedAt = usedAt;
    }

    public static RecoveryCode fresh(String hash, OffsetDateTime now) {
        return new RecoveryCode(hash, false, now, null);
    }

    public RecoveryCode markUsed(OffsetDateTime now) {
        if (used) {
            throw new IllegalStateException("Recovery code has already been used");
        }
        return new RecoveryCode(hash, true, createdAt, now);
    }

    // Getters
    public String getHash() { return hash; }
    public boolean isUsed() { return used; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getUsedAt() { return usedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecoveryCode that)) return false;
        return used == that.used && hash.equals(that.hash)
                && Objects.equals(createdAt, that.createdAt) && Objects.equals(usedAt, that.usedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hash, used, createdAt, usedAt);
    }
}
