package com.skillbridge.mfa.domain.mfa;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the two-step login exchange.
 */
public enum LoginState {
    /**
     * No credential has been presented yet
     */
    UNVERIFIED,

    /**
     * The primary identity token was accepted
     */
    IDENTITY_VERIFIED,

    /**
     * A challenge token was issued and a second factor is awaited
     */
    MFA_PENDING,

    /**
     * The second factor was accepted
     */
    MFA_VERIFIED,

    /**
     * Login is complete
     */
    SESSION_ESTABLISHED;

    public Set<LoginState> successors() {
        return switch (this) {
            case UNVERIFIED -> EnumSet.of(IDENTITY_VERIFIED);
            case IDENTITY_VERIFIED -> EnumSet.of(SESSION_ESTABLISHED, MFA_PENDING);
            case MFA_PENDING -> EnumSet.of(MFA_VERIFIED, MFA_PENDING);
            case MFA_VERIFIED -> EnumSet.of(SESSION_ESTABLISHED);
            case SESSION_ESTABLISHED -> EnumSet.noneOf(LoginState.class);
        };
    }

    public boolean canTransitionTo(LoginState next) {
        return successors().contains(next);
    }
}
