package com.skillbridge.mfa.domain.mfa;

/**
 * What a challenge token was issued for. A token is only accepted by the step it was issued for.
 */
public enum ChallengePurpose {
    LOGIN,
    SETUP
}
