package com.skillbridge.mfa.domain.mfa;

public enum ActivityType {
    LOGIN,
    MFA_REQUIRED,
    MFA_SETUP_INITIATED,
    MFA_ENABLED,
    MFA_VERIFICATION_FAILED,
    MFA_SUCCESS,
    MFA_RECOVERY_CODE_USED,
    MFA_DISABLED,
    MFA_RECOVERY_CODES_REGENERATED
}
