package com.skillbridge.mfa.exception;

import org.springframework.http.HttpStatus;

/**
 * Error taxonomy exposed to callers of the MFA endpoints.
 * Both wrong-code errors share one message so a caller cannot tell which factor type failed.
 */
public enum MfaErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Missing or malformed request fields"),
    AUTH_TOKEN_INVALID(HttpStatus.UNAUTHORIZED, "Invalid or expired identity token"),
    INVALID_MFA_TOKEN(HttpStatus.BAD_REQUEST, "Invalid or expired MFA token"),
    INVALID_MFA_CODE(HttpStatus.BAD_REQUEST, "Invalid verification code"),
    INVALID_VERIFICATION_CODE(HttpStatus.BAD_REQUEST, "Invalid verification code"),
    MFA_NOT_ENABLED(HttpStatus.BAD_REQUEST, "MFA is not enabled for this account"),
    MFA_ALREADY_ENABLED(HttpStatus.BAD_REQUEST, "MFA is already enabled for this account"),
    MFA_SETUP_NOT_FOUND(HttpStatus.NOT_FOUND, "MFA setup not found"),
    INVALID_CIPHERTEXT(HttpStatus.INTERNAL_SERVER_ERROR, "Stored MFA secret could not be read"),
    LOGIN_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to complete login"),
    MFA_STATUS_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to get MFA status"),
    MFA_SETUP_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to setup MFA"),
    MFA_ENABLE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to enable MFA"),
    MFA_UPDATE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to record MFA verification"),
    MFA_DISABLE_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to disable MFA"),
    RECOVERY_CODES_REGENERATION_FAILED(HttpStatus.INTERNAL_SERVER_ERROR, "Failed to regenerate recovery codes");

    private final HttpStatus status;
    private final String message;

    MfaErrorCode(HttpStatus status, String message) {
        this.status = status;
        this.message = message;
    }

    public HttpStatus getStatus() { return status; }
    public String getMessage() { return message; }
}
