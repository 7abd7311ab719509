package com.skillbridge.mfa.exception;

/**
 * Typed failure of an MFA operation, rendered at the request boundary by {@link GlobalExceptionHandler}.
 */
public class MfaException extends RuntimeException {

    private final MfaErrorCode errorCode;

    public MfaException(MfaErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public MfaException(MfaErrorCode errorCode, Throwable cause) {
        super(errorCode.getMessage(), cause);
        this.errorCode = errorCode;
    }

    public MfaErrorCode getErrorCode() {
        return errorCode;
    }
}
