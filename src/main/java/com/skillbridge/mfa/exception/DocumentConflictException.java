package com.skillbridge.mfa.exception;

/**
 * Thrown when a conditional write loses to a concurrent modification of the same document.
 */
public class DocumentConflictException extends DocumentStoreException {

    public DocumentConflictException(String message) {
        super(message);
    }

    public DocumentConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
