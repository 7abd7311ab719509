package com.skillbridge.mfa.exception;

/**
 * Thrown when the document store is unavailable or a read/write fails.
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
