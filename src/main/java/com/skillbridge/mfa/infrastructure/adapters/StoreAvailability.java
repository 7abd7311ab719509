package com.skillbridge.mfa.infrastructure.adapters;

/**
 * Whether a document store backend was configured at startup.
 */
public enum StoreAvailability {
    AVAILABLE,
    UNAVAILABLE
}
