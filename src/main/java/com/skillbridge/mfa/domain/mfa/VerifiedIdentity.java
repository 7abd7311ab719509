package com.skillbridge.mfa.domain.mfa;

/**
 * Stable user id and profile claims yielded by primary authentication.
 */
public record VerifiedIdentity(String userId, String email, String name) {

    public String accountLabel() {
        return email != null && !email.isBlank() ? email : userId;
    }
}
