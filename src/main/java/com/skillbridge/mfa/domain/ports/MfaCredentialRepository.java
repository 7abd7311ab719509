package com.skillbridge.mfa.domain.ports;

import com.skillbridge.mfa.domain.mfa.MfaCredential;

import java.util.Optional;

public interface MfaCredentialRepository {

    Optional<MfaCredential> findByUserId(String userId);

    MfaCredential create(MfaCredential credential);

    /** Conditional write: fails if the record changed since {@code credential} was read. */
    MfaCredential update(MfaCredential credential);
}
