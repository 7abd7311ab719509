package com.skillbridge.mfa.domain.ports;

import com.skillbridge.mfa.domain.mfa.VerifiedIdentity;

import java.util.Optional;

public interface IdentityTokenVerifier {

    Optional<VerifiedIdentity> verify(String idToken);
}
