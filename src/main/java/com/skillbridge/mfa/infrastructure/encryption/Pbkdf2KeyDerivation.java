package com.skillbridge.mfa.infrastructure.encryption;

import com.skillbridge.mfa.config.MfaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * PBKDF2-HMAC-SHA256 shared by the secret cipher and the recovery-code hashes.
 */
@Component
public class Pbkdf2KeyDerivation {

    private static final Logger log = LoggerFactory.getLogger(Pbkdf2KeyDerivation.class);

    private static final String ALGORITHM = "PBKDF2WithHmacSHA256";
    public static final int MIN_ITERATIONS = 100_000;
    public static final int KEY_LENGTH_BYTES = 32;

    private final int iterations;

    public Pbkdf2KeyDerivation(MfaProperties properties) {
        int configured = properties.getKdf().getIterations();
        if (configured < MIN_ITERATIONS) {
            throw new IllegalStateException(String.format(
                    "KDF iteration count %d is below the minimum of %d", configured, MIN_ITERATIONS));
        }
        this.iterations = configured;
        log.info("Key derivation initialized - Algorithm: {}, Iterations: {}", ALGORITHM, iterations);
    }

    public byte[] derive(String input, String salt) {
        PBEKeySpec spec = new PBEKeySpec(input.toCharArray(), salt.getBytes(StandardCharsets.UTF_8),
                iterations, KEY_LENGTH_BYTES * 8);
        try {
            return SecretKeyFactory.getInstance(ALGORITHM).generateSecret(spec).getEncoded();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(ALGORITHM + " is not available", e);
        } finally {
            spec.clearPassword();
        }
    }

    public int getIterations() {
        return iterations;
    }
}
