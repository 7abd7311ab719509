// ==============================================================================
// Secret Cipher - authenticated encryption for TOTP secrets and challenge payloads
// File: src/main/java/com/skillbridge/mfa/infrastructure/encryption/SecretCipher.java
// ==============================================================================

package com.skillbridge.mfa.infrastructure.encryption;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbridge.mfa.config.MfaProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

@Service
public class SecretCipher {

    private static final Logger log = LoggerFactory.getLogger(SecretCipher.class);

    // AES-GCM configuration
    private static final String ALGORITHM = "AES";
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int GCM_IV_LENGTH = 12; // 96 bits
    private static final int GCM_TAG_LENGTH = 16; // 128 bits
    private static final int KEY_VERSION = 1;

    private final SecretKeySpec secretKey;
    private final SecureRandom secureRandom;
    private final ObjectMapper objectMapper;

    public SecretCipher(MfaProperties properties, Pbkdf2KeyDerivation keyDerivation, ObjectMapper objectMapper) {
        String masterSecret = properties.getMasterSecret();
        if (masterSecret == null || masterSecret.isBlank()) {
            throw new IllegalStateException("MFA master secret is required. Set app.mfa.master-secret (MFA_SECRET_KEY).");
        }
        this.secretKey = new SecretKeySpec(
                keyDerivation.derive(masterSecret, properties.getKdf().getCipherSalt()), ALGORITHM);
        this.secureRandom = new SecureRandom();
        this.objectMapper = objectMapper;
        log.info("Secret cipher initialized - Algorithm: AES-256-GCM, KeyVersion: {}", KEY_VERSION);
    }

    /**
     * Encrypts an arbitrary payload. The result is a URL-safe Base64 envelope holding the IV,
     * the ciphertext and its GCM tag.
     */
    public String encrypt(byte[] plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("Plaintext is required");
        }
        try {
            byte[] iv = new byte[GCM_IV_LENGTH];
            secureRandom.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            byte[] encryptedData = cipher.doFinal(plaintext);

            EncryptionEnvelope envelope = new EncryptionEnvelope(
                    KEY_VERSION,
                    TRANSFORMATION,
                    Base64.getEncoder().encodeToString(iv),
                    Base64.getEncoder().encodeToString(encryptedData));

            byte[] envelopeJson = objectMapper.writeValueAsBytes(envelope);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(envelopeJson);
        } catch (GeneralSecurityException | JsonProcessingException e) {
            log.error("Encryption failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to encrypt payload", e);
        }
    }

    /**
     * @throws InvalidCiphertextException if the blob is malformed or fails the integrity check
     */
    public byte[] decrypt(String ciphertext) {
        if (ciphertext == null || ciphertext.isBlank()) {
            throw new InvalidCiphertextException("Ciphertext is empty");
        }
        try {
            byte[] envelopeJson = Base64.getUrlDecoder().decode(ciphertext.trim());
            EncryptionEnvelope envelope = objectMapper.readValue(envelopeJson, EncryptionEnvelope.class);

            if (envelope == null || !TRANSFORMATION.equals(envelope.algorithm()) || envelope.iv() == null || envelope.data() == null) {
                throw new InvalidCiphertextException("Unsupported or incomplete encryption envelope");
            }
            if (envelope.keyVersion() == null || envelope.keyVersion() != KEY_VERSION) {
                throw new InvalidCiphertextException("Unknown key version: " + envelope.keyVersion());
            }

            byte[] iv = Base64.getDecoder().decode(envelope.iv());
            if (iv.length != GCM_IV_LENGTH) {
                throw new InvalidCiphertextException("Invalid IV length");
            }

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(GCM_TAG_LENGTH * 8, iv));
            return cipher.doFinal(Base64.getDecoder().decode(envelope.data()));

        } catch (InvalidCiphertextException e) {
            throw e;
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Malformed ciphertext: {}", e.getMessage());
            throw new InvalidCiphertextException("Malformed ciphertext", e);
        } catch (GeneralSecurityException e) {
            log.debug("Ciphertext failed integrity check: {}", e.getMessage());
            throw new InvalidCiphertextException("Ciphertext failed integrity check", e);
        }
    }

    public String encryptString(String plaintext) {
        return encrypt(plaintext.getBytes(StandardCharsets.UTF_8));
    }

    public String decryptString(String ciphertext) {
        return new String(decrypt(ciphertext), StandardCharsets.UTF_8);
    }

    /**
     * Encryption envelope for metadata
     */
    public record EncryptionEnvelope(
            Integer keyVersion,
            String algorithm,
            String iv,
            String data
    ) {}

    /**
     * Raised when a blob cannot be decrypted; callers treat it as INVALID_CIPHERTEXT.
     */
    public static class InvalidCiphertextException extends RuntimeException {
        public InvalidCiphertextException(String message) {
            super(message);
        }

        public InvalidCiphertextException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
