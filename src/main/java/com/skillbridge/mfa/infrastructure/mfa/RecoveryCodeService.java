package com.skillbridge.mfa.infrastructure.mfa;

import com.skillbridge.mfa.config.MfaProperties;
import com.skillbridge.mfa.domain.mfa.MfaCredential;
import com.skillbridge.mfa.domain.mfa.RecoveryCode;
import com.skillbridge.mfa.infrastructure.encryption.Pbkdf2KeyDerivation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.OptionalInt;

/**
 * One-time recovery codes: generation, salted KDF hashing and consumption.
 */
@Service
public class RecoveryCodeService {

    private static final Logger log = LoggerFactory.getLogger(RecoveryCodeService.class);

    private static final String ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";
    private static final int CODE_LENGTH = 8;

    private final Pbkdf2KeyDerivation keyDerivation;
    private final String salt;
    private final int batchSize;
    private final Clock clock;
    private final SecureRandom secureRandom;

    public RecoveryCodeService(MfaProperties properties, Pbkdf2KeyDerivation keyDerivation, Clock clock) {
        this.keyDerivation = keyDerivation;
        this.salt = properties.getKdf().getRecoverySalt();
        this.batchSize = properties.getRecoveryCodes().getCount();
        this.clock = clock;
        this.secureRandom = new SecureRandom();
    }

    public List<String> generateCodes() {
        return generateCodes(batchSize);
    }

    /**
     * Plaintext codes formatted {@code XXXX-XXXX}. They are shown to the user once and never stored.
     */
    public List<String> generateCodes(int count) {
        List<String> codes = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            StringBuilder code = new StringBuilder(CODE_LENGTH + 1);
            for (int c = 0; c < CODE_LENGTH; c++) {
                if (c == CODE_LENGTH / 2) {
                    code.append('-');
                }
                code.append(ALPHABET.charAt(secureRandom.nextInt(ALPHABET.length())));
            }
            codes.add(code.toString());
        }
        log.debug("Generated {} recovery codes", count);
        return codes;
    }

    public String hash(String code) {
        return Base64.getUrlEncoder().encodeToString(keyDerivation.derive(normalize(code), salt));
    }

    public boolean verifyCode(String code, String storedHash) {
        if (code == null || code.isBlank() || storedHash == null) {
            return false;
        }
        return constantTimeEquals(hash(code), storedHash);
    }

    /**
     * Hashes a freshly generated batch for storage.
     */
    public List<RecoveryCode> toStoredCodes(List<String> plaintextCodes) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return plaintextCodes.stream()
                .map(code -> RecoveryCode.fresh(hash(code), now))
                .toList();
    }

    /**
     * Index of the first unused code matching {@code code}, if any.
     */
    public OptionalInt findUnusedMatch(MfaCredential credential, String code) {
        if (code == null || code.isBlank()) {
            return OptionalInt.empty();
        }
        // One KDF run per attempt; the salt is fixed so the digest compares against every stored hash
        String candidate = hash(code);
        List<RecoveryCode> codes = credential.getRecoveryCodes();
        for (int i = 0; i < codes.size(); i++) {
            RecoveryCode stored = codes.get(i);
            if (!stored.isUsed() && constantTimeEquals(candidate, stored.getHash())) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Marks the first matching unused code as used. Returns {@code credential} itself when nothing matches.
     */
    public MfaCredential consumeCode(MfaCredential credential, String code) {
        OptionalInt match = findUnusedMatch(credential, code);
        if (match.isEmpty()) {
            return credential;
        }
        return credential.withRecoveryCodeUsed(match.getAsInt(), OffsetDateTime.now(clock));
    }

    static String normalize(String code) {
        return code.replace("-", "").replaceAll("\\s", "").toUpperCase(Locale.ROOT);
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
