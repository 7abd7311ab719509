package com.skillbridge.mfa.infrastructure.adapters;

import com.skillbridge.mfa.domain.mfa.MfaCredential;
import com.skillbridge.mfa.domain.mfa.RecoveryCode;
import com.skillbridge.mfa.domain.ports.DocumentStore;
import com.skillbridge.mfa.domain.ports.DocumentStore.StoredDocument;
import com.skillbridge.mfa.domain.ports.MfaCredentialRepository;
import com.skillbridge.mfa.exception.DocumentStoreException;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps {@link MfaCredential} to the {@code user_mfa} collection, one document per user id.
 */
@Component
public class DocumentMfaCredentialRepositoryAdapter implements MfaCredentialRepository {

    static final String COLLECTION = "user_mfa";

    private final DocumentStore store;

    public DocumentMfaCredentialRepositoryAdapter(DocumentStore store) {
        this.store = store;
    }

    @Override
    public Optional<MfaCredential> findByUserId(String userId) {
        return store.get(COLLECTION, userId).map(this::toDomain);
    }

    @Override
    public MfaCredential create(MfaCredential credential) {
        StoredDocument doc = store.create(COLLECTION, credential.getUserId(), toDocument(credential));
        return credential.withVersion(doc.version());
    }

    @Override
    public MfaCredential update(MfaCredential credential) {
        StoredDocument doc = store.update(COLLECTION, credential.getUserId(), toDocument(credential),
                credential.getVersion());
        return credential.withVersion(doc.version());
    }

    private Map<String, Object> toDocument(MfaCredential c) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("secret", c.getSecretCiphertext());
        data.put("enabled", c.isEnabled());
        data.put("setup_completed", c.isSetupCompleted());

        List<Map<String, Object>> codes = new ArrayList<>();
        for (RecoveryCode code : c.getRecoveryCodes()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("hash", code.getHash());
            entry.put("used", code.isUsed());
            entry.put("created_at", format(code.getCreatedAt()));
            entry.put("used_at", format(code.getUsedAt()));
            codes.add(entry);
        }
        data.put("recovery_codes", codes);

        data.put("created_at", format(c.getCreatedAt()));
        data.put("verified_at", format(c.getVerifiedAt()));
        data.put("disabled_at", format(c.getDisabledAt()));
        data.put("last_used_at", format(c.getLastUsedAt()));
        data.put("recovery_codes_regenerated_at", format(c.getRecoveryCodesRegeneratedAt()));
        data.put("updated_at", format(c.getUpdatedAt()));
        return data;
    }

    private MfaCredential toDomain(StoredDocument doc) {
        Map<String, Object> data = doc.data();
        try {
            List<RecoveryCode> codes = new ArrayList<>();
            Object rawCodes = data.get("recovery_codes");
            if (rawCodes instanceof List<?> list) {
                for (Object item : list) {
                    if (!(item instanceof Map<?, ?> entry)) {
                        throw new DocumentStoreException("Malformed recovery code in " + COLLECTION + "/" + doc.id());
                    }
                    codes.add(new RecoveryCode(
                            (String) entry.get("hash"),
                            Boolean.TRUE.equals(entry.get("used")),
                            parse(entry.get("created_at")),
                            parse(entry.get("used_at"))));
                }
            } else if (rawCodes != null) {
                throw new DocumentStoreException("Malformed recovery_codes in " + COLLECTION + "/" + doc.id());
            }

            return new MfaCredential(
                    doc.id(),
                    (String) data.get("secret"),
                    Boolean.TRUE.equals(data.get("enabled")),
                    Boolean.TRUE.equals(data.get("setup_completed")),
                    codes,
                    parse(data.get("created_at")),
                    parse(data.get("verified_at")),
                    parse(data.get("disabled_at")),
                    parse(data.get("last_used_at")),
                    parse(data.get("recovery_codes_regenerated_at")),
                    parse(data.get("updated_at")),
                    doc.version());
        } catch (ClassCastException | DateTimeParseException | IllegalArgumentException | IllegalStateException e) {
            throw new DocumentStoreException("Malformed MFA document " + COLLECTION + "/" + doc.id(), e);
        }
    }

    private static String format(OffsetDateTime time) {
        return time == null ? null : time.toString();
    }

    private static OffsetDateTime parse(Object value) {
        return value == null ? null : OffsetDateTime.parse((String) value);
    }
}
