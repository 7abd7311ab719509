package com.skillbridge.mfa.infrastructure.adapters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbridge.mfa.domain.mfa.MfaCredential;
import com.skillbridge.mfa.domain.mfa.RecoveryCode;
import com.skillbridge.mfa.domain.ports.DocumentStore;
import com.skillbridge.mfa.exception.DocumentConflictException;
import com.skillbridge.mfa.exception.DocumentStoreException;
import com.skillbridge.mfa.infrastructure.jpa.SpringDocumentRepository;
import com.skillbridge.mfa.support.MutableClock;
import com.skillbridge.mfa.support.TestClockConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
class DocumentMfaCredentialRepositoryAdapterTest {

    @Autowired
    private DocumentMfaCredentialRepositoryAdapter repository;

    @Autowired
    private DocumentStore store;

    @Autowired
    private SpringDocumentRepository documents;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private MutableClock clock;

    private MfaCredential newCredential(String userId) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        return MfaCredential.pending(userId, "ciphertext",
                List.of(RecoveryCode.fresh("hash-1", now), RecoveryCode.fresh("hash-2", now)), now);
    }

    @Test
    void shouldPersistAndReloadCredential() {
        String userId = UUID.randomUUID().toString();
        MfaCredential created = repository.create(newCredential(userId));

        MfaCredential loaded = repository.findByUserId(userId).orElseThrow();

        assertThat(loaded.getVersion()).isEqualTo(created.getVersion());
        assertThat(loaded.getSecretCiphertext()).isEqualTo("ciphertext");
        assertThat(loaded.isEnabled()).isFalse();
        assertThat(loaded.getRecoveryCodes()).containsExactlyElementsOf(created.getRecoveryCodes());
        assertThat(loaded.getCreatedAt()).isEqualTo(created.getCreatedAt());
        assertThat(loaded.getVerifiedAt()).isNull();
    }

    @Test
    void shouldStoreSnakeCaseDocument() {
        String userId = UUID.randomUUID().toString();
        repository.create(newCredential(userId));

        Map<String, Object> data = store.get("user_mfa", userId).orElseThrow().data();

        assertThat(data).containsKeys("secret", "enabled", "setup_completed", "recovery_codes", "created_at");
        assertThat(data.get("setup_completed")).isEqualTo(false);
    }

    @Test
    void shouldReturnEmptyForUnknownUser() {
        assertThat(repository.findByUserId("nobody-" + UUID.randomUUID())).isEmpty();
    }

    @Test
    void shouldApplyConditionalUpdate() {
        String userId = UUID.randomUUID().toString();
        MfaCredential created = repository.create(newCredential(userId));

        MfaCredential updated = repository.update(created.enable(OffsetDateTime.now(clock)));

        assertThat(updated.getVersion()).isEqualTo(created.getVersion() + 1);
        assertThat(repository.findByUserId(userId).orElseThrow().isEnabled()).isTrue();
    }

    @Test
    void shouldRejectStaleWrite() {
        String userId = UUID.randomUUID().toString();
        MfaCredential created = repository.create(newCredential(userId));
        OffsetDateTime now = OffsetDateTime.now(clock);

        repository.update(created.withRecoveryCodeUsed(0, now));

        // Second writer still holds the original version
        assertThatThrownBy(() -> repository.update(created.withRecoveryCodeUsed(0, now)))
                .isInstanceOf(DocumentConflictException.class);
        assertThat(repository.findByUserId(userId).orElseThrow().unusedRecoveryCodeCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectDuplicateCreate() {
        String userId = UUID.randomUUID().toString();
        repository.create(newCredential(userId));

        assertThatThrownBy(() -> repository.create(newCredential(userId)))
                .isInstanceOf(DocumentConflictException.class);
    }

    @Test
    void shouldRejectMalformedDocument() {
        String userId = UUID.randomUUID().toString();
        store.create("user_mfa", userId, Map.of("secret", "x", "recovery_codes", "oops"));

        assertThatThrownBy(() -> repository.findByUserId(userId))
                .isInstanceOf(DocumentStoreException.class);
    }

    @Test
    void shouldQueryByField() {
        String uid = UUID.randomUUID().toString();
        store.create("activity_logs", UUID.randomUUID().toString(), Map.of("uid", uid, "type", "LOGIN"));
        store.create("activity_logs", UUID.randomUUID().toString(), Map.of("uid", uid, "type", "MFA_SUCCESS"));

        assertThat(store.query("activity_logs", "uid", uid, 10)).hasSize(2);
        assertThat(store.query("activity_logs", "uid", uid, 1)).hasSize(1);
    }

    @Test
    void shouldFailEveryOperationWhenStoreUnavailable() {
        JpaDocumentStoreAdapter unavailable = new JpaDocumentStoreAdapter(
                documents, objectMapper, clock, StoreAvailability.UNAVAILABLE);
        DocumentMfaCredentialRepositoryAdapter offline = new DocumentMfaCredentialRepositoryAdapter(unavailable);

        assertThatThrownBy(() -> offline.findByUserId("u1")).isInstanceOf(DocumentStoreException.class);
        assertThatThrownBy(() -> offline.create(newCredential("u1"))).isInstanceOf(DocumentStoreException.class);
        assertThatThrownBy(() -> unavailable.query("user_mfa", "enabled", true, 10))
                .isInstanceOf(DocumentStoreException.class);
    }
}
