package com.skillbridge.mfa.infrastructure.notify;

import com.skillbridge.mfa.domain.mfa.ActivityType;
import com.skillbridge.mfa.domain.ports.ActivityLog;
import com.skillbridge.mfa.domain.ports.DocumentStore;
import com.skillbridge.mfa.exception.DocumentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Best-effort audit trail. A failed write is logged and never fails the calling operation.
 */
@Component
public class DocumentActivityLog implements ActivityLog {
    private static final Logger log = LoggerFactory.getLogger(DocumentActivityLog.class);

    static final String COLLECTION = "activity_logs";

    private final DocumentStore store;
    private final Clock clock;

    public DocumentActivityLog(DocumentStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public void record(String userId, ActivityType type, String message) {
        if (type == ActivityType.MFA_VERIFICATION_FAILED) {
            log.warn("User {} activity {}: {}", userId, type, message);
        } else {
            log.info("User {} activity {}: {}", userId, type, message);
        }

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("uid", userId);
        entry.put("type", type.name());
        entry.put("message", message);
        entry.put("created_at", OffsetDateTime.now(clock).toString());
        try {
            store.create(COLLECTION, UUID.randomUUID().toString(), entry);
        } catch (DocumentStoreException e) {
            log.warn("Failed to persist {} activity for user {}: {}", type, userId, e.getMessage());
        }
    }
}
