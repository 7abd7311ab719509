package com.skillbridge.mfa.domain.ports;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Key-value-per-collection document store.
 * <p>
 * Every stored document carries a version counter. {@link #update} only succeeds when the
 * caller's expected version is still current, otherwise it throws
 * {@link com.skillbridge.mfa.exception.DocumentConflictException}. Store failures surface as
 * {@link com.skillbridge.mfa.exception.DocumentStoreException}.
 */
public interface DocumentStore {

    Optional<StoredDocument> get(String collection, String id);

    StoredDocument create(String collection, String id, Map<String, Object> data);

    StoredDocument update(String collection, String id, Map<String, Object> data, long expectedVersion);

    List<StoredDocument> query(String collection, String field, Object value, int limit);

    record StoredDocument(String collection, String id, Map<String, Object> data, long version) {}
}
