package com.skillbridge.mfa.infrastructure.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.skillbridge.mfa.domain.ports.DocumentStore;
import com.skillbridge.mfa.exception.DocumentConflictException;
import com.skillbridge.mfa.exception.DocumentStoreException;
import com.skillbridge.mfa.infrastructure.jpa.DocumentEntity;
import com.skillbridge.mfa.infrastructure.jpa.DocumentKey;
import com.skillbridge.mfa.infrastructure.jpa.SpringDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@Component
@Transactional
public class JpaDocumentStoreAdapter implements DocumentStore {

    private static final Logger log = LoggerFactory.getLogger(JpaDocumentStoreAdapter.class);

    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {};

    private final SpringDocumentRepository documents;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final StoreAvailability availability;

    public JpaDocumentStoreAdapter(SpringDocumentRepository documents,
                                   ObjectMapper objectMapper,
                                   Clock clock,
                                   @Value("${app.store.availability:AVAILABLE}") StoreAvailability availability) {
        this.documents = documents;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.availability = availability;
        if (availability == StoreAvailability.UNAVAILABLE) {
            log.warn("Document store is not configured; every store operation will fail");
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredDocument> get(String collection, String id) {
        requireAvailable();
        try {
            return documents.findById(new DocumentKey(collection, id)).map(this::toStored);
        } catch (DataAccessException e) {
            throw new DocumentStoreException("Failed to read " + collection + "/" + id, e);
        }
    }

    @Override
    public StoredDocument create(String collection, String id, Map<String, Object> data) {
        requireAvailable();
        try {
            if (documents.existsById(new DocumentKey(collection, id))) {
                throw new DocumentConflictException("Document already exists: " + collection + "/" + id);
            }
            DocumentEntity entity = new DocumentEntity(collection, id, writeBody(data), OffsetDateTime.now(clock));
            documents.saveAndFlush(entity);
            log.debug("Created document {}/{}", collection, id);
            return new StoredDocument(collection, id, copyOf(data), entity.getVersion());
        } catch (DataIntegrityViolationException e) {
            throw new DocumentConflictException("Document already exists: " + collection + "/" + id, e);
        } catch (DataAccessException e) {
            throw new DocumentStoreException("Failed to create " + collection + "/" + id, e);
        }
    }

    @Override
    public StoredDocument update(String collection, String id, Map<String, Object> data, long expectedVersion) {
        requireAvailable();
        int updated;
        try {
            updated = documents.updateIfVersionMatches(collection, id, writeBody(data), expectedVersion,
                    OffsetDateTime.now(clock));
        } catch (DataAccessException e) {
            throw new DocumentStoreException("Failed to update " + collection + "/" + id, e);
        }
        if (updated == 0) {
            log.warn("Conditional write rejected for {}/{} at version {}", collection, id, expectedVersion);
            throw new DocumentConflictException("Document " + collection + "/" + id
                    + " is missing or changed since version " + expectedVersion);
        }
        return new StoredDocument(collection, id, copyOf(data), expectedVersion + 1);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredDocument> query(String collection, String field, Object value, int limit) {
        requireAvailable();
        try {
            return documents.findByCollectionNameOrderByCreatedAtAsc(collection).stream()
                    .map(this::toStored)
                    .filter(doc -> Objects.equals(doc.data().get(field), value))
                    .limit(limit)
                    .toList();
        } catch (DataAccessException e) {
            throw new DocumentStoreException("Failed to query " + collection, e);
        }
    }

    private void requireAvailable() {
        if (availability == StoreAvailability.UNAVAILABLE) {
            throw new DocumentStoreException("Document store is not available");
        }
    }

    private String writeBody(Map<String, Object> data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new DocumentStoreException("Document body is not serializable", e);
        }
    }

    // Bodies may hold null values
    private static Map<String, Object> copyOf(Map<String, Object> data) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    private StoredDocument toStored(DocumentEntity entity) {
        try {
            Map<String, Object> data = objectMapper.readValue(entity.getBody(), BODY_TYPE);
            return new StoredDocument(entity.getCollectionName(), entity.getDocId(), data, entity.getVersion());
        } catch (JsonProcessingException e) {
            throw new DocumentStoreException("Stored document " + entity.getCollectionName() + "/"
                    + entity.getDocId() + " is not valid JSON", e);
        }
    }
}
