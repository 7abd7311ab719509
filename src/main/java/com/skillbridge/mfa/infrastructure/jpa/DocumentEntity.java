package com.skillbridge.mfa.infrastructure.jpa;

import jakarta.persistence.*;
import org.springframework.data.domain.Persistable;

import java.time.OffsetDateTime;

@Entity
@Table(name = "documents")
@IdClass(DocumentKey.class)
public class DocumentEntity implements Persistable<DocumentKey> {
    @Id
    @Column(name = "collection_name", nullable = false, length = 100)
    private String collectionName;

    @Id
    @Column(name = "doc_id", nullable = false)
    private String docId;

    // JSON object
    @Column(name = "body", nullable = false, length = 1_000_000)
    private String body;

    @Column(nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    // Inserts go through persist so a duplicate key fails instead of merging
    @Transient
    private boolean isNew = true;

    // Constructors
    public DocumentEntity() {}

    public DocumentEntity(String collectionName, String docId, String body, OffsetDateTime now) {
        this.collectionName = collectionName;
        this.docId = docId;
        this.body = body;
        this.version = 1L;
        this.createdAt = now;
        this.updatedAt = now;
    }

    @Override
    public DocumentKey getId() {
        return new DocumentKey(collectionName, docId);
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    // Getters and Setters
    public String getCollectionName() { return collectionName; }
    public void setCollectionName(String collectionName) { this.collectionName = collectionName; }

    public String getDocId() { return docId; }
    public void setDocId(String docId) { this.docId = docId; }

    public String getBody() { return body; }
    public void setBody(String body) { this.body = body; }

    public long getVersion() { return version; }
    public void setVersion(long version) { this.version = version; }

    public OffsetDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(OffsetDateTime createdAt) { this.createdAt = createdAt; }

    public OffsetDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(OffsetDateTime updatedAt) { this.updatedAt = updatedAt; }
}
