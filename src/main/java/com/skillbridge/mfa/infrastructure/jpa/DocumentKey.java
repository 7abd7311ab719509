package com.skillbridge.mfa.infrastructure.jpa;

import java.io.Serializable;
import java.util.Objects;

public class DocumentKey implements Serializable {
    private String collectionName;
    private String docId;

    public DocumentKey() {}

    public DocumentKey(String collectionName, String docId) {
        this.collectionName = collectionName;
        this.docId = docId;
    }

    public String getCollectionName() { return collectionName; }
    public String getDocId() { return docId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DocumentKey that)) return false;
        return Objects.equals(collectionName, that.collectionName) && Objects.equals(docId, that.docId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collectionName, docId);
    }
}
