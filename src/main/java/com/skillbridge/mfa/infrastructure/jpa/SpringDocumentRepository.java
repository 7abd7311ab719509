package com.skillbridge.mfa.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;

public interface SpringDocumentRepository extends JpaRepository<DocumentEntity, DocumentKey> {

    List<DocumentEntity> findByCollectionNameOrderByCreatedAtAsc(String collectionName);

    // Compare-and-set on the version column; returns 0 when another writer got there first
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DocumentEntity d SET d.body = :body, d.version = d.version + 1, d.updatedAt = :updatedAt " +
           "WHERE d.collectionName = :collectionName AND d.docId = :docId AND d.version = :expectedVersion")
    int updateIfVersionMatches(@Param("collectionName") String collectionName,
                               @Param("docId") String docId,
                               @Param("body") String body,
                               @Param("expectedVersion") long expectedVersion,
                               @Param("updatedAt") OffsetDateTime updatedAt);
}
