package com.flamingo.ai.extraction.domain.repository;

import com.flamingo.ai.extraction.domain.entity.ExtractionRecord;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ExtractionRecord entities. */
@Repository
public interface ExtractionRecordRepository extends JpaRepository<ExtractionRecord, UUID> {

  /** Finds the newest version stored for a document. */
  Optional<ExtractionRecord> findFirstByDocumentIdOrderByVersionDesc(UUID documentId);

  /** Finds every version stored for a document, newest first. */
  List<ExtractionRecord> findByDocumentIdOrderByVersionDesc(UUID documentId);

  /** Checks whether a run was already persisted. */
  boolean existsByRunId(UUID runId);

  /** Returns the highest stored version of a document, 0 when none exists. */
  @Query(
      "SELECT COALESCE(MAX(r.version), 0) FROM ExtractionRecord r "
          + "WHERE r.documentId = :documentId")
  int findMaxVersion(@Param("documentId") UUID documentId);
}
