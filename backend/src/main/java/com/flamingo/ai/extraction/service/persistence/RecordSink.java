package com.flamingo.ai.extraction.service.persistence;

import com.flamingo.ai.extraction.domain.model.ConsolidatedRecord;
import java.util.Optional;
import java.util.UUID;

/** Durable storage for consolidated records. Each run is written exactly once. */
public interface RecordSink {

  /**
   * Stores a record as the next version of its document.
   *
   * @param documentId owning document
   * @param record record to store
   * @return the stored version
   * @throws com.flamingo.ai.extraction.exception.PersistenceFailureException if the write is
   *     rejected; the record is then not durable
   */
  StoredRecord write(UUID documentId, ConsolidatedRecord record);

  /** Returns the latest stored version of a document's record, if any. */
  Optional<StoredRecord> findLatest(UUID documentId);
}
