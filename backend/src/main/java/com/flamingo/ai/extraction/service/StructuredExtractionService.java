package com.flamingo.ai.extraction.service;

import com.flamingo.ai.extraction.domain.model.FieldSchema;
import com.flamingo.ai.extraction.service.persistence.StoredRecord;
import java.util.UUID;

/**
 * Entry point of the extraction engine: field discovery, parallel extraction and consolidation
 * of a document into one persisted record.
 */
public interface StructuredExtractionService {

  /**
   * Discovers the extractable fields of a document.
   *
   * @param documentId the document
   * @return the frozen field schema
   * @throws com.flamingo.ai.extraction.exception.DiscoveryTimeoutException if a discovery pass
   *     timed out after its retry
   * @throws com.flamingo.ai.extraction.exception.DiscoveryLowConfidenceException if too few
   *     fields were found
   */
  FieldSchema discoverFields(UUID documentId);

  /**
   * Extracts the schema's fields from a document with a planned number of parallel agents,
   * consolidates their output and persists the record as the document's next version.
   *
   * @param documentId the document
   * @param schema frozen field schema, discovered or supplied by the caller
   * @return the persisted record and its version
   * @throws com.flamingo.ai.extraction.exception.ScalingMisconfigurationException if the
   *     document has no pages
   * @throws com.flamingo.ai.extraction.exception.ExtractionEscalatedException if every agent
   *     failed
   * @throws com.flamingo.ai.extraction.exception.PersistenceFailureException if the record could
   *     not be stored
   */
  StoredRecord extractStructured(UUID documentId, FieldSchema schema);

  /** Runs {@link #discoverFields} and then {@link #extractStructured} with the result. */
  StoredRecord discoverAndExtract(UUID documentId);

  /**
   * Returns the latest persisted record of a document.
   *
   * @throws com.flamingo.ai.extraction.exception.RecordNotFoundException if none exists
   */
  StoredRecord getLatestRecord(UUID documentId);
}
