package com.flamingo.ai.extraction.exception;

import java.util.UUID;

/** Exception thrown when the record sink rejects a write. The record is not durable. */
public class PersistenceFailureException extends RuntimeException {

  private final UUID documentId;
  private final UUID runId;

  public PersistenceFailureException(UUID documentId, UUID runId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.runId = runId;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public UUID getRunId() {
    return runId;
  }
}
