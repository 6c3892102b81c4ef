package com.flamingo.ai.extraction.exception;

import java.util.UUID;

/** Exception thrown when no extraction record has been stored for a document. */
public class RecordNotFoundException extends RuntimeException {

  private final UUID documentId;

  public RecordNotFoundException(UUID documentId) {
    super("No extraction record stored for document: " + documentId);
    this.documentId = documentId;
  }

  public UUID getDocumentId() {
    return documentId;
  }
}
