package com.flamingo.ai.extraction.exception;

import java.util.UUID;

/** Exception thrown when a stored document cannot be opened or read page by page. */
public class DocumentReadException extends RuntimeException {

  private final UUID documentId;
  private final String userMessage;

  public DocumentReadException(UUID documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = "Failed to read document";
  }

  public DocumentReadException(UUID documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to read document";
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
