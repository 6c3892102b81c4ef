package com.flamingo.ai.extraction.exception;

import java.util.UUID;

/** Exception thrown when a document cannot be partitioned, e.g. it reports zero pages. */
public class ScalingMisconfigurationException extends RuntimeException {

  private final UUID documentId;
  private final int pageCount;

  public ScalingMisconfigurationException(UUID documentId, int pageCount, String message) {
    super(message);
    this.documentId = documentId;
    this.pageCount = pageCount;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public int getPageCount() {
    return pageCount;
  }
}
