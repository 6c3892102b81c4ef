package com.flamingo.ai.extraction.exception;

import java.util.UUID;

/** Exception thrown when discovery yields fewer fields than extraction needs. */
public class DiscoveryLowConfidenceException extends RuntimeException {

  private final UUID documentId;
  private final int discoveredFieldCount;
  private final int minimumFieldCount;

  public DiscoveryLowConfidenceException(
      UUID documentId, int discoveredFieldCount, int minimumFieldCount) {
    super(
        String.format(
            "Discovery for document %s found %d fields, at least %d required",
            documentId, discoveredFieldCount, minimumFieldCount));
    this.documentId = documentId;
    this.discoveredFieldCount = discoveredFieldCount;
    this.minimumFieldCount = minimumFieldCount;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public int getDiscoveredFieldCount() {
    return discoveredFieldCount;
  }

  public int getMinimumFieldCount() {
    return minimumFieldCount;
  }
}
