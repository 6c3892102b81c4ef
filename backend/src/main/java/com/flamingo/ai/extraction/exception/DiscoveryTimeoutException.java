package com.flamingo.ai.extraction.exception;

import java.time.Duration;
import java.util.UUID;

/** Exception thrown when a discovery agent does not answer in time, after its retry. */
public class DiscoveryTimeoutException extends RuntimeException {

  private final UUID documentId;
  private final int passNumber;

  public DiscoveryTimeoutException(UUID documentId, int passNumber, Duration timeout) {
    super(
        String.format(
            "Discovery pass %d for document %s did not respond within %d ms",
            passNumber, documentId, timeout.toMillis()));
    this.documentId = documentId;
    this.passNumber = passNumber;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public int getPassNumber() {
    return passNumber;
  }
}
