package com.flamingo.ai.extraction.exception;

import com.flamingo.ai.extraction.domain.model.AgentOutcome;
import java.util.List;
import java.util.UUID;

/** Exception thrown when every extraction agent of a document failed. */
public class ExtractionEscalatedException extends RuntimeException {

  private final UUID documentId;
  private final List<AgentOutcome> outcomes;

  public ExtractionEscalatedException(UUID documentId, List<AgentOutcome> outcomes) {
    super(
        String.format(
            "All %d extraction agents failed for document %s", outcomes.size(), documentId));
    this.documentId = documentId;
    this.outcomes = List.copyOf(outcomes);
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public List<AgentOutcome> getOutcomes() {
    return outcomes;
  }
}
