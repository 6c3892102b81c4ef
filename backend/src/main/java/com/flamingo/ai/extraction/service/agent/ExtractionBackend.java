package com.flamingo.ai.extraction.service.agent;

import com.flamingo.ai.extraction.domain.model.AgentAssignment;
import com.flamingo.ai.extraction.domain.model.FieldExtraction;
import java.util.List;

/**
 * Produces field values for one page range. One implementation per model backend.
 *
 * <p>Implementations read only the pages of their assignment, return nothing for fields that do not
 * occur there, and may be called concurrently for different assignments of the same document.
 */
public interface ExtractionBackend {

  /**
   * Extracts the schema's fields from the assignment's pages.
   *
   * @param assignment page range and frozen schema
   * @return zero or more extractions, each attributed to the assignment's agent and range
   */
  List<FieldExtraction> extract(AgentAssignment assignment);
}
