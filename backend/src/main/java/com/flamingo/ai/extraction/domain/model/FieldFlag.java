package com.flamingo.ai.extraction.domain.model;

/** Review flags attached to a consolidated field. */
public enum FieldFlag {
  /** Required field that no agent observed. */
  MISSING,

  /** Resolved confidence below the configured threshold. */
  LOW_CONFIDENCE,

  /** Resolved value violates at least one validation rule. */
  VALIDATION_FAILED,

  /** Several agents reported different values; the loser values are kept as provenance. */
  CONFLICT_RESOLVED
}
