package com.flamingo.ai.extraction.domain.model;

/** Review flags attached to a consolidated record as a whole. */
public enum RecordFlag {
  /** The run was cancelled by the document deadline before every agent finished. */
  PARTIAL,

  /** Fewer than the configured fraction of agents completed. */
  DEGRADED,

  /** At least one required field is missing. */
  MISSING_REQUIRED,

  /** At least one field was resolved below the confidence threshold. */
  LOW_CONFIDENCE,

  /** At least one field failed validation. */
  VALIDATION_FAILED
}
