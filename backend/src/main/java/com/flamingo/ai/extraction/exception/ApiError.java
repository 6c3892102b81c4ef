package com.flamingo.ai.extraction.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_READ_ERROR = "DOCUMENT_002";
  public static final String DISCOVERY_TIMEOUT = "DISCOVERY_001";
  public static final String DISCOVERY_LOW_CONFIDENCE = "DISCOVERY_002";
  public static final String SCALING_MISCONFIGURATION = "SCALING_001";
  public static final String EXTRACTION_ESCALATED = "EXTRACTION_001";
  public static final String PERSISTENCE_FAILURE = "PERSISTENCE_001";
  public static final String RECORD_NOT_FOUND = "PERSISTENCE_002";
  public static final String LLM_UNAVAILABLE = "LLM_001";
  public static final String LLM_RATE_LIMITED = "LLM_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Document the failure relates to, if any. */
  private final String documentId;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
