package com.flamingo.ai.extraction.domain.model;

/** Terminal state of one extraction agent. */
public enum AgentStatus {
  SUCCEEDED,
  TIMED_OUT,
  FAILED,
  /** Stopped by the document-level deadline. */
  CANCELLED;

  public boolean isSuccess() {
    return this == SUCCEEDED;
  }
}
