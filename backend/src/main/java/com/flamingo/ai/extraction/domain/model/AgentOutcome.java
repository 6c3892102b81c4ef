package com.flamingo.ai.extraction.domain.model;

import java.time.Duration;
import java.util.List;

/**
 * Terminal result of one extraction agent. Failed agents carry no extractions.
 *
 * @param agentId agent identifier
 * @param pageRange the agent's page range
 * @param status terminal state
 * @param extractions values produced; empty unless {@code status} is SUCCEEDED
 * @param error failure description, null on success
 * @param elapsed wall-clock time until the terminal state
 */
public record AgentOutcome(
    String agentId,
    PageRange pageRange,
    AgentStatus status,
    List<FieldExtraction> extractions,
    String error,
    Duration elapsed) {

  public AgentOutcome {
    extractions = status == AgentStatus.SUCCEEDED && extractions != null
        ? List.copyOf(extractions)
        : List.of();
  }

  public static AgentOutcome succeeded(
      AgentAssignment assignment, List<FieldExtraction> extractions, Duration elapsed) {
    return new AgentOutcome(
        assignment.agentId(), assignment.pageRange(), AgentStatus.SUCCEEDED, extractions, null,
        elapsed);
  }

  public static AgentOutcome failed(
      AgentAssignment assignment, AgentStatus status, String error, Duration elapsed) {
    return new AgentOutcome(
        assignment.agentId(), assignment.pageRange(), status, List.of(), error, elapsed);
  }
}
