package com.flamingo.ai.extraction.domain.model;

/**
 * Provenance metadata about one agent, stored on the record.
 *
 * @param agentId agent identifier
 * @param pageRange the agent's page range
 * @param status terminal state
 * @param extractionCount number of values it produced
 * @param error failure description, null on success
 * @param elapsedMillis time to terminal state
 */
public record AgentRunSummary(
    String agentId,
    PageRange pageRange,
    AgentStatus status,
    int extractionCount,
    String error,
    long elapsedMillis) {

  public static AgentRunSummary from(AgentOutcome outcome) {
    return new AgentRunSummary(
        outcome.agentId(),
        outcome.pageRange(),
        outcome.status(),
        outcome.extractions().size(),
        outcome.error(),
        outcome.elapsed() != null ? outcome.elapsed().toMillis() : 0L);
  }
}
