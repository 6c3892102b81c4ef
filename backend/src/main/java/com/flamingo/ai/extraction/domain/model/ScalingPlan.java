package com.flamingo.ai.extraction.domain.model;

import java.util.List;
import java.util.UUID;

/**
 * Partition of a document across extraction agents.
 *
 * @param documentId document being planned
 * @param pageCount total number of pages
 * @param agentCount number of assignments actually produced
 * @param assignments assignments ordered by start page
 * @param warnings non-fatal planning problems, e.g. a reduced agent count
 */
public record ScalingPlan(
    UUID documentId,
    int pageCount,
    int agentCount,
    List<AgentAssignment> assignments,
    List<String> warnings) {

  public ScalingPlan {
    assignments = List.copyOf(assignments);
    warnings = warnings != null ? List.copyOf(warnings) : List.of();
  }

  public List<PageRange> pageRanges() {
    return assignments.stream().map(AgentAssignment::pageRange).toList();
  }
}
