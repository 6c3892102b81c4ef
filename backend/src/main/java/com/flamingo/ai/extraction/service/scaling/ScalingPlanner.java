package com.flamingo.ai.extraction.service.scaling;

import com.flamingo.ai.extraction.config.ExtractionConfig;
import com.flamingo.ai.extraction.domain.model.AgentAssignment;
import com.flamingo.ai.extraction.domain.model.FieldSchema;
import com.flamingo.ai.extraction.domain.model.PageRange;
import com.flamingo.ai.extraction.domain.model.ScalingPlan;
import com.flamingo.ai.extraction.exception.ScalingMisconfigurationException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decides how many extraction agents a document gets and which pages each one owns.
 *
 * <p>Pages are split into contiguous ranges that cover {@code [1, P]} exactly once. The first
 * {@code P mod K} ranges are one page longer than the rest. The plan is a pure function of the
 * page count and the configured thresholds.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScalingPlanner {

  private final ExtractionConfig config;

  /** Returns the configured agent count for a document of {@code pageCount} pages. */
  public int agentCountFor(int pageCount) {
    ExtractionConfig.Scaling scaling = config.getScaling();
    if (pageCount < scaling.getSmallDocumentPages()) {
      return scaling.getSmallAgentCount();
    }
    if (pageCount <= scaling.getLargeDocumentPages()) {
      return scaling.getMediumAgentCount();
    }
    return scaling.getLargeAgentCount();
  }

  /**
   * Splits {@code [1, pageCount]} into {@code agentCount} contiguous ranges.
   *
   * @throws IllegalArgumentException if either argument is not positive or there are fewer pages
   *     than agents
   */
  public static List<PageRange> partition(int pageCount, int agentCount) {
    if (pageCount <= 0 || agentCount <= 0 || agentCount > pageCount) {
      throw new IllegalArgumentException(
          "Cannot split " + pageCount + " pages across " + agentCount + " agents");
    }
    int base = pageCount / agentCount;
    int remainder = pageCount % agentCount;

    List<PageRange> ranges = new ArrayList<>(agentCount);
    int start = 1;
    for (int i = 0; i < agentCount; i++) {
      int size = base + (i < remainder ? 1 : 0);
      ranges.add(new PageRange(start, start + size - 1));
      start += size;
    }
    return List.copyOf(ranges);
  }

  /**
   * Builds the assignments for one extraction run.
   *
   * @param documentId the document
   * @param pageCount number of pages
   * @param schema the frozen field schema every agent receives
   * @return the plan; carries a warning when the agent count had to be reduced
   * @throws ScalingMisconfigurationException if the document has no pages
   */
  public ScalingPlan plan(UUID documentId, int pageCount, FieldSchema schema) {
    if (pageCount <= 0) {
      log.error("Document {} reports {} pages; no agents dispatched", documentId, pageCount);
      throw new ScalingMisconfigurationException(
          documentId, pageCount, "Document reports " + pageCount + " pages; nothing to extract");
    }

    List<String> warnings = new ArrayList<>();
    int agentCount = agentCountFor(pageCount);
    if (pageCount < agentCount) {
      String warning =
          String.format(
              "ScalingMisconfiguration: %d pages is fewer than %d agents, using %d",
              pageCount, agentCount, pageCount);
      log.warn("Document {}: {}", documentId, warning);
      warnings.add(warning);
      agentCount = pageCount;
    }

    List<PageRange> ranges = partition(pageCount, agentCount);
    List<AgentAssignment> assignments = new ArrayList<>(ranges.size());
    for (int i = 0; i < ranges.size(); i++) {
      assignments.add(new AgentAssignment(documentId, "agent-" + (i + 1), ranges.get(i), schema));
    }

    log.info(
        "Planned {} agents over {} pages for document {}: {}",
        agentCount,
        pageCount,
        documentId,
        ranges);
    return new ScalingPlan(documentId, pageCount, agentCount, assignments, warnings);
  }
}
