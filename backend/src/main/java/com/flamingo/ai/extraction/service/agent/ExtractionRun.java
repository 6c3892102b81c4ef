package com.flamingo.ai.extraction.service.agent;

import com.flamingo.ai.extraction.domain.model.AgentOutcome;
import com.flamingo.ai.extraction.domain.model.AgentStatus;
import com.flamingo.ai.extraction.domain.model.FieldExtraction;
import java.util.List;

/**
 * Terminal outcomes of every agent dispatched for one document.
 *
 * @param outcomes one outcome per assignment, ordered by page range
 * @param deadlineExceeded whether the document deadline cancelled agents still in flight
 * @param planWarnings warnings raised while planning the run, carried into the record
 */
public record ExtractionRun(
    List<AgentOutcome> outcomes, boolean deadlineExceeded, List<String> planWarnings) {

  public ExtractionRun {
    outcomes = List.copyOf(outcomes);
    planWarnings = planWarnings != null ? List.copyOf(planWarnings) : List.of();
  }

  public ExtractionRun(List<AgentOutcome> outcomes, boolean deadlineExceeded) {
    this(outcomes, deadlineExceeded, List.of());
  }

  public long succeededCount() {
    return outcomes.stream().filter(o -> o.status() == AgentStatus.SUCCEEDED).count();
  }

  public boolean allFailed() {
    return !outcomes.isEmpty() && succeededCount() == 0;
  }

  public double completedFraction() {
    return outcomes.isEmpty() ? 0.0 : (double) succeededCount() / outcomes.size();
  }

  public List<FieldExtraction> extractions() {
    return outcomes.stream().flatMap(o -> o.extractions().stream()).toList();
  }
}
