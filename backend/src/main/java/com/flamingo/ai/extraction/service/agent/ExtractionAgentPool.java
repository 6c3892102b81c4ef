package com.flamingo.ai.extraction.service.agent;

import com.flamingo.ai.extraction.config.ExtractionConfig;
import com.flamingo.ai.extraction.domain.model.AgentAssignment;
import com.flamingo.ai.extraction.domain.model.AgentOutcome;
import com.flamingo.ai.extraction.domain.model.AgentStatus;
import com.flamingo.ai.extraction.domain.model.FieldExtraction;
import com.flamingo.ai.extraction.domain.model.ScalingPlan;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs the assignments of a {@link ScalingPlan} in parallel, one task per assignment, and waits for
 * every task to reach a terminal state.
 *
 * <p>Each agent has its own timeout, counted from the moment a worker thread starts it, so agents
 * queued behind another document are not charged for the wait. A failing or slow agent only loses
 * its own page range. When the document deadline passes, every agent still running is cancelled and
 * the run is reported as exceeded.
 */
@Component
@Slf4j
public class ExtractionAgentPool {

  private final ExtractionBackend backend;
  private final ThreadPoolTaskExecutor executor;
  private final ExtractionConfig config;
  private final MeterRegistry meterRegistry;

  public ExtractionAgentPool(
      ExtractionBackend backend,
      @Qualifier("extractionAgentExecutor") ThreadPoolTaskExecutor executor,
      ExtractionConfig config,
      MeterRegistry meterRegistry) {
    this.backend = backend;
    this.executor = executor;
    this.config = config;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Dispatches every assignment and blocks until all of them finished, timed out, failed or were
   * cancelled.
   */
  public ExtractionRun run(ScalingPlan plan) {
    long documentDeadline =
        System.nanoTime() + config.getAgents().getDocumentDeadline().toNanos();

    List<PendingAgent> pending = new ArrayList<>(plan.assignments().size());
    for (AgentAssignment assignment : plan.assignments()) {
      pending.add(dispatch(assignment));
    }
    log.debug("Dispatched {} extraction agents for document {}", pending.size(), plan.documentId());

    List<AgentOutcome> outcomes = new ArrayList<>(pending.size());
    boolean deadlineExceeded = false;
    for (PendingAgent agent : pending) {
      AgentOutcome outcome;
      if (agent.rejected() != null) {
        outcome = agent.rejected();
      } else if (deadlineExceeded) {
        outcome = cancel(agent);
      } else {
        outcome = await(agent, documentDeadline);
        deadlineExceeded =
            outcome.status() == AgentStatus.CANCELLED && System.nanoTime() >= documentDeadline;
      }
      recordOutcome(plan, outcome);
      outcomes.add(outcome);
    }

    if (deadlineExceeded) {
      meterRegistry.counter("extraction.deadline_exceeded").increment();
      log.warn(
          "Document deadline {} exceeded for document {}; in-flight agents cancelled",
          config.getAgents().getDocumentDeadline(),
          plan.documentId());
    }
    return new ExtractionRun(outcomes, deadlineExceeded, plan.warnings());
  }

  private PendingAgent dispatch(AgentAssignment assignment) {
    try {
      AgentTask<TimedExtractions> task =
          AgentTask.submit(
              executor,
              () -> {
                long start = System.nanoTime();
                List<FieldExtraction> extractions = backend.extract(assignment);
                return new TimedExtractions(
                    extractions, Duration.ofNanos(System.nanoTime() - start));
              });
      return new PendingAgent(assignment, task, null);
    } catch (TaskRejectedException e) {
      log.warn("Agent {} could not be scheduled: {}", assignment.agentId(), e.getMessage());
      return new PendingAgent(
          assignment,
          null,
          AgentOutcome.failed(
              assignment,
              AgentStatus.FAILED,
              "Rejected by executor: " + e.getMessage(),
              Duration.ZERO));
    }
  }

  private AgentOutcome await(PendingAgent agent, long documentDeadline) {
    AgentAssignment assignment = agent.assignment();
    AgentTask<TimedExtractions> task = agent.task();
    try {
      TimedExtractions result = task.await(config.getAgents().getTimeout(), documentDeadline);
      List<FieldExtraction> extractions =
          result.extractions() != null ? result.extractions() : List.of();
      return AgentOutcome.succeeded(assignment, extractions, result.elapsed());

    } catch (TimeoutException e) {
      Duration running = task.runningTime();
      task.cancel();
      if (System.nanoTime() >= documentDeadline) {
        return AgentOutcome.failed(
            assignment, AgentStatus.CANCELLED, "Document deadline exceeded", running);
      }
      log.warn("Agent {} on pages {} timed out", assignment.agentId(), assignment.pageRange());
      return AgentOutcome.failed(assignment, AgentStatus.TIMED_OUT, "Agent timed out", running);

    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.warn(
          "Agent {} on pages {} failed: {}",
          assignment.agentId(),
          assignment.pageRange(),
          cause.getMessage());
      return AgentOutcome.failed(
          assignment,
          AgentStatus.FAILED,
          cause.getClass().getSimpleName() + ": " + cause.getMessage(),
          task.runningTime());

    } catch (CancellationException e) {
      return AgentOutcome.failed(
          assignment, AgentStatus.CANCELLED, "Agent cancelled", task.runningTime());

    } catch (InterruptedException e) {
      task.cancel();
      Thread.currentThread().interrupt();
      return AgentOutcome.failed(
          assignment, AgentStatus.CANCELLED, "Extraction interrupted", task.runningTime());
    }
  }

  private AgentOutcome cancel(PendingAgent agent) {
    if (agent.task().isDone() && !agent.task().isCancelled()) {
      // finished before we got to it; keep the result
      return await(agent, System.nanoTime());
    }
    Duration running = agent.task().runningTime();
    agent.task().cancel();
    return AgentOutcome.failed(
        agent.assignment(), AgentStatus.CANCELLED, "Document deadline exceeded", running);
  }

  private void recordOutcome(ScalingPlan plan, AgentOutcome outcome) {
    meterRegistry.counter("extraction.agents", "status", outcome.status().name()).increment();
    log.debug(
        "Agent {} of document {} on pages {}: {} with {} extraction(s) in {} ms",
        outcome.agentId(),
        plan.documentId(),
        outcome.pageRange(),
        outcome.status(),
        outcome.extractions().size(),
        outcome.elapsed().toMillis());
  }

  private record TimedExtractions(List<FieldExtraction> extractions, Duration elapsed) {}

  private record PendingAgent(
      AgentAssignment assignment, AgentTask<TimedExtractions> task, AgentOutcome rejected) {}
}
