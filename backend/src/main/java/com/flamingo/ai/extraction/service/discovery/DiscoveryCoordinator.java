package com.flamingo.ai.extraction.service.discovery;

import com.flamingo.ai.extraction.agent.FieldDiscoveryAgent;
import com.flamingo.ai.extraction.agent.dto.DiscoveredField;
import com.flamingo.ai.extraction.agent.dto.DiscoveredRule;
import com.flamingo.ai.extraction.agent.dto.DiscoveryAgentResult;
import com.flamingo.ai.extraction.config.ExtractionConfig;
import com.flamingo.ai.extraction.domain.model.DiscoveryMethod;
import com.flamingo.ai.extraction.domain.model.FieldSchema;
import com.flamingo.ai.extraction.domain.model.FieldSpecification;
import com.flamingo.ai.extraction.domain.model.FieldType;
import com.flamingo.ai.extraction.domain.model.ValidationRule;
import com.flamingo.ai.extraction.exception.DiscoveryLowConfidenceException;
import com.flamingo.ai.extraction.exception.DiscoveryTimeoutException;
import com.flamingo.ai.extraction.exception.LlmServiceException;
import com.flamingo.ai.extraction.service.agent.AgentTask;
import com.flamingo.ai.extraction.service.document.DocumentAccessor;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Produces the field schema of a document.
 *
 * <p>Short documents are read by a single discovery agent. Long documents go through a chain of
 * dependent agents: each pass receives the cumulative field set of the passes before it and may
 * confirm, refine or extend it. The chain is a fold over the ordered pass list, so passes never run
 * concurrently and nothing outside the fold holds discovery state.
 */
@Service
@Slf4j
public class DiscoveryCoordinator {

  private final DocumentAccessor documentAccessor;
  private final FieldDiscoveryAgent discoveryAgent;
  private final ExtractionConfig config;
  private final Retry discoveryRetry;
  private final ThreadPoolTaskExecutor discoveryExecutor;
  private final MeterRegistry meterRegistry;

  public DiscoveryCoordinator(
      DocumentAccessor documentAccessor,
      FieldDiscoveryAgent discoveryAgent,
      ExtractionConfig config,
      Retry discoveryRetry,
      @Qualifier("discoveryExecutor") ThreadPoolTaskExecutor discoveryExecutor,
      MeterRegistry meterRegistry) {
    this.documentAccessor = documentAccessor;
    this.discoveryAgent = discoveryAgent;
    this.config = config;
    this.discoveryRetry = discoveryRetry;
    this.discoveryExecutor = discoveryExecutor;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Discovers the fields of a document.
   *
   * @param documentId the document
   * @return the frozen schema
   * @throws DiscoveryTimeoutException if a pass timed out on every attempt
   * @throws DiscoveryLowConfidenceException if too few fields were found
   * @throws LlmServiceException if the model failed for another reason
   */
  @Timed(value = "extraction.discovery", description = "Time to discover the fields of a document")
  public FieldSchema discoverFields(UUID documentId) {
    int pageCount = documentAccessor.getPageCount(documentId);
    ExtractionConfig.Discovery settings = config.getDiscovery();

    DiscoveryMethod method;
    List<List<Integer>> passes;
    if (pageCount <= settings.getSingleAgentMaxPages()) {
      method = DiscoveryMethod.SINGLE_AGENT;
      passes = List.of(PageSampler.evenlySpaced(pageCount, settings.getSingleAgentSamplePages()));
    } else {
      method = DiscoveryMethod.SEQUENTIAL_CHAIN;
      passes =
          PageSampler.roundRobin(
              pageCount, settings.getChainAgentCount(), settings.getChainSamplePages());
    }

    log.info(
        "Discovering fields of document {} ({} pages) with {} in {} pass(es)",
        documentId,
        pageCount,
        method,
        passes.size());

    DiscoveryState state = DiscoveryState.initial();
    for (int i = 0; i < passes.size(); i++) {
      state = runPass(documentId, pageCount, i + 1, passes.size(), passes.get(i), state);
    }

    int minimum = Math.max(1, settings.getMinFieldCount());
    if (state.fields().size() < minimum) {
      meterRegistry.counter("discovery.low_confidence").increment();
      log.warn(
          "Discovery of document {} found {} field(s), minimum is {}",
          documentId,
          state.fields().size(),
          minimum);
      throw new DiscoveryLowConfidenceException(documentId, state.fields().size(), minimum);
    }

    meterRegistry.counter("discovery.completed", "method", method.name()).increment();
    log.info(
        "Discovered {} fields for document {} (type '{}'): {}",
        state.fields().size(),
        documentId,
        state.documentType(),
        state.fields().stream().map(FieldSpecification::name).toList());

    return new FieldSchema(
        documentId, state.documentType(), method, state.fields(), state.sampledPages());
  }

  private DiscoveryState runPass(
      UUID documentId,
      int pageCount,
      int passNumber,
      int passCount,
      List<Integer> pages,
      DiscoveryState previous) {
    if (pages.isEmpty()) {
      log.debug("Discovery pass {} of document {} has no pages, skipping", passNumber, documentId);
      return previous;
    }

    String pageText = renderPages(documentId, pages);
    String previousFields = renderFields(previous.fields());
    String documentType = previous.documentType() != null ? previous.documentType() : "unknown";

    DiscoveryAgentResult result =
        Retry.decorateSupplier(
                discoveryRetry,
                () ->
                    callAgent(
                        documentId,
                        passNumber,
                        () ->
                            discoveryAgent.discover(
                                passNumber,
                                passCount,
                                pageCount,
                                documentType,
                                previousFields,
                                pageText)))
            .get();

    meterRegistry.counter("discovery.passes").increment();
    List<FieldSpecification> passFields = toSpecifications(documentId, passNumber, result);
    log.debug(
        "Discovery pass {}/{} of document {} read pages {} and returned {} field(s)",
        passNumber,
        passCount,
        documentId,
        pages,
        passFields.size());

    return previous.merge(
        result != null ? result.documentType() : null,
        passFields,
        explicitlyTyped(result),
        pages);
  }

  private DiscoveryAgentResult callAgent(
      UUID documentId, int passNumber, Callable<DiscoveryAgentResult> call) {
    Duration timeout = config.getDiscovery().getAgentTimeout();
    AgentTask<DiscoveryAgentResult> task = AgentTask.submit(discoveryExecutor, call);
    try {
      return task.await(timeout, Long.MAX_VALUE);
    } catch (TimeoutException e) {
      task.cancel();
      meterRegistry.counter("discovery.timeouts").increment();
      log.warn(
          "Discovery pass {} of document {} timed out after {}", passNumber, documentId, timeout);
      throw new DiscoveryTimeoutException(documentId, passNumber, timeout);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.error(
          "Discovery pass {} of document {} failed: {}",
          passNumber,
          documentId,
          cause.getMessage());
      throw LlmServiceException.fromModelFailure("Discovery agent failed", cause);
    } catch (InterruptedException e) {
      task.cancel();
      Thread.currentThread().interrupt();
      throw new LlmServiceException("Discovery interrupted for document " + documentId, e);
    }
  }

  private List<FieldSpecification> toSpecifications(
      UUID documentId, int passNumber, DiscoveryAgentResult result) {
    if (result == null || result.fields() == null) {
      return List.of();
    }
    List<FieldSpecification> specifications = new ArrayList<>();
    for (DiscoveredField field : result.fields()) {
      if (field == null || FieldSpecification.normalizeName(field.name()).isEmpty()) {
        log.debug("Ignoring unnamed field from pass {} of document {}", passNumber, documentId);
        continue;
      }
      specifications.add(
          new FieldSpecification(
              field.name(),
              FieldType.fromLabel(field.type()),
              field.description(),
              toRules(field.validationRules()),
              Boolean.TRUE.equals(field.required())));
    }
    return specifications;
  }

  private static Set<String> explicitlyTyped(DiscoveryAgentResult result) {
    if (result == null || result.fields() == null) {
      return Set.of();
    }
    Set<String> names = new HashSet<>();
    for (DiscoveredField field : result.fields()) {
      if (field != null && FieldType.parseLabel(field.type()).isPresent()) {
        names.add(FieldSpecification.normalizeName(field.name()));
      }
    }
    return names;
  }

  private List<ValidationRule> toRules(List<DiscoveredRule> rules) {
    if (rules == null) {
      return List.of();
    }
    List<ValidationRule> parsed = new ArrayList<>();
    for (DiscoveredRule rule : rules) {
      if (rule == null || rule.kind() == null) {
        continue;
      }
      try {
        ValidationRule.Kind kind =
            ValidationRule.Kind.valueOf(rule.kind().trim().toUpperCase(Locale.ROOT));
        parsed.add(ValidationRule.of(kind, rule.argument()));
      } catch (IllegalArgumentException e) {
        log.debug("Ignoring unknown validation rule kind '{}'", rule.kind());
      }
    }
    return parsed;
  }

  private String renderPages(UUID documentId, List<Integer> pages) {
    int maxChars = config.getDiscovery().getMaxPageChars();
    StringBuilder sb = new StringBuilder();
    for (int page : pages) {
      String text = documentAccessor.getPage(documentId, page);
      if (text.length() > maxChars) {
        text = text.substring(0, maxChars);
      }
      sb.append("--- Page ").append(page).append(" ---\n").append(text).append("\n\n");
    }
    return sb.toString();
  }

  private static String renderFields(List<FieldSpecification> fields) {
    if (fields.isEmpty()) {
      return "(none)";
    }
    return fields.stream()
        .map(
            f ->
                String.format(
                    "- %s (%s%s): %s",
                    f.name(),
                    f.type().name().toLowerCase(Locale.ROOT),
                    f.required() ? ", required" : "",
                    f.description()))
        .collect(Collectors.joining("\n"));
  }
}
