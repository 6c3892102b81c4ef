package com.flamingo.ai.extraction.service.agent;

import com.flamingo.ai.extraction.agent.FieldExtractionAgent;
import com.flamingo.ai.extraction.agent.dto.ExtractedValue;
import com.flamingo.ai.extraction.agent.dto.ExtractionAgentResult;
import com.flamingo.ai.extraction.config.ExtractionConfig;
import com.flamingo.ai.extraction.domain.model.AgentAssignment;
import com.flamingo.ai.extraction.domain.model.FieldExtraction;
import com.flamingo.ai.extraction.domain.model.FieldSpecification;
import com.flamingo.ai.extraction.domain.model.PageRange;
import com.flamingo.ai.extraction.service.document.DocumentAccessor;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * {@link ExtractionBackend} backed by the LangChain4j {@link FieldExtractionAgent}.
 *
 * <p>Model confidence is kept only for values that occur literally in the page text. Paraphrased or
 * inferred values are capped at {@code extraction.agents.inferred-confidence-cap}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LlmExtractionBackend implements ExtractionBackend {

  private final FieldExtractionAgent extractionAgent;
  private final DocumentAccessor documentAccessor;
  private final ExtractionConfig config;

  @Override
  @CircuitBreaker(name = "llm")
  public List<FieldExtraction> extract(AgentAssignment assignment) {
    PageRange range = assignment.pageRange();
    String pageText = readPages(assignment);

    ExtractionAgentResult result =
        extractionAgent.extract(
            range.startPage(),
            range.endPage(),
            renderFields(assignment.schema().fields()),
            pageText);

    if (result == null || result.values() == null) {
      return List.of();
    }

    String searchableText = normalize(pageText);
    List<FieldExtraction> extractions = new ArrayList<>();
    for (ExtractedValue extracted : result.values()) {
      if (extracted == null) {
        continue;
      }
      Optional<FieldSpecification> spec = assignment.schema().field(extracted.field());
      if (spec.isEmpty()) {
        log.debug(
            "Agent {} returned unknown field '{}', dropping",
            assignment.agentId(),
            extracted.field());
        continue;
      }
      Object value = typedValue(spec.get(), extracted);
      if (value == null) {
        continue;
      }
      double confidence = confidenceFor(extracted, value, searchableText);
      extractions.add(
          new FieldExtraction(spec.get().name(), value, confidence, range, assignment.agentId()));
    }
    log.debug(
        "Agent {} extracted {} value(s) from pages {}",
        assignment.agentId(),
        extractions.size(),
        range);
    return extractions;
  }

  private String readPages(AgentAssignment assignment) {
    int maxChars = config.getAgents().getMaxPageChars();
    StringBuilder sb = new StringBuilder();
    PageRange range = assignment.pageRange();
    for (int page = range.startPage(); page <= range.endPage(); page++) {
      String text = documentAccessor.getPage(assignment.documentId(), page);
      if (text.length() > maxChars) {
        text = text.substring(0, maxChars);
      }
      sb.append("--- Page ").append(page).append(" ---\n").append(text).append("\n\n");
    }
    return sb.toString();
  }

  /** Picks the value slot matching the field type; returns null when nothing usable was sent. */
  private static Object typedValue(FieldSpecification spec, ExtractedValue extracted) {
    switch (spec.type()) {
      case LIST -> {
        List<String> members = new ArrayList<>();
        if (extracted.values() != null) {
          extracted.values().stream()
              .filter(v -> v != null && !v.isBlank())
              .map(String::trim)
              .forEach(members::add);
        }
        if (members.isEmpty() && extracted.value() != null && !extracted.value().isBlank()) {
          members.add(extracted.value().trim());
        }
        return members.isEmpty() ? null : members;
      }
      case STRUCTURED -> {
        Map<String, String> properties = new LinkedHashMap<>();
        if (extracted.properties() != null) {
          extracted.properties().forEach(
              (key, v) -> {
                if (key != null && v != null && !v.isBlank()) {
                  properties.put(key.trim(), v.trim());
                }
              });
        }
        return properties.isEmpty() ? null : properties;
      }
      default -> {
        String value = extracted.value();
        if ((value == null || value.isBlank())
            && extracted.values() != null
            && !extracted.values().isEmpty()) {
          value = extracted.values().get(0);
        }
        return value == null || value.isBlank() ? null : value.trim();
      }
    }
  }

  private double confidenceFor(ExtractedValue extracted, Object value, String searchableText) {
    double cap = config.getAgents().getInferredConfidenceCap();
    double confidence =
        extracted.confidence() != null && !extracted.confidence().isNaN()
            ? Math.max(0.0, Math.min(1.0, extracted.confidence()))
            : cap;
    return isLiteral(value, searchableText) ? confidence : Math.min(confidence, cap);
  }

  /** True when every textual part of the value occurs verbatim (modulo case and spacing). */
  private static boolean isLiteral(Object value, String searchableText) {
    List<String> parts = new ArrayList<>();
    if (value instanceof List<?> list) {
      list.forEach(member -> parts.add(String.valueOf(member)));
    } else if (value instanceof Map<?, ?> map) {
      map.values().forEach(member -> parts.add(String.valueOf(member)));
    } else {
      parts.add(String.valueOf(value));
    }
    return parts.stream().map(LlmExtractionBackend::normalize).allMatch(searchableText::contains);
  }

  private static String normalize(String text) {
    return text.replaceAll("\\s+", " ").trim().toLowerCase(Locale.ROOT);
  }

  private static String renderFields(List<FieldSpecification> fields) {
    return fields.stream()
        .map(
            f ->
                String.format(
                    "- %s (%s): %s",
                    f.name(), f.type().name().toLowerCase(Locale.ROOT), f.description()))
        .collect(Collectors.joining("\n"));
  }
}
