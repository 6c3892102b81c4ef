package com.flamingo.ai.extraction.service.consolidation;

import com.flamingo.ai.extraction.config.ExtractionConfig;
import com.flamingo.ai.extraction.domain.model.AgentOutcome;
import com.flamingo.ai.extraction.domain.model.AgentRunSummary;
import com.flamingo.ai.extraction.domain.model.ConsolidatedField;
import com.flamingo.ai.extraction.domain.model.ConsolidatedRecord;
import com.flamingo.ai.extraction.domain.model.FieldExtraction;
import com.flamingo.ai.extraction.domain.model.FieldFlag;
import com.flamingo.ai.extraction.domain.model.FieldSchema;
import com.flamingo.ai.extraction.domain.model.FieldSpecification;
import com.flamingo.ai.extraction.domain.model.FieldType;
import com.flamingo.ai.extraction.domain.model.ListMember;
import com.flamingo.ai.extraction.domain.model.RecordFlag;
import com.flamingo.ai.extraction.service.agent.ExtractionRun;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Merges the outputs of every agent of a run into one {@link ConsolidatedRecord}.
 *
 * <p>Conflict resolution:
 *
 * <ul>
 *   <li>scalar and structured fields: the highest confidence wins, ties go to the agent with the
 *       earliest start page; losing values stay on the field as discarded provenance
 *   <li>list fields: union of distinct members, each keeping its best confidence
 *   <li>required fields nobody found are kept as MISSING
 * </ul>
 *
 * <p>Extractions are sorted before merging, so the result does not depend on the order in which
 * agents finished.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Consolidator {

  private static final Comparator<FieldExtraction> BY_PRECEDENCE =
      Comparator.comparingDouble(FieldExtraction::confidence)
          .reversed()
          .thenComparingInt(e -> e.sourcePageRange().startPage())
          .thenComparing(FieldExtraction::extractedByAgent);

  private static final Comparator<FieldExtraction> BY_POSITION =
      Comparator.<FieldExtraction>comparingInt(e -> e.sourcePageRange().startPage())
          .thenComparing(FieldExtraction::extractedByAgent);

  private final ExtractionConfig config;
  private final FieldValidator fieldValidator;
  private final MeterRegistry meterRegistry;

  /**
   * Builds the record of a run. Must only be called once every agent reached a terminal state.
   *
   * @param runId identifier of the run
   * @param schema the frozen schema the agents worked from
   * @param run terminal outcomes of every dispatched agent
   * @return the immutable record
   */
  public ConsolidatedRecord consolidate(UUID runId, FieldSchema schema, ExtractionRun run) {
    Map<String, List<FieldExtraction>> byField =
        run.extractions().stream()
            .collect(
                Collectors.groupingBy(
                    FieldExtraction::fieldName, TreeMap::new, Collectors.toList()));

    byField.keySet().stream()
        .filter(name -> schema.field(name).isEmpty())
        .forEach(name -> log.debug("Ignoring extractions for unknown field '{}'", name));

    double threshold = config.getConsolidation().getLowConfidenceThreshold();
    Map<String, ConsolidatedField> fields = new LinkedHashMap<>();
    Set<RecordFlag> recordFlags = EnumSet.noneOf(RecordFlag.class);

    for (FieldSpecification spec : schema.fields()) {
      List<FieldExtraction> candidates = byField.getOrDefault(spec.name(), List.of());
      if (candidates.isEmpty()) {
        if (spec.required()) {
          fields.put(spec.name(), ConsolidatedField.missing(spec));
          recordFlags.add(RecordFlag.MISSING_REQUIRED);
        }
        continue;
      }

      ConsolidatedField field =
          spec.type() == FieldType.LIST
              ? resolveList(spec, candidates, threshold)
              : resolveSingle(spec, candidates, threshold);
      fields.put(spec.name(), field);

      if (field.hasFlag(FieldFlag.LOW_CONFIDENCE)) {
        recordFlags.add(RecordFlag.LOW_CONFIDENCE);
      }
      if (field.hasFlag(FieldFlag.VALIDATION_FAILED)) {
        recordFlags.add(RecordFlag.VALIDATION_FAILED);
      }
    }

    double completedFraction = run.completedFraction();
    if (run.deadlineExceeded()) {
      recordFlags.add(RecordFlag.PARTIAL);
    }
    if (completedFraction < config.getConsolidation().getMinCompletedFraction()) {
      recordFlags.add(RecordFlag.DEGRADED);
      meterRegistry.counter("extraction.records.degraded").increment();
      log.warn(
          "Consolidation incomplete for document {}: only {} of {} agents completed",
          schema.documentId(),
          run.succeededCount(),
          run.outcomes().size());
    }

    List<AgentRunSummary> agentRuns =
        run.outcomes().stream()
            .sorted(Comparator.comparing(AgentOutcome::pageRange))
            .map(AgentRunSummary::from)
            .toList();

    log.info(
        "Consolidated {} of {} fields for document {} (flags {})",
        fields.values().stream().filter(f -> !f.isMissing()).count(),
        schema.fields().size(),
        schema.documentId(),
        recordFlags);

    return new ConsolidatedRecord(
        runId,
        schema.documentId(),
        schema.documentType(),
        fields,
        recordFlags,
        agentRuns,
        completedFraction,
        run.planWarnings(),
        Instant.now());
  }

  private ConsolidatedField resolveSingle(
      FieldSpecification spec, List<FieldExtraction> candidates, double threshold) {
    List<FieldExtraction> ordered = candidates.stream().sorted(BY_PRECEDENCE).toList();
    FieldExtraction winner = ordered.get(0);

    Set<String> contributing = new TreeSet<>();
    contributing.add(winner.extractedByAgent());
    List<FieldExtraction> discarded = new ArrayList<>();
    for (FieldExtraction other : ordered.subList(1, ordered.size())) {
      if (sameValue(winner.value(), other.value())) {
        contributing.add(other.extractedByAgent());
      } else {
        discarded.add(other);
      }
    }

    Set<FieldFlag> flags = EnumSet.noneOf(FieldFlag.class);
    if (!discarded.isEmpty()) {
      flags.add(FieldFlag.CONFLICT_RESOLVED);
      log.debug(
          "Field '{}' resolved to {} from {} over {} conflicting value(s)",
          spec.name(),
          winner.value(),
          winner.extractedByAgent(),
          discarded.size());
    }
    return finish(
        spec,
        winner.value(),
        winner.confidence(),
        new ArrayList<>(contributing),
        List.of(),
        discarded,
        flags,
        threshold);
  }

  private ConsolidatedField resolveList(
      FieldSpecification spec, List<FieldExtraction> candidates, double threshold) {
    Map<String, MemberAccumulator> members = new LinkedHashMap<>();
    Set<String> contributing = new TreeSet<>();
    for (FieldExtraction extraction : candidates.stream().sorted(BY_POSITION).toList()) {
      contributing.add(extraction.extractedByAgent());
      for (Object member : extraction.valueMembers()) {
        String key = String.valueOf(member).trim();
        if (key.isEmpty()) {
          continue;
        }
        members
            .computeIfAbsent(key, k -> new MemberAccumulator())
            .add(extraction.confidence(), extraction.extractedByAgent());
      }
    }

    List<ListMember> listMembers = new ArrayList<>();
    members.forEach(
        (value, acc) ->
            listMembers.add(new ListMember(value, acc.confidence, new ArrayList<>(acc.agents))));
    double confidence = listMembers.stream().mapToDouble(ListMember::confidence).max().orElse(0.0);
    List<Object> value = listMembers.stream().map(ListMember::value).toList();

    return finish(
        spec,
        value,
        confidence,
        new ArrayList<>(contributing),
        listMembers,
        List.of(),
        EnumSet.noneOf(FieldFlag.class),
        threshold);
  }

  private ConsolidatedField finish(
      FieldSpecification spec,
      Object value,
      double confidence,
      List<String> contributing,
      List<ListMember> members,
      List<FieldExtraction> discarded,
      Set<FieldFlag> flags,
      double threshold) {
    if (confidence < threshold) {
      flags.add(FieldFlag.LOW_CONFIDENCE);
    }
    List<String> violations = fieldValidator.violations(spec, value);
    if (!violations.isEmpty()) {
      flags.add(FieldFlag.VALIDATION_FAILED);
    }
    return new ConsolidatedField(
        spec.name(),
        spec.type(),
        value,
        confidence,
        contributing,
        members,
        discarded,
        flags,
        violations);
  }

  private static boolean sameValue(Object a, Object b) {
    if (a instanceof Map<?, ?> left && b instanceof Map<?, ?> right) {
      return trimmed(left).equals(trimmed(right));
    }
    return String.valueOf(a).trim().equals(String.valueOf(b).trim());
  }

  private static Map<String, String> trimmed(Map<?, ?> map) {
    Map<String, String> result = new TreeMap<>();
    map.forEach((k, v) -> result.put(String.valueOf(k).trim(), String.valueOf(v).trim()));
    return result;
  }

  private static final class MemberAccumulator {
    private double confidence;
    private final Set<String> agents = new TreeSet<>();

    void add(double memberConfidence, String agentId) {
      confidence = Math.max(confidence, memberConfidence);
      agents.add(agentId);
    }
  }
}
