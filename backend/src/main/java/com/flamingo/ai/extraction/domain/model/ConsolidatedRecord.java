package com.flamingo.ai.extraction.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Final structured output of one extraction run. Never mutated after creation; reprocessing a
 * document produces a new record with a new run id.
 *
 * @param runId identifier of the producing run
 * @param documentId owning document
 * @param documentType document type from the schema
 * @param fields resolved fields keyed by name, in schema order
 * @param flags record-level review flags
 * @param agentRuns provenance for every dispatched agent, ordered by page range
 * @param completedFraction fraction of agents that succeeded
 * @param warnings planning warnings of the run, e.g. a reduced agent count
 * @param createdAt creation time
 */
public record ConsolidatedRecord(
    UUID runId,
    UUID documentId,
    String documentType,
    Map<String, ConsolidatedField> fields,
    Set<RecordFlag> flags,
    List<AgentRunSummary> agentRuns,
    double completedFraction,
    List<String> warnings,
    Instant createdAt) {

  public ConsolidatedRecord {
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    flags = Set.copyOf(flags);
    agentRuns = List.copyOf(agentRuns);
    warnings = warnings != null ? List.copyOf(warnings) : List.of();
  }

  public Optional<ConsolidatedField> field(String name) {
    return Optional.ofNullable(fields.get(FieldSpecification.normalizeName(name)));
  }

  public boolean hasFlag(RecordFlag flag) {
    return flags.contains(flag);
  }

  @JsonIgnore
  public boolean isPartial() {
    return flags.contains(RecordFlag.PARTIAL);
  }

  @JsonIgnore
  public boolean isDegraded() {
    return flags.contains(RecordFlag.DEGRADED);
  }
}
