package com.flamingo.ai.extraction.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Set;

/**
 * The single resolved value of one field in a {@link ConsolidatedRecord}.
 *
 * @param name normalized field name
 * @param type field type
 * @param value resolved value; null when missing
 * @param confidence resolved confidence; 0.0 when missing
 * @param contributingAgents agents whose output forms the resolved value, sorted
 * @param members distinct members for list fields, empty otherwise
 * @param discarded extractions that lost conflict resolution, kept as provenance
 * @param flags review flags
 * @param violations descriptions of failed validation rules
 */
public record ConsolidatedField(
    String name,
    FieldType type,
    Object value,
    double confidence,
    List<String> contributingAgents,
    List<ListMember> members,
    List<FieldExtraction> discarded,
    Set<FieldFlag> flags,
    List<String> violations) {

  public ConsolidatedField {
    contributingAgents = List.copyOf(contributingAgents);
    members = List.copyOf(members);
    discarded = List.copyOf(discarded);
    flags = Set.copyOf(flags);
    violations = List.copyOf(violations);
  }

  public static ConsolidatedField missing(FieldSpecification spec) {
    return new ConsolidatedField(
        spec.name(), spec.type(), null, 0.0, List.of(), List.of(), List.of(),
        Set.of(FieldFlag.MISSING), List.of());
  }

  @JsonIgnore
  public boolean isMissing() {
    return flags.contains(FieldFlag.MISSING);
  }

  public boolean hasFlag(FieldFlag flag) {
    return flags.contains(flag);
  }
}
