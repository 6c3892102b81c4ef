package com.flamingo.ai.extraction.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * The frozen field specification set of one document.
 *
 * <p>Created once by discovery (or supplied by the caller) and shared read-only by the planner and
 * every extraction agent.
 *
 * @param documentId owning document
 * @param documentType document type as refined by the discovery passes, e.g. "invoice"
 * @param method how the fields were discovered
 * @param fields ordered field specifications, unique by normalized name
 * @param sampledPages pages read by discovery, in pass order
 */
public record FieldSchema(
    UUID documentId,
    String documentType,
    DiscoveryMethod method,
    List<FieldSpecification> fields,
    List<Integer> sampledPages) {

  public FieldSchema {
    documentType = documentType != null && !documentType.isBlank() ? documentType : "unknown";
    fields = fields != null ? List.copyOf(fields) : List.of();
    sampledPages = sampledPages != null ? List.copyOf(sampledPages) : List.of();
    long distinct = fields.stream().map(FieldSpecification::name).distinct().count();
    if (distinct != fields.size()) {
      throw new IllegalArgumentException("Field names must be unique within a schema");
    }
  }

  /** Builds a caller-supplied schema. */
  public static FieldSchema provided(UUID documentId, List<FieldSpecification> fields) {
    return new FieldSchema(documentId, null, DiscoveryMethod.PROVIDED, fields, List.of());
  }

  public Optional<FieldSpecification> field(String name) {
    String normalized = FieldSpecification.normalizeName(name);
    return fields.stream().filter(f -> f.name().equals(normalized)).findFirst();
  }

  public List<String> fieldNames() {
    return fields.stream().map(FieldSpecification::name).toList();
  }

  @JsonIgnore
  public boolean isEmpty() {
    return fields.isEmpty();
  }
}
