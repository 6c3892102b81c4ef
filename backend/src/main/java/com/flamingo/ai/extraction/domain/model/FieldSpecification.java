package com.flamingo.ai.extraction.domain.model;

import java.util.List;
import java.util.Locale;

/**
 * A named, typed, validated attribute the extraction agents attempt to populate.
 *
 * <p>Instances are immutable. The name is normalized on construction (trimmed, lower-cased,
 * internal whitespace collapsed) so that the same field reported by different discovery agents
 * compares equal.
 */
public record FieldSpecification(
    String name,
    FieldType type,
    String description,
    List<ValidationRule> validationRules,
    boolean required) {

  public FieldSpecification {
    name = normalizeName(name);
    if (name.isEmpty()) {
      throw new IllegalArgumentException("Field name must not be blank");
    }
    type = type != null ? type : FieldType.SCALAR;
    description = description != null ? description.trim() : "";
    validationRules = validationRules != null ? List.copyOf(validationRules) : List.of();
  }

  public static FieldSpecification scalar(String name, String description, boolean required) {
    return new FieldSpecification(name, FieldType.SCALAR, description, List.of(), required);
  }

  public static FieldSpecification list(String name, String description, boolean required) {
    return new FieldSpecification(name, FieldType.LIST, description, List.of(), required);
  }

  /** Normalizes a field name for duplicate and refinement matching. */
  public static String normalizeName(String rawName) {
    if (rawName == null) {
      return "";
    }
    return rawName.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
