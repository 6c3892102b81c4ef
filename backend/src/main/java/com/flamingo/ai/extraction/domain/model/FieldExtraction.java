package com.flamingo.ai.extraction.domain.model;

import java.util.List;
import java.util.Map;

/**
 * One value observed by one agent for one field.
 *
 * <p>The value is typed per {@link FieldType}: a {@code String} for scalars, a {@code
 * List<String>} for lists and a {@code Map<String, String>} for structured fields.
 *
 * @param fieldName normalized field name
 * @param value extracted value
 * @param confidence how directly the source supports the value, 0.0 to 1.0
 * @param sourcePageRange page range of the producing agent
 * @param extractedByAgent producing agent id
 */
public record FieldExtraction(
    String fieldName,
    Object value,
    double confidence,
    PageRange sourcePageRange,
    String extractedByAgent) {

  public FieldExtraction {
    fieldName = FieldSpecification.normalizeName(fieldName);
    if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
      throw new IllegalArgumentException("Confidence must be within [0, 1]: " + confidence);
    }
    if (value instanceof List<?> list) {
      value = List.copyOf(list);
    } else if (value instanceof Map<?, ?> map) {
      value = Map.copyOf(map);
    }
  }

  /** Returns the value as list members; scalars and structured values become a single member. */
  public List<Object> valueMembers() {
    if (value instanceof List<?> list) {
      return List.copyOf(list);
    }
    return value == null ? List.of() : List.of(value);
  }
}
