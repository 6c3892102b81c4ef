package com.flamingo.ai.extraction.domain.model;

import java.util.Locale;
import java.util.Optional;

/** Shape of the value an extraction agent produces for a field. */
public enum FieldType {
  /** A single value (a date, an amount, a name). */
  SCALAR,

  /** A collection of values; multiple agents contribute to one union. */
  LIST,

  /** A set of named sub-values (an address, a party block). */
  STRUCTURED;

  /**
   * Parses a type label produced by a model. Unknown or blank labels fall back to {@link #SCALAR}.
   */
  public static FieldType fromLabel(String label) {
    return parseLabel(label).orElse(SCALAR);
  }

  /** Parses a type label, empty when the label is blank or not recognized. */
  public static Optional<FieldType> parseLabel(String label) {
    if (label == null || label.isBlank()) {
      return Optional.empty();
    }
    return switch (label.trim().toLowerCase(Locale.ROOT)) {
      case "scalar", "single", "value", "string", "text", "number", "date" -> Optional.of(SCALAR);
      case "list", "array", "multi", "multiple" -> Optional.of(LIST);
      case "structured", "object", "composite", "record" -> Optional.of(STRUCTURED);
      default -> Optional.empty();
    };
  }
}
