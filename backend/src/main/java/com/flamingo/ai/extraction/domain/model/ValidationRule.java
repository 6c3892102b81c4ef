package com.flamingo.ai.extraction.domain.model;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A predicate constraint attached to a {@link FieldSpecification}.
 *
 * @param kind the predicate to apply
 * @param argument rule argument (length bound, regex, comma-separated options); may be null
 */
public record ValidationRule(Kind kind, String argument) {

  /** Supported predicates. */
  public enum Kind {
    NOT_BLANK,
    MIN_LENGTH,
    MAX_LENGTH,
    PATTERN,
    NUMERIC,
    ONE_OF
  }

  public ValidationRule {
    if (kind == null) {
      throw new IllegalArgumentException("Validation rule kind is required");
    }
  }

  public static ValidationRule of(Kind kind) {
    return new ValidationRule(kind, null);
  }

  public static ValidationRule of(Kind kind, String argument) {
    return new ValidationRule(kind, argument);
  }

  /**
   * Tests a single textual value against this rule. Rules with an unusable argument (unparseable
   * bound, invalid regex) accept every value.
   */
  public boolean test(String value) {
    String text = value == null ? "" : value.trim();
    return switch (kind) {
      case NOT_BLANK -> !text.isEmpty();
      case MIN_LENGTH -> parseBound().map(min -> text.length() >= min).orElse(true);
      case MAX_LENGTH -> parseBound().map(max -> text.length() <= max).orElse(true);
      case PATTERN -> matchesPattern(text);
      case NUMERIC -> isNumeric(text);
      case ONE_OF -> isOneOf(text);
    };
  }

  private Optional<Integer> parseBound() {
    if (argument == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Integer.parseInt(argument.trim()));
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }

  private boolean matchesPattern(String text) {
    if (argument == null || argument.isBlank()) {
      return true;
    }
    try {
      return Pattern.compile(argument).matcher(text).matches();
    } catch (PatternSyntaxException e) {
      return true;
    }
  }

  private static boolean isNumeric(String text) {
    String normalized = text.replace(",", "").replaceAll("^[^0-9+\\-.]+", "");
    if (normalized.isEmpty()) {
      return false;
    }
    try {
      new BigDecimal(normalized);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private boolean isOneOf(String text) {
    if (argument == null || argument.isBlank()) {
      return true;
    }
    String candidate = text.toLowerCase(Locale.ROOT);
    return Arrays.stream(argument.split(","))
        .map(option -> option.trim().toLowerCase(Locale.ROOT))
        .anyMatch(candidate::equals);
  }
}
