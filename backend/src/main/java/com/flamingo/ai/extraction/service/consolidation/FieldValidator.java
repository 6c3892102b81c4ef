package com.flamingo.ai.extraction.service.consolidation;

import com.flamingo.ai.extraction.domain.model.FieldSpecification;
import com.flamingo.ai.extraction.domain.model.ValidationRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Evaluates the validation rules of a field against its resolved value. */
@Component
public class FieldValidator {

  /**
   * Returns one description per violated rule. List members and structured sub-values are checked
   * one by one; a rule fails when any of them fails.
   */
  public List<String> violations(FieldSpecification spec, Object value) {
    if (spec.validationRules().isEmpty() || value == null) {
      return List.of();
    }
    List<String> parts = textualParts(value);
    List<String> violations = new ArrayList<>();
    for (ValidationRule rule : spec.validationRules()) {
      parts.stream()
          .filter(part -> !rule.test(part))
          .findFirst()
          .ifPresent(failing -> violations.add(describe(rule, failing)));
    }
    return violations;
  }

  private static List<String> textualParts(Object value) {
    if (value instanceof List<?> list) {
      return list.stream().map(String::valueOf).toList();
    }
    if (value instanceof Map<?, ?> map) {
      return map.values().stream().map(String::valueOf).toList();
    }
    return List.of(String.valueOf(value));
  }

  private static String describe(ValidationRule rule, String value) {
    String name =
        rule.argument() != null ? rule.kind() + "(" + rule.argument() + ")" : rule.kind().name();
    return name + " rejected '" + value + "'";
  }
}
