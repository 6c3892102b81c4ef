package com.flamingo.ai.extraction.api.dto.request;

import com.flamingo.ai.extraction.domain.model.ValidationRule;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one validation rule of a caller-supplied field. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationRuleRequest {

  @NotNull(message = "Rule kind is required")
  private ValidationRule.Kind kind;

  private String argument;

  public ValidationRule toRule() {
    return ValidationRule.of(kind, argument);
  }
}
