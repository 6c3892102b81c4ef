package com.flamingo.ai.extraction.api.dto.request;

import com.flamingo.ai.extraction.domain.model.FieldSpecification;
import com.flamingo.ai.extraction.domain.model.FieldType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for one caller-supplied field specification. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldSpecificationRequest {

  @NotBlank(message = "Field name is required")
  @Size(max = 100, message = "Field name must be at most 100 characters")
  private String name;

  private FieldType type;

  @Size(max = 1000, message = "Description must be at most 1000 characters")
  private String description;

  private boolean required;

  @Valid @Builder.Default private List<ValidationRuleRequest> validationRules = new ArrayList<>();

  public FieldSpecification toSpecification() {
    return new FieldSpecification(
        name,
        type,
        description,
        validationRules == null
            ? List.of()
            : validationRules.stream().map(ValidationRuleRequest::toRule).toList(),
        required);
  }
}
