package com.flamingo.ai.extraction.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for extracting a document with a caller-supplied schema. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractionRequest {

  @NotEmpty(message = "At least one field is required")
  @Valid
  private List<FieldSpecificationRequest> fields;
}
