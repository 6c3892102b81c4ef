package com.flamingo.ai.extraction.api.rest;

import com.flamingo.ai.extraction.api.dto.request.ExtractionRequest;
import com.flamingo.ai.extraction.api.dto.request.FieldSpecificationRequest;
import com.flamingo.ai.extraction.api.dto.response.ExtractionRecordResponse;
import com.flamingo.ai.extraction.domain.model.FieldSchema;
import com.flamingo.ai.extraction.service.StructuredExtractionService;
import com.flamingo.ai.extraction.service.persistence.StoredRecord;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for field discovery and structured extraction. */
@RestController
@RequestMapping("/documents/{documentId}")
@RequiredArgsConstructor
public class ExtractionController {

  private final StructuredExtractionService extractionService;

  /** Discovers the field schema of a document. */
  @PostMapping("/schema")
  public ResponseEntity<FieldSchema> discoverSchema(@PathVariable UUID documentId) {
    return ResponseEntity.ok(extractionService.discoverFields(documentId));
  }

  /**
   * Extracts a document into a new record version. Uses the supplied fields when a body is sent,
   * otherwise discovers them first.
   */
  @PostMapping("/extractions")
  public ResponseEntity<ExtractionRecordResponse> extract(
      @PathVariable UUID documentId,
      @Valid @RequestBody(required = false) ExtractionRequest request) {
    StoredRecord stored;
    if (request == null) {
      stored = extractionService.discoverAndExtract(documentId);
    } else {
      FieldSchema schema =
          FieldSchema.provided(
              documentId,
              request.getFields().stream()
                  .map(FieldSpecificationRequest::toSpecification)
                  .toList());
      stored = extractionService.extractStructured(documentId, schema);
    }
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(ExtractionRecordResponse.fromStored(stored));
  }

  /** Gets the latest extraction record of a document. */
  @GetMapping("/extractions/latest")
  public ResponseEntity<ExtractionRecordResponse> getLatest(@PathVariable UUID documentId) {
    return ResponseEntity.ok(
        ExtractionRecordResponse.fromStored(extractionService.getLatestRecord(documentId)));
  }
}
