package com.flamingo.ai.extraction.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(DocumentNotFoundException.class)
  public ResponseEntity<ApiError> handleDocumentNotFound(
      DocumentNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("document_not_found");
    String errorId = generateErrorId();
    log.warn("Document not found [{}]: {}", errorId, ex.getDocumentId());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.DOCUMENT_NOT_FOUND,
        "Document not found",
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(RecordNotFoundException.class)
  public ResponseEntity<ApiError> handleRecordNotFound(
      RecordNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("record_not_found");
    String errorId = generateErrorId();
    log.warn("Extraction record not found [{}]: {}", errorId, ex.getDocumentId());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.RECORD_NOT_FOUND,
        "No extraction record exists for this document",
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(DocumentReadException.class)
  public ResponseEntity<ApiError> handleDocumentRead(
      DocumentReadException ex, HttpServletRequest request) {

    incrementErrorCounter("document_read");
    String errorId = generateErrorId();
    log.error("Document read error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DOCUMENT_READ_ERROR,
        ex.getUserMessage(),
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(DiscoveryTimeoutException.class)
  public ResponseEntity<ApiError> handleDiscoveryTimeout(
      DiscoveryTimeoutException ex, HttpServletRequest request) {

    incrementErrorCounter("discovery_timeout");
    String errorId = generateErrorId();
    log.error("Discovery timeout [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.GATEWAY_TIMEOUT,
        errorId,
        ApiError.DISCOVERY_TIMEOUT,
        "Field discovery did not complete in time",
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(DiscoveryLowConfidenceException.class)
  public ResponseEntity<ApiError> handleDiscoveryLowConfidence(
      DiscoveryLowConfidenceException ex, HttpServletRequest request) {

    incrementErrorCounter("discovery_low_confidence");
    String errorId = generateErrorId();
    log.warn("Discovery low confidence [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.DISCOVERY_LOW_CONFIDENCE,
        "Not enough fields could be discovered in this document",
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(ScalingMisconfigurationException.class)
  public ResponseEntity<ApiError> handleScalingMisconfiguration(
      ScalingMisconfigurationException ex, HttpServletRequest request) {

    incrementErrorCounter("scaling_misconfiguration");
    String errorId = generateErrorId();
    log.warn("Scaling misconfiguration [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.SCALING_MISCONFIGURATION,
        ex.getMessage(),
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(ExtractionEscalatedException.class)
  public ResponseEntity<ApiError> handleExtractionEscalated(
      ExtractionEscalatedException ex, HttpServletRequest request) {

    incrementErrorCounter("extraction_escalated");
    String errorId = generateErrorId();
    log.error("Extraction escalated [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_GATEWAY,
        errorId,
        ApiError.EXTRACTION_ESCALATED,
        "Every extraction agent failed for this document",
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(PersistenceFailureException.class)
  public ResponseEntity<ApiError> handlePersistenceFailure(
      PersistenceFailureException ex, HttpServletRequest request) {

    incrementErrorCounter("persistence_failure");
    String errorId = generateErrorId();
    log.error("Persistence failure [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.PERSISTENCE_FAILURE,
        "The extraction record could not be stored",
        ex.getDocumentId(),
        request);
  }

  @ExceptionHandler(LlmServiceException.class)
  public ResponseEntity<ApiError> handleLlmService(
      LlmServiceException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "llm_rate_limited" : "llm_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error("LLM service error [{}]: {}", errorId, ex.getMessage(), ex);

    String code = ex.isRateLimited() ? ApiError.LLM_RATE_LIMITED : ApiError.LLM_UNAVAILABLE;

    return build(HttpStatus.SERVICE_UNAVAILABLE, errorId, code, ex.getUserMessage(), null, request);
  }

  @ExceptionHandler({MethodArgumentNotValidException.class, IllegalArgumentException.class})
  public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex instanceof MethodArgumentNotValidException invalid
            ? invalid.getBindingResult().getFieldErrors().stream()
                .findFirst()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .orElse("Validation failed")
            : ex.getMessage();

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, null, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        null,
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String message,
      UUID documentId,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .documentId(documentId != null ? documentId.toString() : null)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
