package com.flamingo.ai.voicecompanion.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(UnsupportedFormatException.class)
  public ResponseEntity<ApiError> handleUnsupportedFormat(
      UnsupportedFormatException ex, HttpServletRequest request) {

    incrementErrorCounter("unsupported_format");
    String errorId = generateErrorId();
    log.warn("Unsupported format [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNSUPPORTED_MEDIA_TYPE,
        errorId,
        ApiError.UNSUPPORTED_FORMAT,
        ApiError.KIND_UNSUPPORTED_FORMAT,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(IngestionFailedException.class)
  public ResponseEntity<ApiError> handleIngestionFailed(
      IngestionFailedException ex, HttpServletRequest request) {

    incrementErrorCounter("ingestion_failed");
    String errorId = generateErrorId();
    log.warn("Ingestion failed [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.INGESTION_FAILED,
        ApiError.KIND_INGESTION_FAILED,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiError> handleMaxUploadSize(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {

    incrementErrorCounter("ingestion_failed");
    String errorId = generateErrorId();
    log.warn("Upload rejected by multipart limit [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.UNPROCESSABLE_ENTITY,
        errorId,
        ApiError.INGESTION_FAILED,
        ApiError.KIND_INGESTION_FAILED,
        "The document exceeds the maximum upload size",
        request);
  }

  @ExceptionHandler(EmbeddingUnavailableException.class)
  public ResponseEntity<ApiError> handleEmbeddingUnavailable(
      EmbeddingUnavailableException ex, HttpServletRequest request) {

    incrementErrorCounter("embedding_unavailable");
    String errorId = generateErrorId();
    log.error("Embedding unavailable [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.SERVICE_UNAVAILABLE,
        errorId,
        ApiError.EMBEDDING_UNAVAILABLE,
        ApiError.KIND_EMBEDDING_UNAVAILABLE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(IndexBuildFailedException.class)
  public ResponseEntity<ApiError> handleIndexBuildFailed(
      IndexBuildFailedException ex, HttpServletRequest request) {

    incrementErrorCounter("index_build_failed");
    String errorId = generateErrorId();
    log.error("Index build failed [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INDEX_BUILD_FAILED,
        ApiError.KIND_INDEX_BUILD_FAILED,
        ex.getUserMessage(),
        request);
  }

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
        null,
        "Document not found",
        request);
  }

  @ExceptionHandler(SessionNotFoundException.class)
  public ResponseEntity<ApiError> handleSessionNotFound(
      SessionNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("session_not_found");
    String errorId = generateErrorId();
    log.warn("Conversation session not found [{}]: {}", errorId, ex.getSessionId());

    return build(
        HttpStatus.NOT_FOUND,
        errorId,
        ApiError.SESSION_NOT_FOUND,
        null,
        "Conversation session not found",
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, null, message, request);
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingServletRequestPartException.class
  })
  public ResponseEntity<ApiError> handleMalformedRequest(
      Exception ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();
    log.warn("Malformed request [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.VALIDATION_ERROR,
        null,
        "Malformed request",
        request);
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
        null,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status,
      String errorId,
      String code,
      String kind,
      String message,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .kind(kind)
                .message(message)
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
