package com.flamingo.ai.voicecompanion.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String UNSUPPORTED_FORMAT = "DOCUMENT_001";
  public static final String INGESTION_FAILED = "DOCUMENT_002";
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_003";
  public static final String EMBEDDING_UNAVAILABLE = "EMBEDDING_001";
  public static final String INDEX_BUILD_FAILED = "KNOWLEDGE_001";
  public static final String SESSION_NOT_FOUND = "SESSION_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  // Failure kinds reported to callers of the ingestion entry point
  public static final String KIND_UNSUPPORTED_FORMAT = "UnsupportedFormat";
  public static final String KIND_INGESTION_FAILED = "IngestionFailed";
  public static final String KIND_EMBEDDING_UNAVAILABLE = "EmbeddingUnavailable";
  public static final String KIND_INDEX_BUILD_FAILED = "IndexBuildFailed";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** Failure kind, present for ingestion-path errors. */
  private final String kind;

  /** User-friendly error message. */
  private final String message;

  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
