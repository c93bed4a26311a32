package com.flamingo.ai.notesearch.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String CORPUS_NOT_FOUND = "CORPUS_001";
  public static final String CORPUS_MISMATCH = "CORPUS_002";
  public static final String PROFILE_NOT_FOUND = "PROFILE_001";
  public static final String CONFIGURATION_ERROR = "CONFIG_001";
  public static final String INDEXING_FAILED = "INDEX_001";
  public static final String SEARCH_FAILED = "SEARCH_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Technical details, such as the remedies for a corpus mismatch. */
  private final String details;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
