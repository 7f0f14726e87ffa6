package com.flamingo.ai.redline.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Structured API error, always returned wrapped in an {@link ApiErrorResponse}. */
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  // Error codes
  public static final String UNAUTHORIZED = "UNAUTHORIZED";
  public static final String NOT_FOUND = "NOT_FOUND";
  public static final String INVALID_CONTENT_TYPE = "INVALID_CONTENT_TYPE";
  public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
  public static final String MISSING_FILE = "MISSING_FILE";
  public static final String MISSING_EDITS = "MISSING_EDITS";
  public static final String INVALID_EDITS_JSON = "INVALID_EDITS_JSON";
  public static final String INVALID_FILE_TYPE = "INVALID_FILE_TYPE";
  public static final String ZIP_BOMB_DETECTED = "ZIP_BOMB_DETECTED";
  public static final String FILE_TOO_LARGE = "FILE_TOO_LARGE";
  public static final String SERVER_BUSY = "SERVER_BUSY";
  public static final String DOCUMENT_LOAD_FAILED = "DOCUMENT_LOAD_FAILED";
  public static final String EXTRACTION_FAILED = "EXTRACTION_FAILED";
  public static final String APPLY_FAILED = "APPLY_FAILED";
  public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. Never contains paths or stack traces. */
  private final String message;

  /** Structured details, e.g. per-field problems. Always present, possibly empty. */
  @Builder.Default private final List<Object> details = List.of();

  /** Unique error ID for log correlation. */
  private final String errorId;

  public static ApiError of(String code, String message) {
    return ApiError.builder().code(code).message(message).build();
  }
}
