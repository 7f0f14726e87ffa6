package com.flamingo.ai.redline.exception;

import java.util.List;

/** Exception thrown when the {@code edits} form field is missing or cannot be decoded. */
public class InvalidEditsException extends RuntimeException {

  private final String code;
  private final List<Object> details;

  public InvalidEditsException(String code, String message) {
    this(code, message, List.of());
  }

  public InvalidEditsException(String code, String message, List<Object> details) {
    super(message);
    this.code = code;
    this.details = details;
  }

  public String getCode() {
    return code;
  }

  public List<Object> getDetails() {
    return details;
  }
}
