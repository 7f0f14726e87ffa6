package com.flamingo.ai.redline.exception;

/** Exception thrown when an uploaded file is rejected before any editing session is opened. */
public class InvalidUploadException extends RuntimeException {

  private final String code;

  public InvalidUploadException(String code, String message) {
    super(message);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
