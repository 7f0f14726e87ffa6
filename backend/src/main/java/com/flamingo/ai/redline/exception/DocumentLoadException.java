package com.flamingo.ai.redline.exception;

/**
 * Exception thrown when the editing engine rejects a structurally valid archive as a document.
 *
 * <p>This is a processing failure, not a client-input failure: the upload passed the format gate.
 */
public class DocumentLoadException extends RuntimeException {

  private final String code;
  private final String userMessage;

  public DocumentLoadException(String code, String message, String userMessage, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.userMessage = userMessage;
  }

  public String getCode() {
    return code;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
