package com.flamingo.ai.redline.exception;

/** Exception thrown when an unexpected engine fault aborts edit application or export. */
public class DocumentProcessingException extends RuntimeException {

  private final String userMessage;

  public DocumentProcessingException(String message) {
    super(message);
    this.userMessage = "Unable to apply edits to document";
  }

  public DocumentProcessingException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Unable to apply edits to document";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
