package com.flamingo.ai.redline.exception;

/** Exception thrown when no editing slot became free within the configured wait. */
public class AdmissionTimeoutException extends RuntimeException {

  private final String userMessage;

  public AdmissionTimeoutException(String message) {
    super(message);
    this.userMessage = "Server is busy processing other documents. Please retry shortly.";
  }

  public AdmissionTimeoutException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Server is busy processing other documents. Please retry shortly.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
