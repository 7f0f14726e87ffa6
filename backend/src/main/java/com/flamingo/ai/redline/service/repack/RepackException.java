package com.flamingo.ai.redline.service.repack;

/** Thrown when an exported archive cannot be re-encoded. */
public class RepackException extends RuntimeException {

  public RepackException(String message) {
    super(message);
  }

  public RepackException(String message, Throwable cause) {
    super(message, cause);
  }
}
