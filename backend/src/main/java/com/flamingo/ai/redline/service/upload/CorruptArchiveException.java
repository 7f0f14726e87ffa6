package com.flamingo.ai.redline.service.upload;

/** Thrown when the central directory of an archive cannot be parsed. */
public class CorruptArchiveException extends RuntimeException {

  public CorruptArchiveException(String message) {
    super(message);
  }
}
