package com.flamingo.ai.redline.service.edit;

/** What happened to one edit. */
public enum OutcomeStatus {
  APPLIED,
  SKIPPED_NOT_FOUND,
  SKIPPED_PROTECTED,
  SKIPPED_INVALID,
  FAILED;

  public boolean isSkipped() {
    return this == SKIPPED_NOT_FOUND || this == SKIPPED_PROTECTED || this == SKIPPED_INVALID;
  }
}
