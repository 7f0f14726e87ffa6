package com.flamingo.ai.redline.service.edit;

/**
 * A validation issue or warning attached to one edit.
 *
 * @param editIndex position of the edit in the caller's array
 * @param blockId block reference as supplied by the caller, may be {@code null}
 * @param type machine-readable issue type, e.g. {@code missing_block}
 * @param message human-readable description
 */
public record EditIssue(int editIndex, String blockId, String type, String message) {

  public static final String MISSING_BLOCK = "missing_block";
  public static final String TOC_BLOCK = "toc_block";
  public static final String MISSING_FIELD = "missing_field";
  public static final String INVALID_FIELD = "invalid_field";
  public static final String UNKNOWN_OPERATION = "unknown_operation";

  public static final String NO_CHANGE = "no_change";
  public static final String MULTIPLE_EDITS_SAME_BLOCK = "multiple_edits_same_block";
  public static final String EDIT_AFTER_DELETE = "edit_after_delete";
  public static final String COMMENT_FAILED = "comment_failed";
}
