package com.flamingo.ai.redline.service.edit;

/**
 * One element of the caller's edit array, either decoded into an {@link EditOperation} or
 * rejected with a reason.
 *
 * @param index position in the caller's array
 * @param operation operation name as supplied, may be {@code null}
 * @param blockRef block reference as supplied, may be {@code null}
 * @param edit decoded edit, {@code null} when the element is malformed
 * @param issueType issue type for malformed elements
 * @param issueMessage reason for malformed elements
 */
public record ParsedEdit(
    int index,
    String operation,
    String blockRef,
    EditOperation edit,
    String issueType,
    String issueMessage) {

  public static ParsedEdit valid(int index, EditOperation edit) {
    return new ParsedEdit(index, edit.kind().wireName(), edit.blockRef(), edit, null, null);
  }

  public static ParsedEdit invalid(
      int index, String operation, String blockRef, String issueType, String issueMessage) {
    return new ParsedEdit(index, operation, blockRef, null, issueType, issueMessage);
  }

  public boolean isValid() {
    return edit != null;
  }
}
