package com.flamingo.ai.redline.service.editor;

/**
 * Result of a block mutation primitive.
 *
 * @param success whether the mutation took effect
 * @param newBlockId ID of a block created by an insert
 * @param commentId ID of a comment created by a comment mutation
 * @param error failure reason when {@code success} is false
 */
public record MutationResult(boolean success, String newBlockId, String commentId, String error) {

  public static MutationResult ok() {
    return new MutationResult(true, null, null, null);
  }

  public static MutationResult inserted(String newBlockId) {
    return new MutationResult(true, newBlockId, null, null);
  }

  public static MutationResult commented(String commentId) {
    return new MutationResult(true, null, commentId, null);
  }

  public static MutationResult failure(String error) {
    return new MutationResult(false, null, null, error);
  }
}
