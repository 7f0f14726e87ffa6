package com.flamingo.ai.redline.service.editor;

import lombok.Builder;

/**
 * Options for a single block mutation.
 *
 * @param author revision author
 * @param trackChanges record the mutation as a tracked revision
 * @param diff replace only the changed words instead of the whole block
 * @param insertType block type for inserts
 * @param level heading level for inserted headings
 */
@Builder
public record MutationOptions(
    Author author, boolean trackChanges, boolean diff, InsertType insertType, Integer level) {

  /** Kind of block created by an insert. */
  public enum InsertType {
    PARAGRAPH,
    HEADING
  }
}
