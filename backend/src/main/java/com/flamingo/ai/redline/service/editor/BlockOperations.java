package com.flamingo.ai.redline.service.editor;

/**
 * Block-level mutation primitives.
 *
 * <p>Expected failures (unknown block, destroyed editor, unsupported block) are reported through
 * {@link MutationResult#failure(String)}; implementations do not throw for them.
 */
public interface BlockOperations {

  MutationResult replace(
      DocumentEditor editor, String blockId, String newText, MutationOptions options);

  MutationResult delete(DocumentEditor editor, String blockId, MutationOptions options);

  MutationResult insertAfter(
      DocumentEditor editor, String anchorBlockId, String text, MutationOptions options);

  MutationResult addComment(DocumentEditor editor, String blockId, String text, Author author);
}
