package com.flamingo.ai.redline.service.edit;

import com.flamingo.ai.redline.service.editor.MutationOptions.InsertType;

/** A single structured edit. Block references are short IDs or durable IDs. */
public sealed interface EditOperation {

  /** The block this edit targets; for inserts, the anchor block. */
  String blockRef();

  OperationKind kind();

  /**
   * Replaces a block's text.
   *
   * @param diff record only changed words instead of deleting and reinserting the whole block
   */
  record Replace(String blockRef, String newText, String comment, boolean diff)
      implements EditOperation {
    @Override
    public OperationKind kind() {
      return OperationKind.REPLACE;
    }
  }

  /** Deletes a block. */
  record Delete(String blockRef) implements EditOperation {
    @Override
    public OperationKind kind() {
      return OperationKind.DELETE;
    }
  }

  /** Inserts a new block after {@code blockRef}. */
  record Insert(String blockRef, String text, InsertType type, Integer level, String comment)
      implements EditOperation {
    @Override
    public OperationKind kind() {
      return OperationKind.INSERT;
    }
  }

  /** Attaches a comment to a block without changing its content. */
  record Comment(String blockRef, String text) implements EditOperation {
    @Override
    public OperationKind kind() {
      return OperationKind.COMMENT;
    }
  }
}
