package com.flamingo.ai.redline.service.editor;

/**
 * Options used when opening a document.
 *
 * @param mode whether edits are tracked
 * @param author identity stamped on revisions and comments
 */
public record EditorOptions(DocumentMode mode, Author author) {

  public boolean trackChanges() {
    return mode == DocumentMode.SUGGESTING;
  }
}
