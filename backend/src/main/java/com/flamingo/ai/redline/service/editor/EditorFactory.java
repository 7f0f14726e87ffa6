package com.flamingo.ai.redline.service.editor;

/** Opens uploaded documents in the editing engine. */
public interface EditorFactory {

  /**
   * Loads a document.
   *
   * @param buffer DOCX bytes that already passed the format gate
   * @param options editing mode and author
   * @return the editor and its object graph
   * @throws EditorCreationException if the engine rejects the content
   */
  EditorInstance create(byte[] buffer, EditorOptions options);
}
