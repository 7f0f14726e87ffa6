package com.flamingo.ai.redline.service.editor;

import java.util.List;

/**
 * Handle on one loaded document inside the editing engine.
 *
 * <p>An editor is owned by exactly one {@link
 * com.flamingo.ai.redline.service.session.DocumentSession} and is not thread-safe.
 */
public interface DocumentEditor {

  /** Editable blocks in document order. */
  List<BlockNode> blocks();

  /**
   * Serializes the current state of the document.
   *
   * @param options export options
   * @return a complete DOCX archive
   * @throws java.io.UncheckedIOException if serialization fails
   * @throws IllegalStateException if the editor was destroyed
   */
  byte[] exportArchive(ExportOptions options);

  /** Invalidates the editor. Further calls fail. Calling it again is a no-op. */
  void destroy();

  boolean isDestroyed();
}
