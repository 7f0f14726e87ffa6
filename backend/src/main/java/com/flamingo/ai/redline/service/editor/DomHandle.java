package com.flamingo.ai.redline.service.editor;

/** The heavyweight object graph backing an editor. Closing it releases the parsed package. */
public interface DomHandle {

  /**
   * Releases the object graph.
   *
   * @throws Exception if the graph is already closed or cannot be released
   */
  void close() throws Exception;
}
