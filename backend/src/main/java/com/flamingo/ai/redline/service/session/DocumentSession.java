package com.flamingo.ai.redline.service.session;

import com.flamingo.ai.redline.service.editor.DocumentEditor;
import com.flamingo.ai.redline.service.editor.DomHandle;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Owns one loaded document for the duration of a request.
 *
 * <p>{@link #cleanup()} runs its teardown at most once: the editor is destroyed synchronously, then
 * closing the object graph is handed to the cleanup executor so the request thread does not pay
 * for it. Either handle may be {@code null} when the session wraps a partially opened document.
 */
@Slf4j
public final class DocumentSession {

  private final DocumentEditor editor;
  private final DomHandle dom;
  private final Executor cleanupExecutor;
  private final AtomicBoolean cleaned = new AtomicBoolean(false);

  DocumentSession(DocumentEditor editor, DomHandle dom, Executor cleanupExecutor) {
    this.editor = editor;
    this.dom = dom;
    this.cleanupExecutor = cleanupExecutor;
  }

  /**
   * The editor handle.
   *
   * @throws IllegalStateException if the session was already cleaned up
   */
  public DocumentEditor editor() {
    if (cleaned.get()) {
      throw new IllegalStateException("Document session already cleaned up");
    }
    return editor;
  }

  public boolean isCleanedUp() {
    return cleaned.get();
  }

  /** Releases the editor and schedules the object graph for teardown. Never throws. */
  public void cleanup() {
    if (!cleaned.compareAndSet(false, true)) {
      return;
    }
    if (editor != null) {
      try {
        editor.destroy();
      } catch (RuntimeException e) {
        log.debug("Editor destroy failed: {}", e.getMessage());
      }
    }
    if (dom != null) {
      try {
        cleanupExecutor.execute(this::closeDom);
      } catch (RejectedExecutionException e) {
        log.debug("Cleanup executor rejected teardown, closing inline");
        closeDom();
      }
    }
  }

  private void closeDom() {
    try {
      dom.close();
    } catch (Exception e) {
      // Closing an already-released graph is expected to fail.
      log.debug("Document graph close failed: {}", e.getMessage());
    }
  }
}
