package com.flamingo.ai.redline.service.editor;

/**
 * Thrown when the engine cannot open a document.
 *
 * <p>Carries whatever handles were created before the failure so the caller can tear them down
 * through its normal cleanup path.
 */
public class EditorCreationException extends RuntimeException {

  private final transient DocumentEditor partialEditor;
  private final transient DomHandle partialDom;

  public EditorCreationException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  public EditorCreationException(
      String message, Throwable cause, DocumentEditor partialEditor, DomHandle partialDom) {
    super(message, cause);
    this.partialEditor = partialEditor;
    this.partialDom = partialDom;
  }

  /** Editor created before the failure, or {@code null}. */
  public DocumentEditor getPartialEditor() {
    return partialEditor;
  }

  /** Object graph created before the failure, or {@code null}. */
  public DomHandle getPartialDom() {
    return partialDom;
  }
}
