package com.flamingo.ai.redline.service.session;

import com.flamingo.ai.redline.exception.ApiError;
import com.flamingo.ai.redline.exception.DocumentLoadException;
import com.flamingo.ai.redline.service.editor.EditorCreationException;
import com.flamingo.ai.redline.service.editor.EditorFactory;
import com.flamingo.ai.redline.service.editor.EditorInstance;
import com.flamingo.ai.redline.service.editor.EditorOptions;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Opens documents into {@link DocumentSession}s. */
@Component
@Slf4j
public class DocumentSessionFactory {

  private final EditorFactory editorFactory;
  private final Executor cleanupExecutor;

  public DocumentSessionFactory(
      EditorFactory editorFactory,
      @Qualifier("documentCleanupExecutor") Executor cleanupExecutor) {
    this.editorFactory = editorFactory;
    this.cleanupExecutor = cleanupExecutor;
  }

  /**
   * Loads a document into a new session.
   *
   * @param buffer upload bytes that passed the format gate
   * @param options editing mode and author
   * @param errorCode error code reported if the engine rejects the document
   * @return a session that the caller must clean up
   * @throws DocumentLoadException if the engine cannot open the document; anything it created
   *     before failing has already been torn down
   */
  public DocumentSession create(byte[] buffer, EditorOptions options, String errorCode) {
    EditorInstance instance;
    try {
      instance = editorFactory.create(buffer, options);
    } catch (EditorCreationException e) {
      new DocumentSession(e.getPartialEditor(), e.getPartialDom(), cleanupExecutor).cleanup();
      throw loadFailure(errorCode, e);
    } catch (RuntimeException e) {
      throw loadFailure(errorCode, e);
    }
    return new DocumentSession(instance.editor(), instance.dom(), cleanupExecutor);
  }

  /** Loads a document, reporting rejection as {@link ApiError#DOCUMENT_LOAD_FAILED}. */
  public DocumentSession create(byte[] buffer, EditorOptions options) {
    return create(buffer, options, ApiError.DOCUMENT_LOAD_FAILED);
  }

  private static DocumentLoadException loadFailure(String errorCode, RuntimeException cause) {
    log.warn("Editing engine rejected document: {}", cause.getMessage());
    return new DocumentLoadException(
        errorCode,
        "Failed to load document: " + cause.getMessage(),
        "Failed to load document. The file may be corrupted or not a valid DOCX.",
        cause);
  }
}
