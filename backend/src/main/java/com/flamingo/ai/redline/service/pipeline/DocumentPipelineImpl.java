package com.flamingo.ai.redline.service.pipeline;

import com.flamingo.ai.redline.config.RedlineConfig;
import com.flamingo.ai.redline.exception.ApiError;
import com.flamingo.ai.redline.exception.DocumentLoadException;
import com.flamingo.ai.redline.exception.DocumentProcessingException;
import com.flamingo.ai.redline.service.admission.AdmissionController;
import com.flamingo.ai.redline.service.admission.AdmissionPermit;
import com.flamingo.ai.redline.service.edit.ApplyOutcome;
import com.flamingo.ai.redline.service.edit.ApplyResult;
import com.flamingo.ai.redline.service.edit.EditOrchestrator;
import com.flamingo.ai.redline.service.edit.ParsedEdit;
import com.flamingo.ai.redline.service.edit.ValidationReport;
import com.flamingo.ai.redline.service.editor.Author;
import com.flamingo.ai.redline.service.editor.DocumentMode;
import com.flamingo.ai.redline.service.editor.EditorOptions;
import com.flamingo.ai.redline.service.ir.DocumentIr;
import com.flamingo.ai.redline.service.ir.IrExtractor;
import com.flamingo.ai.redline.service.repack.RepackException;
import com.flamingo.ai.redline.service.repack.Repacker;
import com.flamingo.ai.redline.service.session.DocumentSession;
import com.flamingo.ai.redline.service.session.DocumentSessionFactory;
import com.flamingo.ai.redline.service.upload.FormatGate;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the DocumentPipeline. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentPipelineImpl implements DocumentPipeline {

  private final FormatGate formatGate;
  private final AdmissionController admissionController;
  private final DocumentSessionFactory sessionFactory;
  private final IrExtractor irExtractor;
  private final EditOrchestrator editOrchestrator;
  private final Repacker repacker;
  private final RedlineConfig config;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "document.read.duration", description = "Time to extract a document IR")
  public DocumentIr read(byte[] buffer, String filename) {
    log.info("Reading document {} ({} bytes)", filename, buffer.length);
    DocumentIr ir =
        withSession(
            buffer,
            ApiError.EXTRACTION_FAILED,
            session -> {
              try {
                return irExtractor.extract(session.editor(), filename);
              } catch (RuntimeException e) {
                throw new DocumentLoadException(
                    ApiError.EXTRACTION_FAILED,
                    "IR extraction failed: " + e.getMessage(),
                    "Unable to extract document structure",
                    e);
              }
            });
    meterRegistry.counter("document.read").increment();
    return ir;
  }

  @Override
  @Timed(value = "document.apply.duration", description = "Time to apply edits to a document")
  public ApplyResult apply(byte[] buffer, String filename, List<ParsedEdit> edits) {
    log.info("Applying {} edits to {} ({} bytes)", edits.size(), filename, buffer.length);
    Author author = author();
    ApplyResult result =
        withSession(
            buffer,
            ApiError.DOCUMENT_LOAD_FAILED,
            session -> {
              ApplyResult applied;
              try {
                DocumentIr ir = irExtractor.extract(session.editor(), filename);
                applied = editOrchestrator.apply(session, edits, ir, author);
              } catch (DocumentProcessingException e) {
                throw e;
              } catch (RuntimeException e) {
                throw new DocumentProcessingException(
                    "Edit application failed: " + e.getMessage(), e);
              }
              return repack(applied, filename);
            });

    for (ApplyOutcome outcome : result.outcomes()) {
      meterRegistry
          .counter("document.edits", "outcome", outcome.status().name().toLowerCase(Locale.ROOT))
          .increment();
    }
    meterRegistry.counter("document.apply").increment();
    return result;
  }

  /** Recompresses the exported document; on failure the unrepacked bytes are returned. */
  private ApplyResult repack(ApplyResult result, String filename) {
    try {
      return result.withDocument(repacker.repack(result.document()));
    } catch (RepackException e) {
      log.warn("Repacking {} failed, returning uncompressed output: {}", filename, e.getMessage());
      meterRegistry.counter("document.repack.failed").increment();
      return result;
    }
  }

  @Override
  @Timed(value = "document.validate.duration", description = "Time to dry-run edits")
  public ValidationReport validate(byte[] buffer, String filename, List<ParsedEdit> edits) {
    log.info("Validating {} edits against {} ({} bytes)", edits.size(), filename, buffer.length);
    return withSession(
        buffer,
        ApiError.DOCUMENT_LOAD_FAILED,
        session -> {
          try {
            return editOrchestrator.validate(
                edits, irExtractor.extract(session.editor(), filename));
          } catch (RuntimeException e) {
            throw new DocumentProcessingException("Edit validation failed: " + e.getMessage(), e);
          }
        });
  }

  /**
   * Gate, admit, open, work, then clean up and release.
   *
   * <p>Everything {@code work} does, repacking included, runs under the permit. The session is
   * always cleaned up before the permit is released, whichever way {@code work} exits. A gate
   * rejection never takes a permit and a failed acquire never opens a session.
   */
  private <T> T withSession(
      byte[] buffer, String loadErrorCode, Function<DocumentSession, T> work) {
    formatGate.inspect(buffer);
    AdmissionPermit permit = admissionController.acquire();
    DocumentSession session = null;
    try {
      session = sessionFactory.create(buffer, editorOptions(), loadErrorCode);
      return work.apply(session);
    } finally {
      if (session != null) {
        session.cleanup();
      }
      permit.release();
    }
  }

  private EditorOptions editorOptions() {
    return new EditorOptions(DocumentMode.SUGGESTING, author());
  }

  private Author author() {
    RedlineConfig.Editing editing = config.getEditing();
    return new Author(editing.getAuthorName(), editing.getAuthorEmail());
  }
}
