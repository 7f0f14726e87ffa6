package com.flamingo.ai.redline.service.pipeline;

import com.flamingo.ai.redline.service.edit.ApplyResult;
import com.flamingo.ai.redline.service.edit.ParsedEdit;
import com.flamingo.ai.redline.service.edit.ValidationReport;
import com.flamingo.ai.redline.service.ir.DocumentIr;
import java.util.List;

/**
 * Runs uploaded documents through the gated, admission-controlled editing pipeline.
 *
 * <p>Every operation checks the upload first, then waits for an admission permit, opens a session,
 * does its work and finally cleans the session up before returning the permit.
 */
public interface DocumentPipeline {

  /**
   * Extracts the IR of a document.
   *
   * @param buffer uploaded bytes
   * @param filename original upload name
   * @return the document IR
   */
  DocumentIr read(byte[] buffer, String filename);

  /**
   * Applies edits and returns the repacked document with per-edit outcomes.
   *
   * @param buffer uploaded bytes
   * @param filename original upload name
   * @param edits parsed edits
   * @return the edited document and its outcomes
   */
  ApplyResult apply(byte[] buffer, String filename, List<ParsedEdit> edits);

  /**
   * Classifies edits against the document without changing it.
   *
   * @param buffer uploaded bytes
   * @param filename original upload name
   * @param edits parsed edits
   * @return the dry-run report
   */
  ValidationReport validate(byte[] buffer, String filename, List<ParsedEdit> edits);
}
