package com.flamingo.ai.redline.service.ir;

import com.flamingo.ai.redline.service.editor.DocumentEditor;

/** Builds the intermediate representation of a loaded document. */
public interface IrExtractor {

  /**
   * Extracts the IR.
   *
   * @param editor loaded document
   * @param filename original upload name, recorded in the metadata
   * @return the document IR
   */
  DocumentIr extract(DocumentEditor editor, String filename);
}
