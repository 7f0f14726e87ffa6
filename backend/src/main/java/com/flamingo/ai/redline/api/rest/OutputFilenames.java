package com.flamingo.ai.redline.api.rest;

import java.text.Normalizer;

/** Builds safe {@code Content-Disposition} filenames for edited documents. */
final class OutputFilenames {

  private OutputFilenames() {}

  /**
   * Derives the download name from the uploaded name.
   *
   * <p>{@code "Q3 Report.docx"} becomes {@code "Q3_Report-edited.docx"}; anything that is not
   * printable ASCII, or could break a quoted header value, becomes {@code _}.
   */
  static String edited(String filename) {
    String base =
        (filename == null || filename.isBlank() ? "document.docx" : filename)
            .replaceFirst("(?i)\\.docx$", "");
    String ascii =
        Normalizer.normalize(base, Normalizer.Form.NFKD).replaceAll("[^\\x20-\\x7E]", "_");
    String safe =
        ascii
            .replaceAll("[\"\\\\\\r\\n]", "_")
            .replaceAll("[^A-Za-z0-9._ -]", "_")
            .trim()
            .replaceAll("\\s+", "_");
    return (safe.isEmpty() ? "document" : safe) + "-edited.docx";
  }
}
