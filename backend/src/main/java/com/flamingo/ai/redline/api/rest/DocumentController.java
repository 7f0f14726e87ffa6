package com.flamingo.ai.redline.api.rest;

import com.flamingo.ai.redline.exception.ApiError;
import com.flamingo.ai.redline.exception.InvalidUploadException;
import com.flamingo.ai.redline.service.edit.ApplyResult;
import com.flamingo.ai.redline.service.edit.EditParser;
import com.flamingo.ai.redline.service.edit.ParsedEdit;
import com.flamingo.ai.redline.service.edit.ValidationReport;
import com.flamingo.ai.redline.service.ir.DocumentIr;
import com.flamingo.ai.redline.service.pipeline.DocumentPipeline;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for reading and editing uploaded documents. */
@RestController
@RequestMapping("/v1")
@RequiredArgsConstructor
public class DocumentController {

  static final String DOCX_CONTENT_TYPE =
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

  static final String EDITS_APPLIED_HEADER = "X-Edits-Applied";
  static final String EDITS_SKIPPED_HEADER = "X-Edits-Skipped";
  static final String WARNINGS_HEADER = "X-Warnings";

  private final DocumentPipeline documentPipeline;
  private final EditParser editParser;

  /** Returns the block structure of an uploaded document. */
  @PostMapping(value = "/read", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentIr> read(
      @RequestParam(value = "file", required = false) MultipartFile file) {
    byte[] buffer = requireFile(file);
    return ResponseEntity.ok(documentPipeline.read(buffer, filename(file)));
  }

  /**
   * Applies edits to an uploaded document and returns the redlined document.
   *
   * <p>With {@code dry_run=true} the edits are only validated and a JSON report is returned.
   */
  @PostMapping(value = "/apply", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<?> apply(
      @RequestParam(value = "file", required = false) MultipartFile file,
      @RequestParam(value = "edits", required = false) String edits,
      @RequestParam(value = "dry_run", defaultValue = "false") boolean dryRun) {
    byte[] buffer = requireFile(file);
    List<ParsedEdit> parsed = editParser.parse(edits);
    String filename = filename(file);

    if (dryRun) {
      ValidationReport report = documentPipeline.validate(buffer, filename, parsed);
      return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(report);
    }

    ApplyResult result = documentPipeline.apply(buffer, filename, parsed);
    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(DOCX_CONTENT_TYPE))
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            "attachment; filename=\"" + OutputFilenames.edited(filename) + "\"")
        .header(EDITS_APPLIED_HEADER, String.valueOf(result.summary().applied()))
        .header(EDITS_SKIPPED_HEADER, String.valueOf(result.summary().notApplied()))
        .header(WARNINGS_HEADER, String.valueOf(result.summary().warnings()))
        .body(result.document());
  }

  private static byte[] requireFile(MultipartFile file) {
    if (file == null) {
      throw new InvalidUploadException(ApiError.MISSING_FILE, "No file uploaded");
    }
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read uploaded file", e);
    }
  }

  private static String filename(MultipartFile file) {
    String name = file.getOriginalFilename();
    return name == null || name.isBlank() ? "document.docx" : name;
  }
}
