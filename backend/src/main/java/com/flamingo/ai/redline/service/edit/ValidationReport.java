package com.flamingo.ai.redline.service.edit;

import java.util.List;

/**
 * Dry-run report for a batch of edits.
 *
 * @param valid whether every edit would be applied
 * @param summary counts
 * @param issues reasons edits would be skipped
 * @param warnings non-fatal findings
 */
public record ValidationReport(
    boolean valid, Summary summary, List<EditIssue> issues, List<EditIssue> warnings) {

  /** Counts over the batch. */
  public record Summary(int totalEdits, int validEdits, int invalidEdits, int warningCount) {}
}
