package com.flamingo.ai.redline.service.edit;

import java.util.List;

/**
 * Output of applying a batch.
 *
 * @param document exported archive, not yet repacked
 * @param outcomes one outcome per edit, in the caller's order
 * @param summary aggregated counts
 * @param warnings non-fatal findings
 */
public record ApplyResult(
    byte[] document, List<ApplyOutcome> outcomes, ApplySummary summary, List<EditIssue> warnings) {

  /** Same result with a different archive body. */
  public ApplyResult withDocument(byte[] replacement) {
    return new ApplyResult(replacement, outcomes, summary, warnings);
  }
}
