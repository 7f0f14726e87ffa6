package com.flamingo.ai.redline.service.edit;

import java.util.List;

/** Counts over a batch of outcomes. */
public record ApplySummary(int totalEdits, int applied, int skipped, int failed, int warnings) {

  public static ApplySummary of(List<ApplyOutcome> outcomes, int warnings) {
    int applied = 0;
    int skipped = 0;
    int failed = 0;
    for (ApplyOutcome outcome : outcomes) {
      if (outcome.status() == OutcomeStatus.APPLIED) {
        applied++;
      } else if (outcome.status() == OutcomeStatus.FAILED) {
        failed++;
      } else {
        skipped++;
      }
    }
    return new ApplySummary(outcomes.size(), applied, skipped, failed, warnings);
  }

  /** Edits that did not make it into the document, whether skipped or failed. */
  public int notApplied() {
    return skipped + failed;
  }
}
