package com.flamingo.ai.redline.service.edit;

import com.flamingo.ai.redline.exception.DocumentProcessingException;
import com.flamingo.ai.redline.service.editor.Author;
import com.flamingo.ai.redline.service.editor.BlockOperations;
import com.flamingo.ai.redline.service.editor.DocumentEditor;
import com.flamingo.ai.redline.service.editor.ExportOptions;
import com.flamingo.ai.redline.service.editor.MutationOptions;
import com.flamingo.ai.redline.service.editor.MutationResult;
import com.flamingo.ai.redline.service.ir.Block;
import com.flamingo.ai.redline.service.ir.DocumentIr;
import com.flamingo.ai.redline.service.session.DocumentSession;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Applies a batch of edits to an open document session.
 *
 * <p>Every edit is resolved and classified against the document IR before anything is mutated.
 * Edits that survive classification run one at a time; a failing edit is recorded and the batch
 * carries on.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EditOrchestrator {

  private final BlockOperations blockOperations;

  /** An edit after resolution and classification. */
  private record Planned(
      ParsedEdit parsed, Block target, OutcomeStatus preStatus, String preReason) {

    boolean runnable() {
      return preStatus == null;
    }
  }

  /** Classification of a whole batch. */
  private record Plan(
      List<Planned> planned, List<Integer> order, List<EditIssue> issues, List<EditIssue> warnings) {}

  /**
   * Applies the edits and exports the document.
   *
   * @param session open session; the caller remains responsible for cleaning it up
   * @param edits parsed edits in the caller's order
   * @param ir IR extracted from the same session
   * @param author author of revisions and comments
   * @return exported archive with per-edit outcomes
   * @throws DocumentProcessingException if the document cannot be exported
   */
  public ApplyResult apply(
      DocumentSession session, List<ParsedEdit> edits, DocumentIr ir, Author author) {
    Plan plan = plan(edits, ir);
    DocumentEditor editor = session.editor();
    List<EditIssue> warnings = new ArrayList<>(plan.warnings());
    ApplyOutcome[] outcomes = new ApplyOutcome[edits.size()];
    Map<String, String> lastInsertAfter = new HashMap<>();

    for (int slot : plan.order()) {
      Planned planned = plan.planned().get(slot);
      if (!planned.runnable()) {
        outcomes[slot] = outcome(planned, planned.preStatus(), planned.preReason());
        continue;
      }
      ApplyOutcome outcome;
      try {
        outcome = execute(editor, planned, author, lastInsertAfter, warnings);
      } catch (RuntimeException e) {
        log.warn(
            "Edit {} ({}) on {} failed: {}",
            planned.parsed().index(),
            planned.parsed().operation(),
            planned.parsed().blockRef(),
            e.getMessage());
        outcome = outcome(planned, OutcomeStatus.FAILED, describe(e));
      }
      outcomes[slot] = outcome;
    }

    byte[] document;
    try {
      document = editor.exportArchive(new ExportOptions(true, author));
    } catch (RuntimeException e) {
      throw new DocumentProcessingException("Failed to export edited document", e);
    }

    List<ApplyOutcome> outcomeList = List.of(outcomes);
    ApplySummary summary = ApplySummary.of(outcomeList, warnings.size());
    log.info(
        "Applied edits: total={}, applied={}, skipped={}, failed={}, warnings={}",
        summary.totalEdits(),
        summary.applied(),
        summary.skipped(),
        summary.failed(),
        summary.warnings());
    return new ApplyResult(document, outcomeList, summary, List.copyOf(warnings));
  }

  /**
   * Classifies the edits without touching any document.
   *
   * @param edits parsed edits
   * @param ir document IR
   * @return the report a real application would produce, minus runtime failures
   */
  public ValidationReport validate(List<ParsedEdit> edits, DocumentIr ir) {
    Plan plan = plan(edits, ir);
    int invalid = 0;
    for (Planned planned : plan.planned()) {
      if (!planned.runnable()) {
        invalid++;
      }
    }
    ValidationReport.Summary summary =
        new ValidationReport.Summary(
            edits.size(), edits.size() - invalid, invalid, plan.warnings().size());
    return new ValidationReport(invalid == 0, summary, plan.issues(), plan.warnings());
  }

  // ---------------------------------------------------------------------------------------------
  // Planning
  // ---------------------------------------------------------------------------------------------

  private Plan plan(List<ParsedEdit> edits, DocumentIr ir) {
    List<Planned> planned = new ArrayList<>(edits.size());
    List<EditIssue> issues = new ArrayList<>();
    for (int i = 0; i < edits.size(); i++) {
      Planned p = classify(edits.get(i), ir);
      planned.add(p);
      if (!p.runnable()) {
        issues.add(
            new EditIssue(p.parsed().index(), p.parsed().blockRef(), issueType(p), p.preReason()));
      }
    }
    return new Plan(planned, order(planned), issues, warnings(planned));
  }

  private Planned classify(ParsedEdit parsed, DocumentIr ir) {
    if (!parsed.isValid()) {
      return new Planned(parsed, null, OutcomeStatus.SKIPPED_INVALID, parsed.issueMessage());
    }
    Optional<Block> target = ir.resolve(parsed.blockRef());
    if (target.isEmpty()) {
      return new Planned(
          parsed, null, OutcomeStatus.SKIPPED_NOT_FOUND, "Block not found: " + parsed.blockRef());
    }
    Block block = target.get();
    if (parsed.edit().kind() != OperationKind.COMMENT) {
      Optional<String> tocReason = TocDetector.reason(block);
      if (tocReason.isPresent()) {
        return new Planned(parsed, block, OutcomeStatus.SKIPPED_PROTECTED, tocReason.get());
      }
    }
    return new Planned(parsed, block, null, null);
  }

  private static String issueType(Planned planned) {
    return switch (planned.preStatus()) {
      case SKIPPED_NOT_FOUND -> EditIssue.MISSING_BLOCK;
      case SKIPPED_PROTECTED -> EditIssue.TOC_BLOCK;
      default -> planned.parsed().issueType();
    };
  }

  /**
   * Application order as indexes into {@code planned}.
   *
   * <p>Edits on the same block are reordered by kind among the slots they already occupy; every
   * other edit stays in its slot.
   */
  private static List<Integer> order(List<Planned> planned) {
    Map<String, List<Integer>> slotsByBlock = new LinkedHashMap<>();
    for (int i = 0; i < planned.size(); i++) {
      Planned p = planned.get(i);
      if (p.runnable()) {
        slotsByBlock.computeIfAbsent(p.target().id(), k -> new ArrayList<>()).add(i);
      }
    }

    Integer[] order = new Integer[planned.size()];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Comparator<Integer> byKind =
        Comparator.<Integer>comparingInt(i -> planned.get(i).parsed().edit().kind().ordinal())
            .thenComparingInt(i -> i);
    for (List<Integer> slots : slotsByBlock.values()) {
      if (slots.size() < 2) {
        continue;
      }
      List<Integer> sorted = new ArrayList<>(slots);
      sorted.sort(byKind);
      for (int k = 0; k < slots.size(); k++) {
        order[slots.get(k)] = sorted.get(k);
      }
    }
    return List.of(order);
  }

  private static List<EditIssue> warnings(List<Planned> planned) {
    List<EditIssue> warnings = new ArrayList<>();
    Map<String, Integer> editsPerBlock = new HashMap<>();
    Set<String> deletedBlocks = new HashSet<>();
    for (Planned p : planned) {
      if (p.runnable()) {
        editsPerBlock.merge(p.target().id(), 1, Integer::sum);
        if (p.parsed().edit().kind() == OperationKind.DELETE) {
          deletedBlocks.add(p.target().id());
        }
      }
    }

    Set<String> reported = new HashSet<>();
    for (Planned p : planned) {
      if (!p.runnable()) {
        continue;
      }
      ParsedEdit parsed = p.parsed();
      String blockId = p.target().id();
      if (parsed.edit() instanceof EditOperation.Replace replace
          && replace.newText().equals(p.target().text())) {
        warnings.add(
            new EditIssue(
                parsed.index(),
                parsed.blockRef(),
                EditIssue.NO_CHANGE,
                "Replacement text is identical to the current text"));
      }
      if (editsPerBlock.get(blockId) > 1 && !reported.add(blockId)) {
        warnings.add(
            new EditIssue(
                parsed.index(),
                parsed.blockRef(),
                EditIssue.MULTIPLE_EDITS_SAME_BLOCK,
                "Block is targeted by more than one edit"));
      }
      if (parsed.edit().kind() != OperationKind.DELETE && deletedBlocks.contains(blockId)) {
        warnings.add(
            new EditIssue(
                parsed.index(),
                parsed.blockRef(),
                EditIssue.EDIT_AFTER_DELETE,
                "Block is also deleted in this batch"));
      }
    }
    return warnings;
  }

  // ---------------------------------------------------------------------------------------------
  // Execution
  // ---------------------------------------------------------------------------------------------

  private ApplyOutcome execute(
      DocumentEditor editor,
      Planned planned,
      Author author,
      Map<String, String> lastInsertAfter,
      List<EditIssue> warnings) {
    String blockId = planned.target().id();
    EditOperation edit = planned.parsed().edit();
    MutationResult result;
    String commentTarget = blockId;
    String comment = null;

    if (edit instanceof EditOperation.Replace replace) {
      result =
          blockOperations.replace(
              editor, blockId, replace.newText(), options(author).diff(replace.diff()).build());
      comment = replace.comment();
    } else if (edit instanceof EditOperation.Delete) {
      result = blockOperations.delete(editor, blockId, options(author).build());
    } else if (edit instanceof EditOperation.Insert insert) {
      String anchor = lastInsertAfter.getOrDefault(blockId, blockId);
      result =
          blockOperations.insertAfter(
              editor,
              anchor,
              insert.text(),
              options(author).insertType(insert.type()).level(insert.level()).build());
      if (result.success() && result.newBlockId() != null) {
        lastInsertAfter.put(blockId, result.newBlockId());
        commentTarget = result.newBlockId();
      }
      comment = insert.comment();
    } else if (edit instanceof EditOperation.Comment commentEdit) {
      result = blockOperations.addComment(editor, blockId, commentEdit.text(), author);
    } else {
      throw new IllegalStateException("Unhandled edit " + edit.getClass().getSimpleName());
    }

    if (!result.success()) {
      log.warn(
          "Edit {} ({}) on {} failed: {}",
          planned.parsed().index(),
          edit.kind().wireName(),
          planned.parsed().blockRef(),
          result.error());
      return outcome(planned, OutcomeStatus.FAILED, result.error());
    }

    if (comment != null && !comment.isBlank()) {
      MutationResult commentResult;
      try {
        commentResult = blockOperations.addComment(editor, commentTarget, comment, author);
      } catch (RuntimeException e) {
        commentResult = MutationResult.failure(describe(e));
      }
      if (!commentResult.success()) {
        log.warn(
            "Comment for edit {} on {} failed: {}",
            planned.parsed().index(),
            planned.parsed().blockRef(),
            commentResult.error());
        warnings.add(
            new EditIssue(
                planned.parsed().index(),
                planned.parsed().blockRef(),
                EditIssue.COMMENT_FAILED,
                "Edit applied but its comment could not be attached: " + commentResult.error()));
      }
    }
    return outcome(planned, OutcomeStatus.APPLIED, null);
  }

  private static MutationOptions.MutationOptionsBuilder options(Author author) {
    return MutationOptions.builder().author(author).trackChanges(true).diff(true);
  }

  private static ApplyOutcome outcome(Planned planned, OutcomeStatus status, String reason) {
    ParsedEdit parsed = planned.parsed();
    return new ApplyOutcome(
        parsed.index(),
        parsed.operation(),
        parsed.blockRef(),
        planned.target() == null ? null : planned.target().id(),
        status,
        reason);
  }

  private static String describe(RuntimeException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
