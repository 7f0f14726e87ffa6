package com.flamingo.ai.redline.service.edit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.redline.exception.DocumentProcessingException;
import com.flamingo.ai.redline.service.editor.Author;
import com.flamingo.ai.redline.service.editor.BlockOperations;
import com.flamingo.ai.redline.service.editor.DocumentEditor;
import com.flamingo.ai.redline.service.editor.DocumentMode;
import com.flamingo.ai.redline.service.editor.DomHandle;
import com.flamingo.ai.redline.service.editor.EditorFactory;
import com.flamingo.ai.redline.service.editor.EditorInstance;
import com.flamingo.ai.redline.service.editor.EditorOptions;
import com.flamingo.ai.redline.service.editor.MutationOptions;
import com.flamingo.ai.redline.service.editor.MutationResult;
import com.flamingo.ai.redline.service.ir.Block;
import com.flamingo.ai.redline.service.ir.BlockType;
import com.flamingo.ai.redline.service.ir.DocumentIr;
import com.flamingo.ai.redline.service.ir.IrMetadata;
import com.flamingo.ai.redline.service.session.DocumentSession;
import com.flamingo.ai.redline.service.session.DocumentSessionFactory;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EditOrchestratorTest {

  private static final Author AUTHOR = new Author("API User", "api@redline.local");
  private static final byte[] EXPORTED = {9, 9, 9};

  @Mock private BlockOperations blockOperations;
  @Mock private DocumentEditor editor;
  @Mock private EditorFactory editorFactory;
  @Mock private DomHandle dom;

  private DocumentSession session;
  private EditOrchestrator orchestrator;
  private DocumentIr ir;

  @BeforeEach
  void setUp() {
    when(editorFactory.create(any(), any())).thenReturn(new EditorInstance(editor, dom));
    session =
        new DocumentSessionFactory(editorFactory, Runnable::run)
            .create(new byte[0], new EditorOptions(DocumentMode.SUGGESTING, AUTHOR));
    when(editor.exportArchive(any())).thenReturn(EXPORTED);

    when(blockOperations.replace(any(), anyString(), anyString(), any()))
        .thenReturn(MutationResult.ok());
    when(blockOperations.delete(any(), anyString(), any())).thenReturn(MutationResult.ok());
    when(blockOperations.addComment(any(), anyString(), anyString(), any()))
        .thenReturn(MutationResult.commented("0"));
    when(blockOperations.insertAfter(any(), anyString(), anyString(), any()))
        .thenReturn(MutationResult.inserted("new-1"), MutationResult.inserted("new-2"));

    orchestrator = new EditOrchestrator(blockOperations);
    ir =
        new DocumentIr(
            new IrMetadata("test.docx", Instant.EPOCH, 4, "docx"),
            List.of(
                block("id-1", "b001", "Contents", "TOC1", false),
                block("id-2", "b002", "First clause", null, false),
                block("id-3", "b003", "Second clause", null, false),
                block("id-4", "b004", "Third clause", null, false)),
            List.of());
  }

  private static Block block(String id, String seqId, String text, String style, boolean toc) {
    return new Block(
        id, seqId, BlockType.PARAGRAPH, null, style, null, text, 0, false, toc, false);
  }

  private static ParsedEdit replace(int index, String ref, String text) {
    return ParsedEdit.valid(index, new EditOperation.Replace(ref, text, null, true));
  }

  private static ParsedEdit delete(int index, String ref) {
    return ParsedEdit.valid(index, new EditOperation.Delete(ref));
  }

  private static ParsedEdit comment(int index, String ref, String text) {
    return ParsedEdit.valid(index, new EditOperation.Comment(ref, text));
  }

  private static ParsedEdit insert(int index, String ref, String text) {
    return ParsedEdit.valid(
        index,
        new EditOperation.Insert(ref, text, MutationOptions.InsertType.PARAGRAPH, null, null));
  }

  @Nested
  @DisplayName("apply")
  class Apply {

    @Test
    void shouldApplyValidEdits_andSkipUnresolvedOnes() {
      ApplyResult result =
          orchestrator.apply(
              session, List.of(replace(0, "b002", "Changed"), delete(1, "b999")), ir, AUTHOR);

      assertThat(result.outcomes()).extracting(ApplyOutcome::status)
          .containsExactly(OutcomeStatus.APPLIED, OutcomeStatus.SKIPPED_NOT_FOUND);
      assertThat(result.outcomes().get(1).reason()).isEqualTo("Block not found: b999");
      assertThat(result.outcomes().get(0).resolvedBlockId()).isEqualTo("id-2");
      assertThat(result.summary()).isEqualTo(new ApplySummary(2, 1, 1, 0, 0));
      assertThat(result.document()).isEqualTo(EXPORTED);
      verify(blockOperations).replace(eq(editor), eq("id-2"), eq("Changed"), any());
    }

    @Test
    void shouldResolveDurableIds() {
      orchestrator.apply(session, List.of(delete(0, "id-3")), ir, AUTHOR);

      verify(blockOperations).delete(eq(editor), eq("id-3"), any());
    }

    @Test
    void shouldProtectTocBlocks_butAllowComments() {
      ApplyResult result =
          orchestrator.apply(
              session, List.of(replace(0, "b001", "x"), comment(1, "b001", "Check")), ir, AUTHOR);

      assertThat(result.outcomes()).extracting(ApplyOutcome::status)
          .containsExactly(OutcomeStatus.SKIPPED_PROTECTED, OutcomeStatus.APPLIED);
      verify(blockOperations, never()).replace(any(), eq("id-1"), anyString(), any());
    }

    @Test
    void shouldSkipInvalidEdits_withoutCallingEditor() {
      ParsedEdit invalid =
          ParsedEdit.invalid(0, "move", "b002", EditIssue.UNKNOWN_OPERATION, "Unknown operation: move");

      ApplyResult result = orchestrator.apply(session, List.of(invalid), ir, AUTHOR);

      assertThat(result.outcomes().get(0).status()).isEqualTo(OutcomeStatus.SKIPPED_INVALID);
      assertThat(result.outcomes().get(0).reason()).isEqualTo("Unknown operation: move");
      verifyNoInteractions(blockOperations);
    }

    @Test
    void shouldContinueBatch_whenOneEditFails() {
      when(blockOperations.replace(any(), eq("id-2"), anyString(), any()))
          .thenReturn(MutationResult.failure("boom"));
      when(blockOperations.delete(any(), eq("id-3"), any()))
          .thenThrow(new IllegalStateException("exploded"));

      ApplyResult result =
          orchestrator.apply(
              session,
              List.of(replace(0, "b002", "x"), delete(1, "b003"), delete(2, "b004")),
              ir,
              AUTHOR);

      assertThat(result.outcomes()).extracting(ApplyOutcome::status)
          .containsExactly(OutcomeStatus.FAILED, OutcomeStatus.FAILED, OutcomeStatus.APPLIED);
      assertThat(result.outcomes()).extracting(ApplyOutcome::reason)
          .containsExactly("boom", "exploded", null);
      assertThat(result.summary().notApplied()).isEqualTo(2);
    }

    @Test
    void shouldWarn_whenAttachedCommentFails() {
      when(blockOperations.addComment(any(), anyString(), anyString(), any()))
          .thenReturn(MutationResult.failure("no comments part"));
      ParsedEdit edit =
          ParsedEdit.valid(0, new EditOperation.Replace("b002", "New", "Reason", true));

      ApplyResult result = orchestrator.apply(session, List.of(edit), ir, AUTHOR);

      assertThat(result.outcomes().get(0).status()).isEqualTo(OutcomeStatus.APPLIED);
      assertThat(result.warnings()).extracting(EditIssue::type)
          .containsExactly(EditIssue.COMMENT_FAILED);
      assertThat(result.summary().warnings()).isEqualTo(1);
    }

    @Test
    void shouldOrderSameBlockEditsByKind_withinTheirSlots() {
      List<ParsedEdit> edits =
          List.of(
              delete(0, "b002"),
              replace(1, "b003", "Other block"),
              comment(2, "b002", "Note"),
              replace(3, "b002", "Rewritten"));

      ApplyResult result = orchestrator.apply(session, edits, ir, AUTHOR);

      InOrder order = inOrder(blockOperations);
      order.verify(blockOperations).replace(any(), eq("id-2"), eq("Rewritten"), any());
      order.verify(blockOperations).replace(any(), eq("id-3"), eq("Other block"), any());
      order.verify(blockOperations).addComment(any(), eq("id-2"), eq("Note"), any());
      order.verify(blockOperations).delete(any(), eq("id-2"), any());
      assertThat(result.outcomes()).extracting(ApplyOutcome::editIndex)
          .containsExactly(0, 1, 2, 3);
      assertThat(result.warnings()).extracting(EditIssue::type)
          .contains(EditIssue.MULTIPLE_EDITS_SAME_BLOCK, EditIssue.EDIT_AFTER_DELETE);
    }

    @Test
    void shouldChainInsertsAfterSameAnchor_inCallerOrder() {
      orchestrator.apply(
          session, List.of(insert(0, "b002", "One"), insert(1, "b002", "Two")), ir, AUTHOR);

      InOrder order = inOrder(blockOperations);
      order.verify(blockOperations).insertAfter(any(), eq("id-2"), eq("One"), any());
      order.verify(blockOperations).insertAfter(any(), eq("new-1"), eq("Two"), any());
    }

    @Test
    void shouldWrapExportFailure() {
      when(editor.exportArchive(any())).thenThrow(new IllegalStateException("write failed"));

      assertThatThrownBy(
              () -> orchestrator.apply(session, List.of(delete(0, "b002")), ir, AUTHOR))
          .isInstanceOf(DocumentProcessingException.class)
          .hasMessage("Failed to export edited document");
    }

    @Test
    void shouldWarnOnNoOpReplacement() {
      ApplyResult result =
          orchestrator.apply(session, List.of(replace(0, "b002", "First clause")), ir, AUTHOR);

      assertThat(result.warnings()).extracting(EditIssue::type)
          .containsExactly(EditIssue.NO_CHANGE);
    }
  }

  @Nested
  @DisplayName("validate")
  class Validate {

    @Test
    void shouldReportIssues_withoutTouchingDocument() {
      ValidationReport report =
          orchestrator.validate(
              List.of(replace(0, "b002", "x"), delete(1, "b999"), delete(2, "b001")), ir);

      assertThat(report.valid()).isFalse();
      assertThat(report.summary()).isEqualTo(new ValidationReport.Summary(3, 1, 2, 0));
      assertThat(report.issues()).extracting(EditIssue::type)
          .containsExactly(EditIssue.MISSING_BLOCK, EditIssue.TOC_BLOCK);
      assertThat(report.issues()).extracting(EditIssue::editIndex).containsExactly(1, 2);
      verifyNoInteractions(blockOperations);
    }

    @Test
    void shouldBeValid_whenEveryEditResolves() {
      ValidationReport report =
          orchestrator.validate(List.of(comment(0, "b001", "TOC comments are fine")), ir);

      assertThat(report.valid()).isTrue();
      assertThat(report.issues()).isEmpty();
    }
  }
}
