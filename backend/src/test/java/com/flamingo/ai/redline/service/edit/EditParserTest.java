package com.flamingo.ai.redline.service.edit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.redline.exception.ApiError;
import com.flamingo.ai.redline.exception.InvalidEditsException;
import com.flamingo.ai.redline.service.editor.MutationOptions.InsertType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

class EditParserTest {

  private final EditParser parser = new EditParser(new ObjectMapper());

  private ParsedEdit single(String json) {
    List<ParsedEdit> edits = parser.parse("[" + json + "]");
    assertThat(edits).hasSize(1);
    return edits.get(0);
  }

  @Nested
  @DisplayName("envelope")
  class Envelope {

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void shouldRejectMissingField(String raw) {
      assertThatThrownBy(() -> parser.parse(raw))
          .isInstanceOfSatisfying(
              InvalidEditsException.class,
              e -> assertThat(e.getCode()).isEqualTo(ApiError.MISSING_EDITS));
    }

    @Test
    void shouldRejectMalformedJson_withDetails() {
      assertThatThrownBy(() -> parser.parse("[{\"operation\":"))
          .isInstanceOfSatisfying(
              InvalidEditsException.class,
              e -> {
                assertThat(e.getCode()).isEqualTo(ApiError.INVALID_EDITS_JSON);
                assertThat(e.getMessage()).isEqualTo("Edits field must be valid JSON");
                assertThat(e.getDetails()).hasSize(1);
              });
    }

    @Test
    void shouldRejectNonArray() {
      assertThatThrownBy(() -> parser.parse("{\"operation\":\"delete\",\"blockId\":\"b001\"}"))
          .isInstanceOfSatisfying(
              InvalidEditsException.class,
              e -> assertThat(e.getCode()).isEqualTo(ApiError.MISSING_EDITS));
    }

    @Test
    void shouldAcceptEmptyArray() {
      assertThat(parser.parse("[]")).isEmpty();
    }

    @Test
    void shouldKeepValidEdits_whenSiblingIsMalformed() {
      List<ParsedEdit> edits =
          parser.parse(
              "[{\"operation\":\"delete\",\"blockId\":\"b001\"}, 42,"
                  + " {\"operation\":\"comment\",\"blockId\":\"b002\",\"comment\":\"ok\"}]");

      assertThat(edits).extracting(ParsedEdit::isValid).containsExactly(true, false, true);
      assertThat(edits).extracting(ParsedEdit::index).containsExactly(0, 1, 2);
      assertThat(edits.get(1).issueType()).isEqualTo(EditIssue.INVALID_FIELD);
    }
  }

  @Nested
  @DisplayName("operations")
  class Operations {

    @Test
    void shouldParseReplace_withDiffDefaultingToTrue() {
      ParsedEdit edit =
          single("{\"operation\":\"replace\",\"blockId\":\"b003\",\"newText\":\"Updated\"}");

      assertThat(edit.edit()).isEqualTo(new EditOperation.Replace("b003", "Updated", null, true));
      assertThat(edit.operation()).isEqualTo("replace");
    }

    @Test
    void shouldHonourExplicitDiffFalse_andComment() {
      ParsedEdit edit =
          single(
              "{\"operation\":\"replace\",\"blockId\":\"b003\",\"newText\":\"x\","
                  + "\"diff\":false,\"comment\":\"why\"}");

      assertThat(edit.edit()).isEqualTo(new EditOperation.Replace("b003", "x", "why", false));
    }

    @Test
    void shouldAllowEmptyReplacementText() {
      ParsedEdit edit = single("{\"operation\":\"replace\",\"blockId\":\"b001\",\"newText\":\"\"}");

      assertThat(edit.isValid()).isTrue();
    }

    @Test
    void shouldParseInsert_usingAfterBlockId() {
      ParsedEdit edit =
          single(
              "{\"operation\":\"insert\",\"afterBlockId\":\"b002\",\"text\":\"New\","
                  + "\"type\":\"heading\",\"level\":2}");

      assertThat(edit.edit())
          .isEqualTo(new EditOperation.Insert("b002", "New", InsertType.HEADING, 2, null));
      assertThat(edit.blockRef()).isEqualTo("b002");
    }

    @Test
    void shouldDefaultInsertTypeToParagraph() {
      ParsedEdit edit =
          single("{\"operation\":\"insert\",\"afterBlockId\":\"b002\",\"text\":\"New\"}");

      assertThat(((EditOperation.Insert) edit.edit()).type()).isEqualTo(InsertType.PARAGRAPH);
    }

    @Test
    void shouldParseDeleteAndComment() {
      assertThat(single("{\"operation\":\"delete\",\"blockId\":\"b004\"}").edit())
          .isEqualTo(new EditOperation.Delete("b004"));
      assertThat(single("{\"operation\":\"comment\",\"blockId\":\"b004\",\"comment\":\"Hi\"}").edit())
          .isEqualTo(new EditOperation.Comment("b004", "Hi"));
    }
  }

  @Nested
  @DisplayName("malformed elements")
  class Malformed {

    @Test
    void shouldFlagMissingOperation() {
      ParsedEdit edit = single("{\"blockId\":\"b001\"}");

      assertThat(edit.isValid()).isFalse();
      assertThat(edit.issueType()).isEqualTo(EditIssue.MISSING_FIELD);
      assertThat(edit.blockRef()).isEqualTo("b001");
    }

    @Test
    void shouldFlagUnknownOperation() {
      ParsedEdit edit = single("{\"operation\":\"move\",\"blockId\":\"b001\"}");

      assertThat(edit.issueType()).isEqualTo(EditIssue.UNKNOWN_OPERATION);
      assertThat(edit.issueMessage()).isEqualTo("Unknown operation: move");
    }

    @Test
    void shouldNameMissingAnchorField_forInsert() {
      ParsedEdit edit = single("{\"operation\":\"insert\",\"blockId\":\"b001\",\"text\":\"x\"}");

      assertThat(edit.issueType()).isEqualTo(EditIssue.MISSING_FIELD);
      assertThat(edit.issueMessage()).isEqualTo("Edit 'insert' is missing 'afterBlockId'");
    }

    @Test
    void shouldFlagMissingNewText() {
      ParsedEdit edit = single("{\"operation\":\"replace\",\"blockId\":\"b001\"}");

      assertThat(edit.issueMessage()).isEqualTo("Edit 'replace' is missing 'newText'");
    }

    @Test
    void shouldFlagBlankComment() {
      ParsedEdit edit = single("{\"operation\":\"comment\",\"blockId\":\"b001\",\"comment\":\" \"}");

      assertThat(edit.issueType()).isEqualTo(EditIssue.MISSING_FIELD);
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "10", "\"two\""})
    void shouldFlagOutOfRangeHeadingLevel(String level) {
      ParsedEdit edit =
          single(
              "{\"operation\":\"insert\",\"afterBlockId\":\"b001\",\"text\":\"x\","
                  + "\"type\":\"heading\",\"level\":"
                  + level
                  + "}");

      assertThat(edit.issueType()).isEqualTo(EditIssue.INVALID_FIELD);
    }

    @Test
    void shouldFlagUnsupportedInsertType() {
      ParsedEdit edit =
          single("{\"operation\":\"insert\",\"afterBlockId\":\"b001\",\"text\":\"x\",\"type\":\"table\"}");

      assertThat(edit.issueType()).isEqualTo(EditIssue.INVALID_FIELD);
    }
  }
}
