package com.flamingo.ai.redline.service.edit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.redline.exception.ApiError;
import com.flamingo.ai.redline.exception.InvalidEditsException;
import com.flamingo.ai.redline.service.editor.MutationOptions.InsertType;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Decodes the {@code edits} form field.
 *
 * <p>Only the envelope is fatal: a missing field, malformed JSON or a non-array value fails the
 * request. Malformed elements inside the array are returned as invalid {@link ParsedEdit}s so the
 * rest of the batch still applies.
 */
@Component
@RequiredArgsConstructor
public class EditParser {

  private final ObjectMapper objectMapper;

  /**
   * Parses the raw field.
   *
   * @param raw JSON text of the {@code edits} field
   * @return one entry per array element, in order
   * @throws InvalidEditsException if the field is missing, not JSON, or not an array
   */
  public List<ParsedEdit> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidEditsException(
          ApiError.MISSING_EDITS, "Edits field is required and must be a JSON array");
    }
    JsonNode root;
    try {
      root = objectMapper.readTree(raw);
    } catch (JsonProcessingException e) {
      throw new InvalidEditsException(
          ApiError.INVALID_EDITS_JSON,
          "Edits field must be valid JSON",
          List.of(Map.of("field", "edits", "reason", String.valueOf(e.getOriginalMessage()))));
    }
    if (root == null || !root.isArray()) {
      throw new InvalidEditsException(ApiError.MISSING_EDITS, "Edits field must be a JSON array");
    }
    List<ParsedEdit> edits = new ArrayList<>(root.size());
    for (int i = 0; i < root.size(); i++) {
      edits.add(parseOne(i, root.get(i)));
    }
    return edits;
  }

  ParsedEdit parseOne(int index, JsonNode node) {
    if (node == null || !node.isObject()) {
      return ParsedEdit.invalid(
          index, null, null, EditIssue.INVALID_FIELD, "Edit must be a JSON object");
    }
    String operation = text(node, "operation");
    String blockId = text(node, "blockId");
    String afterBlockId = text(node, "afterBlockId");
    if (operation == null) {
      return ParsedEdit.invalid(
          index, null, blockId, EditIssue.MISSING_FIELD, "Edit is missing 'operation'");
    }
    OperationKind kind = OperationKind.fromWireName(operation);
    if (kind == null) {
      return ParsedEdit.invalid(
          index,
          operation,
          blockId != null ? blockId : afterBlockId,
          EditIssue.UNKNOWN_OPERATION,
          "Unknown operation: " + operation);
    }

    String ref = kind == OperationKind.INSERT ? afterBlockId : blockId;
    String refField = kind == OperationKind.INSERT ? "afterBlockId" : "blockId";
    if (ref == null || ref.isBlank()) {
      return missing(index, operation, ref, refField);
    }

    switch (kind) {
      case REPLACE -> {
        String newText = text(node, "newText");
        if (newText == null) {
          return missing(index, operation, ref, "newText");
        }
        JsonNode diff = node.get("diff");
        boolean wordDiff = diff == null || !diff.isBoolean() || diff.booleanValue();
        return ParsedEdit.valid(
            index, new EditOperation.Replace(ref, newText, text(node, "comment"), wordDiff));
      }
      case DELETE -> {
        return ParsedEdit.valid(index, new EditOperation.Delete(ref));
      }
      case INSERT -> {
        String text = text(node, "text");
        if (text == null) {
          return missing(index, operation, ref, "text");
        }
        String type = text(node, "type");
        InsertType insertType;
        if (type == null || "paragraph".equalsIgnoreCase(type)) {
          insertType = InsertType.PARAGRAPH;
        } else if ("heading".equalsIgnoreCase(type)) {
          insertType = InsertType.HEADING;
        } else {
          return ParsedEdit.invalid(
              index, operation, ref, EditIssue.INVALID_FIELD, "Unsupported insert type: " + type);
        }
        JsonNode levelNode = node.get("level");
        Integer level = null;
        if (levelNode != null && !levelNode.isNull()) {
          if (!levelNode.canConvertToInt() || levelNode.asInt() < 1 || levelNode.asInt() > 9) {
            return ParsedEdit.invalid(
                index, operation, ref, EditIssue.INVALID_FIELD, "'level' must be between 1 and 9");
          }
          level = levelNode.asInt();
        }
        return ParsedEdit.valid(
            index,
            new EditOperation.Insert(ref, text, insertType, level, text(node, "comment")));
      }
      case COMMENT -> {
        String comment = text(node, "comment");
        if (comment == null || comment.isBlank()) {
          return missing(index, operation, ref, "comment");
        }
        return ParsedEdit.valid(index, new EditOperation.Comment(ref, comment));
      }
      default -> throw new IllegalStateException("Unhandled operation " + kind);
    }
  }

  private static ParsedEdit missing(int index, String operation, String ref, String field) {
    return ParsedEdit.invalid(
        index,
        operation,
        ref,
        EditIssue.MISSING_FIELD,
        "Edit '" + operation + "' is missing '" + field + "'");
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.isTextual() ? value.textValue() : null;
  }
}
