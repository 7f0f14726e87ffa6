package com.flamingo.ai.redline.service.editor.poi;

import com.flamingo.ai.redline.service.editor.Author;
import com.flamingo.ai.redline.service.editor.BlockOperations;
import com.flamingo.ai.redline.service.editor.DocumentEditor;
import com.flamingo.ai.redline.service.editor.MutationOptions;
import com.flamingo.ai.redline.service.editor.MutationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Block mutation primitives for documents opened by {@link PoiEditorFactory}. */
@Component
@Slf4j
public class PoiBlockOperations implements BlockOperations {

  @Override
  public MutationResult replace(
      DocumentEditor editor, String blockId, String newText, MutationOptions options) {
    return mutate(
        editor,
        blockId,
        poi -> {
          poi.replaceText(blockId, newText == null ? "" : newText, options);
          return MutationResult.ok();
        });
  }

  @Override
  public MutationResult delete(DocumentEditor editor, String blockId, MutationOptions options) {
    return mutate(
        editor,
        blockId,
        poi -> {
          poi.markDeleted(blockId, options);
          return MutationResult.ok();
        });
  }

  @Override
  public MutationResult insertAfter(
      DocumentEditor editor, String anchorBlockId, String text, MutationOptions options) {
    return mutate(
        editor,
        anchorBlockId,
        poi ->
            MutationResult.inserted(
                poi.insertParagraphAfter(anchorBlockId, text == null ? "" : text, options)));
  }

  @Override
  public MutationResult addComment(
      DocumentEditor editor, String blockId, String text, Author author) {
    if (text == null || text.isBlank()) {
      return MutationResult.failure("Comment text is empty");
    }
    return mutate(
        editor, blockId, poi -> MutationResult.commented(poi.comment(blockId, text, author)));
  }

  private interface Mutation {
    MutationResult apply(PoiDocumentEditor editor);
  }

  private MutationResult mutate(DocumentEditor editor, String blockId, Mutation mutation) {
    if (!(editor instanceof PoiDocumentEditor poi)) {
      return MutationResult.failure("Unsupported editor " + editor.getClass().getSimpleName());
    }
    if (poi.isDestroyed()) {
      return MutationResult.failure("Editor has been destroyed");
    }
    if (!poi.contains(blockId)) {
      return MutationResult.failure("Block not found: " + blockId);
    }
    try {
      return mutation.apply(poi);
    } catch (IllegalArgumentException | IllegalStateException e) {
      log.debug("Mutation on block {} rejected: {}", blockId, e.getMessage());
      return MutationResult.failure(e.getMessage());
    }
  }
}
