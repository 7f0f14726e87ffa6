package com.flamingo.ai.redline.service.ir;

import com.flamingo.ai.redline.service.editor.BlockNode;
import com.flamingo.ai.redline.service.editor.DocumentEditor;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Classifies the editor's blocks and assigns short IDs in document order. */
@Component
@Slf4j
public class DefaultIrExtractor implements IrExtractor {

  private static final Pattern HEADING_STYLE = Pattern.compile("heading\\s*([1-9])");

  private final Clock clock;

  @Autowired
  public DefaultIrExtractor() {
    this(Clock.systemUTC());
  }

  DefaultIrExtractor(Clock clock) {
    this.clock = clock;
  }

  @Override
  public DocumentIr extract(DocumentEditor editor, String filename) {
    List<Block> blocks = new ArrayList<>();
    List<OutlineEntry> outline = new ArrayList<>();
    for (BlockNode node : editor.blocks()) {
      Integer level = headingLevel(node);
      BlockType type;
      if (level != null) {
        type = BlockType.HEADING;
      } else if (node.numbered()) {
        type = BlockType.LIST_ITEM;
      } else if (node.inTable()) {
        type = BlockType.TABLE_CELL;
      } else {
        type = BlockType.PARAGRAPH;
      }
      String seqId = seqId(blocks.size() + 1);
      Block block =
          new Block(
              node.id(),
              seqId,
              type,
              level,
              node.styleId(),
              node.styleName(),
              node.text(),
              node.ordinal(),
              node.inTable(),
              node.inTocField(),
              node.tocLinked());
      blocks.add(block);
      if (type == BlockType.HEADING) {
        outline.add(new OutlineEntry(block.id(), seqId, level, block.text()));
      }
    }
    log.debug("Extracted {} blocks ({} headings) from {}", blocks.size(), outline.size(), filename);
    IrMetadata metadata = new IrMetadata(filename, Instant.now(clock), blocks.size(), "docx");
    return new DocumentIr(metadata, blocks, outline);
  }

  /** Short ID for the n-th block, 1-based: {@code b001}, {@code b002}, ... */
  static String seqId(int position) {
    return String.format(Locale.ROOT, "b%03d", position);
  }

  /** Heading level from style or outline level, or {@code null} if the block is not a heading. */
  static Integer headingLevel(BlockNode node) {
    for (String style : new String[] {node.styleId(), node.styleName()}) {
      if (style == null) {
        continue;
      }
      String normalized = style.toLowerCase(Locale.ROOT);
      Matcher matcher = HEADING_STYLE.matcher(normalized);
      if (matcher.matches()) {
        return Integer.parseInt(matcher.group(1));
      }
      if ("title".equals(normalized)) {
        return 1;
      }
    }
    if (node.outlineLevel() >= 0 && node.outlineLevel() < 9) {
      return node.outlineLevel() + 1;
    }
    return null;
  }
}
