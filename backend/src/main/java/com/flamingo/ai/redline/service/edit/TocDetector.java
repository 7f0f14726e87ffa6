package com.flamingo.ai.redline.service.edit;

import com.flamingo.ai.redline.service.ir.Block;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Recognises blocks that belong to a generated table of contents.
 *
 * <p>Such blocks are rebuilt by the word processor whenever the TOC is refreshed, so edits to them
 * would be lost or would corrupt the field.
 */
public final class TocDetector {

  private static final Pattern TOC_STYLE = Pattern.compile("toc\\s*[1-9]|toc\\s*heading");

  // Dot or tab leader and a page number at the end of the entry.
  private static final Pattern LEADER_PAGE =
      Pattern.compile("\\S.*?(?:\\.{3,}|\u2026+|\\t)\\s*\\d{1,4}\\s*$");

  // Leaders are matched against the end of the text only.
  private static final int LEADER_TAIL = 64;

  private TocDetector() {}

  public static boolean isProtected(Block block) {
    return reason(block).isPresent();
  }

  /**
   * Explains why a block is treated as part of a table of contents.
   *
   * @return the reason, or empty if the block is ordinary content
   */
  public static Optional<String> reason(Block block) {
    if (isTocStyle(block.styleId()) || isTocStyle(block.styleName())) {
      return Optional.of("Block uses a table-of-contents style");
    }
    if (block.inTocField()) {
      return Optional.of("Block is inside a table-of-contents field");
    }
    if (block.tocLinked() && hasLeaderAndPageNumber(block.text())) {
      return Optional.of("Block text looks like a table-of-contents entry");
    }
    return Optional.empty();
  }

  static boolean hasLeaderAndPageNumber(String text) {
    if (text == null || text.isBlank()) {
      return false;
    }
    String tail = text.length() > LEADER_TAIL ? text.substring(text.length() - LEADER_TAIL) : text;
    return LEADER_PAGE.matcher(tail).find();
  }

  static boolean isTocStyle(String style) {
    return style != null && TOC_STYLE.matcher(style.trim().toLowerCase(Locale.ROOT)).matches();
  }
}
