package com.flamingo.ai.redline.service.editor.poi;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Word-level diff used to turn a paragraph replacement into a minimal tracked change.
 *
 * <p>Text is split into alternating word and whitespace tokens and compared with a longest common
 * subsequence. Adjacent segments of the same kind are merged, so concatenating the {@code EQUAL} and
 * {@code DELETE} segments yields the old text and concatenating {@code EQUAL} and {@code INSERT}
 * yields the new text.
 */
public final class WordDiff {

  private static final Pattern TOKEN = Pattern.compile("\\s+|[^\\s]+");

  /** Above this many LCS cells the diff degrades to a whole replacement. */
  static final long MAX_CELLS = 4_000_000L;

  private WordDiff() {}

  /** Kind of a diff segment. */
  public enum Kind {
    EQUAL,
    DELETE,
    INSERT
  }

  /** A run of text that is unchanged, removed or added. */
  public record Segment(Kind kind, String text) {}

  /**
   * Computes the word-level difference between two texts.
   *
   * @param oldText current text, {@code null} treated as empty
   * @param newText replacement text, {@code null} treated as empty
   * @return merged segments in document order
   */
  public static List<Segment> diff(String oldText, String newText) {
    List<String> a = tokenize(oldText);
    List<String> b = tokenize(newText);
    if ((long) a.size() * b.size() > MAX_CELLS) {
      return wholeReplacement(oldText, newText);
    }

    int n = a.size();
    int m = b.size();
    int[][] lcs = new int[n + 1][m + 1];
    for (int i = n - 1; i >= 0; i--) {
      for (int j = m - 1; j >= 0; j--) {
        lcs[i][j] =
            a.get(i).equals(b.get(j)) ? lcs[i + 1][j + 1] + 1 : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
      }
    }

    List<Segment> out = new ArrayList<>();
    int i = 0;
    int j = 0;
    while (i < n && j < m) {
      if (a.get(i).equals(b.get(j))) {
        append(out, Kind.EQUAL, a.get(i));
        i++;
        j++;
      } else if (lcs[i + 1][j] >= lcs[i][j + 1]) {
        append(out, Kind.DELETE, a.get(i++));
      } else {
        append(out, Kind.INSERT, b.get(j++));
      }
    }
    while (i < n) {
      append(out, Kind.DELETE, a.get(i++));
    }
    while (j < m) {
      append(out, Kind.INSERT, b.get(j++));
    }
    return out;
  }

  /** Delete everything, then insert everything. Empty sides produce no segment. */
  public static List<Segment> wholeReplacement(String oldText, String newText) {
    List<Segment> out = new ArrayList<>(2);
    if (oldText != null && !oldText.isEmpty()) {
      out.add(new Segment(Kind.DELETE, oldText));
    }
    if (newText != null && !newText.isEmpty()) {
      out.add(new Segment(Kind.INSERT, newText));
    }
    return out;
  }

  static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return tokens;
    }
    Matcher matcher = TOKEN.matcher(text);
    while (matcher.find()) {
      tokens.add(matcher.group());
    }
    return tokens;
  }

  private static void append(List<Segment> out, Kind kind, String token) {
    if (!out.isEmpty()) {
      Segment last = out.get(out.size() - 1);
      if (last.kind() == kind) {
        out.set(out.size() - 1, new Segment(kind, last.text() + token));
        return;
      }
    }
    out.add(new Segment(kind, token));
  }
}
