package com.flamingo.ai.redline.service.edit;

import java.util.Locale;

/**
 * Edit operation kinds in application rank order.
 *
 * <p>When several edits target the same block they run replace first, then comment, then insert,
 * then delete.
 */
public enum OperationKind {
  REPLACE,
  COMMENT,
  INSERT,
  DELETE;

  /** Wire name, e.g. {@code replace}. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Looks up a kind by wire name; returns {@code null} if unknown. */
  public static OperationKind fromWireName(String name) {
    if (name == null) {
      return null;
    }
    for (OperationKind kind : values()) {
      if (kind.wireName().equals(name.trim().toLowerCase(Locale.ROOT))) {
        return kind;
      }
    }
    return null;
  }
}
