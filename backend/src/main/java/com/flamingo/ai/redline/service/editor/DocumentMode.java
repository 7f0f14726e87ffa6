package com.flamingo.ai.redline.service.editor;

/** How an editor records mutations. */
public enum DocumentMode {
  /** Mutations rewrite content directly. */
  EDITING,

  /** Mutations are recorded as tracked revisions attributed to the author. */
  SUGGESTING
}
