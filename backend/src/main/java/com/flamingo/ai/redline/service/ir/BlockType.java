package com.flamingo.ai.redline.service.ir;

/** Structural role of a block. */
public enum BlockType {
  PARAGRAPH,
  HEADING,
  LIST_ITEM,
  TABLE_CELL
}
