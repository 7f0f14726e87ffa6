package com.flamingo.ai.redline.service.editor;

/**
 * Raw structural view of one editable block, as seen by the editing engine.
 *
 * @param id durable block ID, stable for the same document content
 * @param ordinal zero-based position in document order
 * @param text plain text of the block
 * @param styleId style identifier, may be {@code null}
 * @param styleName human-readable style name, may be {@code null}
 * @param outlineLevel explicit outline level (0-8) from paragraph properties, or -1
 * @param numbered whether the block is part of a numbered or bulleted list
 * @param inTable whether the block lives inside a table cell
 * @param inTocField whether the block is inside a table-of-contents field
 * @param tocLinked whether the block links to a {@code _Toc} bookmark or holds a PAGEREF field
 */
public record BlockNode(
    String id,
    int ordinal,
    String text,
    String styleId,
    String styleName,
    int outlineLevel,
    boolean numbered,
    boolean inTable,
    boolean inTocField,
    boolean tocLinked) {}
