package com.flamingo.ai.redline.service.ir;

/**
 * One addressable block of a document.
 *
 * @param id durable block ID
 * @param seqId short sequential ID ({@code b001}, {@code b002}, ...) valid for this document only
 * @param type structural role
 * @param level heading level, {@code null} for non-headings
 * @param styleId paragraph style identifier
 * @param styleName paragraph style display name
 * @param text plain text
 * @param ordinal zero-based position in document order
 * @param inTable whether the block lives in a table cell
 * @param inTocField whether the block is part of a table-of-contents field
 * @param tocLinked whether the block links to a {@code _Toc} bookmark or holds a PAGEREF field
 */
public record Block(
    String id,
    String seqId,
    BlockType type,
    Integer level,
    String styleId,
    String styleName,
    String text,
    int ordinal,
    boolean inTable,
    boolean inTocField,
    boolean tocLinked) {}
