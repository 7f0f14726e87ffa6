package com.flamingo.ai.redline.service.editor;

/**
 * Result of opening a document: the editor and the object graph it runs on.
 *
 * @param editor mutation surface
 * @param dom backing object graph, torn down after the editor
 */
public record EditorInstance(DocumentEditor editor, DomHandle dom) {}
