package com.flamingo.ai.redline.service.editor;

/**
 * Options for serializing an edited document.
 *
 * @param trackChanges keep revision marks instead of accepting them
 * @param author author that revisions are attributed to
 */
public record ExportOptions(boolean trackChanges, Author author) {}
