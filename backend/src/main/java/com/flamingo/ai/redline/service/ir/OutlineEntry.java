package com.flamingo.ai.redline.service.ir;

/** A heading in the document outline. */
public record OutlineEntry(String id, String seqId, int level, String text) {}
