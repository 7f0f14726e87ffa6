package com.flamingo.ai.redline.service.ir;

import java.time.Instant;

/**
 * Describes where an IR came from.
 *
 * @param filename original upload name
 * @param generatedAt extraction time
 * @param blockCount number of blocks
 * @param format source format, always {@code docx}
 */
public record IrMetadata(String filename, Instant generatedAt, int blockCount, String format) {}
