package com.flamingo.ai.redline.service.upload;

/**
 * One entry of a ZIP central directory.
 *
 * @param path entry name as stored in the archive
 * @param compressedSize stored size in bytes
 * @param uncompressedSize declared size after inflation
 * @param directory whether the entry is a directory marker
 */
public record ArchiveEntry(
    String path, long compressedSize, long uncompressedSize, boolean directory) {}
