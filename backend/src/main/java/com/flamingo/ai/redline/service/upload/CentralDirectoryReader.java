package com.flamingo.ai.redline.service.upload;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the central directory of an in-memory ZIP archive.
 *
 * <p>Only the end-of-central-directory record, the optional ZIP64 records and the central file
 * headers are touched. Local file headers and entry payloads are never read, so no entry is ever
 * inflated.
 */
public final class CentralDirectoryReader {

  private static final int EOCD_SIGNATURE = 0x06054b50;
  private static final int EOCD_MIN_LENGTH = 22;
  private static final int MAX_COMMENT_LENGTH = 0xFFFF;
  private static final int ZIP64_LOCATOR_SIGNATURE = 0x07064b50;
  private static final int ZIP64_LOCATOR_LENGTH = 20;
  private static final int ZIP64_EOCD_SIGNATURE = 0x06064b50;
  private static final int CENTRAL_HEADER_SIGNATURE = 0x02014b50;
  private static final int CENTRAL_HEADER_LENGTH = 46;
  private static final int ZIP64_EXTRA_ID = 0x0001;
  private static final long SATURATED_32 = 0xFFFFFFFFL;
  private static final int SATURATED_16 = 0xFFFF;

  private CentralDirectoryReader() {}

  /**
   * Lists the entries declared by the archive's central directory.
   *
   * @param archive complete archive bytes
   * @return entries in central-directory order
   * @throws CorruptArchiveException if the directory structures are missing or inconsistent
   */
  public static List<ArchiveEntry> read(byte[] archive) {
    ByteBuffer buf = ByteBuffer.wrap(archive).order(ByteOrder.LITTLE_ENDIAN);
    int eocd = findEndOfCentralDirectory(buf);

    long entryCount = buf.getShort(eocd + 10) & 0xFFFF;
    long directorySize = buf.getInt(eocd + 12) & SATURATED_32;
    long directoryOffset = buf.getInt(eocd + 16) & SATURATED_32;

    if (entryCount == SATURATED_16
        || directorySize == SATURATED_32
        || directoryOffset == SATURATED_32) {
      int locator = eocd - ZIP64_LOCATOR_LENGTH;
      if (locator >= 0 && buf.getInt(locator) == ZIP64_LOCATOR_SIGNATURE) {
        int zip64Eocd = toIndex(buf.getLong(locator + 8), archive.length, 56);
        if (buf.getInt(zip64Eocd) != ZIP64_EOCD_SIGNATURE) {
          throw new CorruptArchiveException("ZIP64 end of central directory record not found");
        }
        entryCount = buf.getLong(zip64Eocd + 32);
        directorySize = buf.getLong(zip64Eocd + 40);
        directoryOffset = buf.getLong(zip64Eocd + 48);
      }
    }

    if (directoryOffset + directorySize > eocd) {
      throw new CorruptArchiveException("Central directory extends past end record");
    }

    List<ArchiveEntry> entries = new ArrayList<>();
    int pos = toIndex(directoryOffset, archive.length, 0);
    for (long i = 0; i < entryCount; i++) {
      entries.add(readEntry(buf, pos));
      int nameLength = buf.getShort(pos + 28) & 0xFFFF;
      int extraLength = buf.getShort(pos + 30) & 0xFFFF;
      int commentLength = buf.getShort(pos + 32) & 0xFFFF;
      pos += CENTRAL_HEADER_LENGTH + nameLength + extraLength + commentLength;
    }
    return entries;
  }

  private static int findEndOfCentralDirectory(ByteBuffer buf) {
    int limit = buf.capacity();
    if (limit < EOCD_MIN_LENGTH) {
      throw new CorruptArchiveException("Archive too small for an end of central directory");
    }
    int lowest = Math.max(0, limit - EOCD_MIN_LENGTH - MAX_COMMENT_LENGTH);
    for (int pos = limit - EOCD_MIN_LENGTH; pos >= lowest; pos--) {
      if (buf.getInt(pos) == EOCD_SIGNATURE) {
        int commentLength = buf.getShort(pos + 20) & 0xFFFF;
        if (pos + EOCD_MIN_LENGTH + commentLength == limit) {
          return pos;
        }
      }
    }
    throw new CorruptArchiveException("End of central directory record not found");
  }

  private static ArchiveEntry readEntry(ByteBuffer buf, int pos) {
    if (pos < 0 || pos + CENTRAL_HEADER_LENGTH > buf.capacity()) {
      throw new CorruptArchiveException("Central directory header out of bounds");
    }
    if (buf.getInt(pos) != CENTRAL_HEADER_SIGNATURE) {
      throw new CorruptArchiveException("Bad central directory header signature");
    }

    long compressed = buf.getInt(pos + 20) & SATURATED_32;
    long uncompressed = buf.getInt(pos + 24) & SATURATED_32;
    int nameLength = buf.getShort(pos + 28) & 0xFFFF;
    int extraLength = buf.getShort(pos + 30) & 0xFFFF;

    int nameStart = pos + CENTRAL_HEADER_LENGTH;
    int extraStart = nameStart + nameLength;
    if (extraStart + extraLength > buf.capacity()) {
      throw new CorruptArchiveException("Central directory entry name out of bounds");
    }

    byte[] nameBytes = new byte[nameLength];
    buf.get(nameStart, nameBytes);
    String name = new String(nameBytes, StandardCharsets.UTF_8);

    if (uncompressed == SATURATED_32 || compressed == SATURATED_32) {
      long[] sizes = readZip64Sizes(buf, extraStart, extraLength, uncompressed, compressed);
      uncompressed = sizes[0];
      compressed = sizes[1];
    }

    if (uncompressed < 0 || compressed < 0) {
      throw new CorruptArchiveException("Negative entry size for " + name);
    }
    return new ArchiveEntry(name, compressed, uncompressed, name.endsWith("/"));
  }

  private static long[] readZip64Sizes(
      ByteBuffer buf, int extraStart, int extraLength, long uncompressed, long compressed) {
    int pos = extraStart;
    int end = extraStart + extraLength;
    while (pos + 4 <= end) {
      int headerId = buf.getShort(pos) & 0xFFFF;
      int dataSize = buf.getShort(pos + 2) & 0xFFFF;
      int data = pos + 4;
      if (headerId == ZIP64_EXTRA_ID) {
        int cursor = data;
        if (uncompressed == SATURATED_32) {
          uncompressed = readLong(buf, cursor, data + dataSize);
          cursor += 8;
        }
        if (compressed == SATURATED_32) {
          compressed = readLong(buf, cursor, data + dataSize);
        }
        return new long[] {uncompressed, compressed};
      }
      pos = data + dataSize;
    }
    throw new CorruptArchiveException("Saturated entry size without ZIP64 extra field");
  }

  private static long readLong(ByteBuffer buf, int pos, int limit) {
    if (pos + 8 > limit) {
      throw new CorruptArchiveException("Truncated ZIP64 extra field");
    }
    return buf.getLong(pos);
  }

  private static int toIndex(long offset, int length, int required) {
    if (offset < 0 || offset + required > length) {
      throw new CorruptArchiveException("Offset out of bounds: " + offset);
    }
    return (int) offset;
  }
}
