package com.flamingo.ai.redline.service.repack;

import com.flamingo.ai.redline.config.RedlineConfig;
import com.flamingo.ai.redline.service.upload.ArchiveEntry;
import com.flamingo.ai.redline.service.upload.CentralDirectoryReader;
import com.flamingo.ai.redline.service.upload.CorruptArchiveException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.HashSet;
import java.util.Set;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Re-encodes an archive with maximum deflate compression.
 *
 * <p>The central directory decides which entries exist. Local entries it does not list are stale
 * and skipped, directory entries are dropped, and the rest keep their paths and order. Inflated
 * bytes are counted as they are read, so an archive that lies about its sizes cannot expand past
 * the configured limit.
 */
@Component
@Slf4j
public class Repacker {

  private static final int BUFFER_SIZE = 8192;

  private final long maxInflatedBytes;

  @Autowired
  public Repacker(RedlineConfig config) {
    this(config.getUpload().getMaxDecompressedBytes());
  }

  public Repacker(long maxInflatedBytes) {
    this.maxInflatedBytes = maxInflatedBytes;
  }

  /**
   * Repacks an archive.
   *
   * @param archive a complete ZIP archive
   * @return the same entries, recompressed
   * @throws RepackException if the archive cannot be read, contains no entries, or inflates past
   *     the limit
   */
  public byte[] repack(byte[] archive) {
    Set<String> listed = listedFiles(archive);
    ByteArrayOutputStream out = new ByteArrayOutputStream(archive.length);
    long inflated = 0;
    int entries = 0;
    byte[] buffer = new byte[BUFFER_SIZE];
    try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(archive));
        ZipOutputStream zip = new ZipOutputStream(out)) {
      zip.setLevel(Deflater.BEST_COMPRESSION);
      ZipEntry entry;
      while ((entry = in.getNextEntry()) != null) {
        if (entry.isDirectory()) {
          continue;
        }
        if (!listed.remove(entry.getName())) {
          log.debug("Skipping entry {} not listed in the central directory", entry.getName());
          continue;
        }
        ZipEntry copy = new ZipEntry(entry.getName());
        if (entry.getTime() != -1) {
          copy.setTime(entry.getTime());
        }
        zip.putNextEntry(copy);
        int read;
        while ((read = in.read(buffer)) != -1) {
          inflated += read;
          if (inflated > maxInflatedBytes) {
            throw new RepackException(
                "Archive inflates beyond " + maxInflatedBytes + " bytes while repacking");
          }
          zip.write(buffer, 0, read);
        }
        zip.closeEntry();
        entries++;
      }
      if (entries == 0) {
        throw new RepackException("Archive contains no entries");
      }
      zip.finish();
    } catch (IOException | IllegalArgumentException e) {
      throw new RepackException("Failed to repack archive: " + e.getMessage(), e);
    }
    byte[] repacked = out.toByteArray();
    log.debug("Repacked {} entries: {} -> {} bytes", entries, archive.length, repacked.length);
    return repacked;
  }

  private static Set<String> listedFiles(byte[] archive) {
    try {
      Set<String> names = new HashSet<>();
      for (ArchiveEntry entry : CentralDirectoryReader.read(archive)) {
        if (!entry.directory()) {
          names.add(entry.path());
        }
      }
      return names;
    } catch (CorruptArchiveException | IndexOutOfBoundsException e) {
      throw new RepackException("Failed to repack archive: " + e.getMessage(), e);
    }
  }
}
