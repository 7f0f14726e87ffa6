package com.flamingo.ai.redline.service.upload;

import com.flamingo.ai.redline.config.RedlineConfig;
import com.flamingo.ai.redline.exception.ApiError;
import com.flamingo.ai.redline.exception.InvalidUploadException;
import com.flamingo.ai.redline.service.upload.GateResult.Rejection;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Cheap admission checks for uploaded DOCX archives, run before any editing session is opened.
 *
 * <p>Two stages:
 *
 * <ol>
 *   <li>the buffer must start with the ZIP local file header signature {@code PK\3\4};
 *   <li>the declared decompressed size, summed from central-directory metadata, must stay under
 *       both a ratio and an absolute limit.
 * </ol>
 *
 * <p>Neither stage inflates entry data. The ratio check trusts metadata an attacker can forge, so
 * the editor and the repacker enforce their own byte limits during real decompression.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FormatGate {

  private static final byte[] ZIP_MAGIC = {0x50, 0x4B, 0x03, 0x04};

  private final RedlineConfig config;

  /**
   * Runs both checks and throws on the first failure.
   *
   * @param buffer uploaded bytes
   * @throws InvalidUploadException with {@link ApiError#INVALID_FILE_TYPE} or {@link
   *     ApiError#ZIP_BOMB_DETECTED}
   */
  public void inspect(byte[] buffer) {
    GateResult signature = validateSignature(buffer);
    if (!signature.passed()) {
      throw new InvalidUploadException(ApiError.INVALID_FILE_TYPE, signature.message());
    }

    GateResult expansion =
        checkExpansionRatio(
            buffer,
            config.getUpload().getMaxRatio(),
            config.getUpload().getMaxDecompressedBytes());
    if (!expansion.passed()) {
      log.warn(
          "Upload rejected ({}): ratio={}, declaredBytes={}",
          expansion.rejection(),
          String.format("%.1f", expansion.ratio()),
          expansion.totalUncompressed());
      throw new InvalidUploadException(ApiError.ZIP_BOMB_DETECTED, expansion.message());
    }
  }

  /** Checks the ZIP local file header signature. */
  public GateResult validateSignature(byte[] buffer) {
    if (buffer == null || buffer.length < ZIP_MAGIC.length) {
      return GateResult.rejected(Rejection.INVALID_FORMAT, "File too small to be a valid DOCX");
    }
    for (int i = 0; i < ZIP_MAGIC.length; i++) {
      if (buffer[i] != ZIP_MAGIC[i]) {
        return GateResult.rejected(
            Rejection.INVALID_FORMAT,
            "Invalid file format: not a ZIP/DOCX file (bad magic bytes)");
      }
    }
    return GateResult.ok();
  }

  /**
   * Compares the declared decompressed size against the buffer size.
   *
   * @param buffer archive bytes
   * @param maxRatio largest accepted decompressed:compressed ratio
   * @param maxAbsoluteBytes largest accepted total decompressed size
   * @return the check outcome; never throws for malformed input
   */
  public GateResult checkExpansionRatio(byte[] buffer, double maxRatio, long maxAbsoluteBytes) {
    List<ArchiveEntry> entries;
    try {
      entries = CentralDirectoryReader.read(buffer);
    } catch (RuntimeException e) {
      log.debug("Central directory parse failed: {}", e.getMessage());
      return GateResult.rejected(Rejection.CORRUPT, "Corrupted or invalid ZIP/DOCX file");
    }

    long totalUncompressed = 0;
    for (ArchiveEntry entry : entries) {
      if (!entry.directory()) {
        totalUncompressed = saturatedAdd(totalUncompressed, entry.uncompressedSize());
      }
    }

    double ratio = buffer.length > 0 ? (double) totalUncompressed / buffer.length : 0;

    if (totalUncompressed > maxAbsoluteBytes) {
      return GateResult.rejected(
          Rejection.BOMB_SUSPECTED,
          "Decompressed size exceeds maximum allowed",
          ratio,
          totalUncompressed);
    }
    if (ratio > maxRatio) {
      return GateResult.rejected(
          Rejection.BOMB_SUSPECTED,
          "Suspicious compression ratio detected",
          ratio,
          totalUncompressed);
    }
    return GateResult.ok(ratio, totalUncompressed);
  }

  private static long saturatedAdd(long a, long b) {
    long sum = a + b;
    return sum < 0 ? Long.MAX_VALUE : sum;
  }
}
