package com.flamingo.ai.redline.service.upload;

/**
 * Outcome of one {@link FormatGate} check.
 *
 * @param rejection why the buffer was rejected, or {@code null} when it passed
 * @param message human-readable reason, safe to return to callers
 * @param ratio declared decompressed size divided by buffer size (ratio check only)
 * @param totalUncompressed declared decompressed size of all file entries (ratio check only)
 */
public record GateResult(
    Rejection rejection, String message, double ratio, long totalUncompressed) {

  /** Reasons a buffer can fail the gate. */
  public enum Rejection {
    INVALID_FORMAT,
    BOMB_SUSPECTED,
    CORRUPT
  }

  static GateResult ok() {
    return new GateResult(null, null, 0, 0);
  }

  static GateResult ok(double ratio, long totalUncompressed) {
    return new GateResult(null, null, ratio, totalUncompressed);
  }

  static GateResult rejected(Rejection rejection, String message) {
    return new GateResult(rejection, message, 0, 0);
  }

  static GateResult rejected(
      Rejection rejection, String message, double ratio, long totalUncompressed) {
    return new GateResult(rejection, message, ratio, totalUncompressed);
  }

  public boolean passed() {
    return rejection == null;
  }
}
