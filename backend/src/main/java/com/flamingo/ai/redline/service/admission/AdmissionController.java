package com.flamingo.ai.redline.service.admission;

import com.flamingo.ai.redline.exception.AdmissionTimeoutException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounds how many heavyweight editing sessions may be alive at once.
 *
 * <p>Backed by a resilience4j semaphore {@link Bulkhead} with fair call handling, so waiters are
 * admitted in arrival order. {@link #acquire()} parks only the calling request thread.
 */
@Slf4j
public class AdmissionController {

  private final Bulkhead bulkhead;

  public AdmissionController(Bulkhead bulkhead) {
    this.bulkhead = bulkhead;
  }

  /**
   * Creates a controller over a private bulkhead. Mainly useful in tests.
   *
   * @param capacity maximum outstanding permits
   * @param acquireTimeout longest wait for a permit
   */
  public static AdmissionController of(int capacity, Duration acquireTimeout) {
    BulkheadConfig config =
        BulkheadConfig.custom()
            .maxConcurrentCalls(capacity)
            .maxWaitDuration(acquireTimeout)
            .fairCallHandlingStrategyEnabled(true)
            .build();
    return new AdmissionController(Bulkhead.of("documentSessions", config));
  }

  /**
   * Waits for a free slot.
   *
   * @return a permit that must be released exactly once
   * @throws AdmissionTimeoutException if no slot became free within the configured wait, or the
   *     waiting thread was interrupted
   */
  public AdmissionPermit acquire() {
    try {
      bulkhead.acquirePermission();
    } catch (BulkheadFullException e) {
      throw new AdmissionTimeoutException(
          "No editing slot available within "
              + bulkhead.getBulkheadConfig().getMaxWaitDuration().toMillis()
              + "ms",
          e);
    } catch (RuntimeException e) {
      if (Thread.currentThread().isInterrupted()) {
        throw new AdmissionTimeoutException("Interrupted while waiting for an editing slot", e);
      }
      throw e;
    }
    log.debug("Admission permit acquired ({} outstanding)", outstanding());
    return new AdmissionPermit(this);
  }

  /** Returns a slot. Never throws; a failing release is logged and treated as done. */
  void release() {
    try {
      bulkhead.onComplete();
      log.debug("Admission permit released ({} outstanding)", outstanding());
    } catch (RuntimeException e) {
      log.warn("Failed to release admission permit: {}", e.getMessage(), e);
    }
  }

  public int capacity() {
    return bulkhead.getMetrics().getMaxAllowedConcurrentCalls();
  }

  /** Number of permits currently held. */
  public int outstanding() {
    Bulkhead.Metrics metrics = bulkhead.getMetrics();
    return metrics.getMaxAllowedConcurrentCalls() - metrics.getAvailableConcurrentCalls();
  }
}
