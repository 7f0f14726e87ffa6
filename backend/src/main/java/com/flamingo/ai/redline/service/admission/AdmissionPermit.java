package com.flamingo.ai.redline.service.admission;

import java.util.concurrent.atomic.AtomicBoolean;

/** One admission slot. Releasing it more than once is a no-op. */
public final class AdmissionPermit {

  private final AdmissionController controller;
  private final AtomicBoolean released = new AtomicBoolean(false);

  AdmissionPermit(AdmissionController controller) {
    this.controller = controller;
  }

  /** Returns the slot to the controller the first time it is called. */
  public void release() {
    if (released.compareAndSet(false, true)) {
      controller.release();
    }
  }

  public boolean isReleased() {
    return released.get();
  }
}
