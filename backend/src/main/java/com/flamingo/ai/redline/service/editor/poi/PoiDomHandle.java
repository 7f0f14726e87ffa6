package com.flamingo.ai.redline.service.editor.poi;

import com.flamingo.ai.redline.service.editor.DomHandle;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.poi.openxml4j.opc.OPCPackage;

/** The parsed OOXML package behind a {@link PoiDocumentEditor}. */
public final class PoiDomHandle implements DomHandle {

  private final OPCPackage pkg;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public PoiDomHandle(OPCPackage pkg) {
    this.pkg = pkg;
  }

  /**
   * Discards the package without saving it.
   *
   * @throws IllegalStateException if the package was already released
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      throw new IllegalStateException("Package already released");
    }
    pkg.revert();
  }

  public boolean isClosed() {
    return closed.get();
  }
}
