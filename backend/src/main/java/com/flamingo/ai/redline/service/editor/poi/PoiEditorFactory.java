package com.flamingo.ai.redline.service.editor.poi;

import com.flamingo.ai.redline.config.RedlineConfig;
import com.flamingo.ai.redline.service.editor.EditorCreationException;
import com.flamingo.ai.redline.service.editor.EditorFactory;
import com.flamingo.ai.redline.service.editor.EditorInstance;
import com.flamingo.ai.redline.service.editor.EditorOptions;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.util.ZipSecureFile;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Component;

/**
 * Opens DOCX uploads with Apache POI.
 *
 * <p>POI's zip-bomb guards are configured from the same limits as the format gate. The gate only
 * trusts sizes declared in the central directory; these limits are enforced while entries are
 * actually inflated.
 */
@Component
@Slf4j
public class PoiEditorFactory implements EditorFactory {

  public PoiEditorFactory(RedlineConfig config) {
    RedlineConfig.Upload upload = config.getUpload();
    ZipSecureFile.setMaxEntrySize(upload.getMaxDecompressedBytes());
    ZipSecureFile.setMinInflateRatio(1.0d / upload.getMaxRatio());
    log.info(
        "POI inflate limits set (maxEntrySize={}, minInflateRatio={})",
        upload.getMaxDecompressedBytes(),
        1.0d / upload.getMaxRatio());
  }

  @Override
  public EditorInstance create(byte[] buffer, EditorOptions options) {
    OPCPackage pkg;
    try {
      pkg = OPCPackage.open(new ByteArrayInputStream(buffer));
    } catch (InvalidFormatException | IOException | RuntimeException e) {
      throw new EditorCreationException("Not a readable OOXML package", e);
    }

    PoiDomHandle dom = new PoiDomHandle(pkg);
    XWPFDocument document;
    try {
      document = new XWPFDocument(pkg);
    } catch (IOException | RuntimeException e) {
      throw new EditorCreationException("Package is not a Word document", e, null, dom);
    }

    try {
      return new EditorInstance(new PoiDocumentEditor(document, options), dom);
    } catch (RuntimeException e) {
      throw new EditorCreationException("Failed to index document blocks", e, null, dom);
    }
  }
}
