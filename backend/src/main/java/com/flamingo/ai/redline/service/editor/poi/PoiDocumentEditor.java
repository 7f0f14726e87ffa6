package com.flamingo.ai.redline.service.editor.poi;

import com.flamingo.ai.redline.service.editor.Author;
import com.flamingo.ai.redline.service.editor.BlockNode;
import com.flamingo.ai.redline.service.editor.DocumentEditor;
import com.flamingo.ai.redline.service.editor.EditorOptions;
import com.flamingo.ai.redline.service.editor.ExportOptions;
import com.flamingo.ai.redline.service.editor.MutationOptions;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import javax.xml.namespace.QName;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.IBody;
import org.apache.poi.xwpf.usermodel.IBodyElement;
import org.apache.poi.xwpf.usermodel.XWPFComment;
import org.apache.poi.xwpf.usermodel.XWPFComments;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.apache.xmlbeans.impl.xb.xmlschema.SpaceAttribute;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTFldChar;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTHyperlink;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTMarkupRange;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTP;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTParaRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTR;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTRunTrackChange;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTSimpleField;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTText;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTTrackChange;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STFldCharType;

/**
 * {@link com.flamingo.ai.redline.service.editor.DocumentEditor} over an {@link XWPFDocument}.
 *
 * <p>Paragraphs in the main body and in table cells (nested tables included) are indexed as blocks
 * when the document is opened. Mutations work on the underlying WordprocessingML directly and
 * record tracked changes as {@code w:ins}/{@code w:del} revisions. Paragraphs inside content
 * controls are not indexed and therefore cannot be targeted.
 */
@Slf4j
public class PoiDocumentEditor implements DocumentEditor {

  static final String W_NS = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
  private static final String DECLARE_W = "declare namespace w='" + W_NS + "' ";
  private static final String TOC_BOOKMARK_PREFIX = "_Toc";
  private static final QName DEL = new QName(W_NS, "del");
  private static final QName DEL_TEXT = new QName(W_NS, "delText");
  private static final QName ATTR_ID = new QName(W_NS, "id");
  private static final QName ATTR_AUTHOR = new QName(W_NS, "author");
  private static final QName ATTR_DATE = new QName(W_NS, "date");

  // Keeps our revision IDs clear of the ones already in the document.
  private static final int REVISION_ID_BASE = 900_000;

  private final XWPFDocument document;
  private final EditorOptions options;
  private final Map<String, Block> index = new LinkedHashMap<>();
  private final List<BlockNode> loadedBlocks;
  private final AtomicInteger revisionIds = new AtomicInteger(REVISION_ID_BASE);
  private volatile boolean destroyed;

  /** Indexed paragraph with its mutable state. */
  private static final class Block {
    private final XWPFParagraph paragraph;
    private String text;
    private boolean deleted;

    private Block(XWPFParagraph paragraph, String text) {
      this.paragraph = paragraph;
      this.text = text;
    }
  }

  public PoiDocumentEditor(XWPFDocument document, EditorOptions options) {
    this.document = document;
    this.options = options;
    List<BlockNode> nodes = new ArrayList<>();
    indexBody(document.getBodyElements(), false, new TocFieldTracker(), nodes);
    this.loadedBlocks = Collections.unmodifiableList(nodes);
    log.debug("Indexed {} blocks", nodes.size());
  }

  /** Blocks as they were when the document was opened. */
  @Override
  public List<BlockNode> blocks() {
    ensureOpen();
    return loadedBlocks;
  }

  @Override
  public byte[] exportArchive(ExportOptions exportOptions) {
    ensureOpen();
    if (exportOptions.trackChanges()) {
      document.setTrackRevisions(true);
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try {
      document.write(out);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to serialize document", e);
    }
    return out.toByteArray();
  }

  @Override
  public void destroy() {
    destroyed = true;
    index.clear();
  }

  @Override
  public boolean isDestroyed() {
    return destroyed;
  }

  public EditorOptions options() {
    return options;
  }

  XWPFDocument document() {
    return document;
  }

  boolean contains(String blockId) {
    return index.containsKey(blockId);
  }

  /** Current text of a block, reflecting earlier mutations in this session. */
  String currentText(String blockId) {
    return require(blockId).text;
  }

  // ---------------------------------------------------------------------------------------------
  // Mutations
  // ---------------------------------------------------------------------------------------------

  void replaceText(String blockId, String newText, MutationOptions mutation) {
    Block block = requireLive(blockId);
    CTP ctp = block.paragraph.getCTP();
    Author author = mutation.author();

    if (!mutation.trackChanges()) {
      CTRPr template = firstRunProperties(ctp);
      clearRunContent(ctp);
      appendRun(ctp, template, newText);
    } else if (mutation.diff()) {
      CTRPr template = firstRunProperties(ctp);
      clearRunContent(ctp);
      for (WordDiff.Segment segment : WordDiff.diff(block.text, newText)) {
        switch (segment.kind()) {
          case EQUAL -> appendRun(ctp, template, segment.text());
          case DELETE -> appendDeletion(ctp, template, segment.text(), author);
          case INSERT -> appendInsertion(ctp, template, segment.text(), author);
          default -> throw new IllegalStateException("Unexpected segment " + segment.kind());
        }
      }
    } else {
      CTRPr template = firstRunProperties(ctp);
      markRunsDeleted(ctp, author);
      if (!newText.isEmpty()) {
        appendInsertion(ctp, template, newText, author);
      }
    }
    block.text = newText;
  }

  void markDeleted(String blockId, MutationOptions mutation) {
    Block block = requireLive(blockId);
    if (!mutation.trackChanges()) {
      removeParagraph(block.paragraph);
    } else {
      CTP ctp = block.paragraph.getCTP();
      markRunsDeleted(ctp, mutation.author());
      stamp(paragraphMarkProperties(ctp).addNewDel(), mutation.author());
    }
    block.deleted = true;
  }

  /** Inserts a paragraph after the anchor and returns the new block's ID. */
  String insertParagraphAfter(String anchorId, String text, MutationOptions mutation) {
    Block anchor = require(anchorId);
    XWPFParagraph created = newParagraphAfter(anchor.paragraph);
    if (mutation.insertType() == MutationOptions.InsertType.HEADING) {
      int level = mutation.level() == null ? 1 : Math.max(1, Math.min(9, mutation.level()));
      created.setStyle("Heading" + level);
    }
    CTP ctp = created.getCTP();
    if (mutation.trackChanges()) {
      if (!text.isEmpty()) {
        appendInsertion(ctp, null, text, mutation.author());
      }
      stamp(paragraphMarkProperties(ctp).addNewIns(), mutation.author());
    } else if (!text.isEmpty()) {
      appendRun(ctp, null, text);
    }
    String id = UUID.randomUUID().toString();
    index.put(id, new Block(created, text));
    return id;
  }

  /** Adds a comment spanning the whole block and returns the comment ID. */
  String comment(String blockId, String text, Author author) {
    Block block = require(blockId);
    XWPFComments comments = document.getDocComments();
    if (comments == null) {
      comments = document.createComments();
    }
    BigInteger commentId = nextCommentId(comments);
    XWPFComment comment = comments.createComment(commentId);
    comment.setAuthor(author.name());
    comment.setInitials(author.initials());
    comment.setDate(Calendar.getInstance());
    comment.createParagraph().createRun().setText(text);

    CTP ctp = block.paragraph.getCTP();
    CTMarkupRange start = ctp.addNewCommentRangeStart();
    start.setId(commentId);
    moveAfterProperties(ctp, start);
    CTMarkupRange end = ctp.addNewCommentRangeEnd();
    end.setId(commentId);
    moveToEnd(ctp, end);
    CTR reference = ctp.addNewR();
    reference.addNewCommentReference().setId(commentId);
    moveToEnd(ctp, reference);
    return commentId.toString();
  }

  // ---------------------------------------------------------------------------------------------
  // Indexing
  // ---------------------------------------------------------------------------------------------

  private void indexBody(
      List<IBodyElement> elements, boolean inTable, TocFieldTracker toc, List<BlockNode> out) {
    for (IBodyElement element : elements) {
      if (element instanceof XWPFParagraph paragraph) {
        out.add(register(paragraph, out.size(), inTable, toc.scan(paragraph)));
      } else if (element instanceof XWPFTable table) {
        for (XWPFTableRow row : table.getRows()) {
          for (XWPFTableCell cell : row.getTableCells()) {
            indexBody(cell.getBodyElements(), true, toc, out);
          }
        }
      }
    }
  }

  private BlockNode register(XWPFParagraph paragraph, int ordinal, boolean inTable, boolean toc) {
    String text = paragraph.getText();
    String id = durableId(ordinal, text);
    index.put(id, new Block(paragraph, text));
    String styleId = paragraph.getStyle();
    return new BlockNode(
        id,
        ordinal,
        text,
        styleId,
        styleName(styleId),
        outlineLevel(paragraph.getCTP()),
        paragraph.getNumID() != null,
        inTable,
        toc,
        tocLinked(paragraph.getCTP()));
  }

  /** A hyperlink to a {@code _Toc} bookmark or a PAGEREF field, as Word writes into TOC entries. */
  static boolean tocLinked(CTP ctp) {
    for (CTHyperlink link : ctp.getHyperlinkList()) {
      if (link.getAnchor() != null && link.getAnchor().startsWith(TOC_BOOKMARK_PREFIX)) {
        return true;
      }
    }
    for (CTSimpleField field : ctp.getFldSimpleList()) {
      if (isPageRef(field.getInstr())) {
        return true;
      }
    }
    for (XmlObject object : ctp.selectPath(DECLARE_W + ".//w:instrText")) {
      if (object instanceof CTText instr && isPageRef(instr.getStringValue())) {
        return true;
      }
    }
    return false;
  }

  private static boolean isPageRef(String instruction) {
    return instruction != null
        && instruction.trim().toUpperCase(Locale.ROOT).startsWith("PAGEREF");
  }

  /** Name-based UUID over position and content, so re-reading the same file yields the same IDs. */
  static String durableId(int ordinal, String text) {
    return UUID.nameUUIDFromBytes((ordinal + ":" + text).getBytes(StandardCharsets.UTF_8))
        .toString();
  }

  private String styleName(String styleId) {
    if (styleId == null) {
      return null;
    }
    XWPFStyles styles = document.getStyles();
    XWPFStyle style = styles == null ? null : styles.getStyle(styleId);
    return style == null ? null : style.getName();
  }

  private static int outlineLevel(CTP ctp) {
    CTPPr ppr = ctp.getPPr();
    if (ppr == null || !ppr.isSetOutlineLvl() || ppr.getOutlineLvl().getVal() == null) {
      return -1;
    }
    return ppr.getOutlineLvl().getVal().intValue();
  }

  /** Follows complex field nesting across paragraphs to spot TOC field results. */
  private static final class TocFieldTracker {
    private int depth;
    private int tocDepth = -1;

    boolean scan(XWPFParagraph paragraph) {
      CTP ctp = paragraph.getCTP();
      boolean inToc = tocDepth >= 0;
      for (CTSimpleField field : ctp.getFldSimpleList()) {
        if (isTocInstruction(field.getInstr())) {
          inToc = true;
        }
      }
      for (XmlObject object : ctp.selectPath(DECLARE_W + ".//w:r")) {
        if (!(object instanceof CTR run)) {
          continue;
        }
        for (CTFldChar fldChar : run.getFldCharList()) {
          if (fldChar.getFldCharType() == STFldCharType.BEGIN) {
            depth++;
          } else if (fldChar.getFldCharType() == STFldCharType.END && depth > 0) {
            if (depth == tocDepth) {
              tocDepth = -1;
            }
            depth--;
          }
        }
        for (CTText instr : run.getInstrTextList()) {
          if (tocDepth < 0 && depth > 0 && isTocInstruction(instr.getStringValue())) {
            tocDepth = depth;
          }
        }
        inToc |= tocDepth >= 0;
      }
      return inToc;
    }

    private static boolean isTocInstruction(String instruction) {
      return instruction != null && instruction.trim().toUpperCase(Locale.ROOT).startsWith("TOC");
    }
  }

  // ---------------------------------------------------------------------------------------------
  // WordprocessingML helpers
  // ---------------------------------------------------------------------------------------------

  private Block require(String blockId) {
    ensureOpen();
    Block block = index.get(blockId);
    if (block == null) {
      throw new IllegalArgumentException("Unknown block " + blockId);
    }
    return block;
  }

  private Block requireLive(String blockId) {
    Block block = require(blockId);
    if (block.deleted) {
      throw new IllegalStateException("Block " + blockId + " was already deleted");
    }
    return block;
  }

  private void ensureOpen() {
    if (destroyed) {
      throw new IllegalStateException("Editor has been destroyed");
    }
  }

  private static CTRPr firstRunProperties(CTP ctp) {
    for (CTR run : ctp.getRList()) {
      if (run.isSetRPr()) {
        return (CTRPr) run.getRPr().copy();
      }
    }
    return null;
  }

  /** Removes runs, hyperlinks and revisions, keeping paragraph properties and markers. */
  private static void clearRunContent(CTP ctp) {
    XmlCursor cursor = ctp.newCursor();
    try {
      boolean more = cursor.toFirstChild();
      while (more) {
        String local = cursor.getName().getLocalPart();
        if (W_NS.equals(cursor.getName().getNamespaceURI())
            && ("r".equals(local)
                || "ins".equals(local)
                || "del".equals(local)
                || "hyperlink".equals(local))) {
          cursor.removeXml();
          more = skipToElement(cursor);
        } else {
          more = cursor.toNextSibling();
        }
      }
    } finally {
      cursor.dispose();
    }
  }

  private static boolean skipToElement(XmlCursor cursor) {
    while (!cursor.isStart()) {
      if (cursor.isEnd() || cursor.isEnddoc()) {
        return false;
      }
      cursor.toNextToken();
    }
    return true;
  }

  /** Turns every live run into a tracked deletion and drops pending insertions. */
  private void markRunsDeleted(CTP ctp, Author author) {
    for (XmlObject inserted : ctp.selectPath(DECLARE_W + "./w:ins")) {
      XmlCursor cursor = inserted.newCursor();
      try {
        cursor.removeXml();
      } finally {
        cursor.dispose();
      }
    }
    List<CTR> runs = new ArrayList<>(ctp.getRList());
    for (XmlObject object : ctp.selectPath(DECLARE_W + "./w:hyperlink/w:r")) {
      if (object instanceof CTR run) {
        runs.add(run);
      }
    }
    for (CTR run : runs) {
      if (run.getTList().isEmpty()) {
        continue;
      }
      wrapInDeletion(run, author);
    }
  }

  private void wrapInDeletion(CTR run, Author author) {
    for (CTText text : new ArrayList<>(run.getTList())) {
      XmlCursor rename = text.newCursor();
      try {
        rename.setName(DEL_TEXT);
      } finally {
        rename.dispose();
      }
    }
    XmlCursor runCursor = run.newCursor();
    XmlCursor wrapper = run.newCursor();
    try {
      wrapper.beginElement(DEL);
      wrapper.insertAttributeWithValue(ATTR_ID, String.valueOf(revisionIds.incrementAndGet()));
      wrapper.insertAttributeWithValue(ATTR_AUTHOR, author.name());
      wrapper.insertAttributeWithValue(
          ATTR_DATE,
          DateTimeFormatter.ISO_INSTANT.format(Instant.now().truncatedTo(ChronoUnit.SECONDS)));
      runCursor.moveXml(wrapper);
    } finally {
      runCursor.dispose();
      wrapper.dispose();
    }
  }

  private static void appendRun(CTP ctp, CTRPr template, String text) {
    CTR run = ctp.addNewR();
    fillRun(run, template, text, false);
    moveToEnd(ctp, run);
  }

  private void appendInsertion(CTP ctp, CTRPr template, String text, Author author) {
    CTRunTrackChange ins = ctp.addNewIns();
    stamp(ins, author);
    fillRun(ins.addNewR(), template, text, false);
    moveToEnd(ctp, ins);
  }

  private void appendDeletion(CTP ctp, CTRPr template, String text, Author author) {
    CTRunTrackChange del = ctp.addNewDel();
    stamp(del, author);
    fillRun(del.addNewR(), template, text, true);
    moveToEnd(ctp, del);
  }

  private static void fillRun(CTR run, CTRPr template, String text, boolean deleted) {
    if (template != null) {
      run.setRPr(template);
    }
    CTText t = deleted ? run.addNewDelText() : run.addNewT();
    t.setStringValue(text);
    t.setSpace(SpaceAttribute.Space.PRESERVE);
  }

  private void stamp(CTTrackChange change, Author author) {
    change.setId(BigInteger.valueOf(revisionIds.incrementAndGet()));
    change.setAuthor(author.name());
    change.setDate(Calendar.getInstance());
  }

  private static CTParaRPr paragraphMarkProperties(CTP ctp) {
    CTPPr ppr = ctp.isSetPPr() ? ctp.getPPr() : ctp.addNewPPr();
    return ppr.isSetRPr() ? ppr.getRPr() : ppr.addNewRPr();
  }

  private static void moveToEnd(CTP ctp, XmlObject child) {
    XmlCursor source = child.newCursor();
    XmlCursor target = ctp.newCursor();
    try {
      target.toEndToken();
      source.moveXml(target);
    } finally {
      source.dispose();
      target.dispose();
    }
  }

  private static void moveAfterProperties(CTP ctp, XmlObject child) {
    XmlCursor source = child.newCursor();
    XmlCursor target = ctp.newCursor();
    try {
      target.toFirstChild();
      if (ctp.isSetPPr()) {
        target.toNextSibling();
      }
      if (!target.isAtSamePositionAs(source)) {
        source.moveXml(target);
      }
    } finally {
      source.dispose();
      target.dispose();
    }
  }

  private XWPFParagraph newParagraphAfter(XWPFParagraph anchor) {
    IBody body = anchor.getBody();
    XmlCursor cursor = anchor.getCTP().newCursor();
    try {
      if (cursor.toNextSibling()) {
        if (body instanceof XWPFDocument doc) {
          return doc.insertNewParagraph(cursor);
        }
        if (body instanceof XWPFTableCell cell) {
          return cell.insertNewParagraph(cursor);
        }
      }
    } finally {
      cursor.dispose();
    }
    if (body instanceof XWPFTableCell cell) {
      return cell.addParagraph();
    }
    return document.createParagraph();
  }

  private void removeParagraph(XWPFParagraph paragraph) {
    IBody body = paragraph.getBody();
    if (body instanceof XWPFTableCell cell) {
      int pos = cell.getParagraphs().indexOf(paragraph);
      if (pos >= 0) {
        cell.removeParagraph(pos);
      }
      return;
    }
    int pos = document.getPosOfParagraph(paragraph);
    if (pos >= 0) {
      document.removeBodyElement(pos);
    }
  }

  private static BigInteger nextCommentId(XWPFComments comments) {
    BigInteger max = BigInteger.valueOf(-1);
    for (XWPFComment existing : comments.getComments()) {
      try {
        max = max.max(new BigInteger(existing.getId()));
      } catch (NumberFormatException e) {
        log.debug("Ignoring non-numeric comment id {}", existing.getId());
      }
    }
    return max.add(BigInteger.ONE);
  }
}
