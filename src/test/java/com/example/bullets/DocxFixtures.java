package com.example.bullets;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;
import javax.xml.namespace.QName;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTAbstractNum;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTNumPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTPPr;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

/** In-memory documents shared by the engine tests. */
final class DocxFixtures {

  static final String BULLET = BulletEngineConfig.DEFAULT_BULLET_STYLE_ID;
  static final String NS_VML = "urn:schemas-microsoft-com:vml";

  private DocxFixtures() {}

  static byte[] bytes(XWPFDocument doc) {
    try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      doc.write(out);
      return out.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  static XWPFDocument load(byte[] docx) {
    try {
      return new XWPFDocument(new ByteArrayInputStream(docx));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /** Write and re-read, so style wrappers point into the live styles tree. */
  static XWPFDocument roundTrip(XWPFDocument doc) {
    return load(bytes(doc));
  }

  static XWPFParagraph bullet(XWPFParagraph p, String text) {
    p.setStyle(BULLET);
    if (text != null) {
      p.createRun().setText(text);
    }
    return p;
  }

  static XWPFParagraph bullet(XWPFDocument doc, String text) {
    return bullet(doc.createParagraph(), text);
  }

  /** Writes a raw numPr; null leaves the element out. */
  static CTNumPr numPr(XWPFParagraph p, String numId, String ilvl) {
    CTPPr pPr = p.getCTP().isSetPPr() ? p.getCTP().getPPr() : p.getCTP().addNewPPr();
    CTNumPr numPr = pPr.isSetNumPr() ? pPr.getNumPr() : pPr.addNewNumPr();
    if (ilvl != null) {
      numPr.addNewIlvl().setVal(BigInteger.ZERO);
      WordXml.setAttr(numPr.getIlvl(), WordXml.QN_W_VAL, ilvl);
    }
    if (numId != null) {
      numPr.addNewNumId().setVal(BigInteger.ONE);
      WordXml.setAttr(numPr.getNumId(), WordXml.QN_W_VAL, numId);
    }
    return numPr;
  }

  static XWPFStyle addStyle(XWPFDocument doc, String id, String basedOn, boolean engine) {
    XWPFStyles styles = doc.createStyles();
    CTStyle ct = CTStyle.Factory.newInstance();
    ct.setType(STStyleType.PARAGRAPH);
    ct.setStyleId(id);
    ct.addNewName().setVal(id);
    if (basedOn != null) {
      ct.addNewBasedOn().setVal(basedOn);
    }
    if (engine) {
      ct.addNewRsid().setVal(StyleCollisionResolver.ENGINE_RSID);
    }
    XWPFStyle style = new XWPFStyle(ct, styles);
    styles.addStyle(style);
    return style;
  }

  /** Abstract definition without a num referencing it. */
  static void addAbstract(XWPFDocument doc, int abstractId, boolean withLevel) {
    CTAbstractNum abs = CTAbstractNum.Factory.newInstance();
    abs.setAbstractNumId(BigInteger.valueOf(abstractId));
    if (withLevel) {
      abs.addNewLvl().setIlvl(BigInteger.ZERO);
    }
    doc.createNumbering().addAbstractNum(new org.apache.poi.xwpf.usermodel.XWPFAbstractNum(abs));
  }

  /** A bullet paragraph inside a VML text box hosted by a plain body paragraph. */
  static XmlObject textBoxBullet(XWPFDocument doc, String text) {
    XWPFParagraph host = doc.createParagraph();
    XmlObject run = host.createRun().getCTR();
    XmlObject pict = WordXml.appendChild(run, new QName(WordXml.NS_W, "pict"));
    XmlObject shape = WordXml.appendChild(pict, new QName(NS_VML, "shape"));
    XmlObject box = WordXml.appendChild(shape, new QName(NS_VML, "textbox"));
    XmlObject content = WordXml.appendChild(box, WordXml.QN_W_TXBX_CONTENT);
    XmlObject p = WordXml.appendChild(content, WordXml.QN_W_P);
    XmlObject pPr = WordXml.appendChild(p, WordXml.QN_W_PPR);
    WordXml.setAttr(WordXml.appendChild(pPr, WordXml.QN_W_PSTYLE), WordXml.QN_W_VAL, BULLET);
    XmlObject t = WordXml.appendChild(WordXml.appendChild(p, WordXml.QN_W_R), WordXml.QN_W_T);
    try (XmlCursor c = t.newCursor()) {
      c.setTextValue(text);
    }
    return p;
  }

  /** Replaces one zip entry of a package verbatim. */
  static byte[] replaceEntry(byte[] docx, String entryName, String content) {
    try (ZipInputStream in = new ZipInputStream(new ByteArrayInputStream(docx));
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        ZipOutputStream out = new ZipOutputStream(bos)) {
      ZipEntry entry;
      while ((entry = in.getNextEntry()) != null) {
        out.putNextEntry(new ZipEntry(entry.getName()));
        if (entry.getName().equals(entryName)) {
          out.write(content.getBytes(java.nio.charset.StandardCharsets.UTF_8));
        } else {
          in.transferTo(out);
        }
        out.closeEntry();
      }
      out.finish();
      return bos.toByteArray();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
