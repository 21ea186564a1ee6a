package com.example.bullets;

import org.apache.poi.ooxml.POIXMLDocumentPart;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFHeader;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.xmlbeans.XmlObject;

/**
 * 单个 w:p 的句柄。
 * 编号引用按原始属性文本读取，非数字值因此可见（用于区分“缺失”和“损坏”）。
 * 文本框内的段落不一定是强类型 CTP，所以这里统一按 XmlObject + 游标处理。
 */
public final class ParagraphNode {

    private final XmlObject xml;
    private final String part;
    private final ParagraphLocation.Kind partKind;
    private ParagraphLocation location;

    ParagraphNode(XmlObject xml, ParagraphLocation location) {
        this.xml = xml;
        this.part = location.part;
        this.partKind = location.kind;
        this.location = location;
    }

    private ParagraphNode(XmlObject xml, String part, ParagraphLocation.Kind partKind) {
        this.xml = xml;
        this.part = part;
        this.partKind = partKind;
    }

    public static ParagraphNode of(XWPFParagraph p) {
        POIXMLDocumentPart owner = p.getPart();
        ParagraphLocation.Kind kind = owner instanceof XWPFHeader ? ParagraphLocation.Kind.HEADER
                : owner instanceof XWPFFooter ? ParagraphLocation.Kind.FOOTER
                : ParagraphLocation.Kind.BODY;
        String name = owner == null ? "/word/document.xml" : owner.getPackagePart().getPartName().getName();
        return new ParagraphNode(p.getCTP(), name, kind);
    }

    public XmlObject getXml() { return xml; }

    /** 位置按需计算（路径需要向上遍历祖先） */
    public ParagraphLocation getLocation() {
        if (location == null) location = ParagraphLocation.locate(xml, part, partKind);
        return location;
    }

    public String getStyleId() {
        return WordXml.pStyleOf(xml);
    }

    public int runCount() {
        return WordXml.runCount(xml);
    }

    public String getText() {
        return WordXml.text(xml);
    }

    XmlObject numPr() {
        return WordXml.firstChild(WordXml.firstChild(xml, WordXml.QN_W_PPR), WordXml.QN_W_NUMPR);
    }

    public boolean hasNumPr() {
        return numPr() != null;
    }

    /** w:numId/@w:val 原文；缺失返回 null */
    public String rawNumId() {
        return WordXml.attr(WordXml.firstChild(numPr(), WordXml.QN_W_NUMID), WordXml.QN_W_VAL);
    }

    public String rawLevel() {
        return WordXml.attr(WordXml.firstChild(numPr(), WordXml.QN_W_ILVL), WordXml.QN_W_VAL);
    }

    public boolean hasLevelElement() {
        return WordXml.firstChild(numPr(), WordXml.QN_W_ILVL) != null;
    }

    public boolean hasNumIdElement() {
        return WordXml.firstChild(numPr(), WordXml.QN_W_NUMID) != null;
    }

    /** 当前层级；缺失或非法时取 fallback，超出 0..8 的夹到边界 */
    public int levelOr(int fallback) {
        String raw = rawLevel();
        if (!WordXml.isDigits(raw) || raw.length() > 3) return fallback;
        return Math.min(Integer.parseInt(raw), ParagraphBinder.MAX_LEVEL);
    }

    public boolean references(int numId, int level) {
        return String.valueOf(numId).equals(rawNumId()) && String.valueOf(level).equals(rawLevel());
    }

    @Override
    public String toString() {
        return getLocation().toString();
    }
}
