package com.example.bullets;

import org.apache.xmlbeans.XmlObject;

import java.util.Collections;
import java.util.List;

/** 段落在包内的位置：所在容器类型 + part + 元素路径 */
public final class ParagraphLocation {

    public enum Kind { BODY, TABLE_CELL, HEADER, FOOTER, TEXT_BOX }

    public final Kind kind;
    public final String part;
    public final List<Integer> indexPath;
    public final String path;

    public ParagraphLocation(Kind kind, String part, List<Integer> indexPath, String path) {
        this.kind = kind;
        this.part = part;
        this.indexPath = Collections.unmodifiableList(indexPath);
        this.path = path;
    }

    /** 文本框优先，其次页眉页脚，再次表格单元格 */
    static Kind refine(Kind partKind, boolean inTextBox, boolean inTableCell) {
        if (inTextBox) return Kind.TEXT_BOX;
        if (partKind == Kind.HEADER || partKind == Kind.FOOTER) return partKind;
        return inTableCell ? Kind.TABLE_CELL : partKind;
    }

    static ParagraphLocation locate(XmlObject p, String part, Kind partKind) {
        Kind kind = refine(partKind,
                WordXml.hasAncestor(p, WordXml.QN_W_TXBX_CONTENT),
                WordXml.hasAncestor(p, WordXml.QN_W_TC));
        return new ParagraphLocation(kind, part, WordXml.indexPath(p), WordXml.pathString(p));
    }

    public String display() {
        return part + ":" + path;
    }

    @Override
    public String toString() {
        return kind + " " + display();
    }
}
