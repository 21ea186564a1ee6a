// File: src/main/java/com/example/bullets/WordXml.java
package com.example.bullets;

import org.apache.poi.ooxml.POIXMLDocumentPart;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFFooter;
import org.apache.poi.xwpf.usermodel.XWPFHeader;
import org.apache.poi.xwpf.usermodel.XWPFHeaderFooter;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;

import javax.xml.namespace.QName;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;

/** WordprocessingML 常量与 XmlCursor 小工具（XWPF 树与原始 part 共用） */
final class WordXml {

    private WordXml() {}

    static final String NS_W = "http://schemas.openxmlformats.org/wordprocessingml/2006/main";
    static final String DECLARE_W = "declare namespace w='" + NS_W + "' ";

    static final QName QN_W_P             = new QName(NS_W, "p");
    static final QName QN_W_R             = new QName(NS_W, "r");
    static final QName QN_W_T             = new QName(NS_W, "t");
    static final QName QN_W_PPR           = new QName(NS_W, "pPr");
    static final QName QN_W_PSTYLE        = new QName(NS_W, "pStyle");
    static final QName QN_W_NUMPR         = new QName(NS_W, "numPr");
    static final QName QN_W_ILVL          = new QName(NS_W, "ilvl");
    static final QName QN_W_NUMID         = new QName(NS_W, "numId");
    static final QName QN_W_IND           = new QName(NS_W, "ind");
    static final QName QN_W_VAL           = new QName(NS_W, "val");
    static final QName QN_W_ID            = new QName(NS_W, "id");
    static final QName QN_W_TC            = new QName(NS_W, "tc");
    static final QName QN_W_TXBX_CONTENT  = new QName(NS_W, "txbxContent");
    static final QName QN_W_HYPERLINK     = new QName(NS_W, "hyperlink");
    static final QName QN_W_INS           = new QName(NS_W, "ins");
    static final QName QN_W_SMART_TAG     = new QName(NS_W, "smartTag");
    static final QName QN_W_FLD_SIMPLE    = new QName(NS_W, "fldSimple");
    static final QName QN_W_STYLE         = new QName(NS_W, "style");
    static final QName QN_W_STYLE_ID      = new QName(NS_W, "styleId");
    static final QName QN_W_TYPE          = new QName(NS_W, "type");
    static final QName QN_W_NAME          = new QName(NS_W, "name");
    static final QName QN_W_BASED_ON      = new QName(NS_W, "basedOn");
    static final QName QN_W_NEXT          = new QName(NS_W, "next");
    static final QName QN_W_LINK          = new QName(NS_W, "link");
    static final QName QN_W_QFORMAT       = new QName(NS_W, "qFormat");
    static final QName QN_W_NUM           = new QName(NS_W, "num");
    static final QName QN_W_ABSTRACT_NUM  = new QName(NS_W, "abstractNum");
    static final QName QN_W_ABSTRACT_NUM_ID = new QName(NS_W, "abstractNumId");
    static final QName QN_W_LVL           = new QName(NS_W, "lvl");
    static final QName QN_W_START         = new QName(NS_W, "start");
    static final QName QN_W_NUM_FMT       = new QName(NS_W, "numFmt");
    static final QName QN_W_LVL_TEXT      = new QName(NS_W, "lvlText");
    static final QName QN_W_LEFT          = new QName(NS_W, "left");
    static final QName QN_W_HANGING       = new QName(NS_W, "hanging");
    static final QName QN_W_RSID          = new QName(NS_W, "rsid");
    static final QName QN_W_STYLE_LINK    = new QName(NS_W, "styleLink");
    static final QName QN_W_NUM_STYLE_LINK = new QName(NS_W, "numStyleLink");

    // pPr 中必须排在 numPr 之前的子元素
    private static final Set<String> PPR_BEFORE_NUMPR =
        Set.of("pStyle", "keepNext", "keepLines", "pageBreakBefore", "framePr", "widowControl");

    // run 的容器：段内超链接、修订插入、智能标记、简单域
    private static final Set<QName> RUN_CONTAINERS =
        Set.of(QN_W_HYPERLINK, QN_W_INS, QN_W_SMART_TAG, QN_W_FLD_SIMPLE);

    /** 一个可扫描的 part 根节点 */
    static final class PartRoot {
        final String name;
        final ParagraphLocation.Kind kind;
        final XmlObject root;
        // 内存中新建的 part 没有根元素，序列化时才补上这个名字
        final String rootElement;

        PartRoot(String name, ParagraphLocation.Kind kind, XmlObject root, String rootElement) {
            this.name = name; this.kind = kind; this.root = root; this.rootElement = rootElement;
        }
    }

    /** 正文 + 全部页眉页脚（含尚未写出、只挂在关系上的） */
    static List<PartRoot> partRoots(XWPFDocument doc) {
        List<PartRoot> roots = new ArrayList<>();
        roots.add(new PartRoot(partName(doc.getPackagePart().getPartName().getName()),
                ParagraphLocation.Kind.BODY, doc.getDocument(), "document"));
        List<XWPFHeaderFooter> parts = new ArrayList<>();
        parts.addAll(doc.getHeaderList());
        parts.addAll(doc.getFooterList());
        for (POIXMLDocumentPart rel : doc.getRelations()) {
            if (rel instanceof XWPFHeaderFooter) parts.add((XWPFHeaderFooter) rel);
        }
        Set<String> seen = new HashSet<>();
        for (XWPFHeaderFooter hf : parts) {
            String name = hf.getPackagePart().getPartName().getName();
            if (!seen.add(name)) continue;
            if (hf instanceof XWPFHeader) {
                roots.add(new PartRoot(name, ParagraphLocation.Kind.HEADER, hf._getHdrFtr(), "hdr"));
            } else if (hf instanceof XWPFFooter) {
                roots.add(new PartRoot(name, ParagraphLocation.Kind.FOOTER, hf._getHdrFtr(), "ftr"));
            }
        }
        return roots;
    }

    private static String partName(String name) {
        return name == null || name.isEmpty() ? "/word/document.xml" : name;
    }

    static QName name(XmlObject node) {
        try (XmlCursor c = node.newCursor()) {
            return c.getName();
        }
    }

    static String localName(XmlObject node) {
        QName n = name(node);
        return n == null ? "" : n.getLocalPart();
    }

    static String attr(XmlObject node, QName name) {
        if (node == null) return null;
        try (XmlCursor c = node.newCursor()) {
            return c.getAttributeText(name);
        }
    }

    static void setAttr(XmlObject node, QName name, String value) {
        try (XmlCursor c = node.newCursor()) {
            c.setAttributeText(name, value);
        }
    }

    static XmlObject firstChild(XmlObject node, QName name) {
        if (node == null) return null;
        try (XmlCursor c = node.newCursor()) {
            if (!c.toFirstChild()) return null;
            do {
                if (name.equals(c.getName())) return c.getObject();
            } while (c.toNextSibling());
        }
        return null;
    }

    /** name 为 null 时返回全部子元素 */
    static List<XmlObject> children(XmlObject node, QName name) {
        List<XmlObject> out = new ArrayList<>();
        if (node == null) return out;
        try (XmlCursor c = node.newCursor()) {
            if (!c.toFirstChild()) return out;
            do {
                if (name == null || name.equals(c.getName())) out.add(c.getObject());
            } while (c.toNextSibling());
        }
        return out;
    }

    static List<XmlObject> select(XmlObject scope, String path) {
        List<XmlObject> out = new ArrayList<>();
        try (XmlCursor c = scope.newCursor()) {
            c.selectPath(DECLARE_W + path);
            while (c.toNextSelection()) out.add(c.getObject());
        }
        return out;
    }

    static XmlObject appendChild(XmlObject parent, QName name) {
        try (XmlCursor c = parent.newCursor()) {
            c.toEndToken();
            c.beginElement(name);
            c.toParent();
            return c.getObject();
        }
    }

    static XmlObject insertBefore(XmlObject sibling, QName name) {
        try (XmlCursor c = sibling.newCursor()) {
            c.beginElement(name);
            c.toParent();
            return c.getObject();
        }
    }

    static XmlObject insertFirstChild(XmlObject parent, QName name) {
        try (XmlCursor c = parent.newCursor()) {
            if (c.toFirstChild()) {
                c.beginElement(name);
            } else {
                c.toEndToken();
                c.beginElement(name);
            }
            c.toParent();
            return c.getObject();
        }
    }

    static void remove(XmlObject node) {
        try (XmlCursor c = node.newCursor()) {
            c.removeXml();
        }
    }

    static int removeChildren(XmlObject parent, QName name) {
        List<XmlObject> victims = children(parent, name);
        for (XmlObject v : victims) remove(v);
        return victims.size();
    }

    static boolean hasAncestor(XmlObject node, QName qn) {
        try (XmlCursor c = node.newCursor()) {
            while (c.toParent()) {
                if (qn.equals(c.getName())) return true;
            }
        }
        return false;
    }

    /** 从根元素开始的子元素序号路径（根自身为 0） */
    static List<Integer> indexPath(XmlObject node) {
        LinkedList<Integer> path = new LinkedList<>();
        try (XmlCursor c = node.newCursor()) {
            while (true) {
                int idx = 0;
                try (XmlCursor s = c.newCursor()) {
                    while (s.toPrevSibling()) idx++;
                }
                path.addFirst(idx);
                if (!c.toParent() || c.isStartdoc()) break;
            }
        }
        return path;
    }

    /** 可读路径：document/body[0]/tbl[0]/tr[1]/tc[0]/p[2]，方括号内为同名兄弟序号 */
    static String pathString(XmlObject node) {
        LinkedList<String> steps = new LinkedList<>();
        try (XmlCursor c = node.newCursor()) {
            while (true) {
                QName n = c.getName();
                if (n == null) break;
                int same = 0;
                try (XmlCursor s = c.newCursor()) {
                    while (s.toPrevSibling()) {
                        if (n.equals(s.getName())) same++;
                    }
                }
                steps.addFirst(n.getLocalPart() + "[" + same + "]");
                if (!c.toParent() || c.isStartdoc()) break;
            }
        }
        return "/" + String.join("/", steps);
    }

    /** 按 indexPath 在解析出的 part 中重新定位元素 */
    static XmlObject resolve(XmlObject document, List<Integer> path) {
        try (XmlCursor c = document.newCursor()) {
            if (c.isStartdoc()) {
                if (!c.toFirstChild()) return null;
            }
            if (path.isEmpty() || path.get(0) != 0) return null;
            for (int i = 1; i < path.size(); i++) {
                if (!c.toChild(path.get(i))) return null;
            }
            return c.getObject();
        }
    }

    static String text(XmlObject scope) {
        StringBuilder sb = new StringBuilder();
        try (XmlCursor c = scope.newCursor()) {
            c.selectPath(DECLARE_W + ".//w:t");
            while (c.toNextSelection()) {
                String v = c.getTextValue();
                if (v != null) sb.append(v);
            }
        }
        return sb.toString();
    }

    /** 直接 run 与容器内 run 的数量 */
    static int runCount(XmlObject p) {
        int count = 0;
        try (XmlCursor c = p.newCursor()) {
            if (!c.toFirstChild()) return 0;
            do {
                QName n = c.getName();
                if (QN_W_R.equals(n)) {
                    count++;
                } else if (RUN_CONTAINERS.contains(n)) {
                    count += children(c.getObject(), QN_W_R).size();
                }
            } while (c.toNextSibling());
        }
        return count;
    }

    /** 十进制且能放进 int 的 id，否则 null */
    static Integer parseId(String s) {
        return isDigits(s) && s.length() <= 9 ? Integer.valueOf(s) : null;
    }

    static boolean isDigits(String s) {
        if (s == null || s.isEmpty()) return false;
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) return false;
        }
        return true;
    }

    /** pPr 必须是 w:p 的第一个子元素 */
    static XmlObject ensurePPr(XmlObject p) {
        XmlObject pPr = firstChild(p, QN_W_PPR);
        return pPr != null ? pPr : insertFirstChild(p, QN_W_PPR);
    }

    static String pStyleOf(XmlObject p) {
        return attr(firstChild(firstChild(p, QN_W_PPR), QN_W_PSTYLE), QN_W_VAL);
    }

    /** 替换 pPr（或样式 pPr）中的 numPr */
    static XmlObject writeNumPr(XmlObject pPr, int numId, int level) {
        removeChildren(pPr, QN_W_NUMPR);
        XmlObject numPr = insertNumPr(pPr);
        setNumPrValue(numPr, QN_W_ILVL, String.valueOf(level));
        setNumPrValue(numPr, QN_W_NUMID, String.valueOf(numId));
        return numPr;
    }

    static XmlObject ensureNumPr(XmlObject pPr) {
        XmlObject numPr = firstChild(pPr, QN_W_NUMPR);
        return numPr != null ? numPr : insertNumPr(pPr);
    }

    /** 按 schema 顺序插入空 numPr */
    private static XmlObject insertNumPr(XmlObject pPr) {
        for (XmlObject child : children(pPr, null)) {
            if (!PPR_BEFORE_NUMPR.contains(localName(child))) return insertBefore(child, QN_W_NUMPR);
        }
        return appendChild(pPr, QN_W_NUMPR);
    }

    /** 设置 numPr 下 ilvl / numId 的值，保持 ilvl 在前 */
    static void setNumPrValue(XmlObject numPr, QName child, String value) {
        XmlObject el = firstChild(numPr, child);
        if (el == null) {
            XmlObject ilvl = QN_W_ILVL.equals(child) ? null : firstChild(numPr, QN_W_ILVL);
            el = ilvl == null ? insertFirstChild(numPr, child) : insertAfter(ilvl, child);
        }
        setAttr(el, QN_W_VAL, value);
    }

    static XmlObject insertAfter(XmlObject sibling, QName name) {
        try (XmlCursor c = sibling.newCursor()) {
            c.toEndToken();
            c.toNextToken();
            c.beginElement(name);
            c.toParent();
            return c.getObject();
        }
    }

    /** 文档根元素（跳过 STARTDOC） */
    static XmlObject rootElement(XmlObject xml) {
        try (XmlCursor c = xml.newCursor()) {
            if (c.isStartdoc() && !c.toFirstChild()) return null;
            return c.getObject();
        }
    }
}
