package com.example.bullets;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.xmlbeans.XmlObject;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * 把段落绑定到列表编号：写 numPr（ilvl + numId），去掉段落级缩进，写后回读校验。
 * 同一会话内按段落对象身份幂等。
 */
@Slf4j
public class ParagraphBinder {
    public static final int MAX_LEVEL = 8;

    private final Set<XmlObject> bound = Collections.newSetFromMap(new IdentityHashMap<>());

    public void bind(XWPFParagraph paragraph, int numId, int level) {
        bind(ParagraphNode.of(paragraph), numId, level);
    }

    public void bind(ParagraphNode node, int numId, int level) {
        if (numId <= 0) throw new IllegalArgumentException("numId must be positive: " + numId);
        if (level < 0 || level > MAX_LEVEL) {
            throw new IllegalArgumentException("level must be within 0.." + MAX_LEVEL + ": " + level);
        }
        if (node.runCount() == 0) throw new ContentFirstViolationException(node.getLocation());

        XmlObject p = node.getXml();
        if (bound.contains(p) && node.references(numId, level)) {
            log.debug("Paragraph already bound to numId {} at {}", numId, node.getLocation());
            return;
        }

        XmlObject pPr = WordXml.ensurePPr(p);
        WordXml.writeNumPr(pPr, numId, level);
        WordXml.removeChildren(pPr, WordXml.QN_W_IND);

        // 写后回读
        if (!node.references(numId, level)) {
            throw new SilentBindingFailureException(node.getLocation(), numId, level, node.rawNumId(), node.rawLevel());
        }
        bound.add(p);
    }

    public boolean isBound(ParagraphNode node) {
        return bound.contains(node.getXml());
    }

    public int boundCount() {
        return bound.size();
    }
}
