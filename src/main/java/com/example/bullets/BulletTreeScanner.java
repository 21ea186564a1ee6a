// File: src/main/java/com/example/bullets/BulletTreeScanner.java
package com.example.bullets;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;

import javax.xml.namespace.QName;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 全树扫描项目符号样式的段落：正文（含表格）、页眉、页脚、文本框。
 * 深度优先遍历，一次走完顺带记录元素路径。
 */
@Slf4j
public class BulletTreeScanner {

    private final String bulletStyleId;

    public BulletTreeScanner(String bulletStyleId) {
        this.bulletStyleId = bulletStyleId;
    }

    public List<ScannedParagraph> scan(XWPFDocument doc) {
        List<ScannedParagraph> out = new ArrayList<>();
        for (WordXml.PartRoot part : WordXml.partRoots(doc)) {
            Deque<Integer> indices = new ArrayDeque<>();
            Deque<String> steps = new ArrayDeque<>();
            indices.addLast(0);
            steps.addLast(rootStep(part));
            dfsCollect(part, part.root, indices, steps, 0, 0, out);
        }
        log.debug("Scanned {} bullet paragraphs", out.size());
        return out;
    }

    // 写出前后路径一致：内存 part 用序列化时的根元素名
    private static String rootStep(WordXml.PartRoot part) {
        QName n = WordXml.name(part.root);
        return (n == null ? part.rootElement : n.getLocalPart()) + "[0]";
    }

    private void dfsCollect(WordXml.PartRoot part, XmlObject node, Deque<Integer> indices, Deque<String> steps,
                            int cellDepth, int boxDepth, List<ScannedParagraph> out) {
        try (XmlCursor cur = node.newCursor()) {
            if (!cur.toFirstChild()) return;
            Map<QName, Integer> seen = new HashMap<>();
            int ord = 0;
            do {
                QName name = cur.getName();
                XmlObject child = cur.getObject();
                int same = seen.merge(name, 1, Integer::sum) - 1;
                indices.addLast(ord);
                steps.addLast(name.getLocalPart() + "[" + same + "]");

                if (WordXml.QN_W_P.equals(name) && bulletStyleId.equals(WordXml.pStyleOf(child))) {
                    ParagraphLocation loc = new ParagraphLocation(
                            ParagraphLocation.refine(part.kind, boxDepth > 0, cellDepth > 0),
                            part.name, new ArrayList<>(indices), "/" + String.join("/", steps));
                    ParagraphNode pn = new ParagraphNode(child, loc);
                    out.add(new ScannedParagraph(pn, loc.display(), pn.levelOr(0)));
                }

                dfsCollect(part, child, indices, steps,
                        cellDepth + (WordXml.QN_W_TC.equals(name) ? 1 : 0),
                        boxDepth + (WordXml.QN_W_TXBX_CONTENT.equals(name) ? 1 : 0), out);

                indices.removeLast();
                steps.removeLast();
                ord++;
            } while (cur.toNextSibling());
        }
    }
}
