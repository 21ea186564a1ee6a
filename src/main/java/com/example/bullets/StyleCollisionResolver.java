// File: src/main/java/com/example/bullets/StyleCollisionResolver.java
package com.example.bullets;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlObject;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;

import javax.xml.namespace.QName;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.IntSupplier;

/**
 * 样式层：保证文档里保留的项目符号样式属于引擎，并维护一张会话内的样式登记表。
 */
@Slf4j
public class StyleCollisionResolver {

    /** 引擎样式的 w:rsid 标记，用来区分用户自带的同名样式 */
    static final byte[] ENGINE_RSID = {0x00, 0x4D, 0x52, 0x42};
    static final String ALIAS_SUFFIX = "__orig";

    private static final QName[] STYLE_REFS = { WordXml.QN_W_BASED_ON, WordXml.QN_W_NEXT, WordXml.QN_W_LINK };

    private final String bulletStyleId;
    private final IntSupplier freshNumId;

    private final Map<String, StyleDefinition> styles = new LinkedHashMap<>();
    private final Map<Integer, String> numberingOwners = new HashMap<>();
    private final List<StyleCollision> collisions = new ArrayList<>();
    private final Set<String> reportedCycles = new HashSet<>();

    public StyleCollisionResolver(String bulletStyleId, IntSupplier freshNumId) {
        this.bulletStyleId = bulletStyleId;
        this.freshNumId = freshNumId;
        registerBuiltIns();
    }

    private void registerBuiltIns() {
        styles.put(bulletStyleId, StyleDefinition.builtIn(bulletStyleId,
                Map.of("fontSize", "11", "indentLeft", "221", "hanging", "221")));
        styles.put("MR_Name", StyleDefinition.builtIn("MR_Name", Map.of("fontSize", "16", "bold", "true")));
        styles.put("MR_Contact", StyleDefinition.builtIn("MR_Contact", Map.of("fontSize", "10")));
        styles.put("MR_SectionHeader", StyleDefinition.builtIn("MR_SectionHeader",
                Map.of("fontSize", "12", "bold", "true", "caps", "true")));
        styles.put("MR_Company", StyleDefinition.builtIn("MR_Company", Map.of("fontSize", "11", "bold", "true")));
        styles.put("MR_RoleBox", StyleDefinition.builtIn("MR_RoleBox",
                Map.of("fontSize", "11", "italic", "true", "border", "single")));
    }

    // ---------------------------------------------------------------- 文档中的样式

    /**
     * 首次接触文档时调用：把用户自带的同名样式改名让位，再写入引擎自己的样式并绑定 numId。
     * 返回改名后的别名；没有发生改名返回 null。
     */
    public String ensureBulletStyle(XWPFDocument doc, int numId) {
        XWPFStyles docStyles = doc.createStyles();
        String alias = null;
        XWPFStyle existing = docStyles.getStyle(bulletStyleId);
        if (existing != null) {
            if (isEngineStyle(existing)) {
                bindStyleNumPr(existing.getCTStyle(), numId);
                log.debug("Engine style {} already present, bound to numId {}", bulletStyleId, numId);
                return null;
            }
            alias = nextAlias(docStyles);
            renameStyle(doc, existing, alias);
            log.warn("Foreign style '{}' renamed to '{}' to keep the bullet style id", bulletStyleId, alias);
        }
        docStyles.addStyle(new XWPFStyle(buildBulletStyle(numId), docStyles));
        log.debug("Created bullet style {} bound to numId {}", bulletStyleId, numId);
        return alias;
    }

    static boolean isEngineStyle(XWPFStyle style) {
        CTStyle ct = style.getCTStyle();
        return ct.isSetRsid() && Arrays.equals(ct.getRsid().getVal(), ENGINE_RSID);
    }

    private String nextAlias(XWPFStyles docStyles) {
        String alias = bulletStyleId + ALIAS_SUFFIX;
        for (int n = 1; docStyles.styleExist(alias); n++) {
            alias = bulletStyleId + ALIAS_SUFFIX + "_" + n;
        }
        return alias;
    }

    private void renameStyle(XWPFDocument doc, XWPFStyle style, String alias) {
        CTStyle ct = style.getCTStyle();
        String oldId = ct.getStyleId();
        ct.setStyleId(alias);
        if (ct.isSetName()) ct.getName().setVal(alias);
        else ct.addNewName().setVal(alias);

        int paragraphs = 0;
        for (WordXml.PartRoot part : WordXml.partRoots(doc)) {
            for (XmlObject ref : WordXml.select(part.root, ".//w:pStyle")) {
                if (oldId.equals(WordXml.attr(ref, WordXml.QN_W_VAL))) {
                    WordXml.setAttr(ref, WordXml.QN_W_VAL, alias);
                    paragraphs++;
                }
            }
        }

        // 同级样式里的 basedOn / next / link
        int siblings = 0;
        try (XmlCursor c = ct.newCursor()) {
            if (c.toParent()) {
                for (XmlObject sibling : WordXml.children(c.getObject(), WordXml.QN_W_STYLE)) {
                    for (QName ref : STYLE_REFS) {
                        XmlObject el = WordXml.firstChild(sibling, ref);
                        if (el != null && oldId.equals(WordXml.attr(el, WordXml.QN_W_VAL))) {
                            WordXml.setAttr(el, WordXml.QN_W_VAL, alias);
                            siblings++;
                        }
                    }
                }
            }
        }
        log.info("Re-pointed {} paragraph and {} style references from '{}' to '{}'", paragraphs, siblings, oldId, alias);
    }

    private CTStyle buildBulletStyle(int numId) {
        CTStyle ct = CTStyle.Factory.newInstance();
        ct.setType(STStyleType.PARAGRAPH);
        ct.setStyleId(bulletStyleId);
        ct.addNewName().setVal(bulletStyleId);
        ct.addNewQFormat();
        ct.addNewRsid().setVal(ENGINE_RSID);
        var pPr = ct.addNewPPr();
        var numPr = pPr.addNewNumPr();
        numPr.addNewIlvl().setVal(BigInteger.ZERO);
        numPr.addNewNumId().setVal(BigInteger.valueOf(numId));
        var spacing = pPr.addNewSpacing();
        spacing.setBefore(BigInteger.ZERO);
        spacing.setAfter(BigInteger.ZERO);
        return ct;
    }

    private void bindStyleNumPr(CTStyle ct, int numId) {
        XmlObject pPr = WordXml.firstChild(ct, WordXml.QN_W_PPR);
        if (pPr == null) pPr = ct.addNewPPr();
        WordXml.writeNumPr(pPr, numId, 0);
    }

    // ---------------------------------------------------------------- 内存登记表

    public List<StyleCollision> register(StyleDefinition def) {
        List<StyleCollision> found = new ArrayList<>();
        StyleDefinition existing = styles.get(def.name);
        if (existing != null) {
            if (!existing.properties.equals(def.properties) || !existing.type.equals(def.type)) {
                StyleCollision c = new StyleCollision(StyleCollision.Kind.NAME_COLLISION, List.of(def.name),
                        "Style '" + def.name + "' re-registered with different properties",
                        existing.priority >= StyleDefinition.BUILT_IN_PRIORITY ? Severity.HIGH : Severity.MEDIUM, true);
                c.markResolved("kept existing definition of '" + def.name + "'");
                log.warn("{}", c);
                found.add(c);
            }
            collisions.addAll(found);
            return found;
        }

        for (StyleDefinition other : styles.values()) {
            if (!other.type.equals(def.type) || def.properties.isEmpty()) continue;
            if (!other.properties.equals(def.properties)) continue;
            StyleCollision c = new StyleCollision(StyleCollision.Kind.PROPERTY_CONFLICT, List.of(other.name, def.name),
                    "Styles '" + other.name + "' and '" + def.name + "' have identical properties", Severity.LOW, true);
            if (def.priority > other.priority) {
                other.setAliasOf(def.name);
                c.markResolved("'" + other.name + "' aliased to '" + def.name + "'");
            } else {
                def.setAliasOf(other.name);
                c.markResolved("'" + def.name + "' aliased to '" + other.name + "'");
            }
            log.info("{}", c);
            found.add(c);
            break;
        }
        styles.put(def.name, def);
        collisions.addAll(found);

        List<StyleCollision> cycles = checkInheritance();
        collisions.addAll(cycles);
        found.addAll(cycles);
        return found;
    }

    /**
     * 绑定样式与 numId。numId 已被其他样式占用时，低优先级一方换新 id。
     * 返回该样式最终绑定的 numId。
     */
    public int bindNumbering(String styleName, int numId) {
        StyleDefinition style = styles.get(styleName);
        if (style == null) throw new IllegalArgumentException("Unknown style: " + styleName);

        String holderName = numberingOwners.get(numId);
        if (holderName != null && !holderName.equals(styleName)) {
            StyleDefinition holder = styles.get(holderName);
            StyleCollision c = new StyleCollision(StyleCollision.Kind.NUMBERING_CONFLICT, List.of(holderName, styleName),
                    "numId " + numId + " already bound to '" + holderName + "'", Severity.HIGH, true);
            if (style.priority > holder.priority) {
                int moved = freshNumId.getAsInt();
                assign(holder, moved);
                assign(style, numId);
                c.markResolved("'" + holderName + "' moved to numId " + moved);
            } else {
                int fresh = freshNumId.getAsInt();
                assign(style, fresh);
                c.markResolved("'" + styleName + "' moved to numId " + fresh);
            }
            log.warn("{}", c);
            collisions.add(c);
            return style.getNumberingId();
        }
        assign(style, numId);
        return numId;
    }

    private void assign(StyleDefinition style, int numId) {
        Integer previous = style.getNumberingId();
        if (previous != null && style.name.equals(numberingOwners.get(previous))) numberingOwners.remove(previous);
        style.setNumberingId(numId);
        numberingOwners.put(numId, style.name);
    }

    /** 深度优先查找 basedOn 环，每个环只报告一次 */
    private List<StyleCollision> checkInheritance() {
        List<StyleCollision> found = new ArrayList<>();
        Set<String> done = new HashSet<>();
        for (String start : styles.keySet()) {
            if (done.contains(start)) continue;
            List<String> trail = new ArrayList<>();
            String cur = start;
            while (cur != null && !done.contains(cur)) {
                int at = trail.indexOf(cur);
                if (at >= 0) {
                    List<String> cycle = trail.subList(at, trail.size());
                    String key = String.join(",", new TreeSet<>(cycle));
                    if (reportedCycles.add(key)) {
                        StyleCollision c = new StyleCollision(StyleCollision.Kind.INHERITANCE_CYCLE, cycle,
                                "Inheritance cycle: " + String.join(" -> ", cycle) + " -> " + cur, Severity.CRITICAL, false);
                        log.error("{}", c);
                        found.add(c);
                    }
                    break;
                }
                trail.add(cur);
                StyleDefinition def = styles.get(cur);
                cur = def == null ? null : def.parent;
            }
            done.addAll(trail);
        }
        return found;
    }

    /** 样式与 numId 的使用是否一致 */
    public boolean validateUsage(String styleName, int numId) {
        StyleDefinition style = styles.get(styleName);
        if (style == null) return false;
        Integer bound = style.getNumberingId();
        if (bound == null) return !numberingOwners.containsKey(numId);
        return bound == numId;
    }

    public StyleDefinition get(String name) {
        return styles.get(name);
    }

    public List<StyleCollision> collisions() {
        return List.copyOf(collisions);
    }

    public List<StyleCollision> unresolved() {
        List<StyleCollision> out = new ArrayList<>();
        for (StyleCollision c : collisions) if (!c.isResolved()) out.add(c);
        return out;
    }
}
