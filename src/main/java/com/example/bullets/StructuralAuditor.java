// File: src/main/java/com/example/bullets/StructuralAuditor.java
package com.example.bullets;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ooxml.POIXMLTypeLoader;
import org.apache.poi.openxml4j.exceptions.InvalidFormatException;
import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackagePart;
import org.apache.poi.openxml4j.opc.PackageRelationshipCollection;
import org.apache.poi.openxml4j.opc.PackageRelationshipTypes;
import org.apache.xmlbeans.XmlCursor;
import org.apache.xmlbeans.XmlException;
import org.apache.xmlbeans.XmlObject;

import javax.xml.namespace.QName;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 直接在包的原始 part 上做结构体检与修复（不经过 XWPF 对象模型）。
 * 发现的问题一律作为数据返回；只有标记为可自动修复的才会动手。
 */
@Slf4j
public class StructuralAuditor {

    static final String REL_NUMBERING = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/numbering";
    static final String REL_STYLES    = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/styles";
    static final String REL_SETTINGS  = "http://schemas.openxmlformats.org/officeDocument/2006/relationships/settings";
    static final String ENGINE_RSID_HEX = "004D5242";

    private static final Comparator<List<Integer>> PATH_ORDER = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = Integer.compare(a.get(i), b.get(i));
            if (c != 0) return c;
        }
        return Integer.compare(a.size(), b.size());
    };

    /** 同一 part 内按文档逆序修复，先处理的修改不会挪动后处理元素的路径 */
    private static final Comparator<StructuralIssue> REPAIR_ORDER =
        Comparator.<StructuralIssue, String>comparing(i -> i.partName)
                  .thenComparing((a, b) -> PATH_ORDER.compare(b.elementPath, a.elementPath));

    private final String bulletStyleId;
    private final LevelFormat levelFormat;

    public StructuralAuditor(String bulletStyleId, LevelFormat levelFormat) {
        this.bulletStyleId = bulletStyleId;
        this.levelFormat = levelFormat;
    }

    private static final class RawPart {
        final PackagePart part;
        final String name;
        final XmlObject xml;
        boolean modified;

        RawPart(PackagePart part, XmlObject xml) {
            this.part = part;
            this.name = part.getPartName().getName();
            this.xml = xml;
        }

        XmlObject root() { return WordXml.rootElement(xml); }
    }

    private static final class Parts {
        RawPart document, numbering, styles, settings;

        List<RawPart> all() {
            List<RawPart> out = new ArrayList<>();
            for (RawPart p : new RawPart[]{document, numbering, styles, settings}) if (p != null) out.add(p);
            return out;
        }

        RawPart byName(String name) {
            for (RawPart p : all()) if (p.name.equals(name)) return p;
            return null;
        }
    }

    // ---------------------------------------------------------------- 体检

    public List<StructuralIssue> analyze(byte[] docx) {
        List<StructuralIssue> issues = new ArrayList<>();
        OPCPackage pkg;
        try {
            pkg = OPCPackage.open(new ByteArrayInputStream(docx));
        } catch (InvalidFormatException | IOException | RuntimeException e) {
            issues.add(unparsable("/", "Package could not be opened: " + e.getMessage()));
            return issues;
        }
        try {
            Parts parts = load(pkg, issues);
            audit(parts, issues);
        } finally {
            pkg.revert();
        }
        log.info("Structural audit found {} issue(s), {} auto-fixable", issues.size(),
                issues.stream().filter(i -> i.autoFixable).count());
        return issues;
    }

    private Parts load(OPCPackage pkg, List<StructuralIssue> issues) {
        Parts parts = new Parts();
        try {
            PackageRelationshipCollection rels = pkg.getRelationshipsByType(PackageRelationshipTypes.CORE_DOCUMENT);
            if (rels.size() == 0) rels = pkg.getRelationshipsByType(PackageRelationshipTypes.STRICT_CORE_DOCUMENT);
            if (rels.size() == 0) {
                issues.add(unparsable("/", "Package has no main document relationship"));
                return parts;
            }
            PackagePart main = pkg.getPart(rels.getRelationship(0));
            parts.document = parse(main, issues);
            parts.numbering = parse(related(main, REL_NUMBERING), issues);
            parts.styles = parse(related(main, REL_STYLES), issues);
            parts.settings = parse(related(main, REL_SETTINGS), issues);
        } catch (InvalidFormatException e) {
            issues.add(unparsable("/", "Package relationships are invalid: " + e.getMessage()));
        }
        return parts;
    }

    private static PackagePart related(PackagePart main, String relType) throws InvalidFormatException {
        if (main == null) return null;
        PackageRelationshipCollection rels = main.getRelationshipsByType(relType);
        if (rels.size() == 0) return null;
        return main.getRelatedPart(rels.getRelationship(0));
    }

    private static RawPart parse(PackagePart part, List<StructuralIssue> issues) {
        if (part == null) return null;
        try (InputStream in = part.getInputStream()) {
            return new RawPart(part, XmlObject.Factory.parse(in, POIXMLTypeLoader.DEFAULT_XML_OPTIONS));
        } catch (XmlException | IOException e) {
            issues.add(unparsable(part.getPartName().getName(), "Part could not be parsed: " + e.getMessage()));
            return null;
        }
    }

    private static StructuralIssue unparsable(String part, String description) {
        return StructuralIssue.of(StructuralIssue.Kind.UNPARSABLE_PART, part)
                .description(description)
                .severity(Severity.CRITICAL)
                .remedy("Regenerate the document; the part cannot be read as XML")
                .build();
    }

    private void audit(Parts parts, List<StructuralIssue> issues) {
        Set<RawPart> usable = new HashSet<>();
        for (RawPart rp : parts.all()) {
            if (checkNamespace(rp, issues)) usable.add(rp);
        }
        Integer safeDefault = safeDefaultNumId(usable.contains(parts.numbering) ? parts.numbering : null,
                usable.contains(parts.styles) ? parts.styles : null);

        int bulletParagraphs = 0;
        if (usable.contains(parts.document)) {
            Set<Integer> defined = usable.contains(parts.numbering) ? definedNumIds(parts.numbering) : Set.of();
            bulletParagraphs = checkBulletParagraphs(parts.document, defined, safeDefault, issues);
        }
        if (usable.contains(parts.numbering)) checkNumbering(parts.numbering, issues);
        if (usable.contains(parts.styles)) {
            checkStyles(parts.styles, bulletParagraphs, issues);
        } else if (parts.styles == null && bulletParagraphs > 0) {
            issues.add(StructuralIssue.of(StructuralIssue.Kind.MISSING_BULLET_STYLE, "/word/styles.xml")
                    .description("Styles part is missing while " + bulletParagraphs + " paragraph(s) use '" + bulletStyleId + "'")
                    .severity(Severity.HIGH)
                    .remedy("Rebuild the document so the styles part is created")
                    .build());
        }
        for (RawPart rp : parts.all()) {
            if (usable.contains(rp)) checkDuplicateIds(rp, issues);
        }
    }

    private boolean checkNamespace(RawPart rp, List<StructuralIssue> issues) {
        XmlObject root = rp.root();
        QName name = root == null ? null : WordXml.name(root);
        if (name == null) {
            issues.add(unparsable(rp.name, "Part has no root element"));
            return false;
        }
        String ns = name.getNamespaceURI();
        if (WordXml.NS_W.equals(ns)) return true;
        boolean unqualified = ns == null || ns.isEmpty();
        issues.add(StructuralIssue.of(StructuralIssue.Kind.MISSING_NAMESPACE, rp.name)
                .element("/" + name.getLocalPart() + "[0]", List.of(0), name.getLocalPart())
                .description(unqualified
                        ? "Root element <" + name.getLocalPart() + "> is not in the WordprocessingML namespace"
                        : "Root element is in unexpected namespace " + ns)
                .severity(Severity.HIGH)
                .autoFixable(unqualified)
                .remedy(unqualified ? "Declare the w namespace and qualify unqualified names" : "Convert the document to transitional WordprocessingML")
                .build());
        return false;
    }

    private int checkBulletParagraphs(RawPart doc, Set<Integer> defined, Integer safeDefault, List<StructuralIssue> issues) {
        int count = 0;
        for (XmlObject p : WordXml.select(doc.xml, ".//w:p")) {
            if (!bulletStyleId.equals(WordXml.pStyleOf(p))) continue;
            count++;
            XmlObject numPr = WordXml.firstChild(WordXml.firstChild(p, WordXml.QN_W_PPR), WordXml.QN_W_NUMPR);
            if (numPr == null) {
                issues.add(paragraphIssue(doc, p, StructuralIssue.Kind.MALFORMED_NUMBERING_REFERENCE, "numPr",
                        "Bullet paragraph has no numPr", Severity.HIGH, safeDefault));
                continue;
            }
            String rawNum = WordXml.attr(WordXml.firstChild(numPr, WordXml.QN_W_NUMID), WordXml.QN_W_VAL);
            if (rawNum == null) {
                issues.add(paragraphIssue(doc, p, StructuralIssue.Kind.MALFORMED_NUMBERING_REFERENCE, "numId",
                        "numPr has no numId", Severity.HIGH, safeDefault));
            } else if (!WordXml.isDigits(rawNum) || rawNum.length() > 9) {
                issues.add(paragraphIssue(doc, p, StructuralIssue.Kind.MALFORMED_NUMBERING_REFERENCE, "numId",
                        "Non-numeric numId '" + rawNum + "'", Severity.HIGH, safeDefault));
            } else if (!defined.contains(Integer.parseInt(rawNum))) {
                issues.add(paragraphIssue(doc, p, StructuralIssue.Kind.BROKEN_REFERENCE, "numId",
                        "numId " + rawNum + " has no numbering definition", Severity.HIGH, safeDefault));
            }
            String rawLvl = WordXml.attr(WordXml.firstChild(numPr, WordXml.QN_W_ILVL), WordXml.QN_W_VAL);
            Integer lvl = WordXml.parseId(rawLvl);
            if (lvl == null || lvl > ParagraphBinder.MAX_LEVEL) {
                issues.add(StructuralIssue.of(StructuralIssue.Kind.MALFORMED_NUMBERING_REFERENCE, doc.name)
                        .element(WordXml.pathString(p), WordXml.indexPath(p), "p")
                        .attribute("ilvl")
                        .description(rawLvl == null ? "numPr has no ilvl"
                                : lvl == null ? "Non-numeric ilvl '" + rawLvl + "'"
                                : "ilvl " + rawLvl + " is outside 0.." + ParagraphBinder.MAX_LEVEL)
                        .severity(Severity.MEDIUM)
                        .autoFixable(true)
                        .remedy("Set ilvl to 0")
                        .elementText(preview(WordXml.text(p)))
                        .build());
            }
        }
        return count;
    }

    private StructuralIssue paragraphIssue(RawPart doc, XmlObject p, StructuralIssue.Kind kind, String attribute,
                                           String description, Severity severity, Integer safeDefault) {
        return StructuralIssue.of(kind, doc.name)
                .element(WordXml.pathString(p), WordXml.indexPath(p), "p")
                .attribute(attribute)
                .description(description)
                .severity(severity)
                .autoFixable(safeDefault != null)
                .remedy(safeDefault != null
                        ? "Point the paragraph at numId " + safeDefault
                        : "No bullet numbering definition to point at; rebuild the document")
                .elementText(preview(WordXml.text(p)))
                .build();
    }

    private void checkNumbering(RawPart numbering, List<StructuralIssue> issues) {
        XmlObject root = numbering.root();
        Map<Integer, XmlObject> abstracts = new LinkedHashMap<>();
        for (XmlObject abs : WordXml.children(root, WordXml.QN_W_ABSTRACT_NUM)) {
            String raw = WordXml.attr(abs, WordXml.QN_W_ABSTRACT_NUM_ID);
            Integer absId = WordXml.parseId(raw);
            if (absId == null) {
                issues.add(elementIssue(numbering, abs, StructuralIssue.Kind.MISSING_ATTRIBUTE, "abstractNumId",
                        raw == null ? "abstractNum has no abstractNumId" : "abstractNum has invalid abstractNumId '" + raw + "'",
                        Severity.HIGH, false, "Remove or renumber the definition by hand"));
                continue;
            }
            abstracts.put(absId, abs);
            if (WordXml.children(abs, WordXml.QN_W_LVL).isEmpty()) {
                issues.add(elementIssue(numbering, abs, StructuralIssue.Kind.EMPTY_ABSTRACT_DEFINITION, null,
                        "abstractNum " + raw + " defines no levels", Severity.HIGH, true, "Add a bullet level 0"));
            }
        }

        Set<Integer> referenced = new HashSet<>();
        for (XmlObject num : WordXml.children(root, WordXml.QN_W_NUM)) {
            String raw = WordXml.attr(num, WordXml.QN_W_NUMID);
            if (WordXml.parseId(raw) == null) {
                issues.add(elementIssue(numbering, num, StructuralIssue.Kind.MISSING_ATTRIBUTE, "numId",
                        raw == null ? "num has no numId" : "num has invalid numId '" + raw + "'",
                        Severity.HIGH, false, "Remove the instance or assign an id by hand"));
                continue;
            }
            String ref = WordXml.attr(WordXml.firstChild(num, WordXml.QN_W_ABSTRACT_NUM_ID), WordXml.QN_W_VAL);
            Integer refId = WordXml.parseId(ref);
            if (refId == null) {
                issues.add(elementIssue(numbering, num, StructuralIssue.Kind.MISSING_ATTRIBUTE, "abstractNumId",
                        ref == null ? "num " + raw + " has no abstractNumId reference"
                                : "num " + raw + " has invalid abstractNumId reference '" + ref + "'",
                        Severity.HIGH, false, "Point the instance at an existing abstractNum"));
            } else if (!abstracts.containsKey(refId)) {
                issues.add(elementIssue(numbering, num, StructuralIssue.Kind.BROKEN_REFERENCE, "abstractNumId",
                        "num " + raw + " references missing abstractNum " + ref, Severity.HIGH, false,
                        "Restore abstractNum " + ref + " or point the instance elsewhere"));
            } else {
                referenced.add(refId);
            }
        }

        abstracts.forEach((id, abs) -> {
            if (referenced.contains(id)) return;
            // 经由编号样式链接的定义不算孤立
            if (WordXml.firstChild(abs, WordXml.QN_W_STYLE_LINK) != null
                    || WordXml.firstChild(abs, WordXml.QN_W_NUM_STYLE_LINK) != null) return;
            issues.add(elementIssue(numbering, abs, StructuralIssue.Kind.ORPHANED_ABSTRACT_DEFINITION, null,
                    "abstractNum " + id + " is not referenced by any num", Severity.LOW, true, "Remove the definition"));
        });
    }

    private void checkStyles(RawPart styles, int bulletParagraphs, List<StructuralIssue> issues) {
        XmlObject root = styles.root();
        Map<String, String> basedOn = new LinkedHashMap<>();
        Map<String, XmlObject> byId = new HashMap<>();
        boolean hasBullet = false;
        for (XmlObject s : WordXml.children(root, WordXml.QN_W_STYLE)) {
            String id = WordXml.attr(s, WordXml.QN_W_STYLE_ID);
            if (id == null) continue;
            byId.putIfAbsent(id, s);
            if (bulletStyleId.equals(id)) hasBullet = true;
            String parent = WordXml.attr(WordXml.firstChild(s, WordXml.QN_W_BASED_ON), WordXml.QN_W_VAL);
            if (parent != null) basedOn.put(id, parent);
        }

        if (!hasBullet && bulletParagraphs > 0) {
            issues.add(StructuralIssue.of(StructuralIssue.Kind.MISSING_BULLET_STYLE, styles.name)
                    .element(WordXml.pathString(root), List.of(0), WordXml.localName(root))
                    .description(bulletParagraphs + " paragraph(s) use undefined style '" + bulletStyleId + "'")
                    .severity(Severity.HIGH)
                    .autoFixable(true)
                    .remedy("Add the bullet paragraph style")
                    .build());
        }

        Set<String> reported = new HashSet<>();
        Set<String> done = new HashSet<>();
        for (String start : basedOn.keySet()) {
            List<String> trail = new ArrayList<>();
            String cur = start;
            while (cur != null && !done.contains(cur)) {
                int at = trail.indexOf(cur);
                if (at >= 0) {
                    List<String> cycle = new ArrayList<>(trail.subList(at, trail.size()));
                    if (reported.add(String.join(",", new TreeSet<>(cycle)))) {
                        XmlObject first = byId.get(cycle.get(0));
                        issues.add(elementIssue(styles, first, StructuralIssue.Kind.INHERITANCE_CYCLE, "basedOn",
                                "basedOn cycle: " + String.join(" -> ", cycle) + " -> " + cycle.get(0),
                                Severity.CRITICAL, false, "Break the cycle by editing one basedOn reference"));
                    }
                    break;
                }
                trail.add(cur);
                cur = basedOn.get(cur);
            }
            done.addAll(trail);
        }
    }

    /** 同名兄弟元素共享标识属性 */
    private void checkDuplicateIds(RawPart rp, List<StructuralIssue> issues) {
        dfsDuplicates(rp, rp.root(), issues);
    }

    private void dfsDuplicates(RawPart rp, XmlObject node, List<StructuralIssue> issues) {
        Map<String, Boolean> seen = new HashMap<>();
        try (XmlCursor cur = node.newCursor()) {
            if (!cur.toFirstChild()) return;
            do {
                QName name = cur.getName();
                XmlObject child = cur.getObject();
                QName idAttr = identifierAttribute(name);
                String id = cur.getAttributeText(idAttr);
                if (id != null && seen.put(name + "|" + id, Boolean.TRUE) != null) {
                    issues.add(elementIssue(rp, child, StructuralIssue.Kind.DUPLICATE_IDENTIFIER, idAttr.getLocalPart(),
                            "Duplicate " + idAttr.getLocalPart() + " '" + id + "' among <" + name.getLocalPart() + "> siblings",
                            Severity.MEDIUM, true, "Assign a new unique " + idAttr.getLocalPart()));
                }
                dfsDuplicates(rp, child, issues);
            } while (cur.toNextSibling());
        }
    }

    private static QName identifierAttribute(QName element) {
        if (WordXml.QN_W_NUM.equals(element)) return WordXml.QN_W_NUMID;
        if (WordXml.QN_W_ABSTRACT_NUM.equals(element)) return WordXml.QN_W_ABSTRACT_NUM_ID;
        if (WordXml.QN_W_STYLE.equals(element)) return WordXml.QN_W_STYLE_ID;
        return WordXml.QN_W_ID;
    }

    private static StructuralIssue elementIssue(RawPart rp, XmlObject el, StructuralIssue.Kind kind, String attribute,
                                                String description, Severity severity, boolean fixable, String remedy) {
        return StructuralIssue.of(kind, rp.name)
                .element(WordXml.pathString(el), WordXml.indexPath(el), WordXml.localName(el))
                .attribute(attribute)
                .description(description)
                .severity(severity)
                .autoFixable(fixable)
                .remedy(remedy)
                .build();
    }

    /** 项目符号样式自身的 numId；否则第一个 0 级为 bullet 格式的 num */
    private Integer safeDefaultNumId(RawPart numbering, RawPart styles) {
        if (numbering == null) return null;
        Set<Integer> defined = definedNumIds(numbering);
        if (styles != null) {
            for (XmlObject s : WordXml.children(styles.root(), WordXml.QN_W_STYLE)) {
                if (!bulletStyleId.equals(WordXml.attr(s, WordXml.QN_W_STYLE_ID))) continue;
                XmlObject numPr = WordXml.firstChild(WordXml.firstChild(s, WordXml.QN_W_PPR), WordXml.QN_W_NUMPR);
                String raw = WordXml.attr(WordXml.firstChild(numPr, WordXml.QN_W_NUMID), WordXml.QN_W_VAL);
                if (WordXml.isDigits(raw) && raw.length() <= 9 && defined.contains(Integer.parseInt(raw))) {
                    return Integer.parseInt(raw);
                }
            }
        }
        XmlObject root = numbering.root();
        Set<String> bulletAbstracts = new HashSet<>();
        for (XmlObject abs : WordXml.children(root, WordXml.QN_W_ABSTRACT_NUM)) {
            List<XmlObject> levels = WordXml.children(abs, WordXml.QN_W_LVL);
            if (levels.isEmpty()) continue;
            String fmt = WordXml.attr(WordXml.firstChild(levels.get(0), WordXml.QN_W_NUM_FMT), WordXml.QN_W_VAL);
            if ("bullet".equals(fmt)) bulletAbstracts.add(WordXml.attr(abs, WordXml.QN_W_ABSTRACT_NUM_ID));
        }
        for (XmlObject num : WordXml.children(root, WordXml.QN_W_NUM)) {
            String id = WordXml.attr(num, WordXml.QN_W_NUMID);
            String ref = WordXml.attr(WordXml.firstChild(num, WordXml.QN_W_ABSTRACT_NUM_ID), WordXml.QN_W_VAL);
            if (WordXml.isDigits(id) && id.length() <= 9 && bulletAbstracts.contains(ref)) return Integer.parseInt(id);
        }
        return null;
    }

    private static Set<Integer> definedNumIds(RawPart numbering) {
        Set<Integer> ids = new HashSet<>();
        for (XmlObject num : WordXml.children(numbering.root(), WordXml.QN_W_NUM)) {
            String raw = WordXml.attr(num, WordXml.QN_W_NUMID);
            if (WordXml.isDigits(raw) && raw.length() <= 9) ids.add(Integer.parseInt(raw));
        }
        return ids;
    }

    // ---------------------------------------------------------------- 修复

    public RepairReport repair(List<StructuralIssue> issues, byte[] docx) {
        List<RepairReport.Action> actions = new ArrayList<>();
        List<StructuralIssue> fixable = new ArrayList<>();
        for (StructuralIssue issue : issues) {
            if (issue.autoFixable) fixable.add(issue);
            else actions.add(new RepairReport.Action(issue, RepairReport.Outcome.SKIPPED,
                    "Not auto-fixable: " + issue.suggestedRemedy));
        }
        if (fixable.isEmpty()) return new RepairReport(docx, actions);

        OPCPackage pkg;
        try {
            pkg = OPCPackage.open(new ByteArrayInputStream(docx));
        } catch (InvalidFormatException | IOException | RuntimeException e) {
            for (StructuralIssue issue : fixable) {
                actions.add(new RepairReport.Action(issue, RepairReport.Outcome.FAILED, "Package could not be opened: " + e.getMessage()));
            }
            return new RepairReport(docx, actions);
        }

        List<RepairReport.Action> applied = new ArrayList<>();
        try {
            Parts parts = load(pkg, new ArrayList<>());
            Integer safeDefault = safeDefaultNumId(parts.numbering, parts.styles);
            fixable.sort(REPAIR_ORDER);
            for (StructuralIssue issue : fixable) {
                RawPart rp = parts.byName(issue.partName);
                if (rp == null) {
                    applied.add(new RepairReport.Action(issue, RepairReport.Outcome.FAILED, "Part not found: " + issue.partName));
                    continue;
                }
                try {
                    String message = apply(rp, issue, safeDefault);
                    rp.modified = true;
                    applied.add(new RepairReport.Action(issue, RepairReport.Outcome.REPAIRED, message));
                } catch (IllegalStateException e) {
                    log.warn("Could not repair {}: {}", issue, e.getMessage());
                    applied.add(new RepairReport.Action(issue, RepairReport.Outcome.FAILED, e.getMessage()));
                }
            }

            for (RawPart rp : parts.all()) {
                if (!rp.modified) continue;
                try (OutputStream out = rp.part.getOutputStream()) {
                    rp.xml.save(out, POIXMLTypeLoader.DEFAULT_XML_OPTIONS);
                }
            }
            ByteArrayOutputStream bos = new ByteArrayOutputStream();
            pkg.save(bos);
            actions.addAll(applied);
            log.info("Structural repair: {} repaired, {} failed, {} skipped",
                    applied.stream().filter(a -> a.outcome == RepairReport.Outcome.REPAIRED).count(),
                    applied.stream().filter(a -> a.outcome == RepairReport.Outcome.FAILED).count(),
                    issues.size() - fixable.size());
            return new RepairReport(bos.toByteArray(), actions);
        } catch (IOException e) {
            log.error("Could not write repaired package", e);
            for (StructuralIssue issue : fixable) {
                actions.add(new RepairReport.Action(issue, RepairReport.Outcome.FAILED, "Package could not be written: " + e.getMessage()));
            }
            return new RepairReport(docx, actions);
        } finally {
            pkg.revert();
        }
    }

    private String apply(RawPart rp, StructuralIssue issue, Integer safeDefault) {
        switch (issue.kind) {
            case MISSING_NAMESPACE:
                return "Qualified " + qualify(rp.xml) + " name(s) with the w namespace";
            case MISSING_BULLET_STYLE:
                addBulletStyle(rp.root(), safeDefault);
                return "Added style '" + bulletStyleId + "'" + (safeDefault != null ? " bound to numId " + safeDefault : "");
            default:
                break;
        }

        XmlObject target = WordXml.resolve(rp.xml, issue.elementPath);
        if (target == null || !WordXml.localName(target).equals(issue.elementName)) {
            throw new IllegalStateException("Target element not found at " + issue.path);
        }
        switch (issue.kind) {
            case MALFORMED_NUMBERING_REFERENCE:
            case BROKEN_REFERENCE:
                return fixParagraph(target, issue.attribute, safeDefault);
            case EMPTY_ABSTRACT_DEFINITION:
                appendBulletLevel(target);
                return "Added bullet level 0";
            case ORPHANED_ABSTRACT_DEFINITION:
                WordXml.remove(target);
                return "Removed unreferenced abstractNum";
            case DUPLICATE_IDENTIFIER:
                return reassignIdentifier(target, new QName(WordXml.NS_W, issue.attribute));
            default:
                throw new IllegalStateException("No repair available for " + issue.kind);
        }
    }

    private String fixParagraph(XmlObject p, String attribute, Integer safeDefault) {
        XmlObject pPr = WordXml.ensurePPr(p);
        if ("ilvl".equals(attribute)) {
            WordXml.setNumPrValue(WordXml.ensureNumPr(pPr), WordXml.QN_W_ILVL, "0");
            return "Set ilvl to 0";
        }
        if (safeDefault == null) throw new IllegalStateException("No safe default numId available");
        XmlObject numPr = WordXml.ensureNumPr(pPr);
        if (WordXml.firstChild(numPr, WordXml.QN_W_ILVL) == null) {
            WordXml.setNumPrValue(numPr, WordXml.QN_W_ILVL, "0");
        }
        WordXml.setNumPrValue(numPr, WordXml.QN_W_NUMID, String.valueOf(safeDefault));
        return "Pointed paragraph at numId " + safeDefault;
    }

    private void appendBulletLevel(XmlObject abs) {
        XmlObject lvl = WordXml.appendChild(abs, WordXml.QN_W_LVL);
        WordXml.setAttr(lvl, WordXml.QN_W_ILVL, "0");
        WordXml.setAttr(WordXml.appendChild(lvl, WordXml.QN_W_START), WordXml.QN_W_VAL, "1");
        WordXml.setAttr(WordXml.appendChild(lvl, WordXml.QN_W_NUM_FMT), WordXml.QN_W_VAL, "bullet");
        WordXml.setAttr(WordXml.appendChild(lvl, WordXml.QN_W_LVL_TEXT), WordXml.QN_W_VAL, levelFormat.glyph);
        XmlObject ind = WordXml.appendChild(WordXml.appendChild(lvl, WordXml.QN_W_PPR), WordXml.QN_W_IND);
        WordXml.setAttr(ind, WordXml.QN_W_LEFT, String.valueOf(levelFormat.leftFor(0)));
        WordXml.setAttr(ind, WordXml.QN_W_HANGING, String.valueOf(levelFormat.hangingTwips));
    }

    private void addBulletStyle(XmlObject stylesRoot, Integer numId) {
        XmlObject style = WordXml.appendChild(stylesRoot, WordXml.QN_W_STYLE);
        WordXml.setAttr(style, WordXml.QN_W_TYPE, "paragraph");
        WordXml.setAttr(style, WordXml.QN_W_STYLE_ID, bulletStyleId);
        WordXml.setAttr(WordXml.appendChild(style, WordXml.QN_W_NAME), WordXml.QN_W_VAL, bulletStyleId);
        WordXml.appendChild(style, WordXml.QN_W_QFORMAT);
        WordXml.setAttr(WordXml.appendChild(style, WordXml.QN_W_RSID), WordXml.QN_W_VAL, ENGINE_RSID_HEX);
        if (numId != null) {
            WordXml.writeNumPr(WordXml.appendChild(style, WordXml.QN_W_PPR), numId, 0);
        }
    }

    private static String reassignIdentifier(XmlObject el, QName attr) {
        QName name = WordXml.name(el);
        Set<String> taken = new HashSet<>();
        long max = -1;
        try (XmlCursor c = el.newCursor()) {
            c.toParent();
            for (XmlObject sibling : WordXml.children(c.getObject(), name)) {
                String v = WordXml.attr(sibling, attr);
                if (v == null) continue;
                taken.add(v);
                if (WordXml.isDigits(v) && v.length() <= 18) max = Math.max(max, Long.parseLong(v));
            }
        }
        String old = WordXml.attr(el, attr);
        String fresh;
        if (WordXml.isDigits(old)) {
            fresh = String.valueOf(max + 1);
        } else {
            int n = 1;
            do { fresh = old + "_" + n++; } while (taken.contains(fresh));
        }
        WordXml.setAttr(el, attr, fresh);
        return "Changed " + attr.getLocalPart() + " '" + old + "' to '" + fresh + "'";
    }

    /** 给无命名空间的元素与属性补上 w 命名空间 */
    private static int qualify(XmlObject xml) {
        int changed = 0;
        try (XmlCursor c = xml.newCursor()) {
            while (!c.toNextToken().isNone()) {
                if (c.isStart() || c.isAttr()) {
                    QName n = c.getName();
                    if (n.getNamespaceURI() == null || n.getNamespaceURI().isEmpty()) {
                        c.setName(new QName(WordXml.NS_W, n.getLocalPart(), "w"));
                        changed++;
                    }
                }
            }
        }
        return changed;
    }

    private static String preview(String text) {
        if (text == null) return null;
        return text.length() <= 60 ? text : text.substring(0, 60) + "...";
    }
}
