// File: src/main/java/com/example/bullets/BulletReconciler.java
package com.example.bullets;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 构建结束后的一次性全树对账：校验每个项目符号段落的编号引用，缺失或损坏的按原层级重新绑定。
 * 单个段落失败只记入报告，不中断整个过程。
 */
@Slf4j
public class BulletReconciler {

    private static final double MB = 1024.0 * 1024.0;

    private final BulletTreeScanner scanner;
    private final ParagraphBinder binder;
    private final NumberingDefinitionRegistry registry;
    private final BulletEngineConfig config;

    public BulletReconciler(BulletTreeScanner scanner, ParagraphBinder binder,
                            NumberingDefinitionRegistry registry, BulletEngineConfig config) {
        this.scanner = scanner;
        this.binder = binder;
        this.registry = registry;
        this.config = config;
    }

    public ReconciliationReport reconcile(XWPFDocument doc, int numId) {
        long t0 = System.nanoTime();
        long mem0 = usedMemory();
        String requestId = MDC.get("requestId");

        Set<Integer> defined = registry.existingNumIds(doc);
        if (!defined.contains(numId)) {
            throw new ReconciliationException("Repair target numId " + numId + " has no numbering definition");
        }

        List<ScannedParagraph> scanned;
        try {
            scanned = scanner.scan(doc);
        } catch (RuntimeException e) {
            throw new ReconciliationException("Document tree could not be scanned", e);
        }

        int repaired = 0;
        List<ReconcileError> errors = new ArrayList<>();
        Map<BulletErrorCategory, Integer> byCategory = new EnumMap<>(BulletErrorCategory.class);

        for (ScannedParagraph sp : scanned) {
            NumberingCheck check = verify(sp.node, defined);
            if (check == NumberingCheck.OK) continue;

            BulletErrorCategory reason = diagnose(sp.node, check);
            if (check == NumberingCheck.MALFORMED) {
                log.warn("Malformed numbering reference at {}: numId='{}' ilvl='{}'",
                        sp.locationPath, sp.node.rawNumId(), sp.node.rawLevel());
            }
            try {
                binder.bind(sp.node, numId, sp.originalLevel);
                repaired++;
                byCategory.merge(reason, 1, Integer::sum);
                log.debug("Repaired {} ({}) -> numId {} ilvl {}", sp.locationPath, reason, numId, sp.originalLevel);
            } catch (ContentFirstViolationException e) {
                errors.add(new ReconcileError(sp.locationPath, BulletErrorCategory.CONTENT_FIRST, e.getMessage()));
                log.error("Cannot repair empty bullet paragraph at {}", sp.locationPath);
            } catch (SilentBindingFailureException e) {
                errors.add(new ReconcileError(sp.locationPath, BulletErrorCategory.SILENT_BINDING, e.getMessage()));
                log.error("Binding did not persist at {}: {}", sp.locationPath, e.getMessage());
            } catch (RuntimeException e) {
                BulletErrorCategory cat = check == NumberingCheck.MALFORMED ? BulletErrorCategory.CORRUPT_XML : BulletErrorCategory.UNKNOWN;
                errors.add(new ReconcileError(sp.locationPath, cat, e.getClass().getSimpleName() + ": " + e.getMessage()));
                log.error("Repair failed at {}", sp.locationPath, e);
            }
        }

        long durationMs = (System.nanoTime() - t0) / 1_000_000;
        double memoryDeltaMb = Math.max(0, usedMemory() - mem0) / MB;
        ReconciliationReport report = new ReconciliationReport(requestId, scanned.size(), repaired, errors,
                byCategory, durationMs, memoryDeltaMb);

        if (durationMs > config.reconcileSlowMs) {
            log.warn("Reconciliation took {}ms (> {}ms) for {} paragraphs", durationMs, config.reconcileSlowMs, scanned.size());
        }
        if (scanned.size() > config.reconcileMaxParagraphs) {
            log.warn("Reconciliation covered {} paragraphs (> {})", scanned.size(), config.reconcileMaxParagraphs);
        }
        if (memoryDeltaMb > config.reconcileMaxMemoryMb) {
            log.warn("Reconciliation grew heap by {}MB (> {}MB)", String.format("%.1f", memoryDeltaMb), config.reconcileMaxMemoryMb);
        }
        if (errors.isEmpty()) log.info("Reconciliation done: {}", report);
        else log.warn("Reconciliation done with errors: {} {}", report, errors);
        return report;
    }

    /** 三态校验 */
    public NumberingCheck verify(ParagraphNode node, Set<Integer> definedNumIds) {
        if (!node.hasNumPr() || !node.hasNumIdElement() || !node.hasLevelElement()) return NumberingCheck.NEEDS_REPAIR;
        String rawNum = node.rawNumId();
        String rawLvl = node.rawLevel();
        if (rawNum == null || rawLvl == null) return NumberingCheck.NEEDS_REPAIR;
        Integer num = WordXml.parseId(rawNum);
        Integer lvl = WordXml.parseId(rawLvl);
        if (num == null || lvl == null || lvl > ParagraphBinder.MAX_LEVEL) return NumberingCheck.MALFORMED;
        if (!definedNumIds.contains(num)) return NumberingCheck.NEEDS_REPAIR;
        return NumberingCheck.OK;
    }

    private BulletErrorCategory diagnose(ParagraphNode node, NumberingCheck check) {
        if (check == NumberingCheck.MALFORMED) return BulletErrorCategory.CORRUPT_XML;
        if (!node.hasNumPr()) return BulletErrorCategory.MISSING_NUMPR;
        return BulletErrorCategory.INVALID_NUMID;
    }

    private static long usedMemory() {
        Runtime rt = Runtime.getRuntime();
        return rt.totalMemory() - rt.freeMemory();
    }
}
