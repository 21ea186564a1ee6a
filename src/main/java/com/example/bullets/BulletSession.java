// File: src/main/java/com/example/bullets/BulletSession.java
package com.example.bullets;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 单个文档的构建上下文。
 * 构建阶段逐段绑定；构建结束后对账一次并封存；close() 释放该文档的全部 numId。
 * 单线程使用。
 */
@Slf4j
public class BulletSession implements AutoCloseable {

    private final String documentId;
    private final String requestId;
    private final XWPFDocument doc;
    private final BulletEngineConfig config;
    private final NumIdAllocator allocator;
    private final NumberingDefinitionRegistry registry;
    private final StyleCollisionResolver styles;
    private final ParagraphBinder binder;
    private final BulletTextSanitizer sanitizer;
    private final BulletReconciler reconciler;
    private final LevelFormat format;
    private final String locale;
    private final boolean strict;

    private final int styleNumId;
    private final String renamedStyle;
    private final Map<String, Integer> sectionNumIds = new LinkedHashMap<>();
    private int bulletsAdded;
    private ReconciliationReport report;
    private boolean closed;

    BulletSession(String documentId, XWPFDocument doc, BulletEngineConfig config, NumIdAllocator allocator,
                  String locale, boolean strict) {
        this.documentId = documentId;
        this.requestId = documentId + "-" + UUID.randomUUID().toString().substring(0, 8);
        this.doc = doc;
        this.config = config;
        this.allocator = allocator;
        this.registry = new NumberingDefinitionRegistry();
        this.binder = new ParagraphBinder();
        this.sanitizer = new BulletTextSanitizer(config.minConfidence);
        this.reconciler = new BulletReconciler(new BulletTreeScanner(config.bulletStyleId), binder, registry, config);
        // 样式级定义给满 9 级，保留下来的深层级也能渲染
        this.format = config.levelFormat.withLevels(LevelFormat.MAX_LEVELS);
        this.locale = locale;
        this.strict = strict;

        try {
            allocator.reserveExisting(documentId, registry.existingNumIds(doc), registry.existingAbstractIds(doc));
            int numId = materialize(allocator.allocate(documentId, "styles", config.bulletStyleId));
            this.styles = new StyleCollisionResolver(config.bulletStyleId,
                    () -> materialize(allocator.allocate(documentId, "styles", null)));
            this.renamedStyle = styles.ensureBulletStyle(doc, numId);
            this.styleNumId = styles.bindNumbering(config.bulletStyleId, numId);
        } catch (RuntimeException e) {
            allocator.release(documentId);
            throw e;
        }
        log.info("Opened bullet session {} (style numId {}{})", requestId, styleNumId,
                renamedStyle == null ? "" : ", foreign style renamed to " + renamedStyle);
    }

    private int materialize(NumberingId id) {
        if (!registry.ensureDefinition(doc, id.numId, id.abstractNumId, format)) {
            throw new BulletEngineException("Could not define numId " + id.numId
                    + ": abstractNumId " + id.abstractNumId + " is already taken in " + documentId);
        }
        return id.numId;
    }

    /** 分区对应的 numId，首次使用时分配并写入定义 */
    public int numberingFor(String section) {
        checkOpen();
        String key = section == null || section.isBlank() ? "default" : section;
        return sectionNumIds.computeIfAbsent(key, s -> materialize(allocator.allocate(documentId, s, null)));
    }

    public List<XWPFParagraph> addBullet(String text, String section) {
        return addBullet(text, section, 0);
    }

    /**
     * 清洗文本后追加到正文末尾，每个非空行一个段落，逐段绑定。
     * strict 模式下含符号或换行的文本直接抛 {@link BulletSanitizationException}。
     */
    public List<XWPFParagraph> addBullet(String text, String section, int level) {
        checkOpen();
        List<String> lines = sanitizer.sanitize(text, strict, locale);
        if (lines.isEmpty()) {
            log.debug("Skipped empty achievement for section '{}'", section);
            return List.of();
        }
        int numId = numberingFor(section);
        List<XWPFParagraph> added = new ArrayList<>();
        for (String line : lines) {
            XWPFParagraph p = doc.createParagraph();
            p.setStyle(config.bulletStyleId);
            XWPFRun run = p.createRun();
            run.setText(line);
            binder.bind(p, numId, level);
            added.add(p);
            bulletsAdded++;
        }
        return added;
    }

    /** 绑定调用方自己建好的段落 */
    public void bind(XWPFParagraph paragraph, String section, int level) {
        checkOpen();
        if (!config.bulletStyleId.equals(paragraph.getStyle())) paragraph.setStyle(config.bulletStyleId);
        binder.bind(paragraph, numberingFor(section), level);
    }

    /**
     * 构建结束后的全树对账，只能调用一次，之后会话封存。
     */
    public ReconciliationReport reconcile() {
        if (closed) throw new IllegalStateException("Session " + requestId + " is closed");
        if (report != null) throw new IllegalStateException("Session " + requestId + " was already reconciled");
        try (MDC.MDCCloseable ignored = MDC.putCloseable("requestId", requestId)) {
            report = reconciler.reconcile(doc, styleNumId);
        }
        List<AllocationCollision> found = allocator.detectCollisions();
        for (AllocationCollision c : found) {
            if (c.documentIds.contains(documentId) && c.kind != AllocationCollision.Kind.CROSS_DOCUMENT) {
                log.warn("Allocation collision after reconciliation: {}", c);
            }
        }
        return report;
    }

    public List<AllocationCollision> detectCollisions() {
        return allocator.detectCollisions();
    }

    private void checkOpen() {
        if (closed) throw new IllegalStateException("Session " + requestId + " is closed");
        if (report != null) throw new IllegalStateException("Session " + requestId + " is sealed after reconciliation");
    }

    public String getDocumentId() { return documentId; }
    public String getRequestId() { return requestId; }
    public XWPFDocument getDocument() { return doc; }
    public int getStyleNumId() { return styleNumId; }
    public String getRenamedStyle() { return renamedStyle; }
    public int getBulletsAdded() { return bulletsAdded; }
    public ReconciliationReport getReport() { return report; }
    public boolean isSealed() { return report != null; }
    public StyleCollisionResolver styles() { return styles; }
    public BulletTextSanitizer sanitizer() { return sanitizer; }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        int released = allocator.release(documentId);
        log.info("Closed bullet session {}: {} bullets, {} allocations released", requestId, bulletsAdded, released);
    }
}
