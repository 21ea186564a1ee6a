package com.example.bullets;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * 引擎入口：持有进程级分配器，按文档开会话；结构体检与修复不依赖会话。
 */
@Service
public class BulletEngine {

    private final BulletEngineConfig config;
    private final NumIdAllocator allocator;
    private final StructuralAuditor auditor;

    public BulletEngine(BulletEngineConfig config, NumIdAllocator allocator) {
        this.config = config;
        this.allocator = allocator;
        this.auditor = new StructuralAuditor(config.bulletStyleId, config.levelFormat);
    }

    public BulletSession openSession(String documentId, XWPFDocument doc) {
        return openSession(documentId, doc, null, false);
    }

    public BulletSession openSession(String documentId, XWPFDocument doc, String locale, boolean strict) {
        if (documentId == null || documentId.isBlank()) throw new IllegalArgumentException("documentId is required");
        if (doc == null) throw new IllegalArgumentException("document is required");
        allocator.cleanupExpired();
        return new BulletSession(documentId, doc, config, allocator, locale, strict);
    }

    public List<StructuralIssue> analyze(byte[] docx) {
        return auditor.analyze(docx);
    }

    public RepairReport repair(List<StructuralIssue> issues, byte[] docx) {
        return auditor.repair(issues, docx);
    }

    /** 体检后立即修复可自动修复的问题 */
    public RepairReport analyzeAndRepair(byte[] docx) {
        return auditor.repair(auditor.analyze(docx), docx);
    }

    public BulletEngineConfig config() {
        return config;
    }

    public NumIdAllocator allocator() {
        return allocator;
    }
}
