// File: src/main/java/com/example/bullets/ResumeBulletBuilder.java
package com.example.bullets;

import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * 从 (分区, 文本) 列表生成简历正文：每个分区一个标题段落，随后是该分区清洗后的项目符号。
 * 构建完成后对账一次再输出。
 */
@Slf4j
@Service
public class ResumeBulletBuilder {

    static final String SECTION_HEADER_STYLE = "MR_SectionHeader";

    private final BulletEngine engine;

    public ResumeBulletBuilder(BulletEngine engine) {
        this.engine = engine;
    }

    public BuildResult build(BulletBuildRequest request) throws IOException {
        if (request == null || request.getItems() == null) throw new IllegalArgumentException("items are required");
        String documentId = request.getDocumentId() == null || request.getDocumentId().isBlank()
                ? "doc-" + UUID.randomUUID() : request.getDocumentId();

        // 分区按首次出现的顺序
        Map<String, List<BulletBuildRequest.Item>> sections = new LinkedHashMap<>();
        for (BulletBuildRequest.Item item : request.getItems()) {
            String section = item.getSection() == null || item.getSection().isBlank() ? "default" : item.getSection().strip();
            sections.computeIfAbsent(section, k -> new ArrayList<>()).add(item);
        }

        try (XWPFDocument doc = new XWPFDocument();
             BulletSession session = engine.openSession(documentId, doc, request.getLocale(), request.isStrict())) {
            for (Map.Entry<String, List<BulletBuildRequest.Item>> e : sections.entrySet()) {
                addSectionHeader(doc, e.getKey());
                for (BulletBuildRequest.Item item : e.getValue()) {
                    session.addBullet(item.getText(), e.getKey(), item.getLevel());
                }
            }
            ReconciliationReport report = session.reconcile();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            doc.write(out);
            log.info("Built {} with {} sections and {} bullets ({} repaired, {} errors)", documentId,
                    sections.size(), session.getBulletsAdded(), report.repaired, report.errors.size());
            return new BuildResult(documentId, out.toByteArray(), session.getBulletsAdded(), report);
        }
    }

    private static void addSectionHeader(XWPFDocument doc, String section) {
        XWPFParagraph p = doc.createParagraph();
        p.setStyle(SECTION_HEADER_STYLE);
        XWPFRun run = p.createRun();
        run.setBold(true);
        run.setText(section.toUpperCase(Locale.ROOT));
    }
}
