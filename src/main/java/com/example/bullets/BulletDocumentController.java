package com.example.bullets;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/bullets")
public class BulletDocumentController {

    static final MediaType DOCX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document");

    @Autowired
    private ResumeBulletBuilder builder;
    @Autowired
    private BulletEngine engine;

    @GetMapping("/")
    public String home() {
        return "Bullet processor is running";
    }

    // 生成简历项目符号段落
    @PostMapping(value = "/build", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> build(@RequestBody BulletBuildRequest request) throws Exception {
        log.info("Build request: {} items, locale={}, strict={}",
                request.getItems() == null ? 0 : request.getItems().size(), request.getLocale(), request.isStrict());
        BuildResult result = builder.build(request);
        ReconciliationReport report = result.getReport();

        if (engine.config().failOnReconcileErrors && !report.errors.isEmpty()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", HttpStatus.UNPROCESSABLE_ENTITY.value());
            body.put("error", "Reconciliation errors");
            body.put("documentId", result.getDocumentId());
            body.put("errors", report.errors);
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
        }

        return ResponseEntity.ok()
                .contentType(DOCX)
                .header("Content-Disposition", "attachment; filename=" + result.getDocumentId() + ".docx")
                .header("X-Document-Id", result.getDocumentId())
                .header("X-Bullets-Total", String.valueOf(report.total))
                .header("X-Bullets-Repaired", String.valueOf(report.repaired))
                .header("X-Bullets-Errors", String.valueOf(report.errors.size()))
                .body(result.getDocxBytes());
    }

    // 结构体检，只报告不修改
    @PostMapping("/analyze")
    public ResponseEntity<List<StructuralIssue>> analyze(@RequestParam("file") MultipartFile file) throws Exception {
        log.info("Analyze request: {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        return ResponseEntity.ok(engine.analyze(file.getBytes()));
    }

    // 体检并修复可自动修复的问题
    @PostMapping("/repair")
    public ResponseEntity<byte[]> repair(@RequestParam("file") MultipartFile file) throws Exception {
        log.info("Repair request: {} ({} bytes)", file.getOriginalFilename(), file.getSize());
        RepairReport report = engine.analyzeAndRepair(file.getBytes());
        for (RepairReport.Action a : report.actions) log.debug("{}", a);

        return ResponseEntity.ok()
                .contentType(DOCX)
                .header("Content-Disposition", "attachment; filename=repaired.docx")
                .header("X-Repair-Actions", String.valueOf(report.actions.size()))
                .header("X-Repair-Repaired", String.valueOf(report.count(RepairReport.Outcome.REPAIRED)))
                .header("X-Repair-Skipped", String.valueOf(report.count(RepairReport.Outcome.SKIPPED)))
                .header("X-Repair-Failed", String.valueOf(report.count(RepairReport.Outcome.FAILED)))
                .body(report.bytes);
    }
}
