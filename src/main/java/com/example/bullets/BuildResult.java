package com.example.bullets;

import lombok.AllArgsConstructor;
import lombok.Data;

/** 构建产物：docx 字节与对账报告 */
@Data
@AllArgsConstructor
public class BuildResult {
    private String documentId;
    private byte[] docxBytes;
    private int bulletsAdded;
    private ReconciliationReport report;
}
