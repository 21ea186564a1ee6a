package com.example.bullets;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** 一次对账的结果 */
public final class ReconciliationReport {
    public final String requestId;
    public final int total;
    public final int repaired;
    public final List<ReconcileError> errors;
    public final Map<BulletErrorCategory, Integer> repairsByCategory;
    public final long durationMs;
    public final double memoryDeltaMb;

    ReconciliationReport(String requestId, int total, int repaired, List<ReconcileError> errors,
                         Map<BulletErrorCategory, Integer> repairsByCategory, long durationMs, double memoryDeltaMb) {
        this.requestId = requestId;
        this.total = total;
        this.repaired = repaired;
        this.errors = List.copyOf(errors);
        this.repairsByCategory = Collections.unmodifiableMap(repairsByCategory.isEmpty()
                ? new EnumMap<>(BulletErrorCategory.class) : new EnumMap<>(repairsByCategory));
        this.durationMs = durationMs;
        this.memoryDeltaMb = memoryDeltaMb;
    }

    public boolean isClean() {
        return errors.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("total=%d repaired=%d errors=%d duration=%dms memory=%.1fMB",
                total, repaired, errors.size(), durationMs, memoryDeltaMb);
    }
}
