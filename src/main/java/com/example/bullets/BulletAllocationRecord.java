package com.example.bullets;

import java.time.Instant;

/** 分配台账中的一条记录，按 (documentId, numId) 索引 */
public final class BulletAllocationRecord {

    public enum Status { ACTIVE, RELEASED, EXPIRED }

    public final String documentId;
    public final int numId;
    public final int abstractNumId;
    public final String sectionName;
    public final String styleName;      // 可空
    public final Instant allocatedAt;
    private volatile Status status = Status.ACTIVE;

    BulletAllocationRecord(String documentId, int numId, int abstractNumId,
                           String sectionName, String styleName, Instant allocatedAt) {
        this.documentId = documentId; this.numId = numId; this.abstractNumId = abstractNumId;
        this.sectionName = sectionName; this.styleName = styleName; this.allocatedAt = allocatedAt;
    }

    public Status getStatus() { return status; }

    void setStatus(Status status) { this.status = status; }

    public boolean isActive() { return status == Status.ACTIVE; }

    public NumberingId toNumberingId() {
        return new NumberingId(numId, abstractNumId);
    }

    @Override
    public String toString() {
        return String.format("%s#%d(abs=%d, section=%s, style=%s, %s)",
                documentId, numId, abstractNumId, sectionName, styleName, status);
    }
}
