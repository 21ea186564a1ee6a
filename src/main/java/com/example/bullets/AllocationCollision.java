package com.example.bullets;

import java.util.List;

/** 分配台账检查发现的冲突 */
public final class AllocationCollision {

    public enum Kind {
        SAME_DOCUMENT,      // 同一文档内重复的活跃 numId（分配器缺陷）
        CROSS_DOCUMENT,     // 不同文档使用相同 numId，仅提示
        RESERVED_RANGE      // 落入保留区间，必须重新分配
    }

    public final Kind kind;
    public final int numId;
    public final List<String> documentIds;
    public final String description;

    AllocationCollision(Kind kind, int numId, List<String> documentIds, String description) {
        this.kind = kind;
        this.numId = numId;
        this.documentIds = List.copyOf(documentIds);
        this.description = description;
    }

    @Override
    public String toString() {
        return kind + "(" + numId + "): " + description;
    }
}
