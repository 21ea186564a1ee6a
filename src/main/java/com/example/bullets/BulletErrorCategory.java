package com.example.bullets;

/** 对账中修复原因与失败原因的分类 */
public enum BulletErrorCategory {
    MISSING_NUMPR,
    INVALID_NUMID,
    CORRUPT_XML,
    CONTENT_FIRST,
    SILENT_BINDING,
    UNKNOWN
}
