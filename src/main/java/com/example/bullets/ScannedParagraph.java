package com.example.bullets;

/** 扫描结果：段落、位置路径、扫描时的原始层级 */
public final class ScannedParagraph {
    public final ParagraphNode node;
    public final String locationPath;
    public final int originalLevel;

    ScannedParagraph(ParagraphNode node, String locationPath, int originalLevel) {
        this.node = node;
        this.locationPath = locationPath;
        this.originalLevel = originalLevel;
    }

    @Override
    public String toString() {
        return locationPath + " (ilvl " + originalLevel + ")";
    }
}
