package com.example.bullets;

/** 一次符号识别结果 */
public final class MarkerDetection {
    public final BulletGlyph glyph;
    public final String marker;
    public final int start;
    public final int end;                       // 不含
    public final double confidence;
    public final ExclusionPattern exclusion;    // 命中的排除模式，可空
    public final boolean leading;               // 行首（只有前导空白）
    public final boolean removable;

    MarkerDetection(BulletGlyph glyph, String marker, int start, int end, double confidence,
                    ExclusionPattern exclusion, boolean leading, boolean removable) {
        this.glyph = glyph; this.marker = marker; this.start = start; this.end = end;
        this.confidence = confidence; this.exclusion = exclusion; this.leading = leading; this.removable = removable;
    }

    @Override
    public String toString() {
        return String.format("%s '%s' @%d conf=%.2f%s%s", glyph, marker, start, confidence,
                exclusion != null ? " excl=" + exclusion : "", removable ? " removable" : "");
    }
}
