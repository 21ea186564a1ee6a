package com.example.bullets;

/** 列表层级格式：符号、可选字体、缩进（twips）、生成的层级数 */
public final class LevelFormat {
    public static final int MAX_LEVELS = 9;

    public final String glyph;
    public final String glyphFont;       // null 表示沿用段落字体
    public final int leftTwips;          // 每级左缩进步长
    public final int hangingTwips;
    public final int levelCount;

    public LevelFormat(String glyph, String glyphFont, int leftTwips, int hangingTwips, int levelCount) {
        if (glyph == null || glyph.isEmpty()) throw new IllegalArgumentException("glyph must not be empty");
        if (levelCount < 1 || levelCount > MAX_LEVELS) {
            throw new IllegalArgumentException("levelCount must be within 1.." + MAX_LEVELS + ": " + levelCount);
        }
        this.glyph = glyph;
        this.glyphFont = glyphFont;
        this.leftTwips = leftTwips;
        this.hangingTwips = hangingTwips;
        this.levelCount = levelCount;
    }

    /** • ，221/221 twips（约 1em），单层 */
    public static LevelFormat defaults() {
        return new LevelFormat("•", null, 221, 221, 1);
    }

    public LevelFormat withLevels(int levels) {
        return new LevelFormat(glyph, glyphFont, leftTwips, hangingTwips, levels);
    }

    int leftFor(int level) {
        return leftTwips * (level + 1);
    }
}
