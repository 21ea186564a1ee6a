package com.example.bullets;

import java.util.Locale;
import java.util.Set;

/** 可识别的项目符号字符族，附基础置信度与适用语言 */
public enum BulletGlyph {
    WESTERN_BULLET("•·◦▪▫‣⁃⁌⁍", 0.9, Set.of("en", "fr", "de", "es", "it")),
    EASTERN_BULLET("・◆◇■□●○♦◘◙", 0.85, Set.of("ja", "ko", "zh", "zh-cn", "zh-tw")),
    HYPHEN_DASH("-–—‒‑‐⸺⸻", 0.7, Set.of("all")),
    ASTERISK_STAR("*★☆✦✧✱✲✳✴✵", 0.75, Set.of("all")),
    ARROW_POINTER("→⇒⇨►▶▷➤➜⇛⇝", 0.8, Set.of("all")),
    NUMERIC_BULLET("①②③④⑤⑥⑦⑧⑨⑩❶❷❸❹❺❻❼❽❾❿", 0.95, Set.of("all")),
    CUSTOM_SYMBOL("§¶♠♣♥♪♫☎☏✓✔✕✗", 0.6, Set.of("all"));

    static final String ALL = "all";

    private final String chars;
    public final double baseConfidence;
    private final Set<String> locales;

    BulletGlyph(String chars, double baseConfidence, Set<String> locales) {
        this.chars = chars;
        this.baseConfidence = baseConfidence;
        this.locales = locales;
    }

    public boolean matches(int codePoint) {
        return chars.indexOf(codePoint) >= 0;
    }

    /** 首个匹配的字符族；非符号返回 null */
    public static BulletGlyph of(int codePoint) {
        for (BulletGlyph g : values()) {
            if (g.matches(codePoint)) return g;
        }
        return null;
    }

    /** 通用族 +0.1；精确语言 +0.2；同语系 +0.15 */
    public double localeBoost(String locale) {
        if (locale == null || locale.isBlank()) return 0.0;
        if (locales.contains(ALL)) return 0.1;
        String loc = locale.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        if (locales.contains(loc)) return 0.2;
        String family = loc.contains("-") ? loc.substring(0, loc.indexOf('-')) : loc;
        for (String l : locales) {
            String lf = l.contains("-") ? l.substring(0, l.indexOf('-')) : l;
            if (lf.equals(family)) return 0.15;
        }
        return 0.0;
    }
}
