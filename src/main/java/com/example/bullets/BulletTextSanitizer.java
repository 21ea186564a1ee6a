// File: src/main/java/com/example/bullets/BulletTextSanitizer.java
package com.example.bullets;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * 成就文本清洗：拆分内部换行、折叠空白、剥离前导的字面项目符号。
 * 列表符号由编号定义负责渲染，文本里残留的 "• " 会变成双符号。
 */
@Slf4j
public class BulletTextSanitizer {

    private static final Pattern ANY_BREAK = Pattern.compile("\r\n|\r|\n|\u2028|\u2029|\u000B|\u000C|\u0085");
    private static final Pattern WS = Pattern.compile("\\s+");
    private static final String PRECEDING_PUNCT = "!@#$%^&*()[]{}|\\:\";'<>?,.`~";
    private static final int MAX_STRIP_PASSES = 3;
    private static final int PREVIEW_CHARS = 50;

    static final double EXCLUSION_FACTOR = 0.3;
    static final double CONTENT_FOLLOWS_FACTOR = 1.2;
    static final double WORDS_PRECEDE_FACTOR = 0.5;

    private final double minConfidence;

    private final AtomicLong linesProcessed = new AtomicLong();
    private final AtomicLong markersFound = new AtomicLong();
    private final AtomicLong markersRemoved = new AtomicLong();
    private final AtomicLong falsePositivesAvoided = new AtomicLong();
    private final Map<BulletGlyph, AtomicLong> removedByGlyph = new EnumMap<>(BulletGlyph.class);

    public BulletTextSanitizer() {
        this(0.7);
    }

    public BulletTextSanitizer(double minConfidence) {
        this.minConfidence = minConfidence;
        for (BulletGlyph g : BulletGlyph.values()) removedByGlyph.put(g, new AtomicLong());
    }

    public List<String> sanitize(String text, boolean strict) {
        return sanitize(text, strict, null);
    }

    /** 每个非空行成为一个独立条目 */
    public List<String> sanitize(String text, boolean strict, String locale) {
        List<String> out = new ArrayList<>();
        if (text == null || text.isBlank()) return out;

        List<String> lines = new ArrayList<>();
        for (String raw : ANY_BREAK.split(text)) {
            String collapsed = WS.matcher(raw).replaceAll(" ").strip();
            if (!collapsed.isEmpty()) lines.add(collapsed);
        }
        if (lines.size() > 1) {
            if (strict) {
                throw new BulletSanitizationException(
                        "Achievement contains " + (lines.size() - 1) + " internal line break(s)", preview(text));
            }
            log.warn("Split achievement into {} paragraphs: {}", lines.size(), preview(text));
        }

        for (String line : lines) {
            linesProcessed.incrementAndGet();
            String cleaned = stripLeadingMarkers(line, strict, locale);
            if (!cleaned.isEmpty()) out.add(cleaned);
        }
        return out;
    }

    /** 按分区批量清洗，context 只用于日志 */
    public List<String> sanitizeAll(List<String> achievements, String context) {
        List<String> out = new ArrayList<>();
        if (achievements == null) return out;
        for (String a : achievements) out.addAll(sanitize(a, false));
        if (out.size() != achievements.size()) {
            log.info("Sanitized {} achievements into {} bullets for '{}'", achievements.size(), out.size(), context);
        }
        return out;
    }

    private String stripLeadingMarkers(String line, boolean strict, String locale) {
        String current = line;
        for (int pass = 0; pass < MAX_STRIP_PASSES; pass++) {
            MarkerDetection d = detectLeading(current, locale);
            if (d == null) break;
            markersFound.incrementAndGet();
            if (!d.removable) {
                falsePositivesAvoided.incrementAndGet();
                log.debug("Kept marker {} in: {}", d, preview(current));
                break;
            }
            if (strict) {
                throw new BulletSanitizationException(
                        "Achievement contains literal bullet prefix '" + d.marker + "'", preview(line));
            }
            current = current.substring(d.end).strip();
            markersRemoved.incrementAndGet();
            removedByGlyph.get(d.glyph).incrementAndGet();
            log.debug("Stripped {} from: {}", d, preview(line));
        }
        return current;
    }

    /** 行首符号（允许前导空白） */
    MarkerDetection detectLeading(String text, String locale) {
        int i = 0;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) i++;
        if (i >= text.length()) return null;
        int cp = text.codePointAt(i);
        BulletGlyph glyph = BulletGlyph.of(cp);
        if (glyph == null) return null;
        return evaluate(text, glyph, i, i + Character.charCount(cp), true, locale);
    }

    /** 诊断：行内所有候选符号，不修改文本 */
    public List<MarkerDetection> inspect(String text, String locale) {
        List<MarkerDetection> found = new ArrayList<>();
        if (text == null) return found;
        int firstContent = 0;
        while (firstContent < text.length() && Character.isWhitespace(text.charAt(firstContent))) firstContent++;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            int next = i + Character.charCount(cp);
            BulletGlyph glyph = BulletGlyph.of(cp);
            if (glyph != null) found.add(evaluate(text, glyph, i, next, i == firstContent, locale));
            i = next;
        }
        return found;
    }

    private MarkerDetection evaluate(String text, BulletGlyph glyph, int start, int end, boolean leading, String locale) {
        ExclusionPattern exclusion = ExclusionPattern.firstApplying(text, start, end);
        double factor;
        if (exclusion != null) {
            factor = EXCLUSION_FACTOR;
        } else if (text.substring(end).strip().length() > 5) {
            factor = CONTENT_FOLLOWS_FACTOR;
        } else if (wordCount(text.substring(0, start)) >= 3) {
            factor = WORDS_PRECEDE_FACTOR;
        } else {
            factor = 1.0;
        }
        double confidence = Math.min(glyph.baseConfidence * factor, 1.0);
        confidence = Math.min(confidence + glyph.localeBoost(locale), 1.0);
        boolean removable = leading && removable(text, start, end, confidence);
        return new MarkerDetection(glyph, text.substring(start, end), start, end, confidence, exclusion, leading, removable);
    }

    private boolean removable(String text, int start, int end, double confidence) {
        if (confidence < minConfidence) return false;
        if (start > 0 && PRECEDING_PUNCT.indexOf(text.charAt(start - 1)) >= 0) return false;
        if (end < text.length() && Character.isLetter(text.codePointAt(end))) return false;
        return !text.substring(end).isBlank();
    }

    private static int wordCount(String s) {
        String t = s.strip();
        return t.isEmpty() ? 0 : WS.split(t).length;
    }

    private static String preview(String s) {
        String flat = ANY_BREAK.matcher(s).replaceAll("⏎");
        return flat.length() <= PREVIEW_CHARS ? flat : flat.substring(0, PREVIEW_CHARS) + "...";
    }

    public Map<String, Object> stats() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("linesProcessed", linesProcessed.get());
        m.put("markersFound", markersFound.get());
        m.put("markersRemoved", markersRemoved.get());
        m.put("falsePositivesAvoided", falsePositivesAvoided.get());
        Map<String, Long> byGlyph = new LinkedHashMap<>();
        removedByGlyph.forEach((g, n) -> { if (n.get() > 0) byGlyph.put(g.name(), n.get()); });
        m.put("removedByGlyph", byGlyph);
        return m;
    }

    public void resetStats() {
        linesProcessed.set(0);
        markersFound.set(0);
        markersRemoved.set(0);
        falsePositivesAvoided.set(0);
        removedByGlyph.values().forEach(n -> n.set(0));
    }
}
