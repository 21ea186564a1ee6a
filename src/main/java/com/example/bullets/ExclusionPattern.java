package com.example.bullets;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 会让符号看起来像内容一部分的文本模式。
 * LINE 作用于整行；TOUCHING 只在匹配与符号重叠或紧贴时生效。
 */
public enum ExclusionPattern {
    EMAIL("[\\w.-]+@[\\w.-]+\\.\\w+", Scope.LINE),
    PHONE("\\b\\d{3}-\\d{3}-\\d{4}\\b", Scope.LINE),
    URL("https?://[\\w.-]+", Scope.LINE),
    DATE("\\b\\d{1,2}-\\d{1,2}-\\d{4}\\b", Scope.TOUCHING),
    NUMERIC_RANGE("\\b\\d+\\s*[-–—]\\s*\\d+\\b", Scope.TOUCHING),
    COMPOUND_WORD("\\b\\w+-\\w+\\b", Scope.TOUCHING),
    EMOTICON("[:;]-?[()PpDd]", Scope.TOUCHING),
    CURRENCY("[$€£¥₹]\\s*\\d", Scope.TOUCHING);

    enum Scope { LINE, TOUCHING }

    private final Pattern pattern;
    private final Scope scope;

    ExclusionPattern(String regex, Scope scope) {
        this.pattern = Pattern.compile(regex, Pattern.UNICODE_CHARACTER_CLASS);
        this.scope = scope;
    }

    boolean appliesTo(String text, int markerStart, int markerEnd) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            if (scope == Scope.LINE) return true;
            if (m.end() >= markerStart && m.start() <= markerEnd) return true;
        }
        return false;
    }

    /** 第一个生效的排除模式；没有返回 null */
    public static ExclusionPattern firstApplying(String text, int markerStart, int markerEnd) {
        for (ExclusionPattern p : values()) {
            if (p.appliesTo(text, markerStart, markerEnd)) return p;
        }
        return null;
    }
}
