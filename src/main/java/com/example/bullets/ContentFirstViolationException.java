package com.example.bullets;

/** 段落尚无 run 时绑定编号（Word 会把空列表段落渲染成孤立符号） */
public class ContentFirstViolationException extends BulletEngineException {

    private final transient ParagraphLocation location;

    public ContentFirstViolationException(ParagraphLocation location) {
        super("Paragraph has no text run; add content before binding numbering: " + location.display());
        this.location = location;
    }

    public ParagraphLocation getLocation() {
        return location;
    }
}
