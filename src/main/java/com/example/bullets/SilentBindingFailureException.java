package com.example.bullets;

/** 写入 numPr 后回读不一致 */
public class SilentBindingFailureException extends BulletEngineException {

    private final transient ParagraphLocation location;
    private final int expectedNumId;
    private final int expectedLevel;

    public SilentBindingFailureException(ParagraphLocation location, int expectedNumId, int expectedLevel,
                                         String actualNumId, String actualLevel) {
        super(String.format("Numbering reference did not persist at %s: expected numId=%d ilvl=%d, found numId=%s ilvl=%s",
                location.display(), expectedNumId, expectedLevel, actualNumId, actualLevel));
        this.location = location;
        this.expectedNumId = expectedNumId;
        this.expectedLevel = expectedLevel;
    }

    public ParagraphLocation getLocation() {
        return location;
    }

    public int getExpectedNumId() {
        return expectedNumId;
    }

    public int getExpectedLevel() {
        return expectedLevel;
    }
}
