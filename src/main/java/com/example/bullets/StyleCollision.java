package com.example.bullets;

import java.util.List;

/** 样式登记时发现的冲突，作为数据返回 */
public final class StyleCollision {

    public enum Kind { NAME_COLLISION, PROPERTY_CONFLICT, NUMBERING_CONFLICT, INHERITANCE_CYCLE }

    public final Kind kind;
    public final List<String> stylesInvolved;
    public final String description;
    public final Severity severity;
    public final boolean autoResolvable;
    private String resolution;
    private boolean resolved;

    StyleCollision(Kind kind, List<String> stylesInvolved, String description, Severity severity, boolean autoResolvable) {
        this.kind = kind;
        this.stylesInvolved = List.copyOf(stylesInvolved);
        this.description = description;
        this.severity = severity;
        this.autoResolvable = autoResolvable;
    }

    void markResolved(String resolution) {
        this.resolution = resolution;
        this.resolved = true;
    }

    public String getResolution() { return resolution; }

    public boolean isResolved() { return resolved; }

    @Override
    public String toString() {
        return kind + " " + stylesInvolved + " [" + severity + "]: " + description
                + (resolved ? " -> " + resolution : "");
    }
}
