package com.example.bullets;

import java.util.List;

/** 包结构检查发现的问题（只读数据，不抛异常） */
public final class StructuralIssue {

    public enum Kind {
        UNPARSABLE_PART,
        MISSING_NAMESPACE,
        MALFORMED_NUMBERING_REFERENCE,
        BROKEN_REFERENCE,
        MISSING_ATTRIBUTE,
        EMPTY_ABSTRACT_DEFINITION,
        ORPHANED_ABSTRACT_DEFINITION,
        DUPLICATE_IDENTIFIER,
        MISSING_BULLET_STYLE,
        INHERITANCE_CYCLE
    }

    public final Kind kind;
    public final String partName;
    public final String path;
    public final List<Integer> elementPath;     // 从根元素起的子元素序号，part 级问题为空
    public final String elementName;            // 期望的元素本地名，修复前用来核对
    public final String attribute;              // 涉及的属性本地名，可空
    public final String description;
    public final Severity severity;
    public final boolean autoFixable;
    public final String suggestedRemedy;
    public final String elementText;            // 可空

    private StructuralIssue(Builder b) {
        this.kind = b.kind;
        this.partName = b.partName;
        this.path = b.path;
        this.elementPath = List.copyOf(b.elementPath);
        this.elementName = b.elementName;
        this.attribute = b.attribute;
        this.description = b.description;
        this.severity = b.severity;
        this.autoFixable = b.autoFixable;
        this.suggestedRemedy = b.suggestedRemedy;
        this.elementText = b.elementText;
    }

    public static Builder of(Kind kind, String partName) {
        return new Builder(kind, partName);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s %s%s: %s", severity, kind, partName, path == null ? "" : path, description);
    }

    public static final class Builder {
        private final Kind kind;
        private final String partName;
        private String path = "";
        private List<Integer> elementPath = List.of();
        private String elementName;
        private String attribute;
        private String description = "";
        private Severity severity = Severity.MEDIUM;
        private boolean autoFixable;
        private String suggestedRemedy = "";
        private String elementText;

        private Builder(Kind kind, String partName) { this.kind = kind; this.partName = partName; }

        public Builder element(String path, List<Integer> elementPath, String elementName){
            this.path=path; this.elementPath=elementPath; this.elementName=elementName; return this;
        }
        public Builder attribute(String v){ this.attribute=v; return this; }
        public Builder description(String v){ this.description=v; return this; }
        public Builder severity(Severity v){ this.severity=v; return this; }
        public Builder autoFixable(boolean v){ this.autoFixable=v; return this; }
        public Builder remedy(String v){ this.suggestedRemedy=v; return this; }
        public Builder elementText(String v){ this.elementText=v; return this; }
        public StructuralIssue build(){ return new StructuralIssue(this); }
    }
}
