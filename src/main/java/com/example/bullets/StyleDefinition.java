package com.example.bullets;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/** 内存样式登记表中的一项 */
public final class StyleDefinition {
    public static final int BUILT_IN_PRIORITY = 1000;
    public static final int USER_PRIORITY = 100;

    public final String name;
    public final String type;                       // paragraph | character | table | numbering
    public final Map<String, String> properties;
    public final String parent;                     // basedOn，可空
    public final int priority;

    private String aliasOf;
    private Integer numberingId;

    public StyleDefinition(String name, String type, Map<String, String> properties, String parent, int priority) {
        this.name = name;
        this.type = type == null ? "paragraph" : type;
        this.properties = Collections.unmodifiableMap(new TreeMap<>(properties == null ? Map.of() : properties));
        this.parent = parent;
        this.priority = priority;
    }

    public static StyleDefinition user(String name, Map<String, String> properties, String parent) {
        return new StyleDefinition(name, "paragraph", properties, parent, USER_PRIORITY);
    }

    static StyleDefinition builtIn(String name, Map<String, String> properties) {
        return new StyleDefinition(name, "paragraph", properties, null, BUILT_IN_PRIORITY);
    }

    public String getAliasOf() { return aliasOf; }

    void setAliasOf(String aliasOf) { this.aliasOf = aliasOf; }

    public Integer getNumberingId() { return numberingId; }

    void setNumberingId(Integer numberingId) { this.numberingId = numberingId; }

    @Override
    public String toString() {
        return name + "(" + type + ", p=" + priority + (numberingId != null ? ", numId=" + numberingId : "") + ")";
    }
}
