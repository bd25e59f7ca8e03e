package org.dxworks.codelint.rules.classes;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum LiteralStyle {
    /** {@code readonly x = 1} */
    FIELDS("fields"),
    /** {@code get x() { return 1; }} */
    GETTERS("getters");

    private final String name;

    LiteralStyle(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static LiteralStyle fromValue(String value) {
        if (value == null) return null;
        for (LiteralStyle style : values()) {
            if (style.name.equals(value)) return style;
        }
        throw new IllegalArgumentException("Unknown class-literal-property-style option: " + value);
    }
}
