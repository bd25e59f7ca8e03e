package org.dxworks.codelint.rules.typestyle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GenericConstructorStyle {
    /** {@code const a = new Map<string, number>();} */
    CONSTRUCTOR("constructor"),
    /** {@code const a: Map<string, number> = new Map();} */
    TYPE_ANNOTATION("type-annotation");

    private final String name;

    GenericConstructorStyle(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static GenericConstructorStyle fromValue(String value) {
        if (value == null) return null;
        for (GenericConstructorStyle style : values()) {
            if (style.name.equals(value)) return style;
        }
        throw new IllegalArgumentException("Unknown consistent-generic-constructors option: " + value);
    }
}
