package org.dxworks.codelint.rules.typestyle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TypeDefinitionStyle {
    INTERFACE("interface"),
    TYPE("type");

    private final String name;

    TypeDefinitionStyle(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static TypeDefinitionStyle fromValue(String value) {
        if (value == null) return null;
        for (TypeDefinitionStyle style : values()) {
            if (style.name.equals(value)) return style;
        }
        throw new IllegalArgumentException("Unknown consistent-type-definitions option: " + value);
    }
}
