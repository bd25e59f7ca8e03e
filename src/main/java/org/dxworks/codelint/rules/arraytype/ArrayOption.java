package org.dxworks.codelint.rules.arraytype;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ArrayOption {
    ARRAY("array", "array-syntax"),
    GENERIC("generic", "generic-syntax"),
    ARRAY_SIMPLE("array-simple", "array-syntax-simple-only");

    private final String name;
    private final String alias;

    ArrayOption(String name, String alias) {
        this.name = name;
        this.alias = alias;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static ArrayOption fromValue(String value) {
        if (value == null) return null;
        for (ArrayOption option : values()) {
            if (option.name.equals(value) || option.alias.equals(value)) return option;
        }
        throw new IllegalArgumentException("Unknown array-type option: " + value);
    }
}
