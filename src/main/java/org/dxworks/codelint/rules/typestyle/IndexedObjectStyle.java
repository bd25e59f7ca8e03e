package org.dxworks.codelint.rules.typestyle;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IndexedObjectStyle {
    /** {@code Record<string, T>} */
    RECORD("record"),
    /** {@code { [key: string]: T }} */
    INDEX_SIGNATURE("index-signature");

    private final String name;

    IndexedObjectStyle(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static IndexedObjectStyle fromValue(String value) {
        if (value == null) return null;
        for (IndexedObjectStyle style : values()) {
            if (style.name.equals(value)) return style;
        }
        throw new IllegalArgumentException("Unknown consistent-indexed-object-style option: " + value);
    }
}
