package org.dxworks.codelint.linter;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RuleLevel {
    OFF("off"),
    WARN("warn"),
    ERROR("error");

    private final String name;

    RuleLevel(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    /**
     * Accepts the names as well as ESLint's numeric levels. An unquoted YAML {@code off} may arrive
     * as the boolean {@code false}.
     */
    @JsonCreator
    public static RuleLevel fromValue(String value) {
        if (value == null) return ERROR;
        String v = value.trim();
        for (RuleLevel level : values()) {
            if (level.name.equalsIgnoreCase(v) || String.valueOf(level.ordinal()).equals(v)) return level;
        }
        if ("false".equalsIgnoreCase(v)) return OFF;
        if ("true".equalsIgnoreCase(v)) return ERROR;
        throw new IllegalArgumentException("Unknown rule level: " + value);
    }
}
