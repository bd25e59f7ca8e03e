package org.dxworks.codelint.rules.comments;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.regex.Pattern;

/**
 * How one {@code @ts-} directive is treated. Immutable.
 */
public class DirectivePolicy {

    public enum Mode {
        ALLOWED,
        BANNED,
        /** Allowed only when followed by a long enough description, optionally matching a format. */
        ALLOW_WITH_DESCRIPTION
    }

    static final String ALLOW_WITH_DESCRIPTION = "allow-with-description";

    private final Mode mode;
    private final Pattern descriptionFormat;

    private DirectivePolicy(Mode mode, Pattern descriptionFormat) {
        this.mode = mode;
        this.descriptionFormat = descriptionFormat;
    }

    public static DirectivePolicy allowed() {
        return new DirectivePolicy(Mode.ALLOWED, null);
    }

    public static DirectivePolicy banned() {
        return new DirectivePolicy(Mode.BANNED, null);
    }

    public static DirectivePolicy withDescription(Pattern format) {
        return new DirectivePolicy(Mode.ALLOW_WITH_DESCRIPTION, format);
    }

    /**
     * Reads {@code true}, {@code false}, {@code "allow-with-description"} or {@code {descriptionFormat: regex}}.
     */
    static DirectivePolicy parse(String directive, JsonNode value, DirectivePolicy fallback) {
        if (value == null || value.isNull() || value.isMissingNode()) return fallback;
        if (value.isBoolean()) return value.booleanValue() ? banned() : allowed();
        if (value.isTextual() && ALLOW_WITH_DESCRIPTION.equals(value.textValue())) return withDescription(null);
        if (value.isObject()) {
            JsonNode format = value.has("descriptionFormat") ? value.get("descriptionFormat") : value.get("description_format");
            if (format != null && format.isTextual()) {
                // PatternSyntaxException is an IllegalArgumentException
                return withDescription(Pattern.compile(format.textValue()));
            }
        }
        throw new IllegalArgumentException("'" + directive + "' must be a boolean, \"" + ALLOW_WITH_DESCRIPTION
                + "\" or {descriptionFormat: <regex>}, got " + value);
    }

    public Mode getMode() {
        return mode;
    }

    public Pattern getDescriptionFormat() {
        return descriptionFormat;
    }
}
