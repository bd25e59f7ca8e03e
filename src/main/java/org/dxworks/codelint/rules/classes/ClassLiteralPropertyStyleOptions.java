package org.dxworks.codelint.rules.classes;

public class ClassLiteralPropertyStyleOptions {
    public LiteralStyle style;

    public ClassLiteralPropertyStyleOptions() {
    }

    public ClassLiteralPropertyStyleOptions(LiteralStyle style) {
        this.style = style;
    }

    public LiteralStyle resolveStyle() {
        return style != null ? style : LiteralStyle.FIELDS;
    }
}
