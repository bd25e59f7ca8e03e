package org.dxworks.codelint.rules.arraytype;

public enum TypeShape {
    /** Must be wrapped in parentheses to become an array element. */
    NEEDS_PARENS,
    /** A bracket array whose element is simple. */
    ARRAY_OF_SIMPLE,
    SIMPLE,
    OPAQUE
}
