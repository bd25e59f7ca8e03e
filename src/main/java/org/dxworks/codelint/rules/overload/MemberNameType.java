package org.dxworks.codelint.rules.overload;

/**
 * How a member name was written. Two members only match if their names were written the same way,
 * so {@code #x} and {@code '#x'} stay distinct.
 */
public enum MemberNameType {
    PRIVATE,
    QUOTED,
    NORMAL,
    EXPRESSION
}
