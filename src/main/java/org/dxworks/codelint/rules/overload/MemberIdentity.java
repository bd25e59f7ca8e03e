package org.dxworks.codelint.rules.overload;

import java.util.Objects;

public class MemberIdentity {
    private final String name;
    private final boolean isStatic;
    private final boolean callSignature;
    private final MemberNameType type;

    public MemberIdentity(String name, boolean isStatic, boolean callSignature, MemberNameType type) {
        this.name = Objects.requireNonNull(name);
        this.isStatic = isStatic;
        this.callSignature = callSignature;
        this.type = Objects.requireNonNull(type);
    }

    public static MemberIdentity normal(String name) {
        return new MemberIdentity(name, false, false, MemberNameType.NORMAL);
    }

    public String getName() {
        return name;
    }

    public boolean isStatic() {
        return isStatic;
    }

    public boolean isCallSignature() {
        return callSignature;
    }

    public MemberNameType getType() {
        return type;
    }

    /**
     * Name as shown in messages, e.g. {@code static foo}.
     */
    public String displayName() {
        return (isStatic ? "static " : "") + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemberIdentity)) return false;
        MemberIdentity that = (MemberIdentity) o;
        return isStatic == that.isStatic
                && callSignature == that.callSignature
                && name.equals(that.name)
                && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, isStatic, callSignature, type);
    }

    @Override
    public String toString() {
        return type + ":" + displayName() + (callSignature ? "()" : "");
    }
}
