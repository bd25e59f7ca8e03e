package org.dxworks.codelint.rules.overload;

import org.dxworks.codelint.linter.PropertyNames;
import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

class MemberNames {

    private MemberNames() {
    }

    static MemberIdentity identify(TSNode nameNode, byte[] source, boolean isStatic) {
        String text = TreeSitterHelper.getNodeText(source, nameNode);
        switch (nameNode.getType()) {
            case "private_property_identifier":
                return new MemberIdentity(text, isStatic, false, MemberNameType.PRIVATE);
            case "property_identifier":
            case "identifier":
                return new MemberIdentity(text, isStatic, false, MemberNameType.NORMAL);
            case "number":
                return fromPropertyKey(PropertyNames.numericKey(text), isStatic);
            case "string":
                return fromStringLiteral(text, isStatic);
            case "computed_property_name": {
                TSNode inner = TreeSitterHelper.getFirstNamedChild(nameNode);
                if (inner == null) {
                    return new MemberIdentity(text, isStatic, false, MemberNameType.EXPRESSION);
                }
                String innerText = TreeSitterHelper.getNodeText(source, inner);
                if ("string".equals(inner.getType())) return fromStringLiteral(innerText, isStatic);
                if ("number".equals(inner.getType())) {
                    return fromPropertyKey(PropertyNames.numericKey(innerText), isStatic);
                }
                return new MemberIdentity(innerText, isStatic, false, MemberNameType.EXPRESSION);
            }
            default:
                return new MemberIdentity(text, isStatic, false, MemberNameType.EXPRESSION);
        }
    }

    private static MemberIdentity fromStringLiteral(String literal, boolean isStatic) {
        return fromPropertyKey(PropertyNames.unquote(literal), isStatic);
    }

    private static MemberIdentity fromPropertyKey(String value, boolean isStatic) {
        if (TreeSitterHelper.isValidIdentifier(value)) {
            return new MemberIdentity(value, isStatic, false, MemberNameType.NORMAL);
        }
        return new MemberIdentity("\"" + value + "\"", isStatic, false, MemberNameType.QUOTED);
    }
}
