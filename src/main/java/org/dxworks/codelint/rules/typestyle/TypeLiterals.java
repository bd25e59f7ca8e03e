package org.dxworks.codelint.rules.typestyle;

import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

/**
 * Shape checks on object types shared by the type style rules.
 */
final class TypeLiterals {

    private TypeLiterals() {
    }

    /**
     * An {@code object_type} written as a type literal: not an interface body and not a mapped type.
     */
    static boolean isTypeLiteral(TSNode node) {
        if (TreeSitterHelper.isNull(node) || !"object_type".equals(node.getType())) return false;
        TSNode parent = TreeSitterHelper.getParent(node);
        if (parent != null && "interface_declaration".equals(parent.getType())
                && TreeSitterHelper.isFieldOfParent(node, "body")) {
            return false;
        }
        return !isMappedType(node);
    }

    static boolean isMappedType(TSNode node) {
        TSNode first = TreeSitterHelper.getFirstNamedChild(node);
        if (first == null || !"index_signature".equals(first.getType())) return false;
        for (int i = 0; i < first.getChildCount(); i++) {
            String type = first.getChild(i).getType();
            if ("]".equals(type)) return false;
            if ("mapped_type_clause".equals(type)) return true;
        }
        return false;
    }

    static TSNode interfaceBody(TSNode interfaceDeclaration) {
        return TreeSitterHelper.getChildByFieldName(interfaceDeclaration, "body");
    }
}
