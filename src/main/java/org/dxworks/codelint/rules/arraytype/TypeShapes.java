package org.dxworks.codelint.rules.arraytype;

import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

import java.util.List;

/**
 * Pure shape predicates over type nodes. Unknown node kinds are neither simple nor in need of parentheses.
 */
public class TypeShapes {

    private TypeShapes() {
    }

    public static TypeShape classify(TSNode node, byte[] source) {
        if (typeNeedsParentheses(node, source)) return TypeShape.NEEDS_PARENS;
        if (!isSimpleType(node, source)) return TypeShape.OPAQUE;
        TSNode inner = TreeSitterHelper.skipParenthesizedTypes(node);
        return "array_type".equals(inner.getType()) ? TypeShape.ARRAY_OF_SIMPLE : TypeShape.SIMPLE;
    }

    public static boolean isSimpleType(TSNode node, byte[] source) {
        TSNode type = TreeSitterHelper.skipParenthesizedTypes(node);
        if (TreeSitterHelper.isNull(type)) return false;
        switch (type.getType()) {
            case "type_identifier":
            case "nested_type_identifier":
            case "predefined_type":
            case "this_type":
                return true;
            case "literal_type":
                return TreeSitterHelper.isNodeTypeOneOf(TreeSitterHelper.getFirstNamedChild(type), "null", "undefined");
            case "array_type":
                return isSimpleType(TreeSitterHelper.getFirstNamedChild(type), source);
            case "generic_type": {
                TSNode name = TreeSitterHelper.getChildByFieldName(type, "name");
                if (!"type_identifier".equals(name == null ? null : name.getType())
                        || !"Array".equals(TreeSitterHelper.getNodeText(source, name))) {
                    return false;
                }
                List<TSNode> args = typeArguments(type);
                if (args.isEmpty()) return true;
                return args.size() == 1 && isSimpleType(args.get(0), source);
            }
            default:
                return false;
        }
    }

    public static boolean typeNeedsParentheses(TSNode node, byte[] source) {
        TSNode type = TreeSitterHelper.skipParenthesizedTypes(node);
        if (TreeSitterHelper.isNull(type)) return false;
        switch (type.getType()) {
            case "union_type":
            case "intersection_type":
            case "function_type":
            case "constructor_type":
            case "infer_type":
            case "conditional_type":
            case "index_type_query":
            case "readonly_type":
                return true;
            case "type_identifier":
                return "ReadonlyArray".equals(TreeSitterHelper.getNodeText(source, type));
            case "generic_type":
                return typeNeedsParentheses(TreeSitterHelper.getChildByFieldName(type, "name"), source);
            default:
                return false;
        }
    }

    static List<TSNode> typeArguments(TSNode genericType) {
        return TreeSitterHelper.getNamedChildren(TreeSitterHelper.getChildByFieldName(genericType, "type_arguments"));
    }
}
