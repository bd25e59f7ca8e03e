package org.dxworks.codelint.rules.arraytype;

import org.dxworks.codelint.linter.RangeRewriter;
import org.dxworks.codelint.linter.Rule;
import org.dxworks.codelint.linter.RuleContext;
import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Enforces either {@code T[]} or {@code Array<T>} for array types, separately for readonly arrays.
 */
public class ArrayTypeRule implements Rule {

    public static final String NAME = "array-type";

    private static final String ARRAY = "Array";
    private static final String READONLY_ARRAY = "ReadonlyArray";

    private static final Map<String, String> MESSAGES = Map.of(
            "error_string_generic",
            "Array type using '{{readonly_prefix}}{{type}}[]' is forbidden. Use '{{class_name}}<{{type}}>' instead.",
            "error_string_generic_simple",
            "Array type using '{{readonly_prefix}}{{type}}[]' is forbidden for non-simple types. Use '{{class_name}}<{{type}}>' instead.",
            "error_string_array",
            "Array type using '{{class_name}}<{{type}}>' is forbidden. Use '{{readonly_prefix}}{{type}}[]' instead.",
            "error_string_array_simple",
            "Array type using '{{class_name}}<{{type}}>' is forbidden for simple types. Use '{{readonly_prefix}}{{type}}[]' instead."
    );

    private final ArrayOption defaultOption;
    private final ArrayOption readonlyOption;

    public ArrayTypeRule() {
        this(new ArrayTypeOptions());
    }

    public ArrayTypeRule(ArrayTypeOptions options) {
        this.defaultOption = options.resolveDefault();
        this.readonlyOption = options.resolveReadonly();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, String> messages() {
        return MESSAGES;
    }

    @Override
    public void check(RuleContext context) {
        for (TSNode node : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(),
                "array_type", "generic_type", "type_identifier")) {
            switch (node.getType()) {
                case "array_type":
                    checkBracketForm(context, node);
                    break;
                case "generic_type": {
                    TSNode name = TreeSitterHelper.getChildByFieldName(node, "name");
                    if (TreeSitterHelper.isNodeTypeOneOf(name, "type_identifier") && isArrayName(context.getText(name))
                            && !isHeritage(node)) {
                        checkGenericForm(context, node, context.getText(name), TypeShapes.typeArguments(node));
                    }
                    break;
                }
                default:
                    if (isArrayName(context.getText(node)) && isBareTypeReference(node) && !isHeritage(node)) {
                        checkGenericForm(context, node, context.getText(node), Collections.emptyList());
                    }
            }
        }
    }

    private void checkBracketForm(RuleContext context, TSNode node) {
        TSNode parent = TreeSitterHelper.getParent(node);
        boolean isReadonly = TreeSitterHelper.isNodeTypeOneOf(parent, "readonly_type");
        ArrayOption option = isReadonly ? readonlyOption : defaultOption;
        TSNode element = TreeSitterHelper.getFirstNamedChild(node);
        if (element == null) return;

        if (option == ArrayOption.ARRAY
                || (option == ArrayOption.ARRAY_SIMPLE && TypeShapes.isSimpleType(element, context.getSourceBytes()))) {
            return;
        }

        TSNode errorNode = isReadonly ? parent : node;
        TSNode inner = TreeSitterHelper.skipParenthesizedTypes(element);
        String className = isReadonly ? READONLY_ARRAY : ARRAY;

        Map<String, String> data = new LinkedHashMap<>();
        data.put("class_name", className);
        data.put("readonly_prefix", isReadonly ? "readonly " : "");
        data.put("type", messageType(context, inner));

        RangeRewriter fix = new RangeRewriter()
                .replaceRange(errorNode.getStartByte(), inner.getStartByte(), className + "<")
                .replaceRange(inner.getEndByte(), errorNode.getEndByte(), ">");
        String messageId = option == ArrayOption.GENERIC ? "error_string_generic" : "error_string_generic_simple";
        context.report(errorNode, messageId, data, fix);
    }

    private void checkGenericForm(RuleContext context, TSNode node, String className, List<TSNode> typeArguments) {
        boolean isReadonly = READONLY_ARRAY.equals(className);
        ArrayOption option = isReadonly ? readonlyOption : defaultOption;
        if (option == ArrayOption.GENERIC) return;

        String readonlyPrefix = isReadonly ? "readonly " : "";
        String messageId = option == ArrayOption.ARRAY ? "error_string_array" : "error_string_array_simple";
        Map<String, String> data = new LinkedHashMap<>();
        data.put("class_name", className);
        data.put("readonly_prefix", readonlyPrefix);

        if (typeArguments.isEmpty()) {
            data.put("type", "any");
            context.report(node, messageId, data, new RangeRewriter().replaceNode(node, readonlyPrefix + "any[]"));
            return;
        }
        if (typeArguments.size() != 1) return;

        byte[] source = context.getSourceBytes();
        TSNode type = TreeSitterHelper.skipParenthesizedTypes(typeArguments.get(0));
        if (option == ArrayOption.ARRAY_SIMPLE && !TypeShapes.isSimpleType(type, source)) return;

        boolean typeParens = TypeShapes.typeNeedsParentheses(type, source);
        boolean parentParens = isReadonly
                && TreeSitterHelper.isNodeTypeOneOf(TreeSitterHelper.getParent(node), "array_type");
        String start = (parentParens ? "(" : "") + readonlyPrefix + (typeParens ? "(" : "");
        String end = (typeParens ? ")" : "") + "[]" + (parentParens ? ")" : "");

        data.put("type", messageType(context, type));
        RangeRewriter fix = new RangeRewriter()
                .replaceRange(node.getStartByte(), type.getStartByte(), start)
                .replaceRange(type.getEndByte(), node.getEndByte(), end);
        context.report(node, messageId, data, fix);
    }

    private static String messageType(RuleContext context, TSNode type) {
        return TypeShapes.isSimpleType(type, context.getSourceBytes()) ? context.getText(type) : "T";
    }

    private static boolean isArrayName(String text) {
        return ARRAY.equals(text) || READONLY_ARRAY.equals(text);
    }

    // `interface X extends Array<T>` and `implements` clauses name a base type, not an array type
    private static boolean isHeritage(TSNode node) {
        return TreeSitterHelper.isNodeTypeOneOf(TreeSitterHelper.getParent(node), "extends_type_clause", "implements_clause");
    }

    /**
     * A type name used as a type on its own, not as the head of a generic, a segment of a dotted name
     * or the name being declared.
     */
    private static boolean isBareTypeReference(TSNode node) {
        TSNode parent = TreeSitterHelper.getParent(node);
        if (parent == null) return false;
        if (TreeSitterHelper.isNodeTypeOneOf(parent, "generic_type", "nested_type_identifier", "type_parameter")) {
            return false;
        }
        return !TreeSitterHelper.isFieldOfParent(node, "name");
    }
}
