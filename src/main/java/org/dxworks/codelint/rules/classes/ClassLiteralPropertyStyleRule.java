package org.dxworks.codelint.rules.classes;

import org.dxworks.codelint.linter.RangeRewriter;
import org.dxworks.codelint.linter.Rule;
import org.dxworks.codelint.linter.RuleContext;
import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Enforces one way of exposing literal values from classes: readonly fields or getters that return the literal.
 */
public class ClassLiteralPropertyStyleRule implements Rule {

    public static final String NAME = "class-literal-property-style";

    private static final String[] LITERAL_TYPES = {
            "string", "number", "true", "false", "null", "regex"
    };

    private static final Map<String, String> MESSAGES = Map.of(
            "prefer_field_style", "Literals should be exposed using readonly fields.",
            "prefer_field_style_suggestion", "Replace the literals with readonly fields.",
            "prefer_getter_style", "Literals should be exposed using getters.",
            "prefer_getter_style_suggestion", "Replace the literals with getters."
    );

    private final LiteralStyle style;

    public ClassLiteralPropertyStyleRule() {
        this(new ClassLiteralPropertyStyleOptions());
    }

    public ClassLiteralPropertyStyleRule(ClassLiteralPropertyStyleOptions options) {
        this.style = options.resolveStyle();
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
        if (style == LiteralStyle.FIELDS) {
            for (TSNode method : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(), "method_definition")) {
                checkGetter(context, method);
            }
        } else {
            for (TSNode field : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(), "public_field_definition")) {
                checkReadonlyField(context, field);
            }
        }
    }

    private void checkGetter(RuleContext context, TSNode method) {
        if (!TreeSitterHelper.hasChildBeforeField(method, "name", "get")) return;
        TSNode statement = TreeSitterHelper.getFirstNamedChild(TreeSitterHelper.getChildByFieldName(method, "body"));
        if (statement == null || !"return_statement".equals(statement.getType())) return;
        TSNode literal = TreeSitterHelper.getFirstNamedChild(statement);
        if (!isSupportedLiteral(literal)) return;

        TSNode name = TreeSitterHelper.getChildByFieldName(method, "name");
        String replacement = modifiers(context, method, "readonly") + context.getText(name) + " = " + context.getText(literal) + ";";
        context.report(keyNode(name), "prefer_field_style", Collections.emptyMap(), null, List.of(
                context.suggestion("prefer_field_style_suggestion", Collections.emptyMap(),
                        new RangeRewriter().replaceNode(method, replacement))));
    }

    private void checkReadonlyField(RuleContext context, TSNode field) {
        if (!isReadonlyAndNotDeclare(field)) return;
        TSNode literal = TreeSitterHelper.getChildByFieldName(field, "value");
        if (!isSupportedLiteral(literal)) return;

        TSNode name = TreeSitterHelper.getChildByFieldName(field, "name");
        String replacement = modifiers(context, field, "get") + context.getText(name)
                + "() { return " + context.getText(literal) + "; }";
        // the field's terminating semicolon is outside the node
        context.report(keyNode(name), "prefer_getter_style", Collections.emptyMap(), null, List.of(
                context.suggestion("prefer_getter_style_suggestion", Collections.emptyMap(),
                        new RangeRewriter().replaceRange(field.getStartByte(), fieldEnd(context, field), replacement))));
    }

    /**
     * The key expression itself for computed names, so {@code [value]} is reported at {@code value}.
     */
    private static TSNode keyNode(TSNode name) {
        if ("computed_property_name".equals(name.getType())) {
            TSNode inner = TreeSitterHelper.getFirstNamedChild(name);
            if (inner != null) return inner;
        }
        return name;
    }

    private static boolean isReadonlyAndNotDeclare(TSNode field) {
        for (int i = 0; i < field.getChildCount(); i++) {
            if ("name".equals(field.getFieldNameForChild(i))) return false;
            String type = field.getChild(i).getType();
            if ("declare".equals(type)) return false;
            if ("readonly".equals(type)) return true;
        }
        return false;
    }

    static boolean isSupportedLiteral(TSNode node) {
        if (TreeSitterHelper.isNull(node)) return false;
        if (TreeSitterHelper.isNodeTypeOneOf(node, LITERAL_TYPES)) return true;
        if ("template_string".equals(node.getType())) return isSimpleTemplate(node);
        if ("call_expression".equals(node.getType())) {
            TSNode arguments = TreeSitterHelper.getChildByFieldName(node, "arguments");
            return arguments != null && "template_string".equals(arguments.getType()) && isSimpleTemplate(arguments);
        }
        return false;
    }

    private static boolean isSimpleTemplate(TSNode template) {
        return TreeSitterHelper.findFirstChild(template, "template_substitution") == null;
    }

    /**
     * Accessibility and {@code static} of the member followed by {@code keyword}, e.g. {@code public static readonly }.
     */
    private static String modifiers(RuleContext context, TSNode member, String keyword) {
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < member.getChildCount(); i++) {
            if ("name".equals(member.getFieldNameForChild(i))) break;
            TSNode child = member.getChild(i);
            if ("accessibility_modifier".equals(child.getType())) result.append(context.getText(child));
        }
        if (TreeSitterHelper.hasChildBeforeField(member, "name", "static")) result.append(" static");
        result.append(' ').append(keyword).append(' ');
        return result.toString().stripLeading();
    }

    private static int fieldEnd(RuleContext context, TSNode field) {
        byte[] source = context.getSourceBytes();
        int end = field.getEndByte();
        return end < source.length && source[end] == ';' ? end + 1 : end;
    }
}
