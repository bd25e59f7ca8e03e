package org.dxworks.codelint.rules.typestyle;

import org.dxworks.codelint.linter.RangeRewriter;
import org.dxworks.codelint.linter.Rule;
import org.dxworks.codelint.linter.RuleContext;
import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

import java.util.Collections;
import java.util.Map;

/**
 * Keeps the type arguments of {@code new Foo<T>()} initializers on one side: the constructor call or the
 * type annotation.
 */
public class ConsistentGenericConstructorsRule implements Rule {

    public static final String NAME = "consistent-generic-constructors";

    private static final String[] DECLARATION_TYPES = {
            "variable_declarator", "public_field_definition", "required_parameter", "optional_parameter"
    };

    private static final Map<String, String> MESSAGES = Map.of(
            "prefer_type_annotation",
            "The generic type arguments should be specified as part of the type annotation.",
            "prefer_constructor",
            "The generic type arguments should be specified as part of the constructor type arguments."
    );

    private final GenericConstructorStyle style;

    public ConsistentGenericConstructorsRule() {
        this(new ConsistentGenericConstructorsOptions());
    }

    public ConsistentGenericConstructorsRule(ConsistentGenericConstructorsOptions options) {
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
        for (TSNode node : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(), DECLARATION_TYPES)) {
            TSNode value = TreeSitterHelper.getChildByFieldName(node, "value");
            if (value == null || !"new_expression".equals(value.getType())) continue;
            TSNode constructor = TreeSitterHelper.getChildByFieldName(value, "constructor");
            if (constructor == null || !"identifier".equals(constructor.getType())) continue;

            TSNode name = node.getType().endsWith("_parameter")
                    ? TreeSitterHelper.getChildByFieldName(node, "pattern")
                    : TreeSitterHelper.getChildByFieldName(node, "name");
            TSNode annotation = TreeSitterHelper.getChildByFieldName(node, "type");
            if (style == GenericConstructorStyle.TYPE_ANNOTATION) {
                checkPreferTypeAnnotation(context, node, name, annotation, value, constructor);
            } else {
                checkPreferConstructor(context, node, annotation, value, constructor);
            }
        }
    }

    private void checkPreferTypeAnnotation(RuleContext context, TSNode node, TSNode name, TSNode annotation,
                                           TSNode value, TSNode constructor) {
        if (annotation != null || name == null) return;
        TSNode typeArguments = TreeSitterHelper.getChildByFieldName(value, "type_arguments");
        if (typeArguments == null) return;

        String typeAnnotation = context.getText(constructor) + context.getText(typeArguments);
        RangeRewriter fix = new RangeRewriter()
                .remove(typeArguments.getStartByte(), typeArguments.getEndByte())
                .replaceRange(name.getEndByte(), name.getEndByte(), ": " + typeAnnotation);
        context.report(node, "prefer_type_annotation", Collections.emptyMap(), fix);
    }

    private void checkPreferConstructor(RuleContext context, TSNode node, TSNode annotation,
                                        TSNode value, TSNode constructor) {
        if (annotation == null || TreeSitterHelper.getChildByFieldName(value, "type_arguments") != null) return;
        TSNode declared = TreeSitterHelper.getFirstNamedChild(annotation);
        if (declared == null || !"generic_type".equals(declared.getType())) return;
        TSNode declaredName = TreeSitterHelper.getChildByFieldName(declared, "name");
        if (declaredName == null || !"type_identifier".equals(declaredName.getType())
                || !context.getText(declaredName).equals(context.getText(constructor))) return;
        TSNode typeArguments = TreeSitterHelper.getChildByFieldName(declared, "type_arguments");
        if (typeArguments == null) return;

        // comments around the annotated type move along with its arguments
        StringBuilder inserted = new StringBuilder();
        for (TSNode comment : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(), "comment")) {
            if (within(comment, annotation) && !within(comment, typeArguments)) {
                inserted.append(context.getText(comment));
            }
        }
        inserted.append(context.getText(typeArguments));
        if (TreeSitterHelper.getChildByFieldName(value, "arguments") == null) {
            inserted.append("()");
        }
        RangeRewriter fix = new RangeRewriter()
                .remove(annotation.getStartByte(), annotation.getEndByte())
                .replaceRange(constructor.getEndByte(), constructor.getEndByte(), inserted.toString());
        context.report(node, "prefer_constructor", Collections.emptyMap(), fix);
    }

    private static boolean within(TSNode inner, TSNode outer) {
        return inner.getStartByte() >= outer.getStartByte() && inner.getEndByte() <= outer.getEndByte();
    }
}
