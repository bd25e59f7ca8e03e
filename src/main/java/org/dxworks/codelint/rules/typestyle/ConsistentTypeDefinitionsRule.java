package org.dxworks.codelint.rules.typestyle;

import org.dxworks.codelint.linter.RangeRewriter;
import org.dxworks.codelint.linter.Rule;
import org.dxworks.codelint.linter.RuleContext;
import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

import java.util.Collections;
import java.util.Map;

/**
 * Enforces {@code interface} or {@code type} for object type definitions.
 */
public class ConsistentTypeDefinitionsRule implements Rule {

    public static final String NAME = "consistent-type-definitions";

    private static final Map<String, String> MESSAGES = Map.of(
            "interface_over_type", "Use an `interface` instead of a `type`.",
            "type_over_interface", "Use a `type` instead of an `interface`."
    );

    private final TypeDefinitionStyle style;

    public ConsistentTypeDefinitionsRule() {
        this(new ConsistentTypeDefinitionsOptions());
    }

    public ConsistentTypeDefinitionsRule(ConsistentTypeDefinitionsOptions options) {
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
        if (style == TypeDefinitionStyle.INTERFACE) {
            for (TSNode alias : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(), "type_alias_declaration")) {
                checkTypeAlias(context, alias);
            }
        } else {
            for (TSNode declaration : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(), "interface_declaration")) {
                checkInterface(context, declaration);
            }
        }
    }

    private void checkTypeAlias(RuleContext context, TSNode alias) {
        TSNode value = TreeSitterHelper.getChildByFieldName(alias, "value");
        if (!TypeLiterals.isTypeLiteral(value)) return;
        TSNode name = TreeSitterHelper.getChildByFieldName(alias, "name");

        RangeRewriter fix = new RangeRewriter();
        TSNode keyword = TreeSitterHelper.findFirstChildToken(alias, "type");
        if (keyword != null) {
            fix.replaceNode(keyword, "interface");
            fix.replaceRange(head(alias, name).getEndByte(), value.getStartByte(), " ");
        }
        TSNode semicolon = TreeSitterHelper.findFirstChildToken(alias, ";");
        if (semicolon != null && semicolon.getStartByte() >= value.getEndByte()) {
            fix.remove(semicolon.getStartByte(), semicolon.getEndByte());
        }
        context.report(name, "interface_over_type", Collections.emptyMap(), fix);
    }

    private void checkInterface(RuleContext context, TSNode declaration) {
        TSNode name = TreeSitterHelper.getChildByFieldName(declaration, "name");
        TSNode body = TypeLiterals.interfaceBody(declaration);
        if (body == null || isInsideGlobalAugmentation(declaration)) {
            context.report(name, "type_over_interface", Collections.emptyMap());
            return;
        }

        RangeRewriter fix = new RangeRewriter();
        TSNode keyword = TreeSitterHelper.findFirstChildToken(declaration, "interface");
        if (keyword != null) {
            fix.replaceNode(keyword, "type");
            fix.replaceRange(head(declaration, name).getEndByte(), body.getStartByte(), " = ");
        }
        StringBuilder appended = new StringBuilder();
        TSNode heritage = TreeSitterHelper.findFirstChild(declaration, "extends_type_clause");
        for (TSNode type : TreeSitterHelper.getNamedChildren(heritage)) {
            appended.append(" & ").append(context.getText(type));
        }
        TSNode parent = TreeSitterHelper.getParent(declaration);
        if (parent != null && "export_statement".equals(parent.getType())
                && TreeSitterHelper.findFirstChildToken(parent, "default") != null) {
            fix.remove(parent.getStartByte(), declaration.getStartByte());
            appended.append("\nexport default ").append(context.getText(name));
        }
        if (appended.length() > 0) {
            fix.replaceRange(body.getEndByte(), body.getEndByte(), appended.toString());
        }
        context.report(name, "type_over_interface", Collections.emptyMap(), fix);
    }

    /**
     * Type parameters if present, otherwise the name: the last node before the body.
     */
    private static TSNode head(TSNode declaration, TSNode name) {
        TSNode typeParameters = TreeSitterHelper.getChildByFieldName(declaration, "type_parameters");
        return typeParameters != null ? typeParameters : name;
    }

    /**
     * Declarations in {@code declare global { ... }} merge with globals and cannot become aliases.
     */
    private static boolean isInsideGlobalAugmentation(TSNode node) {
        for (TSNode current = TreeSitterHelper.getParent(node); current != null; current = TreeSitterHelper.getParent(current)) {
            if ("ambient_declaration".equals(current.getType())) {
                TSNode second = current.getChildCount() > 1 ? current.getChild(1) : null;
                if (second != null && "global".equals(second.getType())) return true;
            }
        }
        return false;
    }
}
