package org.dxworks.codelint.rules.classes;

import org.dxworks.codelint.linter.PropertyNames;
import org.dxworks.codelint.linter.Rule;
import org.dxworks.codelint.linter.RuleContext;
import org.dxworks.codelint.linter.TreeSitterHelper;
import org.dxworks.codelint.model.SourceRange;
import org.dxworks.codelint.rules.classes.ClassMethodsUseThisOptions.InterfaceExemption;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reports instance methods, accessors and function-valued fields that never touch {@code this} or {@code super}.
 */
public class ClassMethodsUseThisRule implements Rule {

    public static final String NAME = "class-methods-use-this";

    static final String[] FUNCTION_VALUE_TYPES = {
            "function_expression", "function", "generator_function", "arrow_function"
    };

    // nodes that bind their own this
    private static final String[] THIS_SCOPES = {
            "function_expression", "function", "generator_function",
            "function_declaration", "generator_function_declaration", "class_static_block"
    };

    private static final Map<String, String> MESSAGES = Map.of(
            "missing_this", "Expected 'this' to be used by class {{name}}."
    );

    private final Set<String> exceptMethods;
    private final boolean enforceForClassFields;
    private final boolean ignoreOverrideMethods;
    private final InterfaceExemption interfaceExemption;

    public ClassMethodsUseThisRule() {
        this(new ClassMethodsUseThisOptions());
    }

    public ClassMethodsUseThisRule(ClassMethodsUseThisOptions options) {
        this.exceptMethods = new LinkedHashSet<>(options.exceptMethods);
        this.enforceForClassFields = options.isEnforceForClassFields();
        this.ignoreOverrideMethods = options.isIgnoreOverrideMethods();
        this.interfaceExemption = options.resolveInterfaceExemption();
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
        for (TSNode classBody : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(), "class_body")) {
            boolean implementsInterface = implementsInterface(TreeSitterHelper.getParent(classBody));
            for (TSNode member : TreeSitterHelper.getNamedChildren(classBody)) {
                checkMember(context, member, implementsInterface);
            }
        }
    }

    private void checkMember(RuleContext context, TSNode member, boolean implementsInterface) {
        TSNode function;
        if ("method_definition".equals(member.getType())) {
            function = member;
        } else if ("public_field_definition".equals(member.getType()) && enforceForClassFields) {
            function = TreeSitterHelper.getChildByFieldName(member, "value");
            if (!TreeSitterHelper.isNodeTypeOneOf(function, FUNCTION_VALUE_TYPES)) return;
        } else {
            return;
        }
        if (TreeSitterHelper.hasChildBeforeField(member, "name", "static")) return;

        TSNode nameNode = TreeSitterHelper.getChildByFieldName(member, "name");
        boolean privateName = nameNode != null && "private_property_identifier".equals(nameNode.getType());
        String staticName = PropertyNames.staticName(nameNode, context.getSourceBytes());
        if (function == member && !privateName && "constructor".equals(staticName)) return;
        if (isExcepted(context, nameNode, privateName, staticName)) return;
        if (ignoreOverrideMethods && TreeSitterHelper.hasChildBeforeField(member, "name", "override_modifier")) return;
        if (implementsInterface && isExemptForInterface(context, member)) return;
        if (usesThis(function)) return;

        TSNode head = TreeSitterHelper.getChildByFieldName(function, "parameters");
        if (head == null) head = TreeSitterHelper.getChildByFieldName(function, "parameter");
        SourceRange range = head != null ? SourceRange.between(member, head) : SourceRange.of(member);
        context.report(range, "missing_this", Map.of("name", describe(context, member, function, nameNode, staticName)));
    }

    private boolean isExcepted(RuleContext context, TSNode nameNode, boolean privateName, String staticName) {
        if (exceptMethods.isEmpty() || nameNode == null) return false;
        if ("computed_property_name".equals(nameNode.getType())) return false;
        String key = privateName ? context.getText(nameNode) : staticName;
        return key != null && exceptMethods.contains(key);
    }

    private boolean isExemptForInterface(RuleContext context, TSNode member) {
        switch (interfaceExemption) {
            case ALL_MEMBERS:
                return true;
            case PUBLIC_MEMBERS: {
                TSNode accessibility = findBeforeName(member, "accessibility_modifier");
                return accessibility == null || "public".equals(context.getText(accessibility));
            }
            default:
                return false;
        }
    }

    private static boolean implementsInterface(TSNode classNode) {
        TSNode heritage = TreeSitterHelper.findFirstChild(classNode, "class_heritage");
        return heritage != null && TreeSitterHelper.findFirstChild(heritage, "implements_clause") != null;
    }

    private static TSNode findBeforeName(TSNode member, String type) {
        for (int i = 0; i < member.getChildCount(); i++) {
            if ("name".equals(member.getFieldNameForChild(i))) return null;
            TSNode child = member.getChild(i);
            if (!TreeSitterHelper.isNull(child) && type.equals(child.getType())) return child;
        }
        return null;
    }

    /**
     * Looks for {@code this} or {@code super} in the function's own scope. Arrow functions share it, other
     * functions, static blocks and the bodies of nested class members do not, although computed member names do.
     */
    static boolean usesThis(TSNode function) {
        Deque<TSNode> stack = new ArrayDeque<>();
        for (TSNode child : TreeSitterHelper.getNamedChildren(function)) {
            if (!TreeSitterHelper.isFieldOfParent(child, "name")) stack.push(child);
        }
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            String type = node.getType();
            if ("this".equals(type) || "super".equals(type)) return true;
            if (TreeSitterHelper.isTypeOneOf(type, THIS_SCOPES)) continue;
            if ("method_definition".equals(type) || "public_field_definition".equals(type)) {
                TSNode name = TreeSitterHelper.getChildByFieldName(node, "name");
                if (name != null) stack.push(name);
                continue;
            }
            for (TSNode child : TreeSitterHelper.getNamedChildren(node)) {
                stack.push(child);
            }
        }
        return false;
    }

    /**
     * Builds names such as {@code method 'foo'}, {@code private getter #bar} or {@code generator method}.
     */
    private static String describe(RuleContext context, TSNode member, TSNode function, TSNode nameNode,
                                   String staticName) {
        List<String> tokens = new ArrayList<>();
        boolean privateName = nameNode != null && "private_property_identifier".equals(nameNode.getType());
        if (privateName) tokens.add("private");
        boolean method = function == member;
        boolean async = method
                ? TreeSitterHelper.hasChildBeforeField(member, "name", "async")
                : TreeSitterHelper.findFirstChildToken(function, "async") != null;
        boolean generator = method
                ? TreeSitterHelper.hasChildBeforeField(member, "name", "*")
                : "generator_function".equals(function.getType());
        if (async) tokens.add("async");
        if (generator) tokens.add("generator");
        if (method && TreeSitterHelper.hasChildBeforeField(member, "name", "get")) {
            tokens.add("getter");
        } else if (method && TreeSitterHelper.hasChildBeforeField(member, "name", "set")) {
            tokens.add("setter");
        } else {
            tokens.add("method");
        }
        if (privateName) {
            tokens.add(context.getText(nameNode));
        } else if (staticName != null) {
            tokens.add("'" + staticName + "'");
        }
        return String.join(" ", tokens);
    }
}
