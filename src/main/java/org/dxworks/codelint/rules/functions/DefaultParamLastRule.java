package org.dxworks.codelint.rules.functions;

import org.dxworks.codelint.linter.Rule;
import org.dxworks.codelint.linter.RuleContext;
import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reports default and optional parameters that are followed by a required one.
 */
public class DefaultParamLastRule implements Rule {

    public static final String NAME = "default-param-last";

    private static final String[] FUNCTION_TYPES = {
            "function_declaration", "function_expression", "function", "generator_function_declaration",
            "generator_function", "method_definition", "arrow_function"
    };

    private static final Map<String, String> MESSAGES = Map.of(
            "should_be_last", "Default parameters should be last."
    );

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
        for (TSNode function : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(), FUNCTION_TYPES)) {
            List<TSNode> params = TreeSitterHelper.getNamedChildren(TreeSitterHelper.getChildByFieldName(function, "parameters"));
            boolean seenPlain = false;
            for (int i = params.size() - 1; i >= 0; i--) {
                TSNode param = params.get(i);
                if (isPlain(param)) {
                    seenPlain = true;
                } else if (seenPlain && isDefaultOrOptional(param)) {
                    context.report(param, "should_be_last", Collections.emptyMap());
                }
            }
        }
    }

    private static boolean isDefaultOrOptional(TSNode param) {
        return "optional_parameter".equals(param.getType()) || TreeSitterHelper.getChildByFieldName(param, "value") != null;
    }

    private static boolean isPlain(TSNode param) {
        if (isDefaultOrOptional(param)) return false;
        TSNode pattern = TreeSitterHelper.getChildByFieldName(param, "pattern");
        return pattern == null || !"rest_pattern".equals(pattern.getType());
    }
}
