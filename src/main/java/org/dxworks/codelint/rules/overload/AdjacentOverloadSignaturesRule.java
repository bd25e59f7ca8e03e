package org.dxworks.codelint.rules.overload;

import org.dxworks.codelint.linter.Rule;
import org.dxworks.codelint.linter.RuleContext;

import java.util.Map;

/**
 * Requires overloads of the same function or member to be declared next to each other.
 */
public class AdjacentOverloadSignaturesRule implements Rule {

    public static final String NAME = "adjacent-overload-signatures";

    private static final Map<String, String> MESSAGES = Map.of(
            "adjacent_signature", "All {{name}} signatures should be adjacent."
    );

    private final OverloadAdjacencyScanner scanner = new OverloadAdjacencyScanner();

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
        for (OverloadAdjacencyScanner.Misplaced misplaced : scanner.scan(context.getRootNode(), context.getSourceBytes())) {
            context.report(misplaced.node, "adjacent_signature", Map.of("name", misplaced.identity.displayName()));
        }
    }
}
