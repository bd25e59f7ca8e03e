package org.dxworks.codelint.linter;

import org.dxworks.codelint.model.FixResult;
import org.dxworks.codelint.model.Violation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterTypescript;

import java.lang.ref.Reference;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Parses TypeScript with tree-sitter and runs the configured rules over the tree.
 * Instances are immutable and may be shared; every call parses with its own parser.
 */
public class Linter {

    private static final Logger LOG = LoggerFactory.getLogger(Linter.class);

    public static final int MAX_FIX_PASSES = 10;

    private static final Comparator<Violation> BY_LOCATION = Comparator
            .comparingInt((Violation v) -> v.range.startByte)
            .thenComparingInt(v -> v.range.endByte);

    private final List<ConfiguredRule> rules;
    private final FixApplier fixApplier = new FixApplier();

    public Linter(List<ConfiguredRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public List<ConfiguredRule> getRules() {
        return rules;
    }

    public List<Violation> lint(String filePath, String source) {
        TSParser parser = new TSParser();
        parser.setLanguage(language());
        TSTree tree = parser.parseString(null, source);
        TSNode rootNode = tree.getRootNode();
        if (rootNode.hasError()) {
            LOG.debug("{} has syntax errors; results may be partial", filePath);
        }

        List<Violation> violations = new ArrayList<>();
        for (ConfiguredRule configured : rules) {
            if (!configured.isEnabled()) continue;
            RuleContext context = new RuleContext(filePath, source, rootNode, configured.rule, configured.level);
            configured.rule.check(context);
            LOG.debug("{}: {} reported {} violation(s)", filePath, configured.rule.name(), context.getViolations().size());
            violations.addAll(context.getViolations());
        }
        // nodes borrow from the tree; keep it alive until every rule is done
        Reference.reachabilityFence(tree);
        // stable: reports at the same offset keep rule order
        violations.sort(BY_LOCATION);
        return violations;
    }

    /**
     * Lints and applies fixes until nothing more can be fixed or {@link #MAX_FIX_PASSES} is reached.
     */
    public FixResult fix(String filePath, String source) {
        FixResult result = new FixResult();
        String current = source;
        List<Violation> violations = lint(filePath, current);
        while (result.passes < MAX_FIX_PASSES) {
            FixApplier.Pass pass = fixApplier.apply(current, violations);
            if (pass.applied == 0) break;
            result.passes++;
            result.appliedFixes += pass.applied;
            current = pass.output;
            LOG.debug("{}: fix pass {} applied {} fix(es)", filePath, result.passes, pass.applied);
            violations = lint(filePath, current);
        }
        if (result.passes == MAX_FIX_PASSES) {
            LOG.warn("{}: stopped fixing after {} passes", filePath, MAX_FIX_PASSES);
        }
        result.output = current;
        result.remaining = violations;
        return result;
    }

    private static TSLanguage language() {
        return new TreeSitterTypescript();
    }
}
