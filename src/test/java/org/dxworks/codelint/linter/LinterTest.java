package org.dxworks.codelint.linter;

import org.dxworks.codelint.model.FixResult;
import org.dxworks.codelint.model.Violation;
import org.dxworks.codelint.rules.arraytype.ArrayTypeRule;
import org.dxworks.codelint.rules.bantypes.BanTypesRule;
import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinterTest {

    private static final String SOURCE = "let a: Array<String>;";

    @Test
    void violationsOfAllRulesAreSortedByPosition() {
        Linter linter = new Linter(List.of(
                new ConfiguredRule(new BanTypesRule(), RuleLevel.WARN),
                new ConfiguredRule(new ArrayTypeRule(), RuleLevel.ERROR)));

        List<Violation> violations = linter.lint("a.ts", SOURCE);

        assertEquals(2, violations.size());
        Violation arrayType = violations.get(0);
        assertEquals("array-type", arrayType.ruleName);
        assertEquals("error", arrayType.severity);
        assertEquals(1, arrayType.range.startLine);
        assertEquals(8, arrayType.range.startColumn);

        Violation banTypes = violations.get(1);
        assertEquals("ban-types", banTypes.ruleName);
        assertEquals("warn", banTypes.severity);
        assertEquals("banned_type_message", banTypes.messageId);
        assertEquals("Don't use `String` as a type. Use string instead", banTypes.message);
        assertEquals(14, banTypes.range.startColumn);
        assertEquals(13, banTypes.range.startByte);
        assertEquals(19, banTypes.range.endByte);
    }

    @Test
    void disabledRuleDoesNotRun() {
        Linter linter = new Linter(List.of(
                new ConfiguredRule(new BanTypesRule(), RuleLevel.OFF),
                new ConfiguredRule(new ArrayTypeRule(), RuleLevel.ERROR)));

        List<Violation> violations = linter.lint("a.ts", SOURCE);

        assertEquals(1, violations.size());
        assertEquals("array-type", violations.get(0).ruleName);
    }

    @Test
    void overlappingFixesAreAppliedOverSeveralPasses() {
        Linter linter = new Linter(List.of(
                new ConfiguredRule(new ArrayTypeRule(), RuleLevel.ERROR),
                new ConfiguredRule(new BanTypesRule(), RuleLevel.ERROR)));

        FixResult result = linter.fix("a.ts", SOURCE);

        assertEquals("let a: string[];", result.output);
        assertEquals(2, result.passes);
        assertEquals(2, result.appliedFixes);
        assertTrue(result.remaining.isEmpty());
        assertTrue(result.isChanged(SOURCE));
    }

    @Test
    void cleanSourceNeedsNoPass() {
        Linter linter = new Linter(List.of(new ConfiguredRule(new ArrayTypeRule(), RuleLevel.ERROR)));

        FixResult result = linter.fix("a.ts", "let a: string[];");

        assertEquals(0, result.passes);
        assertEquals("let a: string[];", result.output);
    }

    @Test
    void treeStaysValidWhileRulesRunAfterCollection() {
        Rule collecting = new Rule() {
            @Override
            public String name() {
                return "collecting";
            }

            @Override
            public Map<String, String> messages() {
                return Map.of("found", "Found {{name}}.");
            }

            @Override
            public void check(RuleContext context) {
                System.gc();
                for (TSNode name : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(), "identifier")) {
                    context.report(name, "found", Map.of("name", context.getText(name)));
                }
            }
        };
        Linter linter = new Linter(List.of(
                new ConfiguredRule(new ArrayTypeRule(), RuleLevel.ERROR),
                new ConfiguredRule(collecting, RuleLevel.ERROR)));

        List<Violation> violations = linter.lint("a.ts", "let a: Array<string>;\nlet b = 1;\n");

        assertEquals(3, violations.size());
        assertEquals("Found a.", violations.get(0).message);
        assertEquals("array-type", violations.get(1).ruleName);
        assertEquals("Found b.", violations.get(2).message);
    }
}
