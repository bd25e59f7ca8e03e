package org.dxworks.codelint.linter;

public class ConfiguredRule {
    public final Rule rule;
    public final RuleLevel level;

    public ConfiguredRule(Rule rule, RuleLevel level) {
        this.rule = rule;
        this.level = level;
    }

    public boolean isEnabled() {
        return level != RuleLevel.OFF;
    }
}
