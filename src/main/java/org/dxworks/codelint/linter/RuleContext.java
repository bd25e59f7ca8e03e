package org.dxworks.codelint.linter;

import org.dxworks.codelint.model.SourceRange;
import org.dxworks.codelint.model.Suggestion;
import org.dxworks.codelint.model.Violation;
import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-file, per-rule view handed to {@link Rule#check(RuleContext)}. Not shared between threads.
 */
public class RuleContext {

    private final String filePath;
    private final String source;
    private final byte[] sourceBytes;
    private final TSNode rootNode;
    private final Rule rule;
    private final RuleLevel level;
    private final List<Violation> violations = new ArrayList<>();

    public RuleContext(String filePath, String source, TSNode rootNode, Rule rule, RuleLevel level) {
        this.filePath = filePath;
        this.source = source;
        this.sourceBytes = source.getBytes(StandardCharsets.UTF_8);
        this.rootNode = rootNode;
        this.rule = rule;
        this.level = level;
    }

    public String getFilePath() {
        return filePath;
    }

    public String getSource() {
        return source;
    }

    public byte[] getSourceBytes() {
        return sourceBytes;
    }

    public TSNode getRootNode() {
        return rootNode;
    }

    public String getText(TSNode node) {
        return TreeSitterHelper.getNodeText(sourceBytes, node);
    }

    public void report(TSNode node, String messageId, Map<String, String> data) {
        report(node, messageId, data, null, Collections.emptyList());
    }

    public void report(TSNode node, String messageId, Map<String, String> data, RangeRewriter fix) {
        report(node, messageId, data, fix, Collections.emptyList());
    }

    public void report(TSNode node, String messageId, Map<String, String> data,
                       RangeRewriter fix, List<Suggestion> suggestions) {
        report(SourceRange.of(node), messageId, data, fix, suggestions);
    }

    /**
     * Reports a range that does not cover a single node, such as a member head.
     */
    public void report(SourceRange range, String messageId, Map<String, String> data) {
        report(range, messageId, data, null, Collections.emptyList());
    }

    public void report(SourceRange range, String messageId, Map<String, String> data,
                       RangeRewriter fix, List<Suggestion> suggestions) {
        Violation violation = new Violation();
        violation.ruleName = rule.name();
        violation.severity = level.getName();
        violation.messageId = messageId;
        violation.data = data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>();
        violation.message = formatMessage(messageId, violation.data);
        violation.range = range;
        if (fix != null && !fix.isEmpty()) {
            violation.fix = fix.edits();
        }
        if (suggestions != null) {
            violation.suggestions.addAll(suggestions);
        }
        violations.add(violation);
    }

    public Suggestion suggestion(String messageId, Map<String, String> data, RangeRewriter edits) {
        Suggestion suggestion = new Suggestion();
        suggestion.messageId = messageId;
        suggestion.data = new LinkedHashMap<>(data);
        suggestion.message = formatMessage(messageId, suggestion.data);
        suggestion.edits = edits.edits();
        return suggestion;
    }

    public List<Violation> getViolations() {
        return violations;
    }

    private String formatMessage(String messageId, Map<String, String> data) {
        String template = rule.messages().get(messageId);
        if (template == null) {
            throw new IllegalStateException("Rule " + rule.name() + " has no message '" + messageId + "'");
        }
        return MessageFormatter.format(template, data);
    }
}
