package org.dxworks.codelint.rules.comments;

import org.dxworks.codelint.linter.RangeRewriter;
import org.dxworks.codelint.linter.Rule;
import org.dxworks.codelint.linter.RuleContext;
import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reports {@code @ts-expect-error}, {@code @ts-ignore}, {@code @ts-nocheck} and {@code @ts-check} comments
 * according to a per-directive policy.
 */
public class BanTsCommentRule implements Rule {

    public static final String NAME = "ban-ts-comment";

    private static final Pattern LINE_DIRECTIVE =
            Pattern.compile("^/*\\s*@ts-(?<directive>expect-error|ignore|check|nocheck)(?<description>.*)");
    private static final Pattern BLOCK_DIRECTIVE =
            Pattern.compile("^\\s*(?:/|\\*)*\\s*@ts-(?<directive>expect-error|ignore|check|nocheck)(?<description>.*)");
    private static final Pattern GRAPHEME = Pattern.compile("\\X");

    private static final Map<String, String> MESSAGES = Map.of(
            "ts_directive_comment",
            "Do not use \"@ts-{{directive}}\" because it alters compilation errors.",
            "ts_ignore_instead_of_expect_error",
            "Use \"@ts-expect-error\" instead of \"@ts-ignore\", as \"@ts-ignore\" will do nothing if the following line is error-free.",
            "ts_directive_comment_requires_description",
            "Include a description after the \"@ts-{{directive}}\" directive to explain why the @ts-{{directive}} is necessary. The description must be {{minimum_description_length}} characters or longer.",
            "ts_directive_comment_description_not_match_pattern",
            "The description for the \"@ts-{{directive}}\" directive must match the {{format}} format.",
            "replace_ts_ignore_with_ts_expect_error",
            "Replace \"@ts-ignore\" with \"@ts-expect-error\"."
    );

    private final Map<String, DirectivePolicy> policies = new LinkedHashMap<>();
    private final int minimumDescriptionLength;

    public BanTsCommentRule() {
        this(new BanTsCommentOptions());
    }

    public BanTsCommentRule(BanTsCommentOptions options) {
        policies.put("expect-error", DirectivePolicy.parse("ts-expect-error", options.tsExpectError,
                DirectivePolicy.withDescription(null)));
        policies.put("ignore", DirectivePolicy.parse("ts-ignore", options.tsIgnore, DirectivePolicy.banned()));
        policies.put("nocheck", DirectivePolicy.parse("ts-nocheck", options.tsNocheck, DirectivePolicy.banned()));
        policies.put("check", DirectivePolicy.parse("ts-check", options.tsCheck, DirectivePolicy.allowed()));
        this.minimumDescriptionLength = options.resolveMinimumDescriptionLength();
        if (minimumDescriptionLength < 0) {
            throw new IllegalArgumentException("minimumDescriptionLength must not be negative");
        }
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
        for (TSNode comment : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(), "comment")) {
            String text = context.getText(comment);
            boolean block = text.startsWith("/*");
            Matcher matcher = block
                    ? BLOCK_DIRECTIVE.matcher(text.substring(2, Math.max(2, text.length() - 2)))
                    : LINE_DIRECTIVE.matcher(text.substring(2));
            if (!matcher.find()) continue;

            String directive = matcher.group("directive");
            String description = matcher.group("description");
            DirectivePolicy policy = policies.get(directive);
            switch (policy.getMode()) {
                case ALLOWED:
                    break;
                case BANNED:
                    reportBanned(context, comment, text, directive);
                    break;
                case ALLOW_WITH_DESCRIPTION:
                    checkDescription(context, comment, directive, description, policy.getDescriptionFormat());
                    break;
                default:
                    throw new IllegalStateException("Unknown directive mode " + policy.getMode());
            }
        }
    }

    private void reportBanned(RuleContext context, TSNode comment, String text, String directive) {
        if (!"ignore".equals(directive)) {
            context.report(comment, "ts_directive_comment", Map.of("directive", directive));
            return;
        }
        int at = text.indexOf("@ts-ignore");
        int start = comment.getStartByte() + TreeSitterHelper.utf8Length(text.substring(0, at));
        RangeRewriter replacement = new RangeRewriter()
                .replaceRange(start, start + "@ts-ignore".length(), "@ts-expect-error");
        context.report(comment, "ts_ignore_instead_of_expect_error", Collections.emptyMap(), null,
                List.of(context.suggestion("replace_ts_ignore_with_ts_expect_error", Collections.emptyMap(), replacement)));
    }

    private void checkDescription(RuleContext context, TSNode comment, String directive,
                                  String description, Pattern format) {
        if (graphemeLength(description.trim()) < minimumDescriptionLength) {
            context.report(comment, "ts_directive_comment_requires_description", Map.of(
                    "directive", directive,
                    "minimum_description_length", String.valueOf(minimumDescriptionLength)));
        } else if (format != null && !format.matcher(description).find()) {
            context.report(comment, "ts_directive_comment_description_not_match_pattern", Map.of(
                    "directive", directive,
                    "format", format.pattern()));
        }
    }

    /**
     * User-perceived characters, so an emoji sequence counts once.
     */
    static int graphemeLength(String text) {
        boolean ascii = text.chars().allMatch(c -> c < 0x80);
        if (ascii) return text.length();
        Matcher matcher = GRAPHEME.matcher(text);
        int count = 0;
        while (matcher.find()) count++;
        return count;
    }
}
