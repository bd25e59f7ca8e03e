package org.dxworks.codelint.rules.comments;

import org.dxworks.codelint.linter.RangeRewriter;
import org.dxworks.codelint.linter.Rule;
import org.dxworks.codelint.linter.RuleContext;
import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

import java.util.Map;
import java.util.regex.Pattern;

/**
 * Reports leftover {@code tslint:enable} / {@code tslint:disable} directives and removes them.
 */
public class BanTslintCommentRule implements Rule {

    public static final String NAME = "ban-tslint-comment";

    private static final Pattern TSLINT_DIRECTIVE =
            Pattern.compile("^\\s*tslint:(enable|disable)(?:-(line|next-line))?(:|\\s|$)");

    private static final Map<String, String> MESSAGES = Map.of(
            "comment_detected", "tslint comment detected: \"{{ text }}\""
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
        int sourceLength = context.getSourceBytes().length;
        for (TSNode comment : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(), "comment")) {
            String text = context.getText(comment);
            boolean block = text.startsWith("/*");
            String contents = block
                    ? text.substring(2, Math.max(2, text.length() - 2))
                    : text.substring(2);
            if (!TSLINT_DIRECTIVE.matcher(contents).find()) continue;

            String shown = block ? "/* " + contents.trim() + " */" : "// " + contents.trim();
            // take the separating character on either side with the comment
            int start = comment.getStartPoint().getColumn() > 0 ? comment.getStartByte() - 1 : comment.getStartByte();
            int end = comment.getEndByte() < sourceLength ? comment.getEndByte() + 1 : comment.getEndByte();
            context.report(comment, "comment_detected", Map.of("text", shown), new RangeRewriter().remove(start, end));
        }
    }
}
