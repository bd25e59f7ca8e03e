package org.dxworks.codelint.rules.bantypes;

import org.dxworks.codelint.linter.RangeRewriter;
import org.dxworks.codelint.linter.Rule;
import org.dxworks.codelint.linter.RuleContext;
import org.dxworks.codelint.linter.TreeSitterHelper;
import org.dxworks.codelint.model.Suggestion;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reports uses of banned types, optionally replacing them with a configured alternative.
 */
public class BanTypesRule implements Rule {

    public static final String NAME = "ban-types";

    private static final Map<String, String> MESSAGES = Map.of(
            "banned_type_message", "Don't use `{{name}}` as a type.{{custom_message}}",
            "banned_type_replacement", "Replace `{{name}}` with `{{replacement}}`"
    );

    private static final String[] CANDIDATE_TYPES = {
            "type_identifier", "nested_type_identifier", "predefined_type", "literal_type",
            "generic_type", "tuple_type", "object_type"
    };

    private final BannedTypeTable table;

    public BanTypesRule() {
        this(BannedTypeTable.defaults());
    }

    public BanTypesRule(BanTypesOptions options) {
        this(BannedTypeTable.of(options));
    }

    public BanTypesRule(BannedTypeTable table) {
        this.table = table;
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
        for (TSNode node : TreeSitterHelper.findAllDescendantsOfTypes(context.getRootNode(), CANDIDATE_TYPES)) {
            switch (node.getType()) {
                case "type_identifier":
                case "nested_type_identifier":
                    if (isTypeReference(node)) checkBanned(context, node);
                    break;
                case "predefined_type":
                    checkBanned(context, node);
                    break;
                case "literal_type":
                    if (TreeSitterHelper.isNodeTypeOneOf(TreeSitterHelper.getFirstNamedChild(node), "null", "undefined")) {
                        checkBanned(context, node);
                    }
                    break;
                case "generic_type":
                    checkBanned(context, TreeSitterHelper.getChildByFieldName(node, "name"));
                    checkBanned(context, node);
                    break;
                case "tuple_type":
                    if (TreeSitterHelper.getNamedChildren(node).isEmpty()) checkBanned(context, node);
                    break;
                default:
                    if (isEmptyTypeLiteral(node)) checkBanned(context, node);
            }
        }
    }

    private void checkBanned(RuleContext context, TSNode node) {
        if (TreeSitterHelper.isNull(node)) return;
        String name = BannedTypeTable.normalize(context.getText(node));
        Optional<BanPolicy> ban = table.lookup(name);
        if (ban.isEmpty()) return;
        BanPolicy policy = ban.get();

        Map<String, String> data = new LinkedHashMap<>();
        data.put("name", name);
        data.put("custom_message", policy.customMessage());

        RangeRewriter fix = null;
        if (policy.getFixWith() != null) {
            fix = new RangeRewriter().replaceNode(node, policy.getFixWith());
        }
        List<Suggestion> suggestions = new ArrayList<>();
        for (String replacement : policy.getSuggest()) {
            Map<String, String> suggestionData = new LinkedHashMap<>();
            suggestionData.put("name", name);
            suggestionData.put("replacement", replacement);
            suggestions.add(context.suggestion("banned_type_replacement", suggestionData,
                    new RangeRewriter().replaceNode(node, replacement)));
        }
        context.report(node, "banned_type_message", data, fix, suggestions);
    }

    /**
     * Type names in reference position. Segments of dotted names, generic heads (checked with their
     * generic) and declared names are skipped.
     */
    private static boolean isTypeReference(TSNode node) {
        TSNode parent = TreeSitterHelper.getParent(node);
        if (parent == null) return false;
        if (TreeSitterHelper.isNodeTypeOneOf(parent, "nested_type_identifier", "infer_type", "type_parameter")) {
            return false;
        }
        return !TreeSitterHelper.isFieldOfParent(node, "name");
    }

    // `{}` written as a type, not the body of an interface
    private static boolean isEmptyTypeLiteral(TSNode node) {
        if (!TreeSitterHelper.getNamedChildren(node).isEmpty()) return false;
        return !TreeSitterHelper.isNodeTypeOneOf(TreeSitterHelper.getParent(node), "interface_declaration");
    }
}
