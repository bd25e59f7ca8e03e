package org.dxworks.codelint.rules.typestyle;

import org.dxworks.codelint.linter.RangeRewriter;
import org.dxworks.codelint.linter.Rule;
import org.dxworks.codelint.linter.RuleContext;
import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Chooses between {@code Record<K, V>} and a lone index signature {@code { [key: K]: V }} for indexed objects.
 */
public class ConsistentIndexedObjectStyleRule implements Rule {

    public static final String NAME = "consistent-indexed-object-style";

    private static final Map<String, String> MESSAGES = Map.of(
            "prefer_record", "A record is preferred over an index signature.",
            "prefer_index_signature", "An index signature is preferred over a record."
    );

    private final IndexedObjectStyle style;

    public ConsistentIndexedObjectStyleRule() {
        this(new ConsistentIndexedObjectStyleOptions());
    }

    public ConsistentIndexedObjectStyleRule(ConsistentIndexedObjectStyleOptions options) {
        this.style = options.resolveStyle();
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
        TSNode root = context.getRootNode();
        if (style == IndexedObjectStyle.INDEX_SIGNATURE) {
            for (TSNode generic : TreeSitterHelper.findAllDescendantsOfTypes(root, "generic_type")) {
                checkRecord(context, generic);
            }
            return;
        }
        for (TSNode node : TreeSitterHelper.findAllDescendantsOfTypes(root, "object_type", "interface_declaration")) {
            if ("interface_declaration".equals(node.getType())) {
                checkInterface(context, node);
            } else if (TypeLiterals.isTypeLiteral(node)) {
                checkTypeLiteral(context, node);
            }
        }
    }

    private void checkRecord(RuleContext context, TSNode generic) {
        TSNode name = TreeSitterHelper.getChildByFieldName(generic, "name");
        if (name == null || !"type_identifier".equals(name.getType()) || !"Record".equals(context.getText(name))) return;
        List<TSNode> params = TreeSitterHelper.getNamedChildren(TreeSitterHelper.getChildByFieldName(generic, "type_arguments"));
        if (params.size() != 2) return;

        String replacement = "{ [key: " + context.getText(params.get(0)) + "]: " + context.getText(params.get(1)) + " }";
        context.report(generic, "prefer_index_signature", Collections.emptyMap(),
                new RangeRewriter().replaceNode(generic, replacement));
    }

    private void checkTypeLiteral(RuleContext context, TSNode objectType) {
        IndexMember member = IndexMember.soleMember(objectType);
        if (member == null) return;
        TSNode declaration = enclosingTypeAlias(objectType);
        if (declaration != null && member.references(context, TreeSitterHelper.getChildByFieldName(declaration, "name"))) {
            return;
        }
        context.report(objectType, "prefer_record", Collections.emptyMap(),
                new RangeRewriter().replaceNode(objectType, member.asRecord(context)));
    }

    private void checkInterface(RuleContext context, TSNode declaration) {
        IndexMember member = IndexMember.soleMember(TypeLiterals.interfaceBody(declaration));
        if (member == null) return;
        TSNode name = TreeSitterHelper.getChildByFieldName(declaration, "name");
        if (member.references(context, name)) return;

        RangeRewriter fix = null;
        if (TreeSitterHelper.findFirstChild(declaration, "extends_type_clause") == null) {
            TSNode typeParameters = TreeSitterHelper.getChildByFieldName(declaration, "type_parameters");
            String head = "type " + context.getText(name) + (typeParameters != null ? context.getText(typeParameters) : "");
            fix = new RangeRewriter().replaceNode(declaration, head + " = " + member.asRecord(context) + ";");
        }
        context.report(declaration, "prefer_record", Collections.emptyMap(), fix);
    }

    /**
     * The type alias an object type is written in, unless it sits inside a type annotation.
     */
    private static TSNode enclosingTypeAlias(TSNode node) {
        TSNode parent = TreeSitterHelper.getParent(node);
        while (parent != null && !"type_annotation".equals(parent.getType())) {
            if ("type_alias_declaration".equals(parent.getType())) return parent;
            parent = TreeSitterHelper.getParent(parent);
        }
        return null;
    }

    private static final class IndexMember {
        final TSNode keyType;
        final TSNode valueType;
        final boolean readonly;

        private IndexMember(TSNode keyType, TSNode valueType, boolean readonly) {
            this.keyType = keyType;
            this.valueType = valueType;
            this.readonly = readonly;
        }

        /**
         * The only member of the body when it is a plain {@code [name: K]: V} signature.
         */
        static IndexMember soleMember(TSNode body) {
            List<TSNode> members = TreeSitterHelper.getNamedChildren(body);
            if (members.size() != 1 || !"index_signature".equals(members.get(0).getType())) return null;
            TSNode signature = members.get(0);
            TSNode name = TreeSitterHelper.getChildByFieldName(signature, "name");
            TSNode keyType = TreeSitterHelper.getChildByFieldName(signature, "index_type");
            TSNode annotation = TreeSitterHelper.getChildByFieldName(signature, "type");
            if (name == null || keyType == null || annotation == null || !"type_annotation".equals(annotation.getType())) {
                return null;
            }
            TSNode valueType = TreeSitterHelper.getFirstNamedChild(annotation);
            if (valueType == null) return null;
            boolean readonly = false;
            for (int i = 0; i < signature.getChildCount(); i++) {
                String type = signature.getChild(i).getType();
                if ("[".equals(type)) break;
                if ("readonly".equals(type)) readonly = true;
            }
            return new IndexMember(keyType, valueType, readonly);
        }

        /**
         * True if the value type mentions {@code name}, which a record alias could not express.
         */
        boolean references(RuleContext context, TSNode name) {
            if (name == null) return false;
            String target = context.getText(name);
            for (TSNode identifier : TreeSitterHelper.findAllDescendantsOfTypes(valueType, "type_identifier")) {
                TSNode parent = TreeSitterHelper.getParent(identifier);
                if (parent != null && "nested_type_identifier".equals(parent.getType())) continue;
                if (target.equals(context.getText(identifier))) return true;
            }
            return false;
        }

        String asRecord(RuleContext context) {
            String record = "Record<" + context.getText(keyType) + ", " + context.getText(valueType) + ">";
            return readonly ? "Readonly<" + record + ">" : record;
        }
    }
}
