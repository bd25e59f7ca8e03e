package org.dxworks.codelint.rules.overload;

import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

/**
 * A sibling that can take part in overload grouping. The set of variants is closed; anything else
 * in a scope is opaque and {@link #of(TSNode)} returns {@code null} for it.
 */
public abstract class Declaration {

    private final TSNode node;

    private Declaration(TSNode node) {
        this.node = node;
    }

    /**
     * The node a report is anchored to, i.e. the outermost wrapper.
     */
    public TSNode getNode() {
        return node;
    }

    /**
     * Strips export and ambient wrappers.
     */
    public Declaration unwrap() {
        return this;
    }

    /**
     * Identity of the declared member, or {@code null} when it has none (an anonymous function).
     */
    public abstract MemberIdentity identity(byte[] source);

    public static Declaration of(TSNode node) {
        if (TreeSitterHelper.isNull(node)) return null;
        switch (node.getType()) {
            case "function_declaration":
            case "function_signature":
            case "generator_function_declaration":
                return new Function(node);
            case "method_definition":
            case "method_signature":
            case "abstract_method_signature":
                return new MethodSignature(node);
            case "call_signature":
                return new CallSignature(node);
            case "construct_signature":
                return new ConstructSignature(node);
            case "export_statement": {
                Declaration inner = of(TreeSitterHelper.getChildByFieldName(node, "declaration"));
                return inner == null ? null : new Wrapped(node, inner);
            }
            case "ambient_declaration": {
                Declaration inner = of(TreeSitterHelper.getFirstNamedChild(node));
                return inner == null ? null : new Wrapped(node, inner);
            }
            default:
                return null;
        }
    }

    public static final class Function extends Declaration {
        private Function(TSNode node) {
            super(node);
        }

        @Override
        public MemberIdentity identity(byte[] source) {
            TSNode name = TreeSitterHelper.getChildByFieldName(getNode(), "name");
            if (name == null) return null;
            return MemberIdentity.normal(TreeSitterHelper.getNodeText(source, name));
        }
    }

    public static final class MethodSignature extends Declaration {
        private MethodSignature(TSNode node) {
            super(node);
        }

        @Override
        public MemberIdentity identity(byte[] source) {
            TSNode name = TreeSitterHelper.getChildByFieldName(getNode(), "name");
            if (name == null) return null;
            boolean isStatic = TreeSitterHelper.hasChildBeforeField(getNode(), "name", "static", "static get");
            return MemberNames.identify(name, source, isStatic);
        }
    }

    public static final class CallSignature extends Declaration {
        private CallSignature(TSNode node) {
            super(node);
        }

        @Override
        public MemberIdentity identity(byte[] source) {
            return new MemberIdentity("call", false, true, MemberNameType.NORMAL);
        }
    }

    public static final class ConstructSignature extends Declaration {
        private ConstructSignature(TSNode node) {
            super(node);
        }

        @Override
        public MemberIdentity identity(byte[] source) {
            return MemberIdentity.normal("new");
        }
    }

    public static final class Wrapped extends Declaration {
        private final Declaration inner;

        private Wrapped(TSNode node, Declaration inner) {
            super(node);
            this.inner = inner;
        }

        @Override
        public Declaration unwrap() {
            return inner.unwrap();
        }

        @Override
        public MemberIdentity identity(byte[] source) {
            return unwrap().identity(source);
        }
    }
}
