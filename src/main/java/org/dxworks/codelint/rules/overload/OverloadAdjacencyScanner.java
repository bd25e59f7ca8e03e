package org.dxworks.codelint.rules.overload;

import org.dxworks.codelint.linter.TreeSitterHelper;
import org.treesitter.TSNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Walks the tree once, keeping one {@link ScanState} per open scope on an explicit stack.
 */
public class OverloadAdjacencyScanner {

    private static final String[] SCOPE_TYPES = {
            "program", "statement_block", "class_body", "object_type", "interface_body"
    };

    // trivia inside a scope: neither members nor breaks in a run of overloads
    private static final String[] SKIPPED_MEMBER_TYPES = {"comment", "decorator"};

    public static class Misplaced {
        public final TSNode node;
        public final MemberIdentity identity;

        Misplaced(TSNode node, MemberIdentity identity) {
            this.node = node;
            this.identity = identity;
        }
    }

    private static class Step {
        final TSNode node;
        final boolean member;
        final boolean exit;

        Step(TSNode node, boolean member, boolean exit) {
            this.node = node;
            this.member = member;
            this.exit = exit;
        }
    }

    public List<Misplaced> scan(TSNode root, byte[] source) {
        List<Misplaced> result = new ArrayList<>();
        Deque<ScanState> frames = new ArrayDeque<>();
        Deque<Step> work = new ArrayDeque<>();
        work.push(new Step(root, false, false));

        while (!work.isEmpty()) {
            Step step = work.pop();
            if (step.exit) {
                frames.pop();
                continue;
            }
            TSNode node = step.node;
            if (step.member && !frames.isEmpty()) {
                Declaration declaration = Declaration.of(node);
                MemberIdentity identity = declaration == null ? null : declaration.identity(source);
                if (frames.peek().observe(identity)) {
                    result.add(new Misplaced(node, identity));
                }
            }

            boolean scope = TreeSitterHelper.isNodeTypeOneOf(node, SCOPE_TYPES);
            if (scope) {
                frames.push(new ScanState());
                work.push(new Step(node, false, true));
            }
            List<TSNode> children = TreeSitterHelper.getNamedChildrenWithComments(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                TSNode child = children.get(i);
                boolean member = scope && !TreeSitterHelper.isNodeTypeOneOf(child, SKIPPED_MEMBER_TYPES);
                work.push(new Step(child, member, false));
            }
        }
        return result;
    }
}
