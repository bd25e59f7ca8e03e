package org.dxworks.codelint.linter;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class TreeSitterHelper {

    private TreeSitterHelper() {
    }

    public static String getNodeText(String source, TSNode node) {
        return getNodeText(source.getBytes(StandardCharsets.UTF_8), node);
    }

    /**
     * Tree-sitter reports UTF-8 byte offsets, so the text is sliced from the encoded source
     * and decoded back rather than taken from the Java string directly.
     */
    public static String getNodeText(byte[] sourceBytes, TSNode node) {
        if (isNull(node)) return null;
        int startByte = Math.max(node.getStartByte(), 0);
        int endByte = Math.min(node.getEndByte(), sourceBytes.length);
        if (startByte >= endByte) return "";
        return new String(sourceBytes, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /**
     * Remove every whitespace character (not just collapse runs), so that {@code "NS . Bad"}
     * and {@code "NS.Bad"} yield the same key.
     */
    public static String removeWhitespace(String s) {
        if (s == null) return null;
        return s.replaceAll("\\s", "");
    }

    public static int utf8Length(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }

    public static boolean isNull(TSNode node) {
        return node == null || node.isNull();
    }

    public static TSNode getParent(TSNode node) {
        if (isNull(node)) return null;
        TSNode parent = node.getParent();
        return isNull(parent) ? null : parent;
    }

    public static TSNode findFirstChild(TSNode parent, String nodeType) {
        for (TSNode child : getNamedChildrenWithComments(parent)) {
            if (nodeType.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    /**
     * Named children in source order, comments included.
     * Walks the full child list filtered by {@code isNamed()} rather than {@code getNamedChild(i)}.
     */
    public static List<TSNode> getNamedChildrenWithComments(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        if (isNull(parent)) return result;
        int count = parent.getChildCount();
        for (int i = 0; i < count; i++) {
            TSNode child = parent.getChild(i);
            if (!isNull(child) && child.isNamed()) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * Named children in source order, without comments.
     */
    public static List<TSNode> getNamedChildren(TSNode parent) {
        List<TSNode> result = new ArrayList<>();
        for (TSNode child : getNamedChildrenWithComments(parent)) {
            if (!"comment".equals(child.getType())) {
                result.add(child);
            }
        }
        return result;
    }

    public static TSNode getFirstNamedChild(TSNode parent) {
        List<TSNode> children = getNamedChildren(parent);
        return children.isEmpty() ? null : children.get(0);
    }

    public static List<TSNode> findAllDescendantsOfTypes(TSNode root, String... types) {
        List<TSNode> result = new ArrayList<>();
        if (isNull(root)) return result;
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (isNull(node)) continue;
            if (isTypeOneOf(node.getType(), types)) result.add(node);
            List<TSNode> children = getNamedChildrenWithComments(node);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return result;
    }

    public static TSNode getChildByFieldName(TSNode parent, String fieldName) {
        if (isNull(parent)) return null;
        // getFieldNameForChild(i) expects the total child index (anonymous tokens included),
        // not the named child index
        for (int i = 0; i < parent.getChildCount(); i++) {
            if (fieldName.equals(parent.getFieldNameForChild(i))) {
                TSNode child = parent.getChild(i);
                return isNull(child) ? null : child;
            }
        }
        return null;
    }

    /**
     * First direct child of the given type, anonymous tokens such as {@code async} included.
     */
    public static TSNode findFirstChildToken(TSNode parent, String type) {
        if (isNull(parent)) return null;
        for (int i = 0; i < parent.getChildCount(); i++) {
            TSNode child = parent.getChild(i);
            if (!isNull(child) && type.equals(child.getType())) return child;
        }
        return null;
    }

    /**
     * True if a child of one of the given types appears before the child held in {@code fieldName}.
     * Used for modifiers such as {@code static}.
     */
    public static boolean hasChildBeforeField(TSNode node, String fieldName, String... childTypes) {
        if (isNull(node)) return false;
        for (int i = 0; i < node.getChildCount(); i++) {
            if (fieldName.equals(node.getFieldNameForChild(i))) return false;
            TSNode child = node.getChild(i);
            if (!isNull(child) && isTypeOneOf(child.getType(), childTypes)) return true;
        }
        return false;
    }

    public static boolean isFieldOfParent(TSNode node, String fieldName) {
        TSNode parent = getParent(node);
        return parent != null && sameNode(getChildByFieldName(parent, fieldName), node);
    }

    public static boolean sameNode(TSNode a, TSNode b) {
        if (isNull(a) || isNull(b)) return false;
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    public static boolean isTypeOneOf(String type, String... types) {
        if (type == null) return false;
        for (String t : types) if (type.equals(t)) return true;
        return false;
    }

    public static boolean isNodeTypeOneOf(TSNode node, String... types) {
        if (isNull(node)) return false;
        return isTypeOneOf(node.getType(), types);
    }

    public static TSNode skipParenthesizedTypes(TSNode node) {
        TSNode current = node;
        while (!isNull(current) && "parenthesized_type".equals(current.getType())) {
            TSNode inner = getFirstNamedChild(current);
            if (inner == null) break;
            current = inner;
        }
        return current;
    }

    /**
     * Checks if a string is a valid identifier (for JS/TS style identifiers).
     */
    public static boolean isValidIdentifier(String name) {
        if (name == null || name.isEmpty()) return false;
        int first = name.codePointAt(0);
        if (!isIdentifierStart(first)) return false;
        for (int i = Character.charCount(first); i < name.length(); ) {
            int cp = name.codePointAt(i);
            if (!isIdentifierStart(cp) && !isIdentifierPart(cp)) return false;
            i += Character.charCount(cp);
        }
        return true;
    }

    private static boolean isIdentifierStart(int cp) {
        return cp == '$' || cp == '_' || Character.isUnicodeIdentifierStart(cp);
    }

    private static boolean isIdentifierPart(int cp) {
        return cp == '\u200C' || cp == '\u200D' || Character.isUnicodeIdentifierPart(cp) && !Character.isIdentifierIgnorable(cp);
    }
}
