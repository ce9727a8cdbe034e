package org.dxworks.typfmt.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

public class SyntaxHelper {

    public static SyntaxNode findFirstChild(SyntaxNode parent, SyntaxKind kind) {
        if (parent == null) return null;
        for (SyntaxNode child : parent.children()) {
            if (child.is(kind)) return child;
        }
        return null;
    }

    public static SyntaxNode findLastChild(SyntaxNode parent, SyntaxKind kind) {
        if (parent == null) return null;
        List<SyntaxNode> children = parent.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            if (children.get(i).is(kind)) return children.get(i);
        }
        return null;
    }

    public static List<SyntaxNode> findAllChildren(SyntaxNode parent, SyntaxKind kind) {
        List<SyntaxNode> result = new ArrayList<>();
        if (parent == null) return result;
        for (SyntaxNode child : parent.children()) {
            if (child.is(kind)) result.add(child);
        }
        return result;
    }

    public static SyntaxNode findFirstDescendant(SyntaxNode root, SyntaxKind kind) {
        if (root == null) return null;
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.is(kind)) return node;
            List<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return null;
    }

    public static boolean isKindOneOf(SyntaxNode node, SyntaxKind... kinds) {
        if (node == null) return false;
        for (SyntaxKind k : kinds) if (node.is(k)) return true;
        return false;
    }

    /** First child that is an expression, skipping trivia and punctuation. */
    public static SyntaxNode firstExpr(SyntaxNode parent) {
        if (parent == null) return null;
        for (SyntaxNode child : parent.children()) {
            if (child.kind().isExpr()) return child;
        }
        return null;
    }

    public static SyntaxNode lastExpr(SyntaxNode parent) {
        if (parent == null) return null;
        List<SyntaxNode> children = parent.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            if (children.get(i).kind().isExpr()) return children.get(i);
        }
        return null;
    }

    /** Expression children plus the list-only nodes (named, keyed, spread) that stand for items. */
    public static List<SyntaxNode> items(SyntaxNode parent) {
        List<SyntaxNode> result = new ArrayList<>();
        if (parent == null) return result;
        for (SyntaxNode child : parent.children()) {
            if (isItem(child)) result.add(child);
        }
        return result;
    }

    public static boolean isItem(SyntaxNode node) {
        return node.kind().isExpr()
                || isKindOneOf(node, SyntaxKind.NAMED, SyntaxKind.KEYED, SyntaxKind.SPREAD,
                SyntaxKind.DESTRUCTURING, SyntaxKind.UNDERSCORE, SyntaxKind.RENAMED_IMPORT_ITEM);
    }

    public static int countNewlines(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') count++;
        }
        return count;
    }

    public static boolean containsNewline(SyntaxNode node) {
        if (node.isLeaf()) return node.text().indexOf('\n') >= 0;
        return containsNewline(node.children(), 0, node.children().size());
    }

    /** Whether any leaf under {@code nodes[from, to)} holds a line feed. Walks leaves without building text. */
    public static boolean containsNewline(List<SyntaxNode> nodes, int from, int to) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        for (int i = to - 1; i >= from; i--) {
            stack.push(nodes.get(i));
        }
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.isLeaf()) {
                if (node.text().indexOf('\n') >= 0) return true;
                continue;
            }
            List<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return false;
    }
}
