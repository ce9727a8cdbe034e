package org.dxworks.typfmt.syntax;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Lossless concrete syntax tree node. Leaves carry their source text, inner nodes their children;
 * the text of any node is the concatenation of its leaves.
 * <p>
 * Span ids and offsets are assigned once by {@link TypstParser#parse(String)} in pre-order,
 * before the tree is handed out.
 */
public final class SyntaxNode {

    private static final int UNNUMBERED = -1;

    private final SyntaxKind kind;
    private final String leafText;
    private final List<SyntaxNode> children;
    private final String errorMessage;
    private final int length;
    private final boolean erroneous;

    private int id = UNNUMBERED;
    private int offset = UNNUMBERED;
    private String cachedText;

    private SyntaxNode(SyntaxKind kind, String leafText, List<SyntaxNode> children, String errorMessage) {
        this.kind = kind;
        this.leafText = leafText;
        this.children = children;
        this.errorMessage = errorMessage;

        int len = leafText != null ? leafText.length() : 0;
        boolean err = kind == SyntaxKind.ERROR;
        for (SyntaxNode child : children) {
            len += child.length;
            err |= child.erroneous;
        }
        this.length = len;
        this.erroneous = err;
    }

    public static SyntaxNode leaf(SyntaxKind kind, String text) {
        return new SyntaxNode(kind, text, Collections.emptyList(), null);
    }

    public static SyntaxNode inner(SyntaxKind kind, List<SyntaxNode> children) {
        return new SyntaxNode(kind, null, List.copyOf(children), null);
    }

    public static SyntaxNode error(String message, String text) {
        return new SyntaxNode(SyntaxKind.ERROR, text, Collections.emptyList(), message);
    }

    public static SyntaxNode error(String message, List<SyntaxNode> children) {
        return new SyntaxNode(SyntaxKind.ERROR, null, List.copyOf(children), message);
    }

    /** Same children under a different kind, used when a collection turns out to be a pattern. */
    SyntaxNode withKind(SyntaxKind newKind) {
        if (isLeaf()) return leaf(newKind, leafText);
        return inner(newKind, children);
    }

    public SyntaxKind kind() {
        return kind;
    }

    public boolean is(SyntaxKind other) {
        return kind == other;
    }

    public boolean isLeaf() {
        return leafText != null;
    }

    public List<SyntaxNode> children() {
        return children;
    }

    public String text() {
        if (leafText != null) return leafText;
        if (cachedText == null) {
            StringBuilder sb = new StringBuilder(length);
            appendText(sb);
            cachedText = sb.toString();
        }
        return cachedText;
    }

    private void appendText(StringBuilder sb) {
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (node.leafText != null) {
                sb.append(node.leafText);
                continue;
            }
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
    }

    public int length() {
        return length;
    }

    public int id() {
        return id;
    }

    public int offset() {
        return offset;
    }

    public boolean erroneous() {
        return erroneous;
    }

    public String errorMessage() {
        return errorMessage;
    }

    /** First error node in source order, or null when the subtree is clean. */
    public SyntaxNode firstError() {
        SyntaxNode node = this;
        while (node != null && node.erroneous) {
            if (node.kind == SyntaxKind.ERROR) return node;
            SyntaxNode next = null;
            for (SyntaxNode child : node.children) {
                if (child.erroneous) {
                    next = child;
                    break;
                }
            }
            node = next;
        }
        return null;
    }

    /**
     * Assigns pre-order span ids and source offsets to the whole tree.
     * Returns the number of nodes.
     */
    static int number(SyntaxNode root) {
        int next = 0;
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        root.offset = 0;
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            node.id = next++;
            int childOffset = node.offset;
            for (SyntaxNode child : node.children) {
                child.offset = childOffset;
                childOffset += child.length;
            }
            for (int i = node.children.size() - 1; i >= 0; i--) {
                stack.push(node.children.get(i));
            }
        }
        return next;
    }

    @Override
    public String toString() {
        return kind + "@" + id + (isLeaf() ? "(" + leafText + ")" : "[" + children.size() + "]");
    }
}
