package org.dxworks.typfmt.attr;

import org.dxworks.typfmt.syntax.SyntaxHelper;
import org.dxworks.typfmt.syntax.SyntaxKind;
import org.dxworks.typfmt.syntax.SyntaxNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;

/**
 * Per-node classifications computed in one pass over a parsed tree and indexed by span id.
 * Read-only once constructed.
 */
public final class AttrStore {

    private static final Logger LOG = LoggerFactory.getLogger(AttrStore.class);

    /** Comment text that switches formatting off for the next sibling. */
    public static final String FORMAT_OFF = "@typstyle off";

    private final BitSet visited = new BitSet();
    private final BitSet multiline = new BitSet();
    private final BitSet disabled = new BitSet();
    private final BitSet unformattable = new BitSet();
    private final BitSet comment = new BitSet();

    public AttrStore(SyntaxNode root) {
        requireNumbered(root);
        compute(root);
        LOG.trace("Attributes computed: {} nodes, {} disabled, {} unformattable",
                visited.cardinality(), disabled.cardinality(), unformattable.cardinality());
    }

    /** The node's literal source span already contains a line break: the author laid it out over several lines. */
    public boolean isMultiline(SyntaxNode node) {
        return multiline.get(index(node));
    }

    /** The node must be printed exactly as written. */
    public boolean isFormatDisabled(SyntaxNode node) {
        return disabled.get(index(node));
    }

    /** A field-access chain with a comment somewhere along it. */
    public boolean isUnformattable(SyntaxNode node) {
        return unformattable.get(index(node));
    }

    public boolean hasComment(SyntaxNode node) {
        return comment.get(index(node));
    }

    private void compute(SyntaxNode root) {
        List<SyntaxNode> preOrder = new ArrayList<>();
        Deque<SyntaxNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            SyntaxNode node = stack.pop();
            if (visited.get(node.id())) continue;
            visited.set(node.id());
            preOrder.add(node);
            classifyChildren(node);
            List<SyntaxNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                if (!children.get(i).isLeaf()) stack.push(children.get(i));
            }
        }

        // Reverse pre-order sees every chain link before the access built on it.
        for (int i = preOrder.size() - 1; i >= 0; i--) {
            SyntaxNode node = preOrder.get(i);
            if (node.is(SyntaxKind.FIELD_ACCESS)) {
                unformattable.set(node.id(), comment.get(node.id()) || chainLinkUnformattable(node.children().get(0)));
            }
        }
    }

    private void classifyChildren(SyntaxNode node) {
        int id = node.id();
        if (spansLineBreak(node)) multiline.set(id);

        boolean formatOff = false;
        for (SyntaxNode child : node.children()) {
            if (child.kind().isComment()) {
                comment.set(id);
                if (child.text().contains(FORMAT_OFF)) {
                    formatOff = true;
                    disabled.set(child.id());
                }
                if (!isBlockLike(node)) disabled.set(id);
                continue;
            }
            if (child.is(SyntaxKind.ARGS) && hasRowSeparator(child)) {
                disabled.set(child.id());
                continue;
            }
            if (child.isLeaf()) continue;
            if (formatOff) {
                disabled.set(child.id());
                formatOff = false;
            }
        }
    }

    /**
     * Delimited lists, blocks and equations whose source between the delimiters holds a line feed.
     * Trailing content blocks of an argument list lie outside its parentheses and do not count.
     */
    private static boolean spansLineBreak(SyntaxNode node) {
        List<SyntaxNode> children = node.children();
        switch (node.kind()) {
            case ARGS: {
                SyntaxNode open = SyntaxHelper.findFirstChild(node, SyntaxKind.LEFT_PAREN);
                SyntaxNode close = SyntaxHelper.findLastChild(node, SyntaxKind.RIGHT_PAREN);
                if (open == null || close == null) return false;
                return SyntaxHelper.containsNewline(children, children.indexOf(open) + 1, children.indexOf(close));
            }
            case ARRAY:
            case DICT:
            case PARAMS:
            case DESTRUCTURING:
            case IMPORT_ITEMS:
            case CODE:
            case CODE_BLOCK:
            case EQUATION:
                return SyntaxHelper.containsNewline(children, 0, children.size());
            default:
                return false;
        }
    }

    /** Blocks keep their own comment handling; everything else with a comment child stays verbatim. */
    private static boolean isBlockLike(SyntaxNode node) {
        return node.is(SyntaxKind.CONTENT_BLOCK) || node.is(SyntaxKind.CODE_BLOCK) || node.is(SyntaxKind.CODE);
    }

    private static boolean hasRowSeparator(SyntaxNode args) {
        for (SyntaxNode child : args.children()) {
            if (child.is(SyntaxKind.SEMICOLON)) return true;
        }
        return false;
    }

    private boolean chainLinkUnformattable(SyntaxNode target) {
        if (target.is(SyntaxKind.FIELD_ACCESS)) return unformattable.get(target.id());
        if (target.is(SyntaxKind.FUNC_CALL)) {
            SyntaxNode callee = target.children().get(0);
            return callee.is(SyntaxKind.FIELD_ACCESS) && unformattable.get(callee.id());
        }
        return false;
    }

    private static void requireNumbered(SyntaxNode root) {
        if (root.id() < 0) {
            throw new IllegalArgumentException("Tree has no span ids; parse it with TypstParser.parse");
        }
    }

    private static int index(SyntaxNode node) {
        int id = node.id();
        if (id < 0) throw new IllegalArgumentException("Node has no span id: " + node);
        return id;
    }
}
