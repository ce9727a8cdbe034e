package org.dxworks.typfmt.printer;

import org.dxworks.typfmt.doc.Doc;
import org.dxworks.typfmt.syntax.SyntaxKind;
import org.dxworks.typfmt.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lays out the children of a node as a flow of tokens and sub-expressions separated by single
 * spaces. Which children take part, and how they are spaced, is decided by a {@link Classifier}.
 */
public final class FlowConverter {

    /** Decides the flow item for one child. Called once per child, in source order. */
    @FunctionalInterface
    public interface Classifier {
        FlowItem classify(SyntaxNode child);
    }

    private FlowConverter() {
    }

    public static Doc convert(SyntaxNode node, Classifier classifier) {
        List<Doc> parts = new ArrayList<>();
        FlowItem previous = null;
        for (SyntaxNode child : node.children()) {
            if (child.is(SyntaxKind.SPACE)) continue;
            FlowItem item;
            if (child.is(SyntaxKind.LINE_COMMENT)) {
                // a line comment runs to the end of its line
                item = FlowItem.spacedTight(Doc.concat(Doc.text(child.text()), Doc.hardline()));
            } else if (child.is(SyntaxKind.BLOCK_COMMENT)) {
                item = FlowItem.spaced(Doc.text(child.text()));
            } else {
                item = classifier.classify(child);
                if (item.isNone() && child.kind().isKeyword()) {
                    item = FlowItem.spaced(Doc.text(child.text()));
                }
            }
            if (item.isNone()) continue;
            if (previous != null && previous.isSpaceAfter() && item.isSpaceBefore()) {
                parts.add(Doc.space());
            }
            parts.add(item.getDoc());
            previous = item;
        }
        return Doc.concat(parts);
    }
}
