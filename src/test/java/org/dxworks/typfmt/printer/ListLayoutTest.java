package org.dxworks.typfmt.printer;

import org.dxworks.typfmt.doc.Doc;
import org.dxworks.typfmt.doc.DocRenderer;
import org.dxworks.typfmt.syntax.SyntaxHelper;
import org.dxworks.typfmt.syntax.SyntaxKind;
import org.dxworks.typfmt.syntax.SyntaxNode;
import org.dxworks.typfmt.syntax.TypstParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ListLayoutTest {

    private static final List<Doc> AB = List.of(Doc.text("a"), Doc.text("b"));

    @Test
    void commaSeparatedFitsOnOneLine() {
        assertEquals("(a, b)", DocRenderer.render(ListLayout.commaSeparated(AB, "(", ")", FoldStyle.FIT), 80));
    }

    @Test
    void commaSeparatedNeverFolds() {
        assertEquals("(\n  a,\n  b,\n)",
                DocRenderer.render(ListLayout.commaSeparated(AB, "(", ")", FoldStyle.NEVER), 80));
    }

    @Test
    void emptyLists() {
        assertEquals("()", DocRenderer.render(ListLayout.commaSeparated(List.of(), "(", ")", FoldStyle.FIT), 80));
        assertEquals("{}", DocRenderer.render(ListLayout.block(List.of(), FoldStyle.FIT), 80));
    }

    @Test
    void blockFoldsWithSemicolons() {
        assertEquals("{ a; b }", DocRenderer.render(ListLayout.block(AB, FoldStyle.FIT), 80));
        assertEquals("{\n  a\n  b\n}", DocRenderer.render(ListLayout.block(AB, FoldStyle.FIT), 5));
    }

    @Test
    void blockKeepsBlankLinePlaceholders() {
        List<Doc> items = List.of(Doc.text("a"), Doc.NIL, Doc.text("b"));
        assertEquals("{\n  a\n\n  b\n}", DocRenderer.render(ListLayout.block(items, FoldStyle.NEVER), 80));
    }

    @Test
    void tightHasNoBreaks() {
        assertEquals("[a, b]", DocRenderer.render(ListLayout.tight(AB, "[", "]"), 1));
    }

    @Test
    void asIsReplaysSpacingAndLineFeeds() {
        SyntaxNode root = TypstParser.parse("#f(a,   b\n)\n");
        SyntaxNode args = SyntaxHelper.findFirstDescendant(root, SyntaxKind.ARGS);
        Doc doc = ListLayout.asIs(args, node -> Doc.text(node.text()));
        assertEquals("(a, b\n)", DocRenderer.render(doc, 80));
    }
}
