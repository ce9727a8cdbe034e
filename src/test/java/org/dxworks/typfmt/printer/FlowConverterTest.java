package org.dxworks.typfmt.printer;

import org.dxworks.typfmt.doc.Doc;
import org.dxworks.typfmt.doc.DocRenderer;
import org.dxworks.typfmt.syntax.SyntaxHelper;
import org.dxworks.typfmt.syntax.SyntaxKind;
import org.dxworks.typfmt.syntax.SyntaxNode;
import org.dxworks.typfmt.syntax.TypstParser;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FlowConverterTest {

    private static SyntaxNode binding(String source) {
        return SyntaxHelper.findFirstDescendant(TypstParser.parse(source), SyntaxKind.LET_BINDING);
    }

    @Test
    void spacesGoOnlyWhereBothSidesAllowThem() {
        Doc doc = FlowConverter.convert(binding("#let   x   =   1"), child -> {
            if (child.is(SyntaxKind.EQ)) return FlowItem.tightSpaced(Doc.text("="));
            if (child.kind().isExpr()) return FlowItem.spaced(Doc.text(child.text()));
            return FlowItem.none();
        });
        assertEquals("let x= 1", DocRenderer.render(doc, 80));
    }

    @Test
    void unclassifiedKeywordsAreKeptSpaced() {
        Doc doc = FlowConverter.convert(binding("#let x = 1"), child -> FlowItem.none());
        assertEquals("let", DocRenderer.render(doc, 80));
    }

    @Test
    void commentsAreKeptSpaced() {
        SyntaxNode array = SyntaxHelper.findFirstDescendant(TypstParser.parse("#let a = (1, /* c */ 2)"), SyntaxKind.ARRAY);
        Doc doc = FlowConverter.convert(array, child -> child.kind().isExpr()
                ? FlowItem.spaced(Doc.text(child.text()))
                : FlowItem.none());
        assertEquals("1 /* c */ 2", DocRenderer.render(doc, 80));
    }

    @Test
    void lineCommentEndsItsLine() {
        SyntaxNode array = SyntaxHelper.findFirstDescendant(TypstParser.parse("#let a = (1, // c\n  2)"), SyntaxKind.ARRAY);
        Doc doc = FlowConverter.convert(array, child -> child.kind().isExpr()
                ? FlowItem.spaced(Doc.text(child.text()))
                : FlowItem.none());
        assertEquals("1 // c\n2", DocRenderer.render(doc, 80));
    }
}
