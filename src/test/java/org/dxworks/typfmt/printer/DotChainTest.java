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
import static org.junit.jupiter.api.Assertions.assertThrows;

class DotChainTest {

    private static List<Doc> segments(String source) {
        SyntaxNode code = SyntaxHelper.findFirstDescendant(TypstParser.parse(source), SyntaxKind.CODE);
        SyntaxNode chain = SyntaxHelper.lastExpr(code);
        return DotChain.resolve(chain, node -> Doc.text(node.text()),
                call -> Doc.text(call.children().get(1).text()));
    }

    @Test
    void callsStayWithTheirField() {
        List<Doc> segments = segments("#{ a.b(x).c }");
        assertEquals(3, segments.size());
        assertEquals("b(x)", DocRenderer.render(segments.get(1), 80));
    }

    @Test
    void chainHangsOneSegmentPerLineWhenTooLong() {
        Doc chain = DotChain.render(segments("#{ a.b(x).c }"));
        assertEquals("a.b(x).c", DocRenderer.render(chain, 80));
        assertEquals("a\n  .b(x)\n  .c", DocRenderer.render(chain, 3));
    }

    @Test
    void singleAccessNeverBreaks() {
        Doc chain = DotChain.render(segments("#{ a.b }"));
        assertEquals("a.b", DocRenderer.render(chain, 1));
    }

    @Test
    void chainNeedsTwoSegments() {
        assertThrows(IllegalArgumentException.class, () -> DotChain.render(List.of(Doc.text("a"))));
    }
}
