package org.dxworks.typfmt.doc;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class DocRendererTest {

    private static Doc bracketed(String... items) {
        List<Doc> docs = new ArrayList<>();
        for (String item : items) docs.add(Doc.text(item));
        Doc body = Doc.concat(Doc.softline(), Doc.join(docs, Doc.concat(Doc.text(","), Doc.line())),
                Doc.ifBroken(Doc.text(","), Doc.NIL));
        return Doc.concat(Doc.text("("), body.nest(2), Doc.softline(), Doc.text(")")).group();
    }

    @Test
    void groupStaysFlatWhenItFits() {
        assertEquals("(a, b, c)", DocRenderer.render(bracketed("a", "b", "c"), 20));
    }

    @Test
    void groupBreaksWhenTooWide() {
        assertEquals("(\n  a,\n  b,\n  c,\n)", DocRenderer.render(bracketed("a", "b", "c"), 5));
    }

    @Test
    void outerGroupBreaksWhileInnerFits() {
        Doc outer = Doc.concat(Doc.text("x"), Doc.line(), bracketed("aaaa", "bbbb")).group();
        assertEquals("x\n(aaaa, bbbb)", DocRenderer.render(outer, 12));
    }

    @Test
    void hardLineBreaksItsGroups() {
        Doc doc = Doc.concat(Doc.text("a"), Doc.line(), Doc.text("b"), Doc.hardline(), Doc.text("c")).group();
        assertEquals("a\nb\nc", DocRenderer.render(doc, 80));
    }

    @Test
    void multilineTextBreaksItsGroup() {
        Doc doc = Doc.concat(Doc.text("x"), Doc.line(), Doc.text("p\nq")).group();
        assertEquals("x\np\nq", DocRenderer.render(doc, 80));
    }

    @Test
    void trailingBlanksAreTrimmedBeforeLineBreaks() {
        Doc doc = Doc.concat(Doc.text("a"), Doc.space(), Doc.hardline(), Doc.text("b"));
        assertEquals("a\nb", DocRenderer.render(doc, 80));
    }

    @Test
    void blankLineHasNoIndentation() {
        Doc doc = Doc.concat(Doc.text("a"), Doc.blankline(), Doc.text("b")).nest(4);
        assertEquals("a\nb", DocRenderer.render(doc, 80));
    }

    @Test
    void nestIndentsBrokenLines() {
        Doc doc = Doc.concat(Doc.text("{"), Doc.concat(Doc.hardline(), Doc.text("x")).nest(2),
                Doc.hardline(), Doc.text("}"));
        assertEquals("{\n  x\n}", DocRenderer.render(doc, 80));
    }

    @Test
    void emptyTextIsNil() {
        assertSame(Doc.NIL, Doc.text(""));
        assertEquals(2, Doc.concat(Doc.NIL, Doc.text("ab"), Doc.NIL).flatWidth());
    }
}
