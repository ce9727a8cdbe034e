package org.dxworks.typfmt.attr;

import org.dxworks.typfmt.syntax.SyntaxHelper;
import org.dxworks.typfmt.syntax.SyntaxKind;
import org.dxworks.typfmt.syntax.SyntaxNode;
import org.dxworks.typfmt.syntax.TypstParser;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AttrStoreTest {

    @Test
    void commentInsideArrayDisablesOnlyTheArray() {
        SyntaxNode root = TypstParser.parse("#let x = (1, /* c */ 2)\n");
        AttrStore attrs = new AttrStore(root);

        SyntaxNode binding = SyntaxHelper.findFirstDescendant(root, SyntaxKind.LET_BINDING);
        SyntaxNode array = SyntaxHelper.findFirstDescendant(root, SyntaxKind.ARRAY);
        assertTrue(attrs.isFormatDisabled(array));
        assertTrue(attrs.hasComment(array));
        assertFalse(attrs.isFormatDisabled(binding));
    }

    @Test
    void blocksWithCommentsStayFormattable() {
        SyntaxNode root = TypstParser.parse("#{\n  a // c\n}\n");
        AttrStore attrs = new AttrStore(root);

        SyntaxNode block = SyntaxHelper.findFirstDescendant(root, SyntaxKind.CODE_BLOCK);
        SyntaxNode code = SyntaxHelper.findFirstDescendant(root, SyntaxKind.CODE);
        assertFalse(attrs.isFormatDisabled(block));
        assertFalse(attrs.isFormatDisabled(code));
        assertTrue(attrs.hasComment(code));
    }

    @Test
    void formatOffDisablesOnlyTheNextNode() {
        SyntaxNode root = TypstParser.parse("// @typstyle off\n#f(a)\n#g(b)\n");
        AttrStore attrs = new AttrStore(root);

        List<SyntaxNode> calls = SyntaxHelper.findAllChildren(root, SyntaxKind.FUNC_CALL);
        assertTrue(attrs.isFormatDisabled(calls.get(0)));
        assertFalse(attrs.isFormatDisabled(calls.get(1)));
    }

    @Test
    void argumentsWithRowSeparatorAreDisabled() {
        SyntaxNode root = TypstParser.parse("$mat(1, 2; 3, 4)$\n");
        AttrStore attrs = new AttrStore(root);

        assertTrue(attrs.isFormatDisabled(SyntaxHelper.findFirstDescendant(root, SyntaxKind.ARGS)));
    }

    @Test
    void anyLineBreakBetweenTheParenthesesMakesArgumentsMultiline() {
        SyntaxNode leading = TypstParser.parse("#f(\n  a, b)\n");
        SyntaxNode inner = TypstParser.parse("#f(aaa, bbb,\n  ccc)\n");
        SyntaxNode trailing = TypstParser.parse("#f(a, b,\n)\n");
        SyntaxNode contentOnly = TypstParser.parse("#f(a, b)[x\ny]\n");

        for (SyntaxNode root : new SyntaxNode[]{leading, inner, trailing}) {
            assertTrue(new AttrStore(root).isMultiline(SyntaxHelper.findFirstDescendant(root, SyntaxKind.ARGS)));
        }
        assertFalse(new AttrStore(contentOnly).isMultiline(SyntaxHelper.findFirstDescendant(contentOnly, SyntaxKind.ARGS)));
    }

    @Test
    void collectionsAndBlocksAreMultilineWhenTheirSourceIs() {
        assertTrue(multiline("#let a = (1, 2,\n  3)\n", SyntaxKind.ARRAY));
        assertFalse(multiline("#let a = (1, 2, 3)\n", SyntaxKind.ARRAY));
        assertTrue(multiline("#let d = (a: 1,\n  b: 2)\n", SyntaxKind.DICT));
        assertTrue(multiline("#{\n  a\n}\n", SyntaxKind.CODE_BLOCK));
        assertFalse(multiline("#{ a }\n", SyntaxKind.CODE_BLOCK));
        assertTrue(multiline("$ x +\n  y $\n", SyntaxKind.EQUATION));
    }

    private static boolean multiline(String source, SyntaxKind kind) {
        SyntaxNode root = TypstParser.parse(source);
        return new AttrStore(root).isMultiline(SyntaxHelper.findFirstDescendant(root, kind));
    }

    @Test
    void deepOperatorChainIsClassifiedWithoutRecursion() {
        SyntaxNode root = TypstParser.parse("#let x = " + "1 + ".repeat(5000) + "1\n");
        AttrStore attrs = new AttrStore(root);
        assertFalse(attrs.isFormatDisabled(SyntaxHelper.findFirstDescendant(root, SyntaxKind.BINARY)));
    }

    @Test
    void commentAlongAChainMakesTheWholeChainUnformattable() {
        SyntaxNode root = TypstParser.parse("#{\n  a // c\n    .b.c\n}\n");
        AttrStore attrs = new AttrStore(root);

        SyntaxNode outer = SyntaxHelper.lastExpr(SyntaxHelper.findFirstDescendant(root, SyntaxKind.CODE));
        assertTrue(outer.is(SyntaxKind.FIELD_ACCESS));
        assertTrue(attrs.isUnformattable(outer));
    }

    @Test
    void plainChainIsFormattable() {
        SyntaxNode root = TypstParser.parse("#{\n  a.b.c\n}\n");
        AttrStore attrs = new AttrStore(root);

        assertFalse(attrs.isUnformattable(SyntaxHelper.findFirstDescendant(root, SyntaxKind.FIELD_ACCESS)));
    }

    @Test
    void unnumberedTreeIsRejected() {
        SyntaxNode tree = SyntaxNode.leaf(SyntaxKind.TEXT, "a");
        assertThrows(IllegalArgumentException.class, () -> new AttrStore(tree));
    }
}
