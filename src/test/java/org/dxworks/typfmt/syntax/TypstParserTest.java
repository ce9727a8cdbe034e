package org.dxworks.typfmt.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypstParserTest {

    @Test
    void treeReproducesTheSourceExactly() {
        String[] sources = {
                "= Title\n\nSome *strong* and _emph_ text.\n",
                "#let f(x, y: 2) = x + y\n#f(1, y: 3)[body]\n",
                "#{\n  let a = 1 // note\n  a.b(c).d\n}\n",
                "$ sum_(i=1)^n x_i / 2 $\n",
                "```rust\nfn main() {}\n```\n",
                "- a\n  - b\n+ c\n/ Term: desc\n",
                "#import \"m.typ\": a, b as c\n",
        };
        for (String source : sources) {
            SyntaxNode root = TypstParser.parse(source);
            assertEquals(source, root.text());
            assertNull(root.firstError(), source);
        }
    }

    @Test
    void spanIdsArePreOrder() {
        SyntaxNode root = TypstParser.parse("#f(a)\n");
        assertEquals(0, root.id());
        SyntaxNode call = SyntaxHelper.findFirstDescendant(root, SyntaxKind.FUNC_CALL);
        SyntaxNode args = SyntaxHelper.findFirstDescendant(root, SyntaxKind.ARGS);
        assertTrue(call.id() < args.id());
        assertEquals(2, args.offset());
    }

    @Test
    void codeBlockHoldsStatementsInCode() {
        SyntaxNode root = TypstParser.parse("#{ a; b }\n");
        SyntaxNode block = SyntaxHelper.findFirstDescendant(root, SyntaxKind.CODE_BLOCK);
        List<SyntaxNode> children = block.children();
        assertEquals(SyntaxKind.LEFT_BRACE, children.get(0).kind());
        assertEquals(SyntaxKind.CODE, children.get(1).kind());
        assertEquals(SyntaxKind.RIGHT_BRACE, children.get(2).kind());
        assertEquals(2, SyntaxHelper.items(children.get(1)).size());
    }

    @Test
    void trailingContentBlocksBelongToArguments() {
        SyntaxNode root = TypstParser.parse("#box(width: 1pt)[a][b]\n");
        SyntaxNode args = SyntaxHelper.findFirstDescendant(root, SyntaxKind.ARGS);
        assertEquals(2, SyntaxHelper.findAllChildren(args, SyntaxKind.CONTENT_BLOCK).size());
        assertNotNull(SyntaxHelper.findFirstChild(args, SyntaxKind.NAMED));
    }

    @Test
    void parenthesizedListsAreClassified() {
        assertNotNull(SyntaxHelper.findFirstDescendant(TypstParser.parse("#let a = (1,)\n"), SyntaxKind.ARRAY));
        assertNotNull(SyntaxHelper.findFirstDescendant(TypstParser.parse("#let a = (:)\n"), SyntaxKind.DICT));
        assertNotNull(SyntaxHelper.findFirstDescendant(TypstParser.parse("#let a = (1)\n"), SyntaxKind.PARENTHESIZED));
        assertNotNull(SyntaxHelper.findFirstDescendant(TypstParser.parse("#let (a, b) = c\n"), SyntaxKind.DESTRUCTURING));
    }

    @Test
    void blockEquationKeepsItsSpaces() {
        SyntaxNode root = TypstParser.parse("$ x $\n");
        SyntaxNode equation = SyntaxHelper.findFirstDescendant(root, SyntaxKind.EQUATION);
        List<SyntaxNode> children = equation.children();
        assertEquals(5, children.size());
        assertEquals(SyntaxKind.SPACE, children.get(1).kind());
        assertEquals(SyntaxKind.MATH, children.get(2).kind());
    }

    @Test
    void unclosedDelimitersProduceErrors() {
        for (String source : new String[]{"#f(a, b\n", "#{ a\n", "*strong\n"}) {
            SyntaxNode root = TypstParser.parse(source);
            assertEquals(source, root.text());
            SyntaxNode error = root.firstError();
            assertNotNull(error, source);
            assertTrue(root.erroneous());
            assertFalse(error.errorMessage().isEmpty());
        }
    }

    @Test
    void balancedBracketsInProseAreText() {
        for (String source : new String[]{"See [1] for details.\n", "a [b] c\n", "[[nested] pair]\n"}) {
            SyntaxNode root = TypstParser.parse(source);
            assertEquals(source, root.text());
            assertNull(root.firstError(), source);
            assertNull(SyntaxHelper.findFirstDescendant(root, SyntaxKind.CONTENT_BLOCK), source);
        }
    }

    @Test
    void bracketsInsideAContentBlockPairUpBeforeItCloses() {
        SyntaxNode root = TypstParser.parse("#[[a]]\n");
        assertNull(root.firstError());
        SyntaxNode block = SyntaxHelper.findFirstDescendant(root, SyntaxKind.CONTENT_BLOCK);
        assertEquals("[[a]]", block.text());
        assertNull(SyntaxHelper.findFirstDescendant(block.children().get(1), SyntaxKind.CONTENT_BLOCK));
    }

    @Test
    void unmatchedClosingBracketIsAnError() {
        for (String source : new String[]{"a ] b\n", "#[a]]\n", "[a]]\n"}) {
            SyntaxNode error = TypstParser.parse(source).firstError();
            assertNotNull(error, source);
            assertEquals("unexpected closing bracket", error.errorMessage());
        }
    }

    @Test
    void nestingBelowTheLimitParses() {
        String source = "#" + "(".repeat(100) + "1" + ")".repeat(100) + "\n";
        SyntaxNode root = TypstParser.parse(source);
        assertNull(root.firstError());
        assertEquals(source, root.text());
    }

    @Test
    void nestingBeyondTheLimitIsAnError() {
        String[] sources = {
                "#" + "(".repeat(1000) + "1" + ")".repeat(1000) + "\n",
                "#let x = " + "-".repeat(1000) + "1\n",
                "$" + "(".repeat(1000) + "x" + ")".repeat(1000) + "$\n",
                "#[".repeat(1000) + "a" + "]".repeat(1000) + "\n",
        };
        for (String source : sources) {
            SyntaxNode root = TypstParser.parse(source);
            assertTrue(root.erroneous(), source.substring(0, 12));
            assertEquals(source, root.text());
        }
    }

    @Test
    void longOperatorChainsAreNotNesting() {
        SyntaxNode root = TypstParser.parse("#let x = " + "1 + ".repeat(5000) + "1\n");
        assertNull(root.firstError());
    }
}
