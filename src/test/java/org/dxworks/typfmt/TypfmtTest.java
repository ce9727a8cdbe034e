package org.dxworks.typfmt;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypfmtTest {

    private static String format(String source, int width) throws SyntaxErrorException {
        return new Typfmt(TypfmtConfig.with(width, 2)).format(source);
    }

    @Test
    void linkWithContentStaysAsWritten() throws SyntaxErrorException {
        String source = "#link(\"http://example.com\")[test]\n";
        assertEquals(source, format(source, 120));
    }

    @Test
    void longArgumentListBreaksOnePerLine() throws SyntaxErrorException {
        String expected = "#f(\n  aaa,\n  bbb,\n  ccc,\n  ddd,\n  eee,\n  fff,\n)\n";
        assertEquals(expected, format("#f(aaa, bbb, ccc, ddd, eee, fff)\n", 20));
    }

    @Test
    void shortArgumentListStaysFlat() throws SyntaxErrorException {
        assertEquals("#f(aaa, bbb)\n", format("#f(aaa,bbb)\n", 80));
    }

    @Test
    void argumentListWrittenOverLinesStaysBroken() throws SyntaxErrorException {
        assertEquals("#f(\n  a,\n  b,\n)\n", format("#f(\n  a, b)\n", 80));
    }

    @Test
    void lineBreakAfterAnyArgumentKeepsTheListBroken() throws SyntaxErrorException {
        assertEquals("#f(\n  aaa,\n  bbb,\n  ccc,\n)\n", format("#f(aaa, bbb,\n  ccc)\n", 80));
    }

    @Test
    void arrayWrittenOverLinesStaysBroken() throws SyntaxErrorException {
        assertEquals("#let a = (\n  1,\n  2,\n  3,\n)\n", format("#let a = (1, 2,\n  3)\n", 80));
    }

    @Test
    void bracketsInProseStayAsWritten() throws SyntaxErrorException {
        for (String source : new String[]{"See [1] for details.\n", "a [b] c\n", "#[[a]]\n"}) {
            assertEquals(source, format(source, 80));
        }
    }

    @Test
    void longOperatorChainFormats() throws SyntaxErrorException {
        String source = "#let x = " + "1 + ".repeat(5000) + "1\n";
        assertEquals(source, format(source, 120));
    }

    @Test
    void excessiveNestingIsASyntaxError() {
        String source = "#" + "(".repeat(1000) + "1" + ")".repeat(1000) + "\n";
        assertThrows(SyntaxErrorException.class, () -> format(source, 120));
    }

    @Test
    void dotChainFitsOnOneLine() throws SyntaxErrorException {
        String source = "#{\n  a.b.c.d.e.f.g.h\n}\n";
        assertEquals(source, format(source, 80));
    }

    @Test
    void dotChainBreaksBeforeEachDot() throws SyntaxErrorException {
        String expected = "#{\n  a\n    .b\n    .c\n    .d\n    .e\n    .f\n    .g\n    .h\n}\n";
        assertEquals(expected, format("#{\n  a.b.c.d.e.f.g.h\n}\n", 10));
    }

    @Test
    void blankLinesInCodeAreCappedAndCommentStaysOnItsLine() throws SyntaxErrorException {
        String source = "#{\n  let a = 1 // note\n\n\n\n  let b = 2\n}\n";
        String expected = "#{\n  let a = 1 // note\n\n  let b = 2\n}\n";
        assertEquals(expected, new Typfmt(TypfmtConfig.with(120, 1)).format(source));
    }

    @Test
    void singleStatementBlockFolds() throws SyntaxErrorException {
        assertEquals("#{ a }\n", format("#{a}\n", 80));
    }

    @Test
    void severalStatementsUnfold() throws SyntaxErrorException {
        assertEquals("#{\n  a\n  b\n}\n", format("#{a; b}\n", 80));
    }

    @Test
    void binaryOperatorsAreSpaced() throws SyntaxErrorException {
        assertEquals("#let x = 1 + 2 * 3\n", format("#let x = 1+2*3\n", 80));
    }

    @Test
    void singleItemArrayKeepsTrailingComma() throws SyntaxErrorException {
        assertEquals("#let x = (1,)\n", format("#let x = ( 1 , )\n", 80));
    }

    @Test
    void emptyDictionary() throws SyntaxErrorException {
        assertEquals("#let d = (:)\n", format("#let d = (:)\n", 80));
    }

    @Test
    void notIsSpacedFromItsOperand() throws SyntaxErrorException {
        assertEquals("#let y = not x\n", format("#let y = not   x\n", 80));
    }

    @Test
    void setRuleOnTableDoesNotUseRows() throws SyntaxErrorException {
        assertEquals("#set table(columns: 2)\n", format("#set table(columns:2)\n", 80));
    }

    @Test
    void tableCellsAlignInColumns() throws SyntaxErrorException {
        String expected = "#table(\n  columns: 2,\n  [a],  [bbb],\n  [cc], [d],\n)\n";
        assertEquals(expected, format("#table(columns: 2, [a], [bbb], [cc], [d])\n", 80));
    }

    @Test
    void proseSpacesCollapseAndTrailingBlankLinesDrop() throws SyntaxErrorException {
        assertEquals("Hello world\n", format("Hello   world  \n\n\n", 80));
    }

    @Test
    void paragraphBreakInsideListItemLeavesAnEmptyLine() throws SyntaxErrorException {
        String source = "- a\n\n  b\n";
        assertEquals(source, format(source, 80));
    }

    @Test
    void formatOffKeepsNextStatement() throws SyntaxErrorException {
        String source = "#let f(x)=x\n// @typstyle off\n#let   g  =  (1,2)\n";
        String expected = "#let f(x) = x\n// @typstyle off\n#let   g  =  (1,2)\n";
        assertEquals(expected, format(source, 80));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "#f(aaa, bbb, ccc, ddd, eee, fff)\n",
            "#{\n  a.b.c.d.e.f.g.h\n}\n",
            "#table(columns: 2, [a], [bbb], [cc], [d])\n",
            "= Title\n\nSome   *text*.\n",
            "#let   add(x,y)=x+y\n",
    })
    void formattingIsIdempotent(String source) throws SyntaxErrorException {
        String once = format(source, 20);
        assertEquals(once, format(once, 20));
    }

    @Test
    void outputHasNoTrailingSpaces() throws SyntaxErrorException {
        String formatted = format("#let a = (\n  1,   \n  2,\n)   \n\n\ntext  \n", 80);
        for (String line : formatted.split("\n")) {
            assertEquals(line.stripTrailing(), line);
        }
        assertTrue(formatted.endsWith("\n"));
        assertTrue(!formatted.endsWith("\n\n"));
    }

    @Test
    void syntaxErrorIsReported() {
        SyntaxErrorException e = assertThrows(SyntaxErrorException.class, () -> format("#f(a, b\n", 80));
        assertTrue(e.getOffset() >= 0);
    }

    @Test
    void formatOrOriginalReturnsInputOnSyntaxError() {
        String source = "#f(a, b\n";
        assertEquals(source, Typfmt.formatOrOriginal(source, 80));
    }

    @Test
    void formatOrOriginalFormatsValidInput() {
        assertEquals("#f(a, b)\n", Typfmt.formatOrOriginal("#f(a,b)", 80));
    }

    @Test
    void stripTrailingWhitespaceNormalizesLineEnds() {
        assertEquals("a\n  b\n", Typfmt.stripTrailingWhitespace("a  \n  b\t\n\n\n"));
        assertEquals("\n", Typfmt.stripTrailingWhitespace(""));
    }
}
