package org.dxworks.typfmt;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SampleFormattingTest {

    private static final Typfmt TYPFMT = new Typfmt(TypfmtConfig.with(120, 2));

    private static String formatSample(String name) throws IOException, SyntaxErrorException {
        String content = Files.readString(Paths.get("src/test/resources/samples/typst/" + name), StandardCharsets.UTF_8);
        return TYPFMT.format(content);
    }

    @ParameterizedTest
    @ValueSource(strings = {"markup.typ", "code.typ", "disabled.typ", "tables.typ"})
    void formattingTwiceChangesNothing(String name) throws IOException, SyntaxErrorException {
        String once = formatSample(name);
        assertEquals(once, TYPFMT.format(once));
    }

    @ParameterizedTest
    @ValueSource(strings = {"markup.typ", "code.typ", "disabled.typ", "tables.typ"})
    void linesHaveNoTrailingBlanks(String name) throws IOException, SyntaxErrorException {
        for (String line : formatSample(name).split("\n")) {
            assertFalse(line.endsWith(" ") || line.endsWith("\t"), name + ": [" + line + "]");
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"markup.typ", "code.typ", "disabled.typ", "tables.typ"})
    void linesFitTheConfiguredWidth(String name) throws IOException, SyntaxErrorException {
        int width = TYPFMT.getConfig().getMaxWidth();
        for (String line : formatSample(name).split("\n")) {
            boolean singleToken = line.strip().indexOf(' ') < 0;
            assertTrue(singleToken || line.codePointCount(0, line.length()) <= width, name + ": [" + line + "]");
        }
    }
}
