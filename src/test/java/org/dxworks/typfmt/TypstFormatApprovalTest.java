package org.dxworks.typfmt;

import org.approvaltests.Approvals;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class TypstFormatApprovalTest {

    private static final Typfmt TYPFMT = new Typfmt();

    @Test
    void format_Typst_Markup() throws Exception {
        verify(Paths.get("src/test/resources/samples/typst/markup.typ"));
    }

    @Test
    void format_Typst_Code() throws Exception {
        verify(Paths.get("src/test/resources/samples/typst/code.typ"));
    }

    @Test
    void format_Typst_Disabled() throws Exception {
        verify(Paths.get("src/test/resources/samples/typst/disabled.typ"));
    }

    @Test
    void format_Typst_Tables() throws Exception {
        verify(Paths.get("src/test/resources/samples/typst/tables.typ"));
    }

    private static void verify(Path file) throws IOException, SyntaxErrorException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        Approvals.verify(TYPFMT.format(content));
    }
}
