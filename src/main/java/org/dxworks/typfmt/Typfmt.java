package org.dxworks.typfmt;

import org.dxworks.typfmt.attr.AttrStore;
import org.dxworks.typfmt.doc.Doc;
import org.dxworks.typfmt.doc.DocRenderer;
import org.dxworks.typfmt.printer.PrettyPrinter;
import org.dxworks.typfmt.syntax.SyntaxNode;
import org.dxworks.typfmt.syntax.TypstParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Formats Typst documents. Instances are immutable and may be shared between threads.
 */
public class Typfmt {

    private static final Logger LOG = LoggerFactory.getLogger(Typfmt.class);

    private final TypfmtConfig config;

    public Typfmt(TypfmtConfig config) {
        this.config = config;
    }

    public Typfmt() {
        this(TypfmtConfig.defaults());
    }

    public TypfmtConfig getConfig() {
        return config;
    }

    public String format(String content) throws SyntaxErrorException {
        SyntaxNode root = TypstParser.parse(content);
        SyntaxNode error = root.firstError();
        if (error != null) {
            LOG.debug("Refusing to format: {} at offset {}", error.errorMessage(), error.offset());
            throw new SyntaxErrorException(error.errorMessage(), error.offset());
        }
        AttrStore attrs = new AttrStore(root);
        PrettyPrinter printer = new PrettyPrinter(attrs, config.getBlankLinesUpperBound());
        Doc doc = printer.convertMarkup(root);
        return stripTrailingWhitespace(DocRenderer.render(doc, config.getMaxWidth()));
    }

    /** Formats with the given width, or returns {@code content} unchanged when it has syntax errors. */
    public static String formatOrOriginal(String content, int maxWidth) {
        Typfmt typfmt = new Typfmt(TypfmtConfig.with(maxWidth, TypfmtConfig.defaults().getBlankLinesUpperBound()));
        try {
            return typfmt.format(content);
        } catch (SyntaxErrorException e) {
            return content;
        }
    }

    /**
     * Trims spaces and tabs at the end of every line, drops trailing empty lines and ends the
     * text with exactly one line feed.
     */
    public static String stripTrailingWhitespace(String text) {
        List<String> lines = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            lines.add(line.stripTrailing());
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }
        return String.join("\n", lines) + "\n";
    }
}
