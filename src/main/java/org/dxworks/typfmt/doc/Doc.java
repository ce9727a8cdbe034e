package org.dxworks.typfmt.doc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable layout document. Values are built bottom-up by the printer and laid out by
 * {@link DocRenderer}; the same instance may appear in several places.
 */
public abstract class Doc {

    public static final Doc NIL = new Text("");

    private static final Doc SPACE = new Text(" ");
    private static final Doc LINE = new Line(LineKind.SPACE);
    private static final Doc SOFTLINE = new Line(LineKind.SOFT);
    private static final Doc HARDLINE = new Line(LineKind.HARD);
    private static final Doc BLANKLINE = new Line(LineKind.BLANK);

    public enum LineKind {
        /** One space when flat. */
        SPACE,
        /** Nothing when flat. */
        SOFT,
        HARD,
        /** Line feed without indentation. */
        BLANK
    }

    Doc() {
    }

    /** True when this document can never be laid out on a single line. */
    public abstract boolean hasHardBreak();

    /** Width on one line, or -1 when it cannot be flat. */
    public abstract int flatWidth();

    // --- constructors ---

    public static Doc text(String text) {
        if (text.isEmpty()) return NIL;
        if (text.equals(" ")) return SPACE;
        return new Text(text);
    }

    /** A literal space that never breaks. */
    public static Doc space() {
        return SPACE;
    }

    public static Doc line() {
        return LINE;
    }

    public static Doc softline() {
        return SOFTLINE;
    }

    public static Doc hardline() {
        return HARDLINE;
    }

    /** An empty line: breaks like {@link #hardline()} but writes no indentation. */
    public static Doc blankline() {
        return BLANKLINE;
    }

    public static Doc concat(Doc... docs) {
        return concat(Arrays.asList(docs));
    }

    public static Doc concat(List<Doc> docs) {
        List<Doc> parts = new ArrayList<>(docs.size());
        for (Doc doc : docs) {
            if (doc == NIL) continue;
            if (doc instanceof Concat concat) {
                parts.addAll(concat.parts);
            } else {
                parts.add(doc);
            }
        }
        if (parts.isEmpty()) return NIL;
        if (parts.size() == 1) return parts.get(0);
        return new Concat(parts);
    }

    public static Doc nest(int indent, Doc doc) {
        if (doc == NIL) return NIL;
        return new Nest(indent, doc);
    }

    public static Doc group(Doc doc) {
        if (doc instanceof Group || doc instanceof Text) return doc;
        return new Group(doc);
    }

    public static Doc ifBroken(Doc broken, Doc flat) {
        return new IfBroken(broken, flat);
    }

    /** Joins documents with a separator between each pair. */
    public static Doc join(List<Doc> docs, Doc separator) {
        List<Doc> parts = new ArrayList<>();
        for (int i = 0; i < docs.size(); i++) {
            if (i > 0) parts.add(separator);
            parts.add(docs.get(i));
        }
        return concat(parts);
    }

    public static Doc repeat(Doc doc, int times) {
        List<Doc> parts = new ArrayList<>();
        for (int i = 0; i < times; i++) parts.add(doc);
        return concat(parts);
    }

    // --- fluent helpers ---

    public Doc append(Doc other) {
        return concat(this, other);
    }

    public Doc append(String text) {
        return concat(this, text(text));
    }

    public Doc nest(int indent) {
        return nest(indent, this);
    }

    public Doc group() {
        return group(this);
    }

    public Doc enclose(String open, String close) {
        return concat(text(open), this, text(close));
    }

    public Doc enclose(Doc open, Doc close) {
        return concat(open, this, close);
    }

    // --- variants ---

    public static final class Text extends Doc {
        final String text;
        private final int width;
        private final int lastLineWidth;
        private final boolean multiline;

        Text(String text) {
            this.text = text;
            int newline = text.lastIndexOf('\n');
            this.multiline = newline >= 0;
            this.width = multiline ? -1 : text.codePointCount(0, text.length());
            this.lastLineWidth = multiline ? text.codePointCount(newline + 1, text.length()) : width;
        }

        public String getText() {
            return text;
        }

        /** Width of the first line; what a fit check can see before the text breaks. */
        int firstLineWidth() {
            int newline = text.indexOf('\n');
            return newline < 0 ? width : text.codePointCount(0, newline);
        }

        int lastLineWidth() {
            return lastLineWidth;
        }

        boolean isMultiline() {
            return multiline;
        }

        @Override
        public boolean hasHardBreak() {
            return multiline;
        }

        @Override
        public int flatWidth() {
            return width;
        }
    }

    public static final class Line extends Doc {
        final LineKind kind;

        Line(LineKind kind) {
            this.kind = kind;
        }

        public LineKind getKind() {
            return kind;
        }

        @Override
        public boolean hasHardBreak() {
            return kind == LineKind.HARD || kind == LineKind.BLANK;
        }

        @Override
        public int flatWidth() {
            switch (kind) {
                case SPACE: return 1;
                case SOFT: return 0;
                default: return -1;
            }
        }
    }

    public static final class Concat extends Doc {
        final List<Doc> parts;
        private final boolean hardBreak;
        private final int flatWidth;

        Concat(List<Doc> parts) {
            this.parts = List.copyOf(parts);
            boolean hard = false;
            int width = 0;
            for (Doc part : this.parts) {
                hard |= part.hasHardBreak();
                int w = part.flatWidth();
                width = (width < 0 || w < 0) ? -1 : width + w;
            }
            this.hardBreak = hard;
            this.flatWidth = width;
        }

        public List<Doc> getParts() {
            return parts;
        }

        @Override
        public boolean hasHardBreak() {
            return hardBreak;
        }

        @Override
        public int flatWidth() {
            return flatWidth;
        }
    }

    public static final class Nest extends Doc {
        final int indent;
        final Doc doc;

        Nest(int indent, Doc doc) {
            this.indent = indent;
            this.doc = doc;
        }

        @Override
        public boolean hasHardBreak() {
            return doc.hasHardBreak();
        }

        @Override
        public int flatWidth() {
            return doc.flatWidth();
        }
    }

    public static final class Group extends Doc {
        final Doc doc;
        private final boolean hardBreak;

        Group(Doc doc) {
            this.doc = doc;
            this.hardBreak = doc.hasHardBreak();
        }

        @Override
        public boolean hasHardBreak() {
            return hardBreak;
        }

        @Override
        public int flatWidth() {
            return doc.flatWidth();
        }
    }

    /** Renders {@code broken} inside a broken group and {@code flat} inside a flat one. */
    public static final class IfBroken extends Doc {
        final Doc broken;
        final Doc flat;

        IfBroken(Doc broken, Doc flat) {
            this.broken = broken;
            this.flat = flat;
        }

        @Override
        public boolean hasHardBreak() {
            return flat.hasHardBreak();
        }

        @Override
        public int flatWidth() {
            return flat.flatWidth();
        }
    }
}
