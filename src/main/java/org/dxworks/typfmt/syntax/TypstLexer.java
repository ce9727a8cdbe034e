package org.dxworks.typfmt.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Character cursor over Typst source with the token scanners shared by the markup, code and math
 * modes. The parser decides the mode; the lexer only knows how to cut the next token in it.
 */
final class TypstLexer {

    private static final Map<String, SyntaxKind> KEYWORDS = Map.ofEntries(
            Map.entry("none", SyntaxKind.NONE),
            Map.entry("auto", SyntaxKind.AUTO),
            Map.entry("true", SyntaxKind.BOOL),
            Map.entry("false", SyntaxKind.BOOL),
            Map.entry("not", SyntaxKind.NOT),
            Map.entry("and", SyntaxKind.AND),
            Map.entry("or", SyntaxKind.OR),
            Map.entry("let", SyntaxKind.LET),
            Map.entry("set", SyntaxKind.SET),
            Map.entry("show", SyntaxKind.SHOW),
            Map.entry("context", SyntaxKind.CONTEXT),
            Map.entry("if", SyntaxKind.IF),
            Map.entry("else", SyntaxKind.ELSE),
            Map.entry("for", SyntaxKind.FOR),
            Map.entry("in", SyntaxKind.IN),
            Map.entry("while", SyntaxKind.WHILE),
            Map.entry("break", SyntaxKind.BREAK),
            Map.entry("continue", SyntaxKind.CONTINUE),
            Map.entry("return", SyntaxKind.RETURN),
            Map.entry("import", SyntaxKind.IMPORT),
            Map.entry("include", SyntaxKind.INCLUDE),
            Map.entry("as", SyntaxKind.AS));

    private static final String[] UNITS = {"pt", "mm", "cm", "in", "em", "fr", "deg", "rad", "%"};

    private final String src;
    private int pos;

    TypstLexer(String src) {
        this.src = src;
    }

    // --- cursor ---

    int pos() {
        return pos;
    }

    void jump(int target) {
        pos = target;
    }

    boolean done() {
        return pos >= src.length();
    }

    char peek() {
        return peek(0);
    }

    char peek(int ahead) {
        int i = pos + ahead;
        return i < src.length() ? src.charAt(i) : '\0';
    }

    char charAt(int index) {
        return index >= 0 && index < src.length() ? src.charAt(index) : '\0';
    }

    boolean isEnd(int index) {
        return index >= src.length();
    }

    char before() {
        return pos > 0 ? src.charAt(pos - 1) : '\0';
    }

    boolean at(String s) {
        return src.startsWith(s, pos);
    }

    boolean eat(String s) {
        if (!at(s)) return false;
        pos += s.length();
        return true;
    }

    String from(int start) {
        return src.substring(start, pos);
    }

    /** Consumes everything left in the input. */
    String rest() {
        int start = pos;
        pos = src.length();
        return from(start);
    }

    String slice(int start, int end) {
        return src.substring(start, end);
    }

    SyntaxNode leaf(SyntaxKind kind, int length) {
        int start = pos;
        pos += length;
        return SyntaxNode.leaf(kind, from(start));
    }

    SyntaxNode leafFrom(SyntaxKind kind, int start) {
        return SyntaxNode.leaf(kind, from(start));
    }

    /** Column of the cursor: characters since the last line feed. */
    int column() {
        int lineStart = src.lastIndexOf('\n', pos - 1) + 1;
        return pos - lineStart;
    }

    /** True when only blanks precede the cursor on its line. */
    boolean atLineStart() {
        for (int i = pos - 1; i >= 0; i--) {
            char c = src.charAt(i);
            if (c == '\n') return true;
            if (c != ' ' && c != '\t') return false;
        }
        return true;
    }

    // --- character classes ---

    static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r';
    }

    static boolean isIdStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    static boolean isIdContinue(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-';
    }

    static boolean isLabelChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' || c == ':';
    }

    // --- trivia ---

    int whitespaceEnd(int from) {
        int i = from;
        while (i < src.length() && isSpace(src.charAt(i))) i++;
        return i;
    }

    /**
     * End of the run of whitespace and comments starting at {@code from}. Without {@code newlines}
     * the run stops before any whitespace containing a line feed.
     */
    int triviaEnd(int from, boolean newlines) {
        int i = from;
        while (i < src.length()) {
            char c = src.charAt(i);
            if (isSpace(c)) {
                int end = whitespaceEnd(i);
                if (!newlines && src.substring(i, end).indexOf('\n') >= 0) {
                    // blanks before the line feed still belong to the run
                    while (i < end && (src.charAt(i) == ' ' || src.charAt(i) == '\t')) i++;
                    return i;
                }
                i = end;
            } else if (src.startsWith("//", i)) {
                i = lineCommentEnd(i);
            } else if (src.startsWith("/*", i)) {
                int end = blockCommentEnd(i);
                if (end < 0) return i;
                i = end;
            } else {
                return i;
            }
        }
        return i;
    }

    /** Cuts the trivia between the cursor and {@code end} into space and comment leaves. */
    List<SyntaxNode> triviaUntil(int end) {
        List<SyntaxNode> nodes = new ArrayList<>();
        while (pos < end) {
            if (isSpace(peek())) {
                int start = pos;
                pos = Math.min(whitespaceEnd(pos), end);
                nodes.add(leafFrom(SyntaxKind.SPACE, start));
                continue;
            }
            SyntaxNode node = comment();
            if (node == null) break;
            nodes.add(node);
        }
        return nodes;
    }

    /** One whitespace or comment leaf at the cursor, or null. Whitespace here is always SPACE. */
    SyntaxNode trivia() {
        char c = peek();
        if (isSpace(c)) {
            int start = pos;
            pos = whitespaceEnd(pos);
            return leafFrom(SyntaxKind.SPACE, start);
        }
        return comment();
    }

    SyntaxNode comment() {
        int start = pos;
        if (at("//")) {
            pos = lineCommentEnd(pos);
            return leafFrom(SyntaxKind.LINE_COMMENT, start);
        }
        if (at("/*")) {
            int end = blockCommentEnd(pos);
            if (end < 0) {
                pos = src.length();
                return SyntaxNode.error("unclosed block comment", from(start));
            }
            pos = end;
            return leafFrom(SyntaxKind.BLOCK_COMMENT, start);
        }
        return null;
    }

    boolean atComment() {
        return at("//") || at("/*");
    }

    private int lineCommentEnd(int from) {
        int i = from;
        while (i < src.length() && src.charAt(i) != '\n' && src.charAt(i) != '\r') i++;
        return i;
    }

    /** Block comments nest; returns -1 when unclosed. */
    private int blockCommentEnd(int from) {
        int depth = 0;
        int i = from;
        while (i < src.length()) {
            if (src.startsWith("/*", i)) {
                depth++;
                i += 2;
            } else if (src.startsWith("*/", i)) {
                depth--;
                i += 2;
                if (depth == 0) return i;
            } else {
                i++;
            }
        }
        return -1;
    }

    // --- code tokens ---

    int identEnd(int from) {
        if (from >= src.length() || !isIdStart(src.charAt(from))) return from;
        int i = from + 1;
        while (i < src.length() && isIdContinue(src.charAt(i))) i++;
        return i;
    }

    boolean atIdent() {
        return isIdStart(peek()) && !(peek() == '_' && !isIdContinue(peek(1)));
    }

    /** Keyword kind of the identifier at the cursor, or null. */
    SyntaxKind keywordAt() {
        int end = identEnd(pos);
        if (end == pos) return null;
        return KEYWORDS.get(src.substring(pos, end));
    }

    /** Identifier or keyword leaf at the cursor. */
    SyntaxNode identOrKeyword() {
        int start = pos;
        pos = identEnd(pos);
        String text = from(start);
        SyntaxKind kind = KEYWORDS.getOrDefault(text, SyntaxKind.IDENT);
        return SyntaxNode.leaf(kind, text);
    }

    SyntaxNode ident() {
        int start = pos;
        pos = identEnd(pos);
        return leafFrom(SyntaxKind.IDENT, start);
    }

    boolean atNumber() {
        return Character.isDigit(peek()) || (peek() == '.' && Character.isDigit(peek(1)));
    }

    /** Integer, float or numeric-with-unit literal. */
    SyntaxNode number() {
        int start = pos;
        if (at("0x") || at("0b") || at("0o")) {
            pos += 2;
            while (Character.isLetterOrDigit(peek())) pos++;
            return leafFrom(SyntaxKind.INT, start);
        }
        boolean isFloat = false;
        while (Character.isDigit(peek())) pos++;
        if (peek() == '.' && Character.isDigit(peek(1))) {
            isFloat = true;
            pos++;
            while (Character.isDigit(peek())) pos++;
        }
        if ((peek() == 'e' || peek() == 'E')
                && (Character.isDigit(peek(1)) || ((peek(1) == '+' || peek(1) == '-') && Character.isDigit(peek(2))))) {
            isFloat = true;
            pos += 2;
            while (Character.isDigit(peek())) pos++;
        }
        for (String unit : UNITS) {
            if (at(unit) && (unit.equals("%") || !isIdContinue(peek(unit.length())))) {
                pos += unit.length();
                return leafFrom(SyntaxKind.NUMERIC, start);
            }
        }
        return leafFrom(isFloat ? SyntaxKind.FLOAT : SyntaxKind.INT, start);
    }

    /** String literal; may span lines. */
    SyntaxNode string() {
        int start = pos;
        pos++;
        while (!done()) {
            char c = peek();
            if (c == '\\') {
                pos += 2;
            } else if (c == '"') {
                pos++;
                return leafFrom(SyntaxKind.STR, start);
            } else {
                pos++;
            }
        }
        pos = Math.min(pos, src.length());
        return SyntaxNode.error("unclosed string", from(start));
    }

    /** End of a {@code <label>} at the cursor, or -1. */
    int labelEnd() {
        if (peek() != '<') return -1;
        int i = pos + 1;
        while (i < src.length() && isLabelChar(src.charAt(i))) i++;
        if (i == pos + 1 || i >= src.length() || src.charAt(i) != '>') return -1;
        return i + 1;
    }

    SyntaxNode label() {
        int end = labelEnd();
        int start = pos;
        pos = end;
        return leafFrom(SyntaxKind.LABEL, start);
    }

    /**
     * Operator or punctuation token of code mode, longest match first; null when the cursor is on
     * something else.
     */
    SyntaxKind codePunctAt() {
        char c = peek();
        char n = peek(1);
        switch (c) {
            case '{': return SyntaxKind.LEFT_BRACE;
            case '}': return SyntaxKind.RIGHT_BRACE;
            case '[': return SyntaxKind.LEFT_BRACKET;
            case ']': return SyntaxKind.RIGHT_BRACKET;
            case '(': return SyntaxKind.LEFT_PAREN;
            case ')': return SyntaxKind.RIGHT_PAREN;
            case ',': return SyntaxKind.COMMA;
            case ';': return SyntaxKind.SEMICOLON;
            case ':': return SyntaxKind.COLON;
            case '.': return n == '.' ? SyntaxKind.DOTS : SyntaxKind.DOT;
            case '=':
                if (n == '>') return SyntaxKind.ARROW;
                return n == '=' ? SyntaxKind.EQ_EQ : SyntaxKind.EQ;
            case '!': return n == '=' ? SyntaxKind.EXCL_EQ : null;
            case '<': return n == '=' ? SyntaxKind.LT_EQ : SyntaxKind.LT;
            case '>': return n == '=' ? SyntaxKind.GT_EQ : SyntaxKind.GT;
            case '+': return n == '=' ? SyntaxKind.PLUS_EQ : SyntaxKind.PLUS;
            case '-': return n == '=' ? SyntaxKind.HYPH_EQ : SyntaxKind.MINUS;
            case '*': return n == '=' ? SyntaxKind.STAR_EQ : SyntaxKind.STAR;
            case '/':
                if (n == '/' || n == '*') return null;
                return n == '=' ? SyntaxKind.SLASH_EQ : SyntaxKind.SLASH;
            default: return null;
        }
    }

    static int punctLength(SyntaxKind kind) {
        switch (kind) {
            case DOTS, ARROW, EQ_EQ, EXCL_EQ, LT_EQ, GT_EQ, PLUS_EQ, HYPH_EQ, STAR_EQ, SLASH_EQ:
                return 2;
            default:
                return 1;
        }
    }

    SyntaxNode punct(SyntaxKind kind) {
        return leaf(kind, punctLength(kind));
    }

    // --- raw ---

    boolean atRaw() {
        return peek() == '`';
    }

    /**
     * Raw text: inline spans keep their text as one leaf; fenced blocks are cut into lines with the
     * common indentation moved into the {@code RAW_TRIMMED} separators.
     */
    SyntaxNode raw() {
        int start = pos;
        int ticks = 0;
        while (peek() == '`') {
            pos++;
            ticks++;
        }
        String delim = "`".repeat(ticks);
        List<SyntaxNode> children = new ArrayList<>();
        if (ticks == 2) {
            children.add(SyntaxNode.leaf(SyntaxKind.RAW_DELIM, "`"));
            children.add(SyntaxNode.leaf(SyntaxKind.RAW_DELIM, "`"));
            return SyntaxNode.inner(SyntaxKind.RAW, children);
        }
        if (ticks == 1) {
            int close = src.indexOf('`', pos);
            if (close < 0) {
                pos = src.length();
                return SyntaxNode.error("unclosed raw text", from(start));
            }
            children.add(SyntaxNode.leaf(SyntaxKind.RAW_DELIM, delim));
            if (close > pos) children.add(SyntaxNode.leaf(SyntaxKind.TEXT, src.substring(pos, close)));
            children.add(SyntaxNode.leaf(SyntaxKind.RAW_DELIM, delim));
            pos = close + 1;
            return SyntaxNode.inner(SyntaxKind.RAW, children);
        }

        int close = src.indexOf(delim, pos);
        if (close < 0) {
            pos = src.length();
            return SyntaxNode.error("unclosed raw block", from(start));
        }
        children.add(SyntaxNode.leaf(SyntaxKind.RAW_DELIM, delim));
        int langEnd = pos;
        while (langEnd < close && isIdContinue(src.charAt(langEnd))) langEnd++;
        if (langEnd > pos) {
            children.add(SyntaxNode.leaf(SyntaxKind.RAW_LANG, src.substring(pos, langEnd)));
        }
        rawBody(src.substring(langEnd, close), children);
        children.add(SyntaxNode.leaf(SyntaxKind.RAW_DELIM, delim));
        pos = close + ticks;
        return SyntaxNode.inner(SyntaxKind.RAW, children);
    }

    private static void rawBody(String body, List<SyntaxNode> out) {
        String[] lines = body.split("\n", -1);
        if (lines.length == 1) {
            String line = lines[0];
            String trimmed = line.strip();
            int lead = line.indexOf(trimmed.isEmpty() ? line : trimmed);
            if (trimmed.isEmpty()) {
                if (!line.isEmpty()) out.add(SyntaxNode.leaf(SyntaxKind.RAW_TRIMMED, line));
                return;
            }
            if (lead > 0) out.add(SyntaxNode.leaf(SyntaxKind.RAW_TRIMMED, line.substring(0, lead)));
            out.add(SyntaxNode.leaf(SyntaxKind.TEXT, trimmed));
            int tail = lead + trimmed.length();
            if (tail < line.length()) out.add(SyntaxNode.leaf(SyntaxKind.RAW_TRIMMED, line.substring(tail)));
            return;
        }

        int last = lines.length - 1;
        boolean lastBlank = lines[last].isBlank();
        int dedent = Integer.MAX_VALUE;
        for (int i = 1; i <= last; i++) {
            if (lines[i].isBlank()) continue;
            dedent = Math.min(dedent, indentation(lines[i]));
        }
        if (dedent == Integer.MAX_VALUE) dedent = 0;

        StringBuilder pending = new StringBuilder();
        if (lines[0].isBlank()) {
            pending.append(lines[0]);
        } else {
            String first = lines[0];
            int lead = indentation(first);
            if (lead > 0) out.add(SyntaxNode.leaf(SyntaxKind.RAW_TRIMMED, first.substring(0, lead)));
            out.add(SyntaxNode.leaf(SyntaxKind.TEXT, first.substring(lead)));
        }
        for (int i = 1; i <= last; i++) {
            String line = lines[i];
            pending.append('\n');
            if (i == last && lastBlank) {
                pending.append(line);
                break;
            }
            if (line.isBlank()) {
                pending.append(line);
                out.add(SyntaxNode.leaf(SyntaxKind.RAW_TRIMMED, pending.toString()));
                pending.setLength(0);
                out.add(SyntaxNode.leaf(SyntaxKind.TEXT, ""));
                continue;
            }
            pending.append(line, 0, dedent);
            out.add(SyntaxNode.leaf(SyntaxKind.RAW_TRIMMED, pending.toString()));
            pending.setLength(0);
            out.add(SyntaxNode.leaf(SyntaxKind.TEXT, line.substring(dedent)));
        }
        if (pending.length() > 0) out.add(SyntaxNode.leaf(SyntaxKind.RAW_TRIMMED, pending.toString()));
    }

    private static int indentation(String line) {
        int i = 0;
        while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) i++;
        return i;
    }
}
