package org.dxworks.typfmt.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive descent parser for the Typst syntax the formatter handles. The produced tree is
 * lossless: concatenating its leaves gives back the input. Anything that cannot be completed
 * becomes an {@link SyntaxKind#ERROR} node instead of an exception.
 */
public final class TypstParser {

    private static final String[] MATH_SHORTHANDS = {
            "<==>", "|->", "<->", "->", "=>", "<-", "<=", ">=", "!=", ":=", "...", "<<", ">>", "||", "~"
    };

    /** Nested markup, expressions and math beyond this depth are rejected instead of recursed into. */
    static final int MAX_DEPTH = 256;

    private final TypstLexer lex;
    private boolean inMarkup = true;
    private int depth;
    private boolean depthExceeded;

    private TypstParser(String text) {
        this.lex = new TypstLexer(text);
    }

    /** Parses a whole document; the root is a {@link SyntaxKind#MARKUP} node with span ids assigned. */
    public static SyntaxNode parse(String text) {
        TypstParser parser = new TypstParser(text);
        SyntaxNode root = parser.document();
        SyntaxNode.number(root);
        return root;
    }

    private SyntaxNode document() {
        List<SyntaxNode> nodes = markup(Stops.TOP);
        return SyntaxNode.inner(SyntaxKind.MARKUP, nodes);
    }

    // ---------------------------------------------------------------- markup

    /** Conditions that end a markup run, inherited by nested markup. */
    private static final class Stops {
        static final Stops TOP = new Stops(false, false, false, false, false, -1);

        final boolean bracket;
        final boolean strong;
        final boolean emph;
        final boolean line;
        final boolean colon;
        final int indent;

        Stops(boolean bracket, boolean strong, boolean emph, boolean line, boolean colon, int indent) {
            this.bracket = bracket;
            this.strong = strong;
            this.emph = emph;
            this.line = line;
            this.colon = colon;
            this.indent = indent;
        }

        static Stops brackets() {
            return new Stops(true, false, false, false, false, -1);
        }

        Stops strong() {
            return new Stops(bracket, true, emph, line, colon, indent);
        }

        Stops emph() {
            return new Stops(bracket, strong, true, line, colon, indent);
        }

        Stops heading() {
            return new Stops(bracket, strong, emph, true, false, indent);
        }

        Stops term() {
            return new Stops(bracket, strong, emph, true, true, indent);
        }

        Stops item(int column) {
            return new Stops(bracket, strong, emph, false, false, column);
        }
    }

    private List<SyntaxNode> markup(Stops stops) {
        if (depth >= MAX_DEPTH) return new ArrayList<>(List.of(tooDeep()));
        boolean saved = inMarkup;
        inMarkup = true;
        depth++;
        try {
            List<SyntaxNode> nodes = new ArrayList<>();
            int brackets = 0;
            while (!lex.done()) {
                char c = lex.peek();
                if (c == '[') {
                    brackets++;
                    nodes.add(lex.leaf(SyntaxKind.TEXT, 1));
                    continue;
                }
                if (c == ']') {
                    if (brackets > 0) {
                        brackets--;
                        nodes.add(lex.leaf(SyntaxKind.TEXT, 1));
                        continue;
                    }
                    if (stops.bracket) break;
                }
                if (c == '*' && stops.strong && !inWord()) break;
                if (c == '_' && stops.emph && !inWord()) break;
                if (c == ':' && stops.colon) break;
                if (TypstLexer.isSpace(c)) {
                    int end = lex.whitespaceEnd(lex.pos());
                    String ws = lex.slice(lex.pos(), end);
                    int newlines = countNewlines(ws);
                    if (newlines > 0) {
                        if (stops.line) break;
                        if (stops.indent >= 0 && (atEnd(end) || indentAfter(ws) <= stops.indent)) break;
                        if ((stops.strong || stops.emph) && newlines >= 2) break;
                    }
                    nodes.add(lex.leaf(newlines >= 2 ? SyntaxKind.PARBREAK : SyntaxKind.SPACE, end - lex.pos()));
                    continue;
                }
                markupExpr(stops, nodes);
            }
            return nodes;
        } finally {
            inMarkup = saved;
            depth--;
        }
    }

    private void markupExpr(Stops stops, List<SyntaxNode> nodes) {
        char c = lex.peek();
        char next = lex.peek(1);
        boolean lineStart = lex.atLineStart();

        if (lex.atComment()) {
            nodes.add(lex.comment());
            return;
        }
        switch (c) {
            case '\\':
                nodes.add(escapeOrLinebreak());
                return;
            case '*':
                if (!inWord()) {
                    nodes.add(delimited(SyntaxKind.STRONG, SyntaxKind.STAR, '*', stops.strong()));
                    return;
                }
                break;
            case '_':
                if (!inWord()) {
                    nodes.add(delimited(SyntaxKind.EMPH, SyntaxKind.UNDERSCORE, '_', stops.emph()));
                    return;
                }
                break;
            case '`':
                nodes.add(lex.raw());
                return;
            case '"':
            case '\'':
                nodes.add(lex.leaf(SyntaxKind.SMART_QUOTE, 1));
                return;
            case '$':
                nodes.add(equation());
                return;
            case '#':
                if (startsEmbedded(next)) {
                    nodes.add(lex.leaf(SyntaxKind.HASH, 1));
                    nodes.add(embedded());
                    if (lex.peek() == ';') nodes.add(lex.leaf(SyntaxKind.SEMICOLON, 1));
                    return;
                }
                break;
            case '<':
                if (lex.labelEnd() >= 0) {
                    nodes.add(lex.label());
                    return;
                }
                break;
            case '@':
                if (TypstLexer.isLabelChar(next) && next != '.' && next != ':') {
                    nodes.add(ref());
                    return;
                }
                break;
            case '~':
                nodes.add(lex.leaf(SyntaxKind.SHORTHAND, 1));
                return;
            case '-':
                if (lex.at("---")) {
                    nodes.add(lex.leaf(SyntaxKind.SHORTHAND, 3));
                    return;
                }
                if (lex.at("--") || lex.at("-?")) {
                    nodes.add(lex.leaf(SyntaxKind.SHORTHAND, 2));
                    return;
                }
                if (lineStart && isBlank(next)) {
                    nodes.add(item(SyntaxKind.LIST_ITEM, SyntaxKind.LIST_MARKER, 1, stops));
                    return;
                }
                break;
            case '.':
                if (lex.at("...")) {
                    nodes.add(lex.leaf(SyntaxKind.SHORTHAND, 3));
                    return;
                }
                break;
            case '=':
                if (lineStart) {
                    int n = 0;
                    while (lex.peek(n) == '=') n++;
                    if (isBlank(lex.peek(n))) {
                        nodes.add(heading(n, stops));
                        return;
                    }
                }
                break;
            case '+':
                if (lineStart && isBlank(next)) {
                    nodes.add(item(SyntaxKind.ENUM_ITEM, SyntaxKind.ENUM_MARKER, 1, stops));
                    return;
                }
                break;
            case '/':
                if (lineStart && isBlank(next)) {
                    nodes.add(termItem(stops));
                    return;
                }
                break;
            case ']':
                nodes.add(SyntaxNode.error("unexpected closing bracket", lex.from(advance(1))));
                return;
            default:
                if (Character.isDigit(c) && lineStart) {
                    int n = 0;
                    while (Character.isDigit(lex.peek(n))) n++;
                    if (lex.peek(n) == '.' && isBlank(lex.peek(n + 1))) {
                        nodes.add(item(SyntaxKind.ENUM_ITEM, SyntaxKind.ENUM_MARKER, n + 1, stops));
                        return;
                    }
                }
                if (atLink()) {
                    nodes.add(link());
                    return;
                }
                break;
        }
        nodes.add(text(stops));
    }

    private SyntaxNode text(Stops stops) {
        int start = lex.pos();
        advanceCodePoint();
        while (!lex.done()) {
            char c = lex.peek();
            if (TypstLexer.isSpace(c) || startsSpecial(c, stops)) break;
            advanceCodePoint();
        }
        return lex.leafFrom(SyntaxKind.TEXT, start);
    }

    private boolean startsSpecial(char c, Stops stops) {
        switch (c) {
            case '\\':
            case '`':
            case '"':
            case '\'':
            case '$':
            case '~':
            case '[':
            case ']':
                return true;
            case '/':
                return lex.atComment();
            case '*':
            case '_':
                return !inWord();
            case '#':
                return startsEmbedded(lex.peek(1));
            case '<':
                return lex.labelEnd() >= 0;
            case '@':
                return TypstLexer.isLabelChar(lex.peek(1));
            case '-':
                return lex.at("--") || lex.at("-?");
            case '.':
                return lex.at("...");
            case ':':
                return stops.colon;
            default:
                return atLink();
        }
    }

    private SyntaxNode escapeOrLinebreak() {
        int start = lex.pos();
        char next = lex.peek(1);
        if (next == '\0' || TypstLexer.isSpace(next)) {
            return lex.leaf(SyntaxKind.LINEBREAK, 1);
        }
        if (lex.at("\\u{")) {
            lex.jump(start + 3);
            while (!lex.done() && lex.peek() != '}') advanceCodePoint();
            if (lex.peek() != '}') return SyntaxNode.error("unclosed unicode escape", lex.from(start));
            lex.jump(lex.pos() + 1);
            return lex.leafFrom(SyntaxKind.ESCAPE, start);
        }
        lex.jump(start + 1);
        advanceCodePoint();
        return lex.leafFrom(SyntaxKind.ESCAPE, start);
    }

    private SyntaxNode delimited(SyntaxKind kind, SyntaxKind delim, char close, Stops inner) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.leaf(delim, 1));
        children.add(SyntaxNode.inner(SyntaxKind.MARKUP, markup(inner)));
        if (lex.peek() == close) {
            children.add(lex.leaf(delim, 1));
            return SyntaxNode.inner(kind, children);
        }
        return SyntaxNode.error("unclosed delimiter " + close, children);
    }

    private SyntaxNode heading(int level, Stops stops) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.leaf(SyntaxKind.HEADING_MARKER, level));
        children.add(blanks());
        children.add(SyntaxNode.inner(SyntaxKind.MARKUP, markup(stops.heading())));
        return SyntaxNode.inner(SyntaxKind.HEADING, children);
    }

    private SyntaxNode item(SyntaxKind kind, SyntaxKind marker, int markerLength, Stops stops) {
        int column = lex.column();
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.leaf(marker, markerLength));
        children.add(blanks());
        children.add(SyntaxNode.inner(SyntaxKind.MARKUP, markup(stops.item(column))));
        return SyntaxNode.inner(kind, children);
    }

    private SyntaxNode termItem(Stops stops) {
        int column = lex.column();
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.leaf(SyntaxKind.TERM_MARKER, 1));
        children.add(blanks());
        children.add(SyntaxNode.inner(SyntaxKind.MARKUP, markup(stops.term())));
        if (lex.peek() != ':') {
            return SyntaxNode.error("expected colon after term", children);
        }
        children.add(lex.leaf(SyntaxKind.COLON, 1));
        if (isBlank(lex.peek())) children.add(blanks());
        children.add(SyntaxNode.inner(SyntaxKind.MARKUP, markup(stops.item(column))));
        return SyntaxNode.inner(SyntaxKind.TERM_ITEM, children);
    }

    /** Run of spaces and tabs as one SPACE leaf. */
    private SyntaxNode blanks() {
        int start = lex.pos();
        while (isBlank(lex.peek())) lex.jump(lex.pos() + 1);
        return lex.leafFrom(SyntaxKind.SPACE, start);
    }

    private SyntaxNode ref() {
        List<SyntaxNode> children = new ArrayList<>();
        int start = lex.pos();
        int end = start + 1;
        while (TypstLexer.isLabelChar(charAt(end))) end++;
        while (charAt(end - 1) == '.' || charAt(end - 1) == ':') end--;
        lex.jump(end);
        children.add(lex.leafFrom(SyntaxKind.REF_MARKER, start));
        if (lex.peek() == '[') children.add(contentBlock());
        return SyntaxNode.inner(SyntaxKind.REF, children);
    }

    private boolean atLink() {
        if (!(lex.at("http://") || lex.at("https://"))) return false;
        return !Character.isLetterOrDigit(lex.before());
    }

    private SyntaxNode link() {
        int start = lex.pos();
        int depth = 0;
        while (!lex.done()) {
            char c = lex.peek();
            if (TypstLexer.isSpace(c) || c == '<' || c == '>' || c == '"' || c == '[' || c == ']') break;
            if (c == '(') depth++;
            if (c == ')') {
                if (depth == 0) break;
                depth--;
            }
            lex.jump(lex.pos() + 1);
        }
        while (".,;:!?'".indexOf(lex.before()) >= 0 && lex.pos() > start) {
            lex.jump(lex.pos() - 1);
        }
        return lex.leafFrom(SyntaxKind.LINK, start);
    }

    private SyntaxNode contentBlock() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.leaf(SyntaxKind.LEFT_BRACKET, 1));
        children.add(SyntaxNode.inner(SyntaxKind.MARKUP, markup(Stops.brackets())));
        if (lex.peek() != ']') return SyntaxNode.error("unclosed content block", children);
        children.add(lex.leaf(SyntaxKind.RIGHT_BRACKET, 1));
        return SyntaxNode.inner(SyntaxKind.CONTENT_BLOCK, children);
    }

    private boolean startsEmbedded(char next) {
        return TypstLexer.isIdStart(next) || next == '{' || next == '[' || next == '(';
    }

    /** Expression after {@code #}: a statement, or an atom with directly attached postfixes. */
    private SyntaxNode embedded() {
        SyntaxKind kw = lex.keywordAt();
        if (kw != null && isStatementKeyword(kw)) {
            return primary(false, false);
        }
        return postfix(primary(false, true), false, true);
    }

    private static boolean isStatementKeyword(SyntaxKind kw) {
        switch (kw) {
            case LET, SET, SHOW, IMPORT, INCLUDE, IF, WHILE, FOR, CONTEXT, RETURN, BREAK, CONTINUE:
                return true;
            default:
                return false;
        }
    }

    // ---------------------------------------------------------------- code

    private SyntaxNode codeBlock() {
        boolean saved = inMarkup;
        inMarkup = false;
        try {
            List<SyntaxNode> children = new ArrayList<>();
            children.add(lex.leaf(SyntaxKind.LEFT_BRACE, 1));
            List<SyntaxNode> code = new ArrayList<>();
            while (true) {
                code.addAll(triviaNl());
                if (lex.done() || lex.peek() == '}') break;
                if (lex.peek() == ';') {
                    code.add(lex.leaf(SyntaxKind.SEMICOLON, 1));
                    continue;
                }
                code.add(expr(false));
                int end = lex.triviaEnd(lex.pos(), false);
                char after = charAt(end);
                if (after == ';') {
                    code.addAll(lex.triviaUntil(end));
                    code.add(lex.leaf(SyntaxKind.SEMICOLON, 1));
                } else if (!(atEnd(end) || after == '\n' || after == '\r' || after == '}')) {
                    code.addAll(lex.triviaUntil(end));
                    code.add(errorChar("expected semicolon or line break"));
                }
            }
            children.add(SyntaxNode.inner(SyntaxKind.CODE, code));
            if (lex.peek() != '}') return SyntaxNode.error("unclosed code block", children);
            children.add(lex.leaf(SyntaxKind.RIGHT_BRACE, 1));
            return SyntaxNode.inner(SyntaxKind.CODE_BLOCK, children);
        } finally {
            inMarkup = saved;
        }
    }

    /** Full expression with binary operators. Without {@code nl} a line feed ends it. */
    private SyntaxNode expr(boolean nl) {
        return binary(0, nl);
    }

    private SyntaxNode binary(int minPrec, boolean nl) {
        if (depth >= MAX_DEPTH) return tooDeep();
        depth++;
        try {
            return operatorChain(minPrec, nl);
        } finally {
            depth--;
        }
    }

    private SyntaxNode operatorChain(int minPrec, boolean nl) {
        SyntaxNode lhs;
        SyntaxKind unary = unaryOpAt();
        if (unary != null) {
            List<SyntaxNode> children = new ArrayList<>();
            children.add(unary == SyntaxKind.NOT ? lex.identOrKeyword() : lex.punct(unary));
            children.addAll(triviaNl());
            children.add(binary(unaryPrecedence(unary), nl));
            lhs = SyntaxNode.inner(SyntaxKind.UNARY, children);
        } else {
            lhs = postfix(primary(nl, false), nl, false);
        }

        while (true) {
            int save = lex.pos();
            int end = lex.triviaEnd(save, nl);
            lex.jump(end);
            SyntaxKind op = binaryOpAt();
            lex.jump(save);
            if (op == null) break;
            int prec = binaryPrecedence(op);
            if (prec < minPrec) break;

            List<SyntaxNode> children = new ArrayList<>();
            children.add(lhs);
            children.addAll(lex.triviaUntil(end));
            if (op == SyntaxKind.NOT) {
                // not in
                children.add(lex.identOrKeyword());
                children.addAll(lex.triviaUntil(lex.triviaEnd(lex.pos(), true)));
                children.add(lex.identOrKeyword());
            } else if (op == SyntaxKind.AND || op == SyntaxKind.OR || op == SyntaxKind.IN) {
                children.add(lex.identOrKeyword());
            } else {
                children.add(lex.punct(op));
            }
            children.addAll(triviaNl());
            boolean rightAssoc = isAssignment(op);
            children.add(binary(rightAssoc ? prec : prec + 1, nl));

            if (op == SyntaxKind.EQ && lhs.is(SyntaxKind.ARRAY)) {
                children.set(0, pattern(lhs));
                lhs = SyntaxNode.inner(SyntaxKind.DESTRUCT_ASSIGNMENT, children);
            } else {
                lhs = SyntaxNode.inner(SyntaxKind.BINARY, children);
            }
        }
        return lhs;
    }

    private SyntaxKind unaryOpAt() {
        SyntaxKind kw = lex.keywordAt();
        if (kw == SyntaxKind.NOT) return SyntaxKind.NOT;
        SyntaxKind punct = lex.codePunctAt();
        if (punct == SyntaxKind.PLUS || punct == SyntaxKind.MINUS) return punct;
        return null;
    }

    /** Binary operator at the cursor; {@code NOT} stands for {@code not in}. */
    private SyntaxKind binaryOpAt() {
        SyntaxKind kw = lex.keywordAt();
        if (kw == SyntaxKind.AND || kw == SyntaxKind.OR || kw == SyntaxKind.IN) return kw;
        if (kw == SyntaxKind.NOT) {
            int save = lex.pos();
            lex.jump(lex.identEnd(save));
            lex.jump(lex.triviaEnd(lex.pos(), true));
            boolean notIn = lex.keywordAt() == SyntaxKind.IN;
            lex.jump(save);
            return notIn ? SyntaxKind.NOT : null;
        }
        SyntaxKind punct = lex.codePunctAt();
        if (punct == null) return null;
        switch (punct) {
            case PLUS, MINUS, STAR, SLASH, EQ_EQ, EXCL_EQ, LT, LT_EQ, GT, GT_EQ,
                    EQ, PLUS_EQ, HYPH_EQ, STAR_EQ, SLASH_EQ:
                return punct;
            default:
                return null;
        }
    }

    private static int unaryPrecedence(SyntaxKind op) {
        return op == SyntaxKind.NOT ? 4 : 7;
    }

    private static int binaryPrecedence(SyntaxKind op) {
        switch (op) {
            case STAR, SLASH:
                return 6;
            case PLUS, MINUS:
                return 5;
            case EQ_EQ, EXCL_EQ, LT, LT_EQ, GT, GT_EQ, IN, NOT:
                return 4;
            case AND:
                return 3;
            case OR:
                return 2;
            default:
                return 1;
        }
    }

    private static boolean isAssignment(SyntaxKind op) {
        return op == SyntaxKind.EQ || op == SyntaxKind.PLUS_EQ || op == SyntaxKind.HYPH_EQ
                || op == SyntaxKind.STAR_EQ || op == SyntaxKind.SLASH_EQ;
    }

    /**
     * Calls, trailing content blocks and field accesses. Outside markup a field access may continue
     * on the next line with a leading dot.
     */
    private SyntaxNode postfix(SyntaxNode node, boolean nl, boolean atomic) {
        while (true) {
            char c = lex.peek();
            if (c == '(' || c == '[') {
                node = SyntaxNode.inner(SyntaxKind.FUNC_CALL, List.of(node, args()));
            } else if (c == '.' && TypstLexer.isIdStart(lex.peek(1))) {
                List<SyntaxNode> children = new ArrayList<>();
                children.add(node);
                children.add(lex.leaf(SyntaxKind.DOT, 1));
                children.add(lex.ident());
                node = SyntaxNode.inner(SyntaxKind.FIELD_ACCESS, children);
            } else if (!atomic && !inMarkup && continuesWithDot()) {
                List<SyntaxNode> children = new ArrayList<>();
                children.add(node);
                children.addAll(lex.triviaUntil(lex.triviaEnd(lex.pos(), true)));
                children.add(lex.leaf(SyntaxKind.DOT, 1));
                children.add(lex.ident());
                node = SyntaxNode.inner(SyntaxKind.FIELD_ACCESS, children);
            } else {
                return node;
            }
        }
    }

    private boolean continuesWithDot() {
        int end = lex.triviaEnd(lex.pos(), true);
        return end > lex.pos() && charAt(end) == '.' && TypstLexer.isIdStart(charAt(end + 1));
    }

    private SyntaxNode primary(boolean nl, boolean atomic) {
        char c = lex.peek();
        if (lex.atIdent()) {
            SyntaxKind kw = lex.keywordAt();
            if (kw == null) {
                SyntaxNode ident = lex.ident();
                if (!atomic && atArrow(nl)) {
                    return closure(SyntaxNode.inner(SyntaxKind.PARAMS, List.of(ident)), nl);
                }
                return ident;
            }
            switch (kw) {
                case NONE, AUTO, BOOL:
                    return lex.identOrKeyword();
                case LET:
                    return letBinding(nl);
                case SET:
                    return setRule(nl);
                case SHOW:
                    return showRule(nl);
                case IF:
                    return conditional(nl);
                case WHILE:
                    return whileLoop(nl);
                case FOR:
                    return forLoop(nl);
                case IMPORT:
                    return moduleImport(nl);
                case INCLUDE:
                    return keywordExpr(SyntaxKind.MODULE_INCLUDE, nl);
                case CONTEXT:
                    return keywordExpr(SyntaxKind.CONTEXTUAL, nl);
                case RETURN:
                    return funcReturn(nl);
                case BREAK:
                    return SyntaxNode.inner(SyntaxKind.LOOP_BREAK, List.of(lex.identOrKeyword()));
                case CONTINUE:
                    return SyntaxNode.inner(SyntaxKind.LOOP_CONTINUE, List.of(lex.identOrKeyword()));
                default:
                    SyntaxNode kwNode = lex.identOrKeyword();
                    return SyntaxNode.error("unexpected keyword " + kwNode.text(), List.of(kwNode));
            }
        }
        if (c == '_') return lex.leaf(SyntaxKind.UNDERSCORE, 1);
        if (lex.atNumber()) return lex.number();
        switch (c) {
            case '"':
                return lex.string();
            case '{':
                return codeBlock();
            case '[':
                return contentBlock();
            case '(':
                return collection(nl, atomic);
            case '$':
                return equation();
            case '`':
                return lex.raw();
            case '<':
                if (lex.labelEnd() >= 0) return lex.label();
                break;
            default:
                break;
        }
        return errorChar("expected expression");
    }

    private boolean atArrow(boolean nl) {
        int end = lex.triviaEnd(lex.pos(), nl);
        return charAt(end) == '=' && charAt(end + 1) == '>';
    }

    private SyntaxNode closure(SyntaxNode params, boolean nl) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(params);
        children.addAll(lex.triviaUntil(lex.triviaEnd(lex.pos(), nl)));
        children.add(lex.leaf(SyntaxKind.ARROW, 2));
        children.addAll(triviaNl());
        children.add(expr(nl));
        return SyntaxNode.inner(SyntaxKind.CLOSURE, children);
    }

    /** Item counts gathered while reading a parenthesized list. */
    private static final class ListShape {
        int items;
        boolean keyed;
        boolean spread;
        boolean trailingComma;
        boolean colonOnly;
    }

    private SyntaxNode collection(boolean nl, boolean atomic) {
        SyntaxNode node = parenthesizedList();
        if (!atomic && atArrow(nl) && !node.erroneous()) {
            return closure(params(node), nl);
        }
        return node;
    }

    /** {@code (...)}: parenthesized expression, array or dictionary. */
    private SyntaxNode parenthesizedList() {
        boolean saved = inMarkup;
        inMarkup = false;
        try {
            List<SyntaxNode> children = new ArrayList<>();
            children.add(lex.leaf(SyntaxKind.LEFT_PAREN, 1));
            ListShape shape = listItems(children, false);
            if (lex.peek() != ')') return SyntaxNode.error("unclosed parenthesis", children);
            children.add(lex.leaf(SyntaxKind.RIGHT_PAREN, 1));

            SyntaxKind kind;
            if (shape.colonOnly || shape.keyed) {
                kind = SyntaxKind.DICT;
            } else if (shape.items == 1 && !shape.trailingComma && !shape.spread) {
                kind = SyntaxKind.PARENTHESIZED;
            } else {
                kind = SyntaxKind.ARRAY;
            }
            return SyntaxNode.inner(kind, children);
        } finally {
            inMarkup = saved;
        }
    }

    private ListShape listItems(List<SyntaxNode> out, boolean isArgs) {
        ListShape shape = new ListShape();
        while (true) {
            out.addAll(triviaNl());
            if (lex.done() || lex.peek() == ')') break;
            char c = lex.peek();
            if (c == ':' && !isArgs && shape.items == 0 && charAt(lex.triviaEnd(lex.pos() + 1, true)) == ')') {
                out.add(lex.leaf(SyntaxKind.COLON, 1));
                shape.colonOnly = true;
                continue;
            }
            if (c == ',') {
                out.add(errorChar("expected expression"));
                continue;
            }
            SyntaxNode item = listItem(isArgs);
            out.add(item);
            shape.items++;
            shape.trailingComma = false;
            if (item.is(SyntaxKind.NAMED) || item.is(SyntaxKind.KEYED)) shape.keyed = true;
            if (item.is(SyntaxKind.SPREAD)) shape.spread = true;

            out.addAll(triviaNl());
            if (lex.peek() == ',') {
                out.add(lex.leaf(SyntaxKind.COMMA, 1));
                shape.trailingComma = true;
            } else if (lex.done() || lex.peek() == ')') {
                break;
            } else {
                out.add(errorChar("expected comma"));
            }
        }
        return shape;
    }

    private SyntaxNode listItem(boolean isArgs) {
        if (lex.at("..")) {
            List<SyntaxNode> children = new ArrayList<>();
            children.add(lex.leaf(SyntaxKind.DOTS, 2));
            char c = lex.peek();
            if (c != ',' && c != ')' && !TypstLexer.isSpace(c)) children.add(expr(true));
            return SyntaxNode.inner(SyntaxKind.SPREAD, children);
        }
        SyntaxNode first = expr(true);
        int end = lex.triviaEnd(lex.pos(), true);
        if (charAt(end) != ':') return first;

        List<SyntaxNode> children = new ArrayList<>();
        children.add(first);
        children.addAll(lex.triviaUntil(end));
        children.add(lex.leaf(SyntaxKind.COLON, 1));
        children.addAll(triviaNl());
        children.add(expr(true));
        if (first.is(SyntaxKind.IDENT)) return SyntaxNode.inner(SyntaxKind.NAMED, children);
        if (isArgs) return SyntaxNode.error("expected identifier as argument name", children);
        return SyntaxNode.inner(SyntaxKind.KEYED, children);
    }

    /** Parenthesized arguments followed by any directly attached content blocks. */
    private SyntaxNode args() {
        List<SyntaxNode> children = new ArrayList<>();
        if (lex.peek() == '(') {
            boolean saved = inMarkup;
            inMarkup = false;
            try {
                children.add(lex.leaf(SyntaxKind.LEFT_PAREN, 1));
                listItems(children, true);
                if (lex.peek() != ')') return SyntaxNode.error("unclosed argument list", children);
                children.add(lex.leaf(SyntaxKind.RIGHT_PAREN, 1));
            } finally {
                inMarkup = saved;
            }
        }
        while (lex.peek() == '[') {
            children.add(contentBlock());
        }
        return SyntaxNode.inner(SyntaxKind.ARGS, children);
    }

    /** Reinterprets a collection before {@code =>} as a parameter list. */
    private static SyntaxNode params(SyntaxNode collection) {
        List<SyntaxNode> children = new ArrayList<>();
        for (SyntaxNode child : collection.children()) {
            children.add(pattern(child));
        }
        return SyntaxNode.inner(SyntaxKind.PARAMS, children);
    }

    /** Arrays and dictionaries in binding position become destructuring patterns. */
    private static SyntaxNode pattern(SyntaxNode node) {
        if (!node.is(SyntaxKind.ARRAY) && !node.is(SyntaxKind.DICT)) return node;
        List<SyntaxNode> children = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            children.add(pattern(child));
        }
        return SyntaxNode.inner(SyntaxKind.DESTRUCTURING, children);
    }

    private SyntaxNode bindingPattern() {
        if (lex.peek() == '(') return pattern(parenthesizedList());
        if (lex.peek() == '_' && !TypstLexer.isIdContinue(lex.peek(1))) return lex.leaf(SyntaxKind.UNDERSCORE, 1);
        if (lex.atIdent() && lex.keywordAt() == null) return lex.ident();
        return errorChar("expected pattern");
    }

    private SyntaxNode letBinding(boolean nl) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.identOrKeyword());
        children.addAll(triviaNl());

        if (lex.atIdent() && lex.keywordAt() == null && charAt(lex.identEnd(lex.pos())) == '(') {
            List<SyntaxNode> closure = new ArrayList<>();
            closure.add(lex.ident());
            closure.add(params(parenthesizedList()));
            closure.addAll(triviaNl());
            if (lex.peek() != '=') return SyntaxNode.error("expected equals sign", concat(children, closure));
            closure.add(lex.leaf(SyntaxKind.EQ, 1));
            closure.addAll(triviaNl());
            closure.add(expr(nl));
            children.add(SyntaxNode.inner(SyntaxKind.CLOSURE, closure));
            return SyntaxNode.inner(SyntaxKind.LET_BINDING, children);
        }

        children.add(bindingPattern());
        int end = lex.triviaEnd(lex.pos(), nl);
        if (charAt(end) == '=' && charAt(end + 1) != '=' && charAt(end + 1) != '>') {
            children.addAll(lex.triviaUntil(end));
            children.add(lex.leaf(SyntaxKind.EQ, 1));
            children.addAll(triviaNl());
            children.add(expr(nl));
        }
        return SyntaxNode.inner(SyntaxKind.LET_BINDING, children);
    }

    private SyntaxNode setRule(boolean nl) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.identOrKeyword());
        children.addAll(triviaNl());
        if (!lex.atIdent()) {
            children.add(errorChar("expected set target"));
            return SyntaxNode.inner(SyntaxKind.SET_RULE, children);
        }
        SyntaxNode target = lex.ident();
        while (lex.peek() == '.' && TypstLexer.isIdStart(lex.peek(1))) {
            target = SyntaxNode.inner(SyntaxKind.FIELD_ACCESS,
                    List.of(target, lex.leaf(SyntaxKind.DOT, 1), lex.ident()));
        }
        children.add(target);
        if (lex.peek() != '(') return SyntaxNode.error("expected argument list", children);
        children.add(args());

        int end = lex.triviaEnd(lex.pos(), nl);
        int save = lex.pos();
        lex.jump(end);
        boolean hasCondition = lex.keywordAt() == SyntaxKind.IF;
        lex.jump(save);
        if (hasCondition) {
            children.addAll(lex.triviaUntil(end));
            children.add(lex.identOrKeyword());
            children.addAll(triviaNl());
            children.add(expr(nl));
        }
        return SyntaxNode.inner(SyntaxKind.SET_RULE, children);
    }

    private SyntaxNode showRule(boolean nl) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.identOrKeyword());
        children.addAll(triviaNl());
        if (lex.peek() != ':') {
            children.add(expr(nl));
            children.addAll(triviaNl());
        }
        if (lex.peek() != ':') return SyntaxNode.error("expected colon", children);
        children.add(lex.leaf(SyntaxKind.COLON, 1));
        children.addAll(triviaNl());
        children.add(expr(nl));
        return SyntaxNode.inner(SyntaxKind.SHOW_RULE, children);
    }

    private SyntaxNode block() {
        if (lex.peek() == '{') return codeBlock();
        if (lex.peek() == '[') return contentBlock();
        return errorChar("expected block");
    }

    private SyntaxNode conditional(boolean nl) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.identOrKeyword());
        children.addAll(triviaNl());
        children.add(expr(nl));
        children.addAll(triviaNl());
        children.add(block());

        int end = lex.triviaEnd(lex.pos(), !inMarkup);
        int save = lex.pos();
        lex.jump(end);
        boolean hasElse = lex.keywordAt() == SyntaxKind.ELSE;
        lex.jump(save);
        if (hasElse) {
            children.addAll(lex.triviaUntil(end));
            children.add(lex.identOrKeyword());
            children.addAll(triviaNl());
            children.add(lex.keywordAt() == SyntaxKind.IF ? conditional(nl) : block());
        }
        return SyntaxNode.inner(SyntaxKind.CONDITIONAL, children);
    }

    private SyntaxNode whileLoop(boolean nl) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.identOrKeyword());
        children.addAll(triviaNl());
        children.add(expr(nl));
        children.addAll(triviaNl());
        children.add(block());
        return SyntaxNode.inner(SyntaxKind.WHILE_LOOP, children);
    }

    private SyntaxNode forLoop(boolean nl) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.identOrKeyword());
        children.addAll(triviaNl());
        children.add(bindingPattern());
        children.addAll(triviaNl());
        if (lex.keywordAt() != SyntaxKind.IN) return SyntaxNode.error("expected keyword in", children);
        children.add(lex.identOrKeyword());
        children.addAll(triviaNl());
        children.add(expr(nl));
        children.addAll(triviaNl());
        children.add(block());
        return SyntaxNode.inner(SyntaxKind.FOR_LOOP, children);
    }

    private SyntaxNode moduleImport(boolean nl) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.identOrKeyword());
        children.addAll(triviaNl());
        children.add(postfix(primary(nl, true), nl, false));

        int end = lex.triviaEnd(lex.pos(), nl);
        int save = lex.pos();
        lex.jump(end);
        boolean renamed = lex.keywordAt() == SyntaxKind.AS;
        lex.jump(save);
        if (renamed) {
            children.addAll(lex.triviaUntil(end));
            children.add(lex.identOrKeyword());
            children.addAll(triviaNl());
            children.add(lex.atIdent() ? lex.ident() : errorChar("expected identifier"));
            end = lex.triviaEnd(lex.pos(), nl);
        }
        if (charAt(end) == ':') {
            children.addAll(lex.triviaUntil(end));
            children.add(lex.leaf(SyntaxKind.COLON, 1));
            children.addAll(lex.triviaUntil(lex.triviaEnd(lex.pos(), false)));
            if (lex.peek() == '*') {
                children.add(lex.leaf(SyntaxKind.STAR, 1));
            } else {
                children.add(importItems());
            }
        }
        return SyntaxNode.inner(SyntaxKind.MODULE_IMPORT, children);
    }

    private SyntaxNode importItems() {
        List<SyntaxNode> children = new ArrayList<>();
        boolean parenthesized = lex.peek() == '(';
        if (parenthesized) children.add(lex.leaf(SyntaxKind.LEFT_PAREN, 1));
        while (true) {
            if (parenthesized) {
                children.addAll(triviaNl());
                if (lex.done() || lex.peek() == ')') break;
            }
            if (!lex.atIdent()) {
                children.add(errorChar("expected import item"));
                break;
            }
            children.add(importItem(parenthesized));
            int end = lex.triviaEnd(lex.pos(), parenthesized);
            if (charAt(end) != ',') {
                if (parenthesized) children.addAll(lex.triviaUntil(end));
                break;
            }
            children.addAll(lex.triviaUntil(end));
            children.add(lex.leaf(SyntaxKind.COMMA, 1));
            if (!parenthesized) {
                int next = lex.triviaEnd(lex.pos(), false);
                if (!TypstLexer.isIdStart(charAt(next))) break;
                children.addAll(lex.triviaUntil(next));
            }
        }
        if (parenthesized) {
            if (lex.peek() != ')') return SyntaxNode.error("unclosed import list", children);
            children.add(lex.leaf(SyntaxKind.RIGHT_PAREN, 1));
        }
        return SyntaxNode.inner(SyntaxKind.IMPORT_ITEMS, children);
    }

    private SyntaxNode importItem(boolean nl) {
        SyntaxNode name = lex.ident();
        int end = lex.triviaEnd(lex.pos(), nl);
        int save = lex.pos();
        lex.jump(end);
        boolean renamed = end > save && lex.keywordAt() == SyntaxKind.AS;
        lex.jump(save);
        if (!renamed) return name;
        List<SyntaxNode> children = new ArrayList<>();
        children.add(name);
        children.addAll(lex.triviaUntil(end));
        children.add(lex.identOrKeyword());
        children.addAll(triviaNl());
        children.add(lex.atIdent() ? lex.ident() : errorChar("expected identifier"));
        return SyntaxNode.inner(SyntaxKind.RENAMED_IMPORT_ITEM, children);
    }

    private SyntaxNode keywordExpr(SyntaxKind kind, boolean nl) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.identOrKeyword());
        children.addAll(triviaNl());
        children.add(expr(nl));
        return SyntaxNode.inner(kind, children);
    }

    private SyntaxNode funcReturn(boolean nl) {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.identOrKeyword());
        int end = lex.triviaEnd(lex.pos(), false);
        char after = charAt(end);
        boolean bare = atEnd(end) || after == '\n' || after == '\r' || after == '}' || after == ']'
                || after == ')' || after == ';' || after == ',';
        if (!bare) {
            children.addAll(lex.triviaUntil(end));
            children.add(expr(nl));
        }
        return SyntaxNode.inner(SyntaxKind.FUNC_RETURN, children);
    }

    // ---------------------------------------------------------------- math

    private SyntaxNode equation() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.leaf(SyntaxKind.DOLLAR, 1));
        if (TypstLexer.isSpace(lex.peek())) {
            children.add(lex.leaf(SyntaxKind.SPACE, lex.whitespaceEnd(lex.pos()) - lex.pos()));
        }
        List<SyntaxNode> body = math('\0', false);
        SyntaxNode trailing = popTrailingSpace(body);
        children.add(SyntaxNode.inner(SyntaxKind.MATH, body));
        if (trailing != null) children.add(trailing);
        if (lex.peek() != '$') return SyntaxNode.error("unclosed equation", children);
        children.add(lex.leaf(SyntaxKind.DOLLAR, 1));
        return SyntaxNode.inner(SyntaxKind.EQUATION, children);
    }

    private List<SyntaxNode> math(char closer, boolean args) {
        if (depth >= MAX_DEPTH) return new ArrayList<>(List.of(tooDeep()));
        depth++;
        try {
            return mathRun(closer, args);
        } finally {
            depth--;
        }
    }

    private List<SyntaxNode> mathRun(char closer, boolean args) {
        List<SyntaxNode> nodes = new ArrayList<>();
        while (!lex.done()) {
            char c = lex.peek();
            if (c == '$') break;
            if (args && (c == ',' || c == ';' || c == ')')) break;
            if (closer != '\0' && c == closer) break;
            if (TypstLexer.isSpace(c)) {
                nodes.add(lex.leaf(SyntaxKind.SPACE, lex.whitespaceEnd(lex.pos()) - lex.pos()));
                continue;
            }
            if (lex.atComment()) {
                nodes.add(lex.comment());
                continue;
            }
            if (c == '#' && startsEmbedded(lex.peek(1))) {
                nodes.add(lex.leaf(SyntaxKind.HASH, 1));
                nodes.add(embedded());
                continue;
            }
            nodes.add(mathFrac(closer, args));
        }
        return nodes;
    }

    private SyntaxNode mathFrac(char closer, boolean args) {
        SyntaxNode num = mathAttach(closer, args);
        while (true) {
            int save = lex.pos();
            int wsEnd = lex.whitespaceEnd(save);
            if (charAt(wsEnd) != '/' || charAt(wsEnd + 1) == '/' || charAt(wsEnd + 1) == '*') break;
            int denomStart = lex.whitespaceEnd(wsEnd + 1);
            if (!startsMathAtom(charAt(denomStart), closer, args)) break;

            List<SyntaxNode> children = new ArrayList<>();
            children.add(num);
            if (wsEnd > save) children.add(lex.leaf(SyntaxKind.SPACE, wsEnd - save));
            children.add(lex.leaf(SyntaxKind.SLASH, 1));
            if (denomStart > lex.pos()) children.add(lex.leaf(SyntaxKind.SPACE, denomStart - lex.pos()));
            children.add(mathAttach(closer, args));
            num = SyntaxNode.inner(SyntaxKind.MATH_FRAC, children);
        }
        return num;
    }

    private boolean startsMathAtom(char c, char closer, boolean args) {
        if (c == '\0' || c == '$' || c == '#' || TypstLexer.isSpace(c)) return false;
        if (args && (c == ',' || c == ';' || c == ')')) return false;
        return closer == '\0' || c != closer;
    }

    private SyntaxNode mathAttach(char closer, boolean args) {
        SyntaxNode base = mathPrimary(closer, args);
        List<SyntaxNode> children = new ArrayList<>();
        children.add(base);
        boolean bottom = false;
        boolean top = false;
        while (true) {
            char c = lex.peek();
            if (c == '\'' && children.size() == 1) {
                int start = lex.pos();
                while (lex.peek() == '\'') lex.jump(lex.pos() + 1);
                children.add(lex.leafFrom(SyntaxKind.MATH_PRIMES, start));
            } else if (c == '_' && !bottom && startsMathAtom(lex.peek(1), closer, args)) {
                bottom = true;
                children.add(lex.leaf(SyntaxKind.UNDERSCORE, 1));
                children.add(mathPrimary(closer, args));
            } else if (c == '^' && !top && startsMathAtom(lex.peek(1), closer, args)) {
                top = true;
                children.add(lex.leaf(SyntaxKind.HAT, 1));
                children.add(mathPrimary(closer, args));
            } else {
                break;
            }
        }
        if (children.size() == 1) return base;
        return SyntaxNode.inner(SyntaxKind.MATH_ATTACH, children);
    }

    private SyntaxNode mathPrimary(char closer, boolean args) {
        char c = lex.peek();
        int start = lex.pos();
        if (Character.isLetter(c)) {
            while (Character.isLetter(lex.peek())) lex.jump(lex.pos() + 1);
            if (lex.pos() - start == 1) return lex.leafFrom(SyntaxKind.TEXT, start);
            SyntaxNode node = lex.leafFrom(SyntaxKind.MATH_IDENT, start);
            while (lex.peek() == '.' && Character.isLetter(lex.peek(1))) {
                SyntaxNode dot = lex.leaf(SyntaxKind.DOT, 1);
                int fieldStart = lex.pos();
                while (Character.isLetter(lex.peek())) lex.jump(lex.pos() + 1);
                node = SyntaxNode.inner(SyntaxKind.FIELD_ACCESS,
                        List.of(node, dot, lex.leafFrom(SyntaxKind.IDENT, fieldStart)));
            }
            if (lex.peek() == '(') {
                node = SyntaxNode.inner(SyntaxKind.FUNC_CALL, List.of(node, mathArgs()));
            }
            return node;
        }
        if (Character.isDigit(c)) {
            while (Character.isDigit(lex.peek())) lex.jump(lex.pos() + 1);
            if (lex.peek() == '.' && Character.isDigit(lex.peek(1))) {
                lex.jump(lex.pos() + 1);
                while (Character.isDigit(lex.peek())) lex.jump(lex.pos() + 1);
            }
            return lex.leafFrom(SyntaxKind.TEXT, start);
        }
        switch (c) {
            case '"':
                return lex.string();
            case '\\':
                char next = lex.peek(1);
                if (next == '\0' || next == '$' || TypstLexer.isSpace(next)) return lex.leaf(SyntaxKind.LINEBREAK, 1);
                return escapeOrLinebreak();
            case '&':
                return lex.leaf(SyntaxKind.MATH_ALIGN_POINT, 1);
            case '(':
            case '[':
            case '{':
                return mathDelimited(c, closer, args);
            case '√':
            case '∛':
            case '∜':
                List<SyntaxNode> root = new ArrayList<>();
                root.add(lex.leaf(SyntaxKind.ROOT, 1));
                if (startsMathAtom(lex.peek(), closer, args)) root.add(mathPrimary(closer, args));
                return SyntaxNode.inner(SyntaxKind.MATH_ROOT, root);
            default:
                break;
        }
        for (String shorthand : MATH_SHORTHANDS) {
            if (lex.at(shorthand)) return lex.leaf(SyntaxKind.MATH_SHORTHAND, shorthand.length());
        }
        advanceCodePoint();
        return lex.leafFrom(SyntaxKind.TEXT, start);
    }

    /** Delimited group, or the opening delimiter as plain text when it is never closed. */
    private SyntaxNode mathDelimited(char open, char outerCloser, boolean args) {
        int start = lex.pos();
        char close = open == '(' ? ')' : open == '[' ? ']' : '}';
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.leaf(SyntaxKind.TEXT, 1));
        if (TypstLexer.isSpace(lex.peek())) {
            children.add(lex.leaf(SyntaxKind.SPACE, lex.whitespaceEnd(lex.pos()) - lex.pos()));
        }
        List<SyntaxNode> body = math(close, false);
        if (lex.peek() != close && depthExceeded) {
            children.add(SyntaxNode.inner(SyntaxKind.MATH, body));
            return SyntaxNode.error("maximum nesting depth exceeded", children);
        }
        if (lex.peek() != close) {
            lex.jump(start + 1);
            return lex.leafFrom(SyntaxKind.TEXT, start);
        }
        SyntaxNode trailing = popTrailingSpace(body);
        children.add(SyntaxNode.inner(SyntaxKind.MATH, body));
        if (trailing != null) children.add(trailing);
        children.add(lex.leaf(SyntaxKind.TEXT, 1));
        return SyntaxNode.inner(SyntaxKind.MATH_DELIMITED, children);
    }

    private SyntaxNode mathArgs() {
        List<SyntaxNode> children = new ArrayList<>();
        children.add(lex.leaf(SyntaxKind.LEFT_PAREN, 1));
        while (!lex.done()) {
            if (TypstLexer.isSpace(lex.peek())) {
                children.add(lex.leaf(SyntaxKind.SPACE, lex.whitespaceEnd(lex.pos()) - lex.pos()));
            }
            char c = lex.peek();
            if (c == ')' || c == '$' || lex.done()) break;
            if (c != ',' && c != ';') {
                List<SyntaxNode> arg = math('\0', true);
                SyntaxNode trailing = popTrailingSpace(arg);
                children.add(SyntaxNode.inner(SyntaxKind.MATH, arg));
                if (trailing != null) children.add(trailing);
                c = lex.peek();
            }
            if (c == ',') {
                children.add(lex.leaf(SyntaxKind.COMMA, 1));
            } else if (c == ';') {
                children.add(lex.leaf(SyntaxKind.SEMICOLON, 1));
            } else {
                break;
            }
        }
        if (lex.peek() != ')') return SyntaxNode.error("unclosed math arguments", children);
        children.add(lex.leaf(SyntaxKind.RIGHT_PAREN, 1));
        return SyntaxNode.inner(SyntaxKind.ARGS, children);
    }

    // ---------------------------------------------------------------- helpers

    private List<SyntaxNode> triviaNl() {
        return lex.triviaUntil(lex.triviaEnd(lex.pos(), true));
    }

    private SyntaxNode tooDeep() {
        depthExceeded = true;
        return SyntaxNode.error("maximum nesting depth exceeded", lex.rest());
    }

    private SyntaxNode errorChar(String message) {
        int start = lex.pos();
        if (!lex.done()) advanceCodePoint();
        return SyntaxNode.error(message, lex.from(start));
    }

    private int advance(int n) {
        int start = lex.pos();
        lex.jump(start + n);
        return start;
    }

    private void advanceCodePoint() {
        char c = lex.peek();
        lex.jump(lex.pos() + (Character.isHighSurrogate(c) && Character.isLowSurrogate(lex.peek(1)) ? 2 : 1));
    }

    private boolean inWord() {
        return Character.isLetterOrDigit(lex.before()) && Character.isLetterOrDigit(lex.peek(1));
    }

    private char charAt(int index) {
        return lex.charAt(index);
    }

    private boolean atEnd(int index) {
        return lex.isEnd(index);
    }

    private static SyntaxNode popTrailingSpace(List<SyntaxNode> nodes) {
        if (!nodes.isEmpty() && nodes.get(nodes.size() - 1).is(SyntaxKind.SPACE)) {
            return nodes.remove(nodes.size() - 1);
        }
        return null;
    }

    private static boolean isBlank(char c) {
        return c == ' ' || c == '\t';
    }

    private static int countNewlines(String s) {
        int n = 0;
        for (int i = 0; i < s.length(); i++) {
            if (s.charAt(i) == '\n') n++;
        }
        return n;
    }

    private static int indentAfter(String ws) {
        return ws.length() - ws.lastIndexOf('\n') - 1;
    }

    private static List<SyntaxNode> concat(List<SyntaxNode> a, List<SyntaxNode> b) {
        List<SyntaxNode> all = new ArrayList<>(a);
        all.addAll(b);
        return all;
    }
}
