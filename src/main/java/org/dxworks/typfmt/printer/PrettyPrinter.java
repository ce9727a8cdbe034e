package org.dxworks.typfmt.printer;

import org.dxworks.typfmt.attr.AttrStore;
import org.dxworks.typfmt.doc.Doc;
import org.dxworks.typfmt.syntax.SyntaxHelper;
import org.dxworks.typfmt.syntax.SyntaxKind;
import org.dxworks.typfmt.syntax.SyntaxNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Converts a parsed Typst document into a {@link Doc}. One instance formats one tree; it keeps
 * the current lexical mode as its only state.
 */
public class PrettyPrinter {

    private static final int INDENT = 2;

    private final AttrStore attrs;
    private final int blankLinesUpperBound;
    private final ModeStack modes = new ModeStack();

    public PrettyPrinter(AttrStore attrs, int blankLinesUpperBound) {
        this.attrs = attrs;
        this.blankLinesUpperBound = blankLinesUpperBound;
    }

    // ---------------------------------------------------------------- markup

    /** One logical source line of markup. */
    private static final class MarkupLine {
        final List<SyntaxNode> nodes = new ArrayList<>();
        boolean hasText;
    }

    public Doc convertMarkup(SyntaxNode markup) {
        return convertMarkup(markup.children());
    }

    /**
     * Lines holding prose are copied node by node with only their spaces normalized; other lines
     * are rebuilt from their converted expressions.
     */
    private Doc convertMarkup(List<SyntaxNode> children) {
        try (ModeStack.Scope ignored = modes.enter(Mode.MARKUP)) {
            List<Doc> parts = new ArrayList<>();
            for (MarkupLine line : splitLines(children)) {
                for (SyntaxNode node : line.nodes) {
                    if (node.is(SyntaxKind.SPACE)) {
                        parts.add(convertSpace(node));
                    } else if (node.is(SyntaxKind.PARBREAK)) {
                        parts.add(convertParbreak(node));
                    } else if (line.hasText) {
                        parts.add(verbatim(node));
                    } else if (node.kind().isExpr()) {
                        parts.add(convertExpr(node));
                    } else if (node.kind().isComment()) {
                        parts.add(Doc.text(node.text()));
                    } else {
                        parts.add(Doc.text(node.text().strip()));
                    }
                }
            }
            return Doc.concat(parts);
        }
    }

    private List<MarkupLine> splitLines(List<SyntaxNode> children) {
        List<MarkupLine> lines = new ArrayList<>();
        MarkupLine current = new MarkupLine();
        for (SyntaxNode node : children) {
            boolean breakLine = false;
            switch (node.kind()) {
                case SPACE:
                case PARBREAK:
                    breakLine = SyntaxHelper.containsNewline(node);
                    break;
                case TEXT:
                case STRONG:
                case EMPH:
                    current.hasText = true;
                    break;
                case RAW:
                    if (isBlockRaw(node)) {
                        breakLine = true;
                    } else {
                        current.hasText = true;
                    }
                    break;
                case CODE_BLOCK:
                    breakLine = true;
                    break;
                case EQUATION:
                    breakLine = isBlockEquation(node);
                    break;
                default:
                    breakLine = node.kind().isStmt();
                    break;
            }
            current.nodes.add(node);
            if (breakLine) {
                lines.add(current);
                current = new MarkupLine();
            }
        }
        if (!current.nodes.isEmpty()) lines.add(current);
        return lines;
    }

    private static boolean isBlockRaw(SyntaxNode raw) {
        SyntaxNode delim = SyntaxHelper.findFirstChild(raw, SyntaxKind.RAW_DELIM);
        return delim != null && delim.text().length() >= 3;
    }

    private static boolean isBlockEquation(SyntaxNode equation) {
        List<SyntaxNode> children = equation.children();
        int n = children.size();
        return n >= 4 && children.get(1).is(SyntaxKind.SPACE) && children.get(n - 2).is(SyntaxKind.SPACE);
    }

    private Doc convertSpace(SyntaxNode space) {
        return SyntaxHelper.containsNewline(space) ? Doc.hardline() : Doc.space();
    }

    private Doc convertParbreak(SyntaxNode parbreak) {
        return lineFeeds(SyntaxHelper.countNewlines(parbreak.text()));
    }

    /** {@code count} line feeds: empty lines first, then one line at the current indentation. */
    private static Doc lineFeeds(int count) {
        if (count <= 0) return Doc.NIL;
        return Doc.concat(Doc.repeat(Doc.blankline(), count - 1), Doc.hardline());
    }

    // ---------------------------------------------------------------- dispatch

    public Doc convertExpr(SyntaxNode node) {
        if (attrs.isFormatDisabled(node)) return verbatim(node);
        Doc doc = switch (node.kind()) {
            case MARKUP -> convertMarkup(node);
            case TEXT, LINEBREAK, ESCAPE, SHORTHAND, SMART_QUOTE, LINK, LABEL -> verbatim(node);
            case SPACE -> convertSpace(node);
            case PARBREAK -> convertParbreak(node);
            case STRONG -> convertDelimitedMarkup(node, "*");
            case EMPH -> convertDelimitedMarkup(node, "_");
            case RAW -> convertRaw(node);
            case REF -> convertRef(node);
            case HEADING -> convertHeading(node);
            case LIST_ITEM, ENUM_ITEM -> convertListItem(node);
            case TERM_ITEM -> convertTermItem(node);
            case EQUATION -> convertEquation(node);

            case MATH -> convertMath(node);
            case MATH_IDENT, MATH_SHORTHAND, MATH_ALIGN_POINT -> verbatim(node);
            case MATH_DELIMITED -> convertMathDelimited(node);
            case MATH_ATTACH -> convertMathAttach(node);
            case MATH_PRIMES -> Doc.text("'".repeat(node.text().length()));
            case MATH_FRAC -> convertMathFrac(node);
            case MATH_ROOT -> convertMathRoot(node);

            case IDENT, BOOL, INT, FLOAT, NUMERIC, STR -> verbatim(node);
            case NONE -> Doc.text("none");
            case AUTO -> Doc.text("auto");
            case UNDERSCORE -> Doc.text("_");
            case LOOP_BREAK -> Doc.text("break");
            case LOOP_CONTINUE -> Doc.text("continue");
            case CODE_BLOCK -> convertCodeBlock(node);
            case CONTENT_BLOCK -> convertContentBlock(node);
            case PARENTHESIZED -> convertParenthesized(node);
            case ARRAY -> convertArray(node);
            case DICT -> convertDict(node);
            case NAMED -> convertNamed(node);
            case KEYED -> convertKeyed(node);
            case SPREAD -> convertSpread(node);
            case UNARY -> convertUnary(node);
            case BINARY -> convertBinary(node);
            case FIELD_ACCESS -> convertFieldAccess(node);
            case FUNC_CALL -> convertFuncCall(node);
            case ARGS -> convertArgs(null, node);
            case CLOSURE -> convertClosure(node);
            case PARAMS -> convertParams(node);
            case LET_BINDING, DESTRUCT_ASSIGNMENT -> convertBinding(node);
            case SET_RULE -> convertSetRule(node);
            case SHOW_RULE -> convertShowRule(node);
            case FOR_LOOP -> convertForLoop(node);
            case CONTEXTUAL, CONDITIONAL, WHILE_LOOP, FUNC_RETURN, MODULE_INCLUDE, RENAMED_IMPORT_ITEM ->
                    convertExprFlow(node);
            case MODULE_IMPORT -> convertImport(node);
            case IMPORT_ITEMS -> convertImportItems(node);
            case DESTRUCTURING -> convertDestructuring(node);

            case LINE_COMMENT, BLOCK_COMMENT -> Doc.text(node.text());

            case RAW_LANG, RAW_DELIM, RAW_TRIMMED, REF_MARKER, HEADING_MARKER, LIST_MARKER, ENUM_MARKER,
                    TERM_MARKER, HASH, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET, LEFT_PAREN,
                    RIGHT_PAREN, COMMA, SEMICOLON, COLON, STAR, DOLLAR, PLUS, MINUS, SLASH, HAT, PRIME, DOT,
                    EQ, EQ_EQ, EXCL_EQ, LT, LT_EQ, GT, GT_EQ, PLUS_EQ, HYPH_EQ, STAR_EQ, SLASH_EQ, DOTS, ARROW,
                    ROOT -> Doc.text(node.text());
            case NOT, AND, OR, LET, SET, SHOW, CONTEXT, IF, ELSE, FOR, IN, WHILE, BREAK, CONTINUE, RETURN,
                    IMPORT, INCLUDE, AS -> Doc.text(node.text());

            case CODE -> throw new IllegalStateException("Code is converted by its enclosing block: " + node);
            case ERROR -> throw new IllegalStateException("Cannot format an erroneous node: " + node);
        };
        return doc.group();
    }

    private static Doc verbatim(SyntaxNode node) {
        return Doc.text(node.text());
    }

    private FoldStyle foldStyle(SyntaxNode node) {
        return attrs.isMultiline(node) || attrs.hasComment(node) ? FoldStyle.NEVER : FoldStyle.FIT;
    }

    // ---------------------------------------------------------------- markup nodes

    private Doc convertDelimitedMarkup(SyntaxNode node, String delimiter) {
        SyntaxNode body = SyntaxHelper.findFirstChild(node, SyntaxKind.MARKUP);
        return convertMarkup(body).enclose(delimiter, delimiter);
    }

    private Doc convertRaw(SyntaxNode raw) {
        List<Doc> parts = new ArrayList<>();
        for (SyntaxNode child : raw.children()) {
            if (child.is(SyntaxKind.RAW_TRIMMED)) {
                parts.add(SyntaxHelper.containsNewline(child) ? Doc.hardline() : Doc.space());
            } else {
                parts.add(Doc.text(child.text()));
            }
        }
        return Doc.concat(parts);
    }

    private Doc convertRef(SyntaxNode ref) {
        Doc doc = Doc.text(SyntaxHelper.findFirstChild(ref, SyntaxKind.REF_MARKER).text());
        SyntaxNode supplement = SyntaxHelper.findFirstChild(ref, SyntaxKind.CONTENT_BLOCK);
        if (supplement != null) doc = doc.append(convertContentBlock(supplement));
        return doc;
    }

    private Doc convertHeading(SyntaxNode heading) {
        SyntaxNode marker = SyntaxHelper.findFirstChild(heading, SyntaxKind.HEADING_MARKER);
        SyntaxNode body = SyntaxHelper.findFirstChild(heading, SyntaxKind.MARKUP);
        return Doc.concat(Doc.text(marker.text()), Doc.space(), convertMarkup(body));
    }

    private Doc convertListItem(SyntaxNode item) {
        SyntaxNode marker = item.children().get(0);
        SyntaxNode body = SyntaxHelper.findFirstChild(item, SyntaxKind.MARKUP);
        return Doc.concat(Doc.text(marker.text()), Doc.space(), convertMarkup(body).nest(INDENT));
    }

    private Doc convertTermItem(SyntaxNode item) {
        List<SyntaxNode> bodies = SyntaxHelper.findAllChildren(item, SyntaxKind.MARKUP);
        return Doc.concat(
                Doc.text("/"), Doc.space(),
                convertMarkup(bodies.get(0)),
                Doc.text(":"), Doc.space(),
                convertMarkup(bodies.get(1)).nest(INDENT));
    }

    // ---------------------------------------------------------------- math

    private Doc convertEquation(SyntaxNode equation) {
        try (ModeStack.Scope ignored = modes.enter(Mode.MATH)) {
            Doc body = convertExpr(SyntaxHelper.findFirstChild(equation, SyntaxKind.MATH));
            if (isBlockEquation(equation)) {
                Doc separator = attrs.isMultiline(equation) ? Doc.hardline() : Doc.line();
                body = Doc.concat(Doc.concat(separator, body).nest(INDENT), separator);
            } else {
                body = body.nest(INDENT);
            }
            return body.enclose("$", "$");
        }
    }

    private Doc convertMath(SyntaxNode math) {
        List<Doc> parts = new ArrayList<>();
        for (SyntaxNode child : math.children()) {
            if (child.kind().isExpr()) {
                parts.add(convertExpr(child));
            } else if (child.is(SyntaxKind.SPACE)) {
                parts.add(convertSpace(child));
            } else {
                parts.add(verbatim(child));
            }
        }
        return Doc.concat(parts);
    }

    private Doc convertMathDelimited(SyntaxNode delimited) {
        List<SyntaxNode> children = delimited.children();
        SyntaxNode open = children.get(0);
        SyntaxNode close = children.get(children.size() - 1);
        boolean spaceBefore = false;
        boolean spaceAfter = false;
        boolean beforeBody = true;
        for (SyntaxNode child : children) {
            if (child.is(SyntaxKind.MATH)) {
                beforeBody = false;
            } else if (child.is(SyntaxKind.SPACE)) {
                if (beforeBody) {
                    spaceBefore = true;
                } else {
                    spaceAfter = true;
                }
            }
        }
        Doc body = convertMath(SyntaxHelper.findFirstChild(delimited, SyntaxKind.MATH));
        body = body.enclose(spaceBefore ? Doc.space() : Doc.NIL, spaceAfter ? Doc.space() : Doc.NIL);
        return body.nest(INDENT).enclose(verbatim(open), verbatim(close));
    }

    private Doc convertMathAttach(SyntaxNode attach) {
        List<Doc> parts = new ArrayList<>();
        for (SyntaxNode child : attach.children()) {
            if (child.is(SyntaxKind.UNDERSCORE)) {
                parts.add(Doc.text("_"));
            } else if (child.is(SyntaxKind.HAT)) {
                parts.add(Doc.text("^"));
            } else {
                parts.add(convertExpr(child));
            }
        }
        return Doc.concat(parts);
    }

    private Doc convertMathFrac(SyntaxNode frac) {
        SyntaxNode num = frac.children().get(0);
        SyntaxNode denom = frac.children().get(frac.children().size() - 1);
        return Doc.concat(convertExpr(num), Doc.space(), Doc.text("/"), Doc.space(), convertExpr(denom));
    }

    private Doc convertMathRoot(SyntaxNode root) {
        List<SyntaxNode> children = root.children();
        Doc doc = Doc.text(children.get(0).text());
        if (children.size() > 1) doc = doc.append(convertExpr(children.get(1)));
        return doc;
    }

    // ---------------------------------------------------------------- blocks

    private Doc convertCodeBlock(SyntaxNode block) {
        try (ModeStack.Scope ignored = modes.enter(Mode.CODE)) {
            SyntaxNode code = SyntaxHelper.findFirstChild(block, SyntaxKind.CODE);
            List<Doc> items = convertCode(code.children());
            FoldStyle fold = items.size() == 1 && !attrs.hasComment(code) ? foldStyle(code) : FoldStyle.NEVER;
            return ListLayout.block(items, fold);
        }
    }

    /**
     * Statements of a code body. A comment on the same line as the statement before it stays
     * attached to it; blank line runs are capped and never lead.
     */
    private List<Doc> convertCode(List<SyntaxNode> nodes) {
        int end = nodes.size();
        while (end > 0 && nodes.get(end - 1).is(SyntaxKind.SPACE)) end--;

        List<Doc> items = new ArrayList<>();
        boolean canAttachComment = false;
        for (SyntaxNode node : nodes.subList(0, end)) {
            if (node.kind().isExpr()) {
                items.add(convertExpr(node));
                canAttachComment = true;
            } else if (node.kind().isComment()) {
                Doc comment = Doc.text(node.text());
                if (canAttachComment) {
                    Doc last = items.remove(items.size() - 1);
                    items.add(Doc.concat(last, Doc.space(), comment));
                } else {
                    items.add(comment);
                }
                canAttachComment = false;
            } else if (node.is(SyntaxKind.SPACE)) {
                int newlines = SyntaxHelper.countNewlines(node.text());
                if (newlines > 0) {
                    if (!items.isEmpty()) {
                        for (int i = 0; i < Math.min(newlines - 1, blankLinesUpperBound); i++) {
                            items.add(Doc.NIL);
                        }
                    }
                    canAttachComment = false;
                }
            }
        }
        return items;
    }

    private Doc convertContentBlock(SyntaxNode block) {
        List<SyntaxNode> body = new ArrayList<>(SyntaxHelper.findFirstChild(block, SyntaxKind.MARKUP).children());
        Doc trailing = Doc.NIL;
        if (!body.isEmpty()) {
            SyntaxNode last = body.get(body.size() - 1);
            if (isSpaceOrParbreak(last) && SyntaxHelper.containsNewline(last)) {
                body.remove(body.size() - 1);
                trailing = lineFeeds(SyntaxHelper.countNewlines(last.text()));
            }
        }
        Doc content = convertMarkup(body).group().nest(INDENT);
        return Doc.concat(Doc.text("["), content, trailing, Doc.text("]"));
    }

    private static boolean isSpaceOrParbreak(SyntaxNode node) {
        return node.is(SyntaxKind.SPACE) || node.is(SyntaxKind.PARBREAK);
    }

    // ---------------------------------------------------------------- collections

    private List<Doc> convertItems(SyntaxNode node) {
        List<Doc> docs = new ArrayList<>();
        for (SyntaxNode item : SyntaxHelper.items(node)) {
            docs.add(convertExpr(item));
        }
        return docs;
    }

    private Doc convertParenthesized(SyntaxNode parenthesized) {
        Doc inner = convertExpr(SyntaxHelper.items(parenthesized).get(0));
        Doc body = Doc.concat(Doc.softline(), inner).nest(INDENT);
        return Doc.concat(Doc.text("("), body, Doc.softline(), Doc.text(")")).group();
    }

    private Doc convertArray(SyntaxNode array) {
        List<SyntaxNode> items = SyntaxHelper.items(array);
        if (items.size() == 1 && !items.get(0).is(SyntaxKind.SPREAD)) {
            return Doc.concat(Doc.text("("), convertExpr(items.get(0)), Doc.text(",)"));
        }
        return ListLayout.commaSeparated(convertItems(array), "(", ")", foldStyle(array));
    }

    private Doc convertDict(SyntaxNode dict) {
        List<Doc> items = convertItems(dict);
        if (items.isEmpty()) return Doc.text("(:)");
        return ListLayout.commaSeparated(items, "(", ")", foldStyle(dict));
    }

    private Doc convertDestructuring(SyntaxNode pattern) {
        List<SyntaxNode> items = SyntaxHelper.items(pattern);
        if (items.isEmpty()) {
            return Doc.text(SyntaxHelper.findFirstChild(pattern, SyntaxKind.COLON) != null ? "(:)" : "()");
        }
        SyntaxNode only = items.get(0);
        if (items.size() == 1 && !only.is(SyntaxKind.SPREAD) && !only.is(SyntaxKind.NAMED)) {
            return Doc.concat(Doc.text("("), convertExpr(only), Doc.text(",)"));
        }
        return ListLayout.commaSeparated(convertItems(pattern), "(", ")", foldStyle(pattern));
    }

    private Doc convertParams(SyntaxNode params) {
        if (SyntaxHelper.findFirstChild(params, SyntaxKind.LEFT_PAREN) == null) {
            return convertExpr(SyntaxHelper.items(params).get(0));
        }
        return ListLayout.commaSeparated(convertItems(params), "(", ")", foldStyle(params));
    }

    // ---------------------------------------------------------------- flow

    private Doc convertNamed(SyntaxNode named) {
        boolean[] seenName = {false};
        return FlowConverter.convert(named, child -> {
            if (child.is(SyntaxKind.COLON)) return FlowItem.tightSpaced(Doc.text(":"));
            if (child.is(SyntaxKind.HASH)) return FlowItem.spacedTight(Doc.text("#"));
            if (child.kind().isExpr()) {
                FlowItem item = FlowItem.spacedBefore(convertExpr(child), seenName[0]);
                seenName[0] = true;
                return item;
            }
            if (isPattern(child)) return FlowItem.spaced(convertExpr(child));
            return FlowItem.none();
        });
    }

    private Doc convertKeyed(SyntaxNode keyed) {
        boolean[] seenKey = {false};
        return FlowConverter.convert(keyed, child -> {
            if (child.is(SyntaxKind.COLON)) return FlowItem.tightSpaced(Doc.text(":"));
            if (child.kind().isExpr()) {
                FlowItem item = FlowItem.spacedBefore(convertExpr(child), seenKey[0]);
                seenKey[0] = true;
                return item;
            }
            return FlowItem.none();
        });
    }

    private Doc convertSpread(SyntaxNode spread) {
        return FlowConverter.convert(spread, child -> {
            if (child.is(SyntaxKind.DOTS)) return FlowItem.spacedTight(Doc.text(".."));
            if (child.kind().isExpr()) return FlowItem.tightSpaced(convertExpr(child));
            return FlowItem.none();
        });
    }

    private Doc convertUnary(SyntaxNode unary) {
        boolean keywordOp = unary.children().get(0).is(SyntaxKind.NOT);
        return FlowConverter.convert(unary, child -> {
            if (child.kind().isUnaryOp()) {
                Doc op = Doc.text(child.text());
                return keywordOp ? FlowItem.spaced(op) : FlowItem.spacedTight(op);
            }
            if (child.kind().isExpr()) {
                Doc operand = convertExpr(child);
                return keywordOp ? FlowItem.spaced(operand) : FlowItem.tightSpaced(operand);
            }
            return FlowItem.none();
        });
    }

    /** Left operands that are binary themselves are walked in a loop, so long chains do not recurse. */
    private Doc convertBinary(SyntaxNode binary) {
        Deque<SyntaxNode> spine = new ArrayDeque<>();
        SyntaxNode current = binary;
        while (current.is(SyntaxKind.BINARY) && (current == binary || !attrs.isFormatDisabled(current))) {
            spine.push(current);
            current = current.children().get(0);
        }
        Doc doc = convertExpr(current);
        while (!spine.isEmpty()) {
            SyntaxNode node = spine.pop();
            SyntaxNode lhs = node.children().get(0);
            Doc left = doc;
            doc = FlowConverter.convert(node, child -> {
                if (child == lhs) return FlowItem.spaced(left);
                if (child.kind().isBinaryOp()) return FlowItem.spaced(Doc.text(child.text()));
                if (child.kind().isExpr() || isPattern(child)) return FlowItem.spaced(convertExpr(child));
                return FlowItem.none();
            });
        }
        return doc;
    }

    /** {@code let} bindings and destructuring assignments. */
    private Doc convertBinding(SyntaxNode binding) {
        return FlowConverter.convert(binding, child -> {
            if (child.is(SyntaxKind.EQ)) return FlowItem.spaced(Doc.text("="));
            if (child.kind().isExpr() || isPattern(child)) return FlowItem.spaced(convertExpr(child));
            return FlowItem.none();
        });
    }

    private Doc convertForLoop(SyntaxNode forLoop) {
        int[] seen = {0};
        return FlowConverter.convert(forLoop, child -> {
            if (!child.kind().isExpr() && !isPattern(child)) return FlowItem.none();
            // pattern, iterable, body
            int position = seen[0]++;
            if (position == 1) return FlowItem.spaced(convertWithOptionalParen(child));
            return FlowItem.spaced(convertExpr(child));
        });
    }

    private Doc convertSetRule(SyntaxNode setRule) {
        return FlowConverter.convert(setRule, child -> {
            if (child.is(SyntaxKind.ARGS)) return FlowItem.tightSpaced(convertArgs(null, child));
            if (child.kind().isExpr()) return FlowItem.spaced(convertExpr(child));
            return FlowItem.none();
        });
    }

    private Doc convertShowRule(SyntaxNode showRule) {
        return FlowConverter.convert(showRule, child -> {
            if (child.is(SyntaxKind.COLON)) return FlowItem.tightSpaced(Doc.text(":"));
            if (child.kind().isExpr()) return FlowItem.spaced(convertExpr(child));
            return FlowItem.none();
        });
    }

    /** Keywords and expressions, all spaced. */
    private Doc convertExprFlow(SyntaxNode node) {
        return FlowConverter.convert(node, child -> {
            if (child.kind().isExpr()) return FlowItem.spaced(convertExpr(child));
            return FlowItem.none();
        });
    }

    private Doc convertImport(SyntaxNode moduleImport) {
        return FlowConverter.convert(moduleImport, child -> {
            if (child.is(SyntaxKind.COLON)) return FlowItem.tightSpaced(Doc.text(":"));
            if (child.is(SyntaxKind.STAR)) return FlowItem.spaced(Doc.text("*"));
            if (child.is(SyntaxKind.IMPORT_ITEMS) || child.kind().isExpr()) {
                return FlowItem.spaced(convertExpr(child));
            }
            return FlowItem.none();
        });
    }

    private Doc convertImportItems(SyntaxNode items) {
        List<Doc> docs = convertItems(items);
        if (SyntaxHelper.findFirstChild(items, SyntaxKind.LEFT_PAREN) == null) {
            return Doc.join(docs, Doc.text(", "));
        }
        return ListLayout.commaSeparated(docs, "(", ")", foldStyle(items));
    }

    private static boolean isPattern(SyntaxNode node) {
        return node.is(SyntaxKind.DESTRUCTURING) || node.is(SyntaxKind.UNDERSCORE);
    }

    // ---------------------------------------------------------------- closures

    private Doc convertClosure(SyntaxNode closure) {
        SyntaxNode params = SyntaxHelper.findFirstChild(closure, SyntaxKind.PARAMS);
        SyntaxNode body = SyntaxHelper.lastExpr(closure);
        Doc bodyDoc = convertWithOptionalParen(body);
        if (closure.children().get(0).is(SyntaxKind.IDENT)) {
            Doc name = Doc.text(closure.children().get(0).text());
            return Doc.concat(name, convertExpr(params), Doc.text(" = "), bodyDoc);
        }
        return Doc.concat(convertExpr(params), Doc.text(" => "), bodyDoc);
    }

    /** Binary expressions get parentheses when, and only when, they break over lines. */
    private Doc convertWithOptionalParen(SyntaxNode expr) {
        Doc doc = convertExpr(expr);
        if (!expr.is(SyntaxKind.BINARY) || attrs.isFormatDisabled(expr)) return doc;
        Doc body = Doc.concat(Doc.softline(), doc).nest(INDENT);
        return Doc.concat(
                Doc.ifBroken(Doc.text("("), Doc.NIL),
                body,
                Doc.softline(),
                Doc.ifBroken(Doc.text(")"), Doc.NIL)).group();
    }

    // ---------------------------------------------------------------- field access and calls

    private Doc convertFieldAccess(SyntaxNode fieldAccess) {
        if (attrs.isUnformattable(fieldAccess)) return verbatim(fieldAccess);
        List<Doc> segments = DotChain.resolve(fieldAccess, this::convertExpr,
                call -> convertArgs(call.children().get(0), call.children().get(1)));
        if (modes.isMarkupOrMath()) return Doc.join(segments, Doc.text("."));
        return DotChain.render(segments);
    }

    private Doc convertFuncCall(SyntaxNode call) {
        SyntaxNode callee = call.children().get(0);
        SyntaxNode args = call.children().get(1);
        return convertExpr(callee).append(convertArgs(callee, args));
    }

    /**
     * Parenthesized arguments followed by trailing content blocks. {@code callee} selects the
     * table layout and may be null.
     */
    private Doc convertArgs(SyntaxNode callee, SyntaxNode args) {
        if (attrs.isFormatDisabled(args)) return verbatim(args);
        boolean parenthesized = SyntaxHelper.findFirstChild(args, SyntaxKind.LEFT_PAREN) != null;
        Doc doc = Doc.NIL;
        if (parenthesized) {
            if (TableLayout.isCandidate(callee)) {
                int columns = TableLayout.columnCount(callee, args);
                doc = columns > 0
                        ? TableLayout.render(args, columns, this::convertExpr)
                        : ListLayout.asIs(args, this::convertExpr);
            } else {
                doc = convertParenthesizedArgs(args);
            }
        }

        List<Doc> blocks = new ArrayList<>();
        boolean afterParen = !parenthesized;
        for (SyntaxNode child : args.children()) {
            if (child.is(SyntaxKind.RIGHT_PAREN)) {
                afterParen = true;
            } else if (afterParen && child.is(SyntaxKind.CONTENT_BLOCK)) {
                blocks.add(convertExpr(child));
            }
        }
        return doc.append(Doc.concat(blocks).group());
    }

    private Doc convertParenthesizedArgs(SyntaxNode args) {
        List<SyntaxNode> items = new ArrayList<>();
        for (SyntaxNode child : ListLayout.parenthesized(args)) {
            if (SyntaxHelper.isItem(child)) items.add(child);
        }
        List<Doc> docs = new ArrayList<>();
        for (SyntaxNode item : items) {
            docs.add(convertExpr(item));
        }
        boolean preferTighter = items.isEmpty()
                || (items.size() == 1 && !valueOf(items.get(0)).is(SyntaxKind.FUNC_CALL));
        if (preferTighter) {
            return ListLayout.tight(docs, "(", ")");
        }
        return ListLayout.commaSeparated(docs, "(", ")",
                attrs.isMultiline(args) ? FoldStyle.NEVER : FoldStyle.FIT);
    }

    /** The expression an argument passes: the value of a named argument or a spread. */
    private static SyntaxNode valueOf(SyntaxNode arg) {
        if (arg.is(SyntaxKind.NAMED) || arg.is(SyntaxKind.SPREAD)) {
            SyntaxNode value = SyntaxHelper.lastExpr(arg);
            return value != null ? value : arg;
        }
        return arg;
    }
}
