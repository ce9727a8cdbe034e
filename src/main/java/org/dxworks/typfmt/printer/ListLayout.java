package org.dxworks.typfmt.printer;

import org.dxworks.typfmt.doc.Doc;
import org.dxworks.typfmt.syntax.SyntaxHelper;
import org.dxworks.typfmt.syntax.SyntaxKind;
import org.dxworks.typfmt.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Layouts for bracketed item lists: argument lists, arrays, dictionaries, parameters,
 * destructuring patterns and code blocks.
 */
public final class ListLayout {

    private static final int INDENT = 2;

    private ListLayout() {
    }

    /** {@code (a, b)} with no break opportunity. */
    public static Doc tight(List<Doc> items, String open, String close) {
        return Doc.concat(Doc.text(open), Doc.join(items, Doc.text(", ")), Doc.text(close));
    }

    /**
     * Comma separated items. Flat: {@code (a, b, c)}. Broken: one item per line, each followed
     * by a comma, the closing bracket on its own line.
     */
    public static Doc commaSeparated(List<Doc> items, String open, String close, FoldStyle fold) {
        if (items.isEmpty()) return Doc.text(open + close);
        if (fold == FoldStyle.NEVER) {
            return broken(items, Doc.text(","), Doc.text(","), open, close);
        }
        Doc separator = Doc.concat(Doc.text(","), Doc.line());
        Doc body = Doc.concat(Doc.softline(), Doc.join(items, separator), Doc.ifBroken(Doc.text(","), Doc.NIL));
        return Doc.concat(Doc.text(open), body.nest(INDENT), Doc.softline(), Doc.text(close)).group();
    }

    /**
     * Statements of a code block. Flat: {@code { a; b }}. Broken: one statement per line.
     * {@link Doc#NIL} items stand for blank lines and only show up in the broken form.
     */
    public static Doc block(List<Doc> items, FoldStyle fold) {
        if (items.isEmpty()) return Doc.text("{}");
        if (fold == FoldStyle.NEVER) {
            return broken(items, Doc.NIL, Doc.NIL, "{", "}");
        }
        Doc separator = Doc.concat(Doc.ifBroken(Doc.NIL, Doc.text(";")), Doc.line());
        Doc body = Doc.concat(Doc.line(), Doc.join(items, separator));
        return Doc.concat(Doc.text("{"), body.nest(INDENT), Doc.line(), Doc.text("}")).group();
    }

    private static Doc broken(List<Doc> items, Doc separator, Doc trailing, String open, String close) {
        List<Doc> lines = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            Doc item = items.get(i);
            boolean last = i == items.size() - 1;
            // blank line placeholders get no separator
            if (item == Doc.NIL) {
                lines.add(Doc.NIL);
            } else {
                lines.add(item.append(last ? trailing : separator));
            }
        }
        Doc body = Doc.concat(Doc.hardline(), Doc.join(lines, Doc.hardline()));
        return Doc.concat(Doc.text(open), body.nest(INDENT), Doc.hardline(), Doc.text(close));
    }

    /**
     * Replays the parenthesized part of an argument list the way it was written: commas, spaces,
     * line feeds and comments stay where they are while each argument is still converted.
     * Whitespace before the closing parenthesis is kept outside the indentation.
     */
    public static Doc asIs(SyntaxNode args, Function<SyntaxNode, Doc> convert) {
        List<SyntaxNode> inner = parenthesized(args);
        int end = inner.size();
        while (end > 0 && inner.get(end - 1).is(SyntaxKind.SPACE)) end--;

        List<Doc> body = new ArrayList<>();
        for (int i = 0; i < end; i++) {
            body.add(replay(inner.get(i), convert));
        }
        List<Doc> tail = new ArrayList<>();
        for (int i = end; i < inner.size(); i++) {
            tail.add(replay(inner.get(i), convert));
        }
        return Doc.concat(Doc.text("("), Doc.concat(body).nest(INDENT), Doc.concat(tail), Doc.text(")"));
    }

    private static Doc replay(SyntaxNode node, Function<SyntaxNode, Doc> convert) {
        switch (node.kind()) {
            case COMMA:
                return Doc.text(",");
            case SPACE:
                int newlines = SyntaxHelper.countNewlines(node.text());
                return newlines > 0 ? Doc.repeat(Doc.hardline(), newlines) : Doc.space();
            case LINE_COMMENT:
            case BLOCK_COMMENT:
                return Doc.text(node.text());
            default:
                return convert.apply(node);
        }
    }

    /** Children strictly between the parentheses of an argument list. */
    static List<SyntaxNode> parenthesized(SyntaxNode args) {
        List<SyntaxNode> result = new ArrayList<>();
        boolean inside = false;
        for (SyntaxNode child : args.children()) {
            if (child.is(SyntaxKind.LEFT_PAREN)) {
                inside = true;
            } else if (child.is(SyntaxKind.RIGHT_PAREN)) {
                break;
            } else if (inside) {
                result.add(child);
            }
        }
        return result;
    }
}
