package org.dxworks.typfmt.printer;

import org.dxworks.typfmt.doc.Doc;
import org.dxworks.typfmt.syntax.SyntaxHelper;
import org.dxworks.typfmt.syntax.SyntaxKind;
import org.dxworks.typfmt.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Row-per-line layout for {@code table(..)} and {@code grid(..)} calls, with cells aligned by
 * column when their widths are known.
 */
public final class TableLayout {

    private static final Set<String> TABLE_FUNCTIONS = Set.of("table", "grid");
    private static final String COLUMNS = "columns";
    private static final int INDENT = 2;
    private static final int MAX_DIGITS = 6;

    private TableLayout() {
    }

    public static boolean isCandidate(SyntaxNode callee) {
        return callee != null && callee.is(SyntaxKind.IDENT) && TABLE_FUNCTIONS.contains(callee.text());
    }

    /**
     * Number of columns of a table call's arguments, or -1 when the arguments do not have a shape
     * that can be laid out in rows.
     */
    public static int columnCount(SyntaxNode callee, SyntaxNode args) {
        int columns = -1;
        boolean seenCell = false;
        for (SyntaxNode item : items(args)) {
            if (item.is(SyntaxKind.SPREAD)) return -1;
            if (item.is(SyntaxKind.NAMED)) {
                if (seenCell) return -1;
                if (COLUMNS.equals(item.children().get(0).text())) {
                    columns = columnsOf(SyntaxHelper.lastExpr(item));
                }
                continue;
            }
            if (isCalleeMember(item, callee.text())) return -1;
            seenCell = true;
        }
        return columns > 0 ? columns : -1;
    }

    /**
     * Named arguments one per line, then the cells in rows of {@code columns}.
     *
     * @param convertArg converts one argument
     */
    public static Doc render(SyntaxNode args, int columns, Function<SyntaxNode, Doc> convertArg) {
        List<Doc> lines = new ArrayList<>();
        List<Doc> cells = new ArrayList<>();
        for (SyntaxNode item : items(args)) {
            if (item.is(SyntaxKind.NAMED)) {
                lines.add(convertArg.apply(item).append(","));
            } else {
                cells.add(convertArg.apply(item));
            }
        }

        int[] widths = columnWidths(cells, columns);
        for (int start = 0; start < cells.size(); start += columns) {
            int end = Math.min(start + columns, cells.size());
            List<Doc> row = new ArrayList<>();
            for (int i = start; i < end; i++) {
                Doc cell = cells.get(i).append(",");
                if (i < end - 1) {
                    int column = i - start;
                    int pad = widths[column] < 0 ? 1 : widths[column] - cells.get(i).flatWidth() + 1;
                    cell = cell.append(" ".repeat(pad));
                }
                row.add(cell);
            }
            lines.add(Doc.concat(row));
        }

        Doc body = Doc.concat(Doc.hardline(), Doc.join(lines, Doc.hardline()));
        return Doc.concat(Doc.text("("), body.nest(INDENT), Doc.hardline(), Doc.text(")"));
    }

    /** Widest flat cell per column, or -1 for a column holding a cell that cannot be flat. */
    private static int[] columnWidths(List<Doc> cells, int columns) {
        int[] widths = new int[columns];
        for (int i = 0; i < cells.size(); i++) {
            int column = i % columns;
            int width = cells.get(i).flatWidth();
            if (widths[column] < 0) continue;
            widths[column] = width < 0 ? -1 : Math.max(widths[column], width);
        }
        return widths;
    }

    private static int columnsOf(SyntaxNode value) {
        if (value == null) return -1;
        switch (value.kind()) {
            case INT:
                return parseCount(value.text());
            case ARRAY:
                return SyntaxHelper.items(value).size();
            case BINARY:
                SyntaxNode left = SyntaxHelper.firstExpr(value);
                SyntaxNode right = SyntaxHelper.lastExpr(value);
                if (SyntaxHelper.findFirstChild(value, SyntaxKind.STAR) == null) return -1;
                if (left.is(SyntaxKind.ARRAY) && right.is(SyntaxKind.INT)) {
                    return SyntaxHelper.items(left).size() * parseCount(right.text());
                }
                if (left.is(SyntaxKind.INT) && right.is(SyntaxKind.ARRAY)) {
                    return parseCount(left.text()) * SyntaxHelper.items(right).size();
                }
                return -1;
            default:
                return -1;
        }
    }

    private static int parseCount(String text) {
        if (text.isEmpty() || text.length() > MAX_DIGITS) return -1;
        for (int i = 0; i < text.length(); i++) {
            if (!Character.isDigit(text.charAt(i))) return -1;
        }
        return Integer.parseInt(text);
    }

    /** {@code table.header(..)}, {@code grid.cell(..)} and the like span rows on their own. */
    private static boolean isCalleeMember(SyntaxNode item, String calleeName) {
        if (!item.is(SyntaxKind.FUNC_CALL)) return false;
        SyntaxNode callee = item.children().get(0);
        if (!callee.is(SyntaxKind.FIELD_ACCESS)) return false;
        SyntaxNode target = callee.children().get(0);
        return target.is(SyntaxKind.IDENT) && target.text().equals(calleeName);
    }

    private static List<SyntaxNode> items(SyntaxNode args) {
        List<SyntaxNode> items = new ArrayList<>();
        for (SyntaxNode child : ListLayout.parenthesized(args)) {
            if (SyntaxHelper.isItem(child)) items.add(child);
        }
        return items;
    }
}
