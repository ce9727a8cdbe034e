package org.dxworks.typfmt.printer;

import org.dxworks.typfmt.doc.Doc;
import org.dxworks.typfmt.syntax.SyntaxHelper;
import org.dxworks.typfmt.syntax.SyntaxKind;
import org.dxworks.typfmt.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.function.Function;

/**
 * Flattens nested field accesses and method calls ({@code a.b(x).c}) into a list of segments so
 * that a long chain can hang one {@code .segment} per line.
 */
public final class DotChain {

    private static final int INDENT = 2;

    private DotChain() {
    }

    /**
     * Segments of the chain ending in {@code fieldAccess}: the converted base first, then each
     * field with the arguments of the calls made on it.
     *
     * @param convertExpr converts the base expression
     * @param convertArgs converts the argument list of a call, given the call node
     */
    public static List<Doc> resolve(SyntaxNode fieldAccess,
                                    Function<SyntaxNode, Doc> convertExpr,
                                    Function<SyntaxNode, Doc> convertArgs) {
        LinkedList<Doc> segments = new LinkedList<>();
        Doc suffix = Doc.NIL;
        SyntaxNode current = fieldAccess;
        while (true) {
            if (current.is(SyntaxKind.FIELD_ACCESS)) {
                segments.addFirst(Doc.text(field(current).text()).append(suffix));
                suffix = Doc.NIL;
                current = current.children().get(0);
            } else if (current.is(SyntaxKind.FUNC_CALL) && current.children().get(0).is(SyntaxKind.FIELD_ACCESS)) {
                suffix = convertArgs.apply(current).append(suffix);
                current = current.children().get(0);
            } else {
                segments.addFirst(convertExpr.apply(current).append(suffix));
                return new ArrayList<>(segments);
            }
        }
    }

    /** {@code a.b} on one line; longer chains as {@code a} followed by a group of hanging segments. */
    public static Doc render(List<Doc> segments) {
        if (segments.size() < 2) {
            throw new IllegalArgumentException("A chain has at least two segments, got " + segments.size());
        }
        Doc first = segments.get(0);
        if (segments.size() == 2) {
            return Doc.concat(first, Doc.text("."), segments.get(1));
        }
        Doc separator = Doc.concat(Doc.softline(), Doc.text("."));
        Doc rest = Doc.concat(separator, Doc.join(segments.subList(1, segments.size()), separator));
        return Doc.concat(first, rest.nest(INDENT).group());
    }

    static SyntaxNode field(SyntaxNode fieldAccess) {
        return SyntaxHelper.findLastChild(fieldAccess, SyntaxKind.IDENT);
    }
}
