package org.dxworks.typfmt.doc;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Width-aware layout of a {@link Doc}. A group is laid out flat when its content up to the next
 * possible line break fits in the remaining width, otherwise broken; groups containing a hard
 * break are always broken.
 */
public final class DocRenderer {

    private enum Mode { FLAT, BREAK }

    private static final class Cmd {
        final int indent;
        final Mode mode;
        final Doc doc;

        Cmd(int indent, Mode mode, Doc doc) {
            this.indent = indent;
            this.mode = mode;
            this.doc = doc;
        }
    }

    private DocRenderer() {
    }

    public static String render(Doc doc, int width) {
        StringBuilder out = new StringBuilder();
        Deque<Cmd> stack = new ArrayDeque<>();
        stack.push(new Cmd(0, Mode.BREAK, doc));
        int column = 0;

        while (!stack.isEmpty()) {
            Cmd cmd = stack.pop();
            Doc d = cmd.doc;
            if (d instanceof Doc.Text text) {
                out.append(text.text);
                column = text.isMultiline() ? text.lastLineWidth() : column + text.flatWidth();
            } else if (d instanceof Doc.Concat concat) {
                for (int i = concat.parts.size() - 1; i >= 0; i--) {
                    stack.push(new Cmd(cmd.indent, cmd.mode, concat.parts.get(i)));
                }
            } else if (d instanceof Doc.Nest nest) {
                stack.push(new Cmd(cmd.indent + nest.indent, cmd.mode, nest.doc));
            } else if (d instanceof Doc.Group group) {
                if (cmd.mode == Mode.FLAT && !group.hasHardBreak()) {
                    stack.push(new Cmd(cmd.indent, Mode.FLAT, group.doc));
                } else if (group.hasHardBreak()) {
                    stack.push(new Cmd(cmd.indent, Mode.BREAK, group.doc));
                } else {
                    Cmd flat = new Cmd(cmd.indent, Mode.FLAT, group.doc);
                    boolean fits = fits(flat, stack, width - column);
                    stack.push(fits ? flat : new Cmd(cmd.indent, Mode.BREAK, group.doc));
                }
            } else if (d instanceof Doc.IfBroken ifBroken) {
                stack.push(new Cmd(cmd.indent, cmd.mode, cmd.mode == Mode.BREAK ? ifBroken.broken : ifBroken.flat));
            } else if (d instanceof Doc.Line line) {
                if (cmd.mode == Mode.FLAT && line.kind == Doc.LineKind.SPACE) {
                    out.append(' ');
                    column++;
                } else if (cmd.mode == Mode.FLAT && line.kind == Doc.LineKind.SOFT) {
                    // nothing
                } else {
                    trimTrailingBlanks(out);
                    out.append('\n');
                    if (line.kind == Doc.LineKind.BLANK) {
                        column = 0;
                    } else {
                        out.append(" ".repeat(cmd.indent));
                        column = cmd.indent;
                    }
                }
            } else {
                throw new IllegalStateException("Unknown document variant: " + d.getClass().getName());
            }
        }
        return out.toString();
    }

    /**
     * Whether {@code next} fits in {@code remaining} columns, looking through the rest of the
     * pending commands up to the first line break.
     */
    private static boolean fits(Cmd next, Deque<Cmd> rest, int remaining) {
        Deque<Cmd> work = new ArrayDeque<>();
        work.push(next);
        Iterator<Cmd> restIt = rest.iterator();
        int width = remaining;
        while (width >= 0) {
            if (work.isEmpty()) {
                if (!restIt.hasNext()) return true;
                work.push(restIt.next());
                continue;
            }
            Cmd cmd = work.pop();
            Doc d = cmd.doc;
            if (d instanceof Doc.Text text) {
                if (text.isMultiline()) return width - text.firstLineWidth() >= 0;
                width -= text.flatWidth();
            } else if (d instanceof Doc.Concat concat) {
                for (int i = concat.parts.size() - 1; i >= 0; i--) {
                    work.push(new Cmd(cmd.indent, cmd.mode, concat.parts.get(i)));
                }
            } else if (d instanceof Doc.Nest nest) {
                work.push(new Cmd(cmd.indent + nest.indent, cmd.mode, nest.doc));
            } else if (d instanceof Doc.Group group) {
                Mode mode = group.hasHardBreak() ? Mode.BREAK : cmd.mode;
                work.push(new Cmd(cmd.indent, mode, group.doc));
            } else if (d instanceof Doc.IfBroken ifBroken) {
                work.push(new Cmd(cmd.indent, cmd.mode, cmd.mode == Mode.BREAK ? ifBroken.broken : ifBroken.flat));
            } else if (d instanceof Doc.Line line) {
                if (cmd.mode == Mode.BREAK || line.hasHardBreak()) return true;
                if (line.kind == Doc.LineKind.SPACE) width--;
            }
        }
        return false;
    }

    private static void trimTrailingBlanks(StringBuilder out) {
        int end = out.length();
        while (end > 0 && (out.charAt(end - 1) == ' ' || out.charAt(end - 1) == '\t')) end--;
        out.setLength(end);
    }
}
