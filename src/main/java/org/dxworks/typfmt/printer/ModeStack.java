package org.dxworks.typfmt.printer;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Stack of lexical contexts. {@link Mode#MARKUP} is the base and is never popped.
 * Entries are pushed through {@link #enter(Mode)} and removed when the returned scope closes:
 * <pre>
 * try (ModeStack.Scope ignored = modes.enter(Mode.CODE)) {
 *     ...
 * }
 * </pre>
 */
public final class ModeStack {

    private final Deque<Mode> stack = new ArrayDeque<>();

    public ModeStack() {
        stack.push(Mode.MARKUP);
    }

    public Mode current() {
        return stack.peek();
    }

    public int depth() {
        return stack.size();
    }

    public boolean isMarkupOrMath() {
        Mode mode = current();
        return mode == Mode.MARKUP || mode == Mode.MATH;
    }

    public Scope enter(Mode mode) {
        stack.push(mode);
        return new Scope(stack.size());
    }

    /** Pops the entry it was created for. */
    public final class Scope implements AutoCloseable {
        private final int depth;
        private boolean closed;

        private Scope(int depth) {
            this.depth = depth;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            if (stack.size() != depth) {
                throw new IllegalStateException("Unbalanced mode stack: expected depth " + depth + ", found " + stack.size());
            }
            stack.pop();
        }
    }
}
