package org.dxworks.typfmt.printer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ModeStackTest {

    @Test
    void startsInMarkup() {
        ModeStack modes = new ModeStack();
        assertEquals(Mode.MARKUP, modes.current());
        assertEquals(1, modes.depth());
        assertTrue(modes.isMarkupOrMath());
    }

    @Test
    void scopesRestoreThePreviousMode() {
        ModeStack modes = new ModeStack();
        try (ModeStack.Scope code = modes.enter(Mode.CODE)) {
            assertEquals(Mode.CODE, modes.current());
            assertFalse(modes.isMarkupOrMath());
            try (ModeStack.Scope math = modes.enter(Mode.MATH)) {
                assertEquals(Mode.MATH, modes.current());
                assertTrue(modes.isMarkupOrMath());
                assertEquals(3, modes.depth());
            }
            assertEquals(Mode.CODE, modes.current());
        }
        assertEquals(Mode.MARKUP, modes.current());
        assertEquals(1, modes.depth());
    }

    @Test
    void closingOutOfOrderFails() {
        ModeStack modes = new ModeStack();
        ModeStack.Scope outer = modes.enter(Mode.CODE);
        modes.enter(Mode.MATH);
        assertThrows(IllegalStateException.class, outer::close);
    }

    @Test
    void closingTwiceIsHarmless() {
        ModeStack modes = new ModeStack();
        ModeStack.Scope scope = modes.enter(Mode.CODE);
        scope.close();
        scope.close();
        assertEquals(1, modes.depth());
    }
}
