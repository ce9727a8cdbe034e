package org.dxworks.typfmt.printer;

/** Lexical context the converter is currently in. */
public enum Mode {
    MARKUP,
    CODE,
    MATH
}
