package org.dxworks.typfmt.printer;

/** Whether a list may collapse onto one line. */
public enum FoldStyle {
    /** One line when it fits, otherwise one item per line. */
    FIT,
    /** Always one item per line. */
    NEVER
}
