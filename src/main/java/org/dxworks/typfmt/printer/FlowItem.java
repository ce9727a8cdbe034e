package org.dxworks.typfmt.printer;

import org.dxworks.typfmt.doc.Doc;

/**
 * One child of a flow-like node: its document and whether it wants a space on either side.
 */
public final class FlowItem {

    private static final FlowItem NONE = new FlowItem(null, false, false);

    private final Doc doc;
    private final boolean spaceBefore;
    private final boolean spaceAfter;

    private FlowItem(Doc doc, boolean spaceBefore, boolean spaceAfter) {
        this.doc = doc;
        this.spaceBefore = spaceBefore;
        this.spaceAfter = spaceAfter;
    }

    /** The child contributes nothing. */
    public static FlowItem none() {
        return NONE;
    }

    /** Attached to what precedes it, spaced from what follows: {@code a: b}. */
    public static FlowItem tightSpaced(Doc doc) {
        return new FlowItem(doc, false, true);
    }

    /** Spaced from what precedes it, attached to what follows: {@code ..rest}. */
    public static FlowItem spacedTight(Doc doc) {
        return new FlowItem(doc, true, false);
    }

    public static FlowItem spaced(Doc doc) {
        return new FlowItem(doc, true, true);
    }

    /** Space before only when {@code spaceBefore} holds; always space after. */
    public static FlowItem spacedBefore(Doc doc, boolean spaceBefore) {
        return new FlowItem(doc, spaceBefore, true);
    }

    public boolean isNone() {
        return doc == null;
    }

    public Doc getDoc() {
        return doc;
    }

    public boolean isSpaceBefore() {
        return spaceBefore;
    }

    public boolean isSpaceAfter() {
        return spaceAfter;
    }
}
