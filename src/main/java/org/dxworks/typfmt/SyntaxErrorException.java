package org.dxworks.typfmt;

/** The document has syntax errors and cannot be formatted. */
public class SyntaxErrorException extends Exception {

    private final int offset;

    public SyntaxErrorException(String message, int offset) {
        super("The document has syntax errors: " + message + " at offset " + offset);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
