package org.dxworks.metamark.error;

/**
 * Base type for every failure raised while turning MetaMark text into a document tree.
 * Line and column are 1-based and point at the start of the offending lexeme;
 * both are 0 for failures that carry no source position.
 */
public abstract class MetaMarkException extends Exception {

    private final ErrorKind kind;
    private final int line;
    private final int column;
    private final String detail;

    protected MetaMarkException(ErrorKind kind, int line, int column, String detail, String formatted, Throwable cause) {
        super(formatted, cause);
        this.kind = kind;
        this.line = line;
        this.column = column;
        this.detail = detail;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /** The message without the position prefix. */
    public String getDetail() {
        return detail;
    }

    public boolean hasPosition() {
        return line > 0;
    }
}
