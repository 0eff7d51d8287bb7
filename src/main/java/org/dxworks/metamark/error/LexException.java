package org.dxworks.metamark.error;

public class LexException extends MetaMarkException {

    public LexException(int line, int column, String message) {
        super(ErrorKind.LEX, line, column, message,
                "Lexer error at line " + line + ", column " + column + ": " + message, null);
    }
}
