package org.dxworks.metamark.error;

public class ParserException extends MetaMarkException {

    public ParserException(int line, int column, String message) {
        super(ErrorKind.PARSER, line, column, message,
                "Parser error at line " + line + ", column " + column + ": " + message, null);
    }
}
