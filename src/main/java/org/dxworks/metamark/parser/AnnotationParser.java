package org.dxworks.metamark.parser;

import org.dxworks.metamark.error.ParserException;
import org.dxworks.metamark.model.Annotation;
import org.dxworks.metamark.scanner.Token;

/**
 * Splits an {@code @[kind: content]} lexeme on its first {@code ": "}.
 */
final class AnnotationParser {

    private static final String SEPARATOR = ": ";

    private AnnotationParser() {}

    static Annotation parse(Token token) throws ParserException {
        String lexeme = token.getLexeme();
        String body = lexeme.substring(2, lexeme.length() - 1);
        int separator = body.indexOf(SEPARATOR);
        if (separator < 0) {
            throw new ParserException(token.getLine(), token.getColumn(),
                    "Invalid annotation format '" + lexeme + "', expected @[kind: content]");
        }
        return new Annotation(body.substring(0, separator), body.substring(separator + SEPARATOR.length()));
    }
}
