package org.dxworks.metamark.parser;

import org.dxworks.metamark.error.LexException;
import org.dxworks.metamark.error.ParserException;
import org.dxworks.metamark.model.Bold;
import org.dxworks.metamark.model.Code;
import org.dxworks.metamark.model.InlineMath;
import org.dxworks.metamark.model.Italic;
import org.dxworks.metamark.model.Link;
import org.dxworks.metamark.model.Text;
import org.dxworks.metamark.scanner.Token;
import org.dxworks.metamark.scanner.TokenCursor;
import org.dxworks.metamark.scanner.TokenType;

import java.util.List;

/**
 * Turns the tokens of one heading, paragraph or list-item line into inline nodes.
 * <p>
 * Spans arrive from the scanner already delimited, so each one maps onto a single node and no
 * parsing happens inside emphasis. The line ends at a newline, which is consumed, at the end of
 * input, or before a token that only the block parser understands.
 */
final class InlineParser {

    private static final String LINK_SEPARATOR = "](";

    private final TokenCursor cursor;

    InlineParser(TokenCursor cursor) {
        this.cursor = cursor;
    }

    /**
     * @param leading tokens of this line that the caller already took off the cursor
     */
    InlineLine parseLine(List<Token> leading) throws LexException, ParserException {
        InlineLine line = new InlineLine();
        for (Token token : leading) {
            accept(token, line);
        }

        while (!cursor.isAtEnd()) {
            Token token = cursor.current();
            if (token.is(TokenType.NEWLINE)) {
                cursor.advance();
                break;
            }
            if (!token.getType().isInline()) {
                break;
            }
            cursor.advance();
            accept(token, line);
        }
        return line.finish();
    }

    private void accept(Token token, InlineLine line) throws ParserException {
        String lexeme = token.getLexeme();
        switch (token.getType()) {
            case TEXT:
            case WHITESPACE:
                line.appendText(lexeme);
                break;
            case BOLD:
                line.add(new Bold(new Text(LexemeUtils.unwrap(lexeme, 2))));
                break;
            case ITALIC:
                line.add(new Italic(new Text(LexemeUtils.unwrap(lexeme, 1))));
                break;
            case INLINE_CODE:
                line.add(new Code(LexemeUtils.unwrap(lexeme, 1)));
                break;
            case LINK:
                line.add(parseLink(lexeme));
                break;
            case INLINE_MATH:
                line.add(new InlineMath(LexemeUtils.unwrap(lexeme, 1)));
                break;
            case BLOCK_MATH:
                line.add(new InlineMath(LexemeUtils.unwrap(lexeme, 2)));
                break;
            case ANNOTATION:
                line.annotate(AnnotationParser.parse(token));
                break;
            default:
                throw new IllegalStateException("Not an inline token: " + token);
        }
    }

    private static Link parseLink(String lexeme) {
        int separator = lexeme.indexOf(LINK_SEPARATOR);
        String text = lexeme.substring(1, separator);
        String url = lexeme.substring(separator + LINK_SEPARATOR.length(), lexeme.length() - 1);
        return new Link(text, url);
    }
}
