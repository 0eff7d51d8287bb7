package org.dxworks.metamark.scanner;

import org.dxworks.metamark.error.LexException;

/**
 * Pull-based view over a {@link Scanner}: the current token plus at most one token of look-ahead.
 */
public final class TokenCursor {

    private final Scanner scanner;
    private Token current;
    private Token lookahead;
    private boolean lookaheadLoaded;

    public TokenCursor(Scanner scanner) throws LexException {
        this.scanner = scanner;
        this.current = scanner.nextToken();
    }

    public Token current() {
        return current;
    }

    public boolean isAtEnd() {
        return current == null;
    }

    public boolean at(TokenType type) {
        return current != null && current.is(type);
    }

    public Token peek() throws LexException {
        if (!lookaheadLoaded) {
            lookahead = scanner.nextToken();
            lookaheadLoaded = true;
        }
        return lookahead;
    }

    /** Moves past the current token and returns it. */
    public Token advance() throws LexException {
        Token consumed = current;
        if (lookaheadLoaded) {
            current = lookahead;
            lookahead = null;
            lookaheadLoaded = false;
        } else {
            current = scanner.nextToken();
        }
        return consumed;
    }

    /**
     * With an opening code fence as the current token, takes the block body as raw text and moves
     * past the closing fence.
     *
     * @return the body, or {@code null} if the block is never closed; the cursor is left unchanged then
     */
    public String advanceOverFencedBody() throws LexException {
        if (!at(TokenType.CODE_FENCE) || lookaheadLoaded) {
            throw new IllegalStateException("Not positioned on an opening fence: " + current);
        }
        String body = scanner.readFencedBody();
        if (body != null) {
            current = scanner.nextToken();
        }
        return body;
    }
}
