package org.dxworks.metamark.scanner;

import org.dxworks.metamark.error.LexException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Positional tokenizer for MetaMark text. Produces one {@link Token} per call, each tagged with
 * the 1-based line and column at which its lexeme starts.
 * <p>
 * An instance owns nothing but its cursor over the input, so it is single-use and not shared.
 */
public final class Scanner {

    private static final TokenType[] RULES = Arrays.stream(TokenType.values())
            .sorted(Comparator.comparingInt(TokenType::getPriority).reversed())
            .toArray(TokenType[]::new);

    // A line holding only a bare fence; the region start counts as a line start.
    private static final Pattern CLOSING_FENCE =
            Pattern.compile("(?:\\A|(?<=[\\r\\n]))[ \\t]*```[ \\t]*(?:\\r\\n|\\r|\\n|\\z)");

    private final String input;
    private final Matcher[] matchers;

    private int offset;
    private int line = 1;
    private int column = 1;
    private int lineStart;

    public Scanner(String input) {
        this.input = input == null ? "" : input;
        this.matchers = new Matcher[TokenType.values().length];
        for (TokenType type : TokenType.values()) {
            matchers[type.ordinal()] = type.getPattern().matcher(this.input);
        }
    }

    public static List<Token> scanAll(String input) throws LexException {
        Scanner scanner = new Scanner(input);
        List<Token> tokens = new ArrayList<>();
        Token token;
        while ((token = scanner.nextToken()) != null) {
            tokens.add(token);
        }
        return tokens;
    }

    public boolean isAtEnd() {
        return offset >= input.length();
    }

    /**
     * @return the next token, or {@code null} once the input is exhausted
     * @throws LexException if no rule matches at the current position
     */
    public Token nextToken() throws LexException {
        if (isAtEnd()) {
            return null;
        }

        TokenType bestType = null;
        int bestEnd = -1;
        for (TokenType type : RULES) {
            if (bestType != null && type.getPriority() < bestType.getPriority()) {
                break;
            }
            if (!isEligible(type.getAnchor())) {
                continue;
            }
            Matcher matcher = matchers[type.ordinal()];
            matcher.region(offset, input.length());
            if (matcher.lookingAt() && matcher.end() > offset && matcher.end() > bestEnd) {
                bestType = type;
                bestEnd = matcher.end();
            }
        }

        if (bestType == null) {
            throw new LexException(line, column, "Unrecognized character " + describe(input.codePointAt(offset)));
        }

        String lexeme = input.substring(offset, bestEnd);
        Token token = new Token(bestType, lexeme, line, column);
        consume(bestEnd);
        return token;
    }

    /**
     * Reads the body of a fenced block verbatim, without tokenizing it, and consumes the bare
     * fence line that closes it. Must be called right after the opening fence was scanned.
     *
     * @return the body, or {@code null} if no closing fence follows, in which case nothing is consumed
     */
    public String readFencedBody() {
        Matcher matcher = CLOSING_FENCE.matcher(input);
        matcher.region(offset, input.length());
        if (!matcher.find()) {
            return null;
        }
        String body = input.substring(offset, matcher.start());
        consume(matcher.end());
        return body;
    }

    private boolean isEligible(Anchor anchor) {
        switch (anchor) {
            case LINE_START:
                return offset == lineStart;
            case LEADING_BLANKS:
                for (int i = lineStart; i < offset; i++) {
                    char c = input.charAt(i);
                    if (c != ' ' && c != '\t') {
                        return false;
                    }
                }
                return true;
            default:
                return true;
        }
    }

    private void consume(int end) {
        int i = offset;
        while (i < end) {
            int cp = input.codePointAt(i);
            int width = Character.charCount(cp);
            if (cp == '\n' || (cp == '\r' && (i + 1 >= input.length() || input.charAt(i + 1) != '\n'))) {
                line++;
                column = 1;
                lineStart = i + width;
            } else if (cp != '\r') {
                column++;
            }
            i += width;
        }
        offset = end;
    }

    private static String describe(int codePoint) {
        return String.format("U+%04X", codePoint);
    }
}
