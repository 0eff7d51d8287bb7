package org.dxworks.metamark.parser;

final class LexemeUtils {

    private LexemeUtils() {}

    /** Drops {@code width} delimiter characters from both ends, e.g. {@code **x**} with width 2 gives {@code x}. */
    static String unwrap(String lexeme, int width) {
        if (lexeme.length() < 2 * width) return "";
        return lexeme.substring(width, lexeme.length() - width);
    }

    /** Strips every leading and trailing occurrence of {@code c}. */
    static String trimChar(String s, char c) {
        int start = 0;
        int end = s.length();
        while (start < end && s.charAt(start) == c) start++;
        while (end > start && s.charAt(end - 1) == c) end--;
        return s.substring(start, end);
    }

    /** Leading spaces and tabs of a list marker lexeme. */
    static String indentation(String lexeme) {
        int i = 0;
        while (i < lexeme.length() && (lexeme.charAt(i) == ' ' || lexeme.charAt(i) == '\t')) i++;
        return lexeme.substring(0, i);
    }
}
