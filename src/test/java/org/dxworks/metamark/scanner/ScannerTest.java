package org.dxworks.metamark.scanner;

import org.dxworks.metamark.error.ErrorKind;
import org.dxworks.metamark.error.LexException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ScannerTest {

    private static List<TokenType> types(String input) throws LexException {
        return Scanner.scanAll(input).stream().map(Token::getType).collect(Collectors.toList());
    }

    @Test
    void headingMarkerWinsOverText() throws LexException {
        List<Token> tokens = Scanner.scanAll("# Title");

        assertEquals(List.of(TokenType.HEADING, TokenType.TEXT), types("# Title"));
        assertEquals("# ", tokens.get(0).getLexeme());
        assertEquals("Title", tokens.get(1).getLexeme());
    }

    @Test
    void textStopsWhereAnInlineSpanCanStart() throws LexException {
        List<Token> tokens = Scanner.scanAll("a**b**c");

        assertEquals(List.of(TokenType.TEXT, TokenType.BOLD, TokenType.TEXT), types("a**b**c"));
        assertEquals("**b**", tokens.get(1).getLexeme());
    }

    @Test
    void codeFenceCarriesItsTagAndLineBreak() throws LexException {
        List<Token> tokens = Scanner.scanAll("```rust\nfn\n```");

        assertEquals(TokenType.CODE_FENCE, tokens.get(0).getType());
        assertEquals("```rust\n", tokens.get(0).getLexeme());
        assertEquals(TokenType.CODE_FENCE, tokens.get(tokens.size() - 1).getType());
    }

    @Test
    void fencedBodyIsReadRawUpToTheBareFence() throws LexException {
        Scanner scanner = new Scanner("```js\na\f`b\n```js\n ``` \nnext");
        scanner.nextToken();

        assertEquals("a\f`b\n```js\n", scanner.readFencedBody());
        Token after = scanner.nextToken();
        assertEquals("next", after.getLexeme());
        assertEquals(5, after.getLine());
        assertEquals(1, after.getColumn());
    }

    @Test
    void fencedBodyWithoutClosingFenceIsNotConsumed() throws LexException {
        Scanner scanner = new Scanner("```\nlet x");
        scanner.nextToken();

        assertNull(scanner.readFencedBody());
        assertEquals("let", scanner.nextToken().getLexeme());
    }

    @Test
    void longestMatchWinsAmongEqualPriority() throws LexException {
        List<Token> tokens = Scanner.scanAll("  - item");

        assertEquals(TokenType.UNORDERED_LIST_MARKER, tokens.get(0).getType());
        assertEquals("  - ", tokens.get(0).getLexeme());
    }

    @Test
    void blockMathIsPreferredOverInlineMath() throws LexException {
        assertEquals(List.of(TokenType.BLOCK_MATH), types("$$x^2$$"));
        assertEquals(List.of(TokenType.INLINE_MATH), types("$x$"));
    }

    @Test
    void inlineAnnotationAndLinkAreRecognized() throws LexException {
        assertEquals(List.of(TokenType.LINK, TokenType.WHITESPACE, TokenType.ANNOTATION),
                types("[docs](https://x.io) @[note: see docs]"));
    }

    @Test
    void listMarkersOnlyMatchAtLineStart() throws LexException {
        assertEquals(List.of(TokenType.TEXT, TokenType.WHITESPACE, TokenType.TEXT, TokenType.WHITESPACE, TokenType.TEXT),
                types("a - b"));
        assertEquals(List.of(TokenType.ORDERED_LIST_MARKER, TokenType.TEXT), types("12. item"));
    }

    @Test
    void headingAndCommentMayFollowLeadingBlanksOnly() throws LexException {
        assertEquals(List.of(TokenType.WHITESPACE, TokenType.HEADING, TokenType.TEXT), types("  # Title"));
        assertEquals(List.of(TokenType.TEXT, TokenType.WHITESPACE, TokenType.TEXT, TokenType.WHITESPACE, TokenType.TEXT),
                types("x # y"));
        assertEquals(List.of(TokenType.COMMENT), types("%% note to self"));
    }

    @Test
    void frontmatterDelimiterOnlyAtColumnOne() throws LexException {
        assertEquals(List.of(TokenType.FRONTMATTER_DELIMITER, TokenType.FRONTMATTER_DELIMITER), types("---\n---"));
        assertEquals(List.of(TokenType.WHITESPACE, TokenType.TEXT), types(" ---"));
    }

    @Test
    void tracksLinesAndColumns() throws LexException {
        List<Token> tokens = Scanner.scanAll("ab cd\r\n\tef\rgh");

        Token ef = tokens.stream().filter(t -> t.getLexeme().equals("ef")).findFirst().orElseThrow();
        assertEquals(2, ef.getLine());
        assertEquals(2, ef.getColumn());

        Token gh = tokens.get(tokens.size() - 1);
        assertEquals("gh", gh.getLexeme());
        assertEquals(3, gh.getLine());
        assertEquals(1, gh.getColumn());
    }

    @Test
    void columnsCountCodePoints() throws LexException {
        List<Token> tokens = Scanner.scanAll("😀 x");

        assertEquals(3, tokens.get(2).getColumn());
    }

    @Test
    void consecutiveLineBreaksFormOneToken() throws LexException {
        List<Token> tokens = Scanner.scanAll("a\n\n\nb");

        assertEquals(TokenType.NEWLINE, tokens.get(1).getType());
        assertEquals("\n\n\n", tokens.get(1).getLexeme());
        assertEquals(4, tokens.get(2).getLine());
    }

    @Test
    void rescanningYieldsIdenticalTokens() throws LexException {
        String input = "---\ntitle: x\n---\n# Head @[note: a]\n\n- one\n  - two\n\n[[component: card]]\nbody\n[[/component]]\n";

        assertEquals(Scanner.scanAll(input), Scanner.scanAll(input));
    }

    @Test
    void reportsPositionOfUnrecognizedCharacter() {
        LexException e = assertThrows(LexException.class, () -> Scanner.scanAll("ok\n  \f"));

        assertEquals(ErrorKind.LEX, e.getKind());
        assertEquals(2, e.getLine());
        assertEquals(3, e.getColumn());
        assertEquals("Lexer error at line 2, column 3: Unrecognized character U+000C", e.getMessage());
    }

    @Test
    void emptyInputHasNoTokens() throws LexException {
        Scanner scanner = new Scanner("");

        assertTrue(scanner.isAtEnd());
        assertNull(scanner.nextToken());
    }
}
