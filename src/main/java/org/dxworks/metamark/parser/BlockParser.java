package org.dxworks.metamark.parser;

import org.dxworks.metamark.MetamarkConfig;
import org.dxworks.metamark.error.LexException;
import org.dxworks.metamark.error.MetaMarkException;
import org.dxworks.metamark.error.ParserException;
import org.dxworks.metamark.metadata.MetadataResolver;
import org.dxworks.metamark.model.Annotation;
import org.dxworks.metamark.model.Block;
import org.dxworks.metamark.model.CodeBlock;
import org.dxworks.metamark.model.Comment;
import org.dxworks.metamark.model.Component;
import org.dxworks.metamark.model.Diagram;
import org.dxworks.metamark.model.DiagramKind;
import org.dxworks.metamark.model.Document;
import org.dxworks.metamark.model.Heading;
import org.dxworks.metamark.model.ListBlock;
import org.dxworks.metamark.model.ListItem;
import org.dxworks.metamark.model.MathBlock;
import org.dxworks.metamark.model.Metadata;
import org.dxworks.metamark.model.Paragraph;
import org.dxworks.metamark.scanner.Scanner;
import org.dxworks.metamark.scanner.Token;
import org.dxworks.metamark.scanner.TokenCursor;
import org.dxworks.metamark.scanner.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive-descent parser for MetaMark blocks.
 * <p>
 * Looks at the current token, dispatches to the routine for that construct, and lets the routine
 * consume tokens up to its own terminator. Frontmatter is handed to {@link MetadataResolver}, line
 * content to {@link InlineParser}. There is no error recovery: the first violation aborts the parse.
 * An instance parses exactly one document.
 */
public class BlockParser {

    private final TokenCursor cursor;
    private final InlineParser inlineParser;
    private final MetadataResolver metadataResolver;
    private final int maxNestingDepth;

    public BlockParser(Scanner scanner, MetamarkConfig config) throws LexException {
        this.cursor = new TokenCursor(scanner);
        this.inlineParser = new InlineParser(cursor);
        this.metadataResolver = new MetadataResolver(config.isStrictMetadata());
        this.maxNestingDepth = config.getMaxNestingDepth();
    }

    public Document parse() throws MetaMarkException {
        Metadata metadata = null;
        if (cursor.at(TokenType.FRONTMATTER_DELIMITER)) {
            metadata = parseFrontmatter();
        }
        List<Block> blocks = parseBlocks(null, 0);
        return new Document(metadata, blocks);
    }

    // ---- Frontmatter ----

    private Metadata parseFrontmatter() throws MetaMarkException {
        Token opening = cursor.advance();
        StringBuilder text = new StringBuilder();

        while (true) {
            Token token = cursor.current();
            if (token == null) {
                throw new ParserException(opening.getLine(), opening.getColumn(),
                        "Unterminated frontmatter, missing closing '---'");
            }
            if (token.is(TokenType.FRONTMATTER_DELIMITER)) {
                cursor.advance();
                break;
            }
            if (!isFrontmatterText(token.getType())) {
                throw new ParserException(token.getLine(), token.getColumn(),
                        "Unexpected " + token.getType() + " in frontmatter, only plain text is allowed");
            }
            text.append(token.getLexeme());
            cursor.advance();
        }

        return metadataResolver.resolve(text.toString());
    }

    // List markers are plain text to YAML block sequences.
    private static boolean isFrontmatterText(TokenType type) {
        return type == TokenType.TEXT
                || type == TokenType.WHITESPACE
                || type == TokenType.NEWLINE
                || type.isListMarker();
    }

    // ---- Block sequences ----

    /**
     * Parses blocks until end of input or, inside a component, until its end marker, which is
     * left on the cursor for the caller.
     */
    private List<Block> parseBlocks(Token openComponent, int depth) throws MetaMarkException {
        List<Block> blocks = new ArrayList<>();

        while (!cursor.isAtEnd()) {
            Token token = cursor.current();
            switch (token.getType()) {
                case NEWLINE:
                case WHITESPACE:
                    cursor.advance();
                    break;
                case COMPONENT_END:
                    if (openComponent != null) {
                        return blocks;
                    }
                    throw new ParserException(token.getLine(), token.getColumn(),
                            "Component end marker without a matching [[component: ...]]");
                default:
                    blocks.add(parseBlock(token, depth));
            }
        }

        if (openComponent != null) {
            throw new ParserException(openComponent.getLine(), openComponent.getColumn(),
                    "Unterminated component " + openComponent.getLexeme() + ", missing [[/component]]");
        }
        return blocks;
    }

    private Block parseBlock(Token token, int depth) throws MetaMarkException {
        switch (token.getType()) {
            case HEADING:
                return parseHeading();
            case UNORDERED_LIST_MARKER:
            case ORDERED_LIST_MARKER:
                return parseList(depth + 1);
            case COMPONENT_START:
                return parseComponent(depth + 1);
            case CODE_FENCE:
                return parseCodeBlock();
            case COMMENT:
                return parseComment();
            case BLOCK_MATH:
                return parseMathOrParagraph();
            case TEXT:
            case BOLD:
            case ITALIC:
            case INLINE_CODE:
            case LINK:
            case INLINE_MATH:
            case ANNOTATION:
                return parseParagraph(List.of());
            default:
                throw new ParserException(token.getLine(), token.getColumn(),
                        "Unexpected " + token.getType() + " '" + token.getLexeme().strip() + "'");
        }
    }

    // ---- Constructs ----

    private Heading parseHeading() throws MetaMarkException {
        Token marker = cursor.advance();
        int level = (int) marker.getLexeme().chars().filter(c -> c == '#').count();

        StringBuilder content = new StringBuilder();
        List<Annotation> annotations = new ArrayList<>();
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
            if (token.is(TokenType.ANNOTATION)) {
                annotations.add(AnnotationParser.parse(token));
            } else {
                content.append(token.getLexeme());
            }
        }

        return new Heading(level, content.toString().trim(), annotations);
    }

    private Component parseComponent(int depth) throws MetaMarkException {
        Token start = cursor.advance();
        checkDepth(start, depth);
        ComponentHeader header = ComponentHeader.parse(start.getLexeme());

        List<Block> content = parseBlocks(start, depth);
        cursor.advance(); // [[/component]]

        return new Component(header.name, header.attributes, content);
    }

    private ListBlock parseList(int depth) throws MetaMarkException {
        Token first = cursor.current();
        checkDepth(first, depth);
        boolean ordered = first.is(TokenType.ORDERED_LIST_MARKER);
        int level = indentLevel(first);
        List<ItemBuilder> items = new ArrayList<>();

        while (!cursor.isAtEnd()) {
            Token token = cursor.current();
            if (token.is(TokenType.NEWLINE)) {
                cursor.advance();
                continue;
            }
            if (token.is(TokenType.WHITESPACE)) {
                Token next = cursor.peek();
                if (next == null || next.is(TokenType.NEWLINE)) {
                    cursor.advance();
                    continue;
                }
                break;
            }
            if (!token.getType().isListMarker()) {
                break;
            }

            int markerLevel = indentLevel(token);
            if (markerLevel < level) {
                break;
            }
            if (markerLevel > level) {
                items.get(items.size() - 1).content.add(parseList(depth + 1));
                continue;
            }
            if (token.is(TokenType.ORDERED_LIST_MARKER) != ordered) {
                break;
            }

            cursor.advance();
            ItemBuilder item = new ItemBuilder(level);
            InlineLine line = inlineParser.parseLine(List.of());
            if (!line.isEmpty()) {
                item.content.add(line.toParagraph());
            }
            items.add(item);
        }

        List<ListItem> built = new ArrayList<>(items.size());
        for (ItemBuilder item : items) {
            built.add(item.build());
        }
        return new ListBlock(ordered, built);
    }

    private Block parseCodeBlock() throws MetaMarkException {
        Token fence = cursor.current();
        String language = fenceTag(fence);

        String content = cursor.advanceOverFencedBody();
        if (content == null) {
            throw new ParserException(fence.getLine(), fence.getColumn(),
                    "Unterminated code block, missing closing ```");
        }

        Optional<DiagramKind> diagramKind = DiagramKind.fromFenceTag(language);
        if (diagramKind.isPresent()) {
            return new Diagram(diagramKind.get(), content);
        }
        return new CodeBlock(language, content);
    }

    private Comment parseComment() throws MetaMarkException {
        Token comment = cursor.advance();
        return new Comment(comment.getLexeme().substring(2).trim());
    }

    /** A {@code $$...$$} span alone on its line is block math; otherwise it opens a paragraph. */
    private Block parseMathOrParagraph() throws MetaMarkException {
        Token math = cursor.advance();
        List<Token> consumed = new ArrayList<>();
        consumed.add(math);
        if (cursor.at(TokenType.WHITESPACE)) {
            consumed.add(cursor.advance());
        }

        if (cursor.isAtEnd() || cursor.at(TokenType.NEWLINE)) {
            if (!cursor.isAtEnd()) {
                cursor.advance();
            }
            return new MathBlock(LexemeUtils.unwrap(math.getLexeme(), 2));
        }
        return parseParagraph(consumed);
    }

    private Paragraph parseParagraph(List<Token> leading) throws MetaMarkException {
        return inlineParser.parseLine(leading).toParagraph();
    }

    // ---- Helpers ----

    private void checkDepth(Token token, int depth) throws ParserException {
        if (depth > maxNestingDepth) {
            throw new ParserException(token.getLine(), token.getColumn(),
                    "Nesting depth exceeds the maximum of " + maxNestingDepth);
        }
    }

    /** Two leading spaces per level; tabs have no defined width and are rejected. */
    private static int indentLevel(Token marker) throws ParserException {
        String indentation = LexemeUtils.indentation(marker.getLexeme());
        if (indentation.indexOf('\t') >= 0) {
            throw new ParserException(marker.getLine(), marker.getColumn(),
                    "Tab indentation before a list marker is not supported, indent with spaces");
        }
        return indentation.length() / 2;
    }

    private static String fenceTag(Token fence) {
        String tag = fence.getLexeme().substring(3).strip();
        return tag.isEmpty() ? null : tag;
    }

    private static class ItemBuilder {
        final int level;
        final List<Block> content = new ArrayList<>();

        ItemBuilder(int level) {
            this.level = level;
        }

        ListItem build() {
            return new ListItem(level, content);
        }
    }
}
