package org.dxworks.metamark.parser;

import org.dxworks.metamark.MetamarkConfig;
import org.dxworks.metamark.error.ErrorKind;
import org.dxworks.metamark.error.MetaMarkException;
import org.dxworks.metamark.error.ParserException;
import org.dxworks.metamark.model.Annotation;
import org.dxworks.metamark.model.Block;
import org.dxworks.metamark.model.Bold;
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
import org.dxworks.metamark.model.MetaValue;
import org.dxworks.metamark.model.Paragraph;
import org.dxworks.metamark.model.Text;
import org.dxworks.metamark.scanner.Scanner;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BlockParserTest {

    private static Document parse(String source) throws MetaMarkException {
        return parse(source, MetamarkConfig.defaults());
    }

    private static Document parse(String source, MetamarkConfig config) throws MetaMarkException {
        return new BlockParser(new Scanner(source), config).parse();
    }

    private static Paragraph paragraph(String text) {
        return new Paragraph(List.of(new Text(text)), List.of());
    }

    private static ParserException parseFailure(String source) {
        return assertThrows(ParserException.class, () -> parse(source));
    }

    @Test
    void emptyInputGivesEmptyDocument() throws MetaMarkException {
        Document document = parse("");

        assertFalse(document.hasMetadata());
        assertTrue(document.blocks.isEmpty());
    }

    @Test
    void headingKeepsTrimmedContentAndAnnotations() throws MetaMarkException {
        Document document = parse("## Release **notes**   @[note: draft]\n");

        assertEquals(List.of(new Heading(2, "Release **notes**", List.of(new Annotation("note", "draft")))),
                document.blocks);
    }

    @Test
    void headingLevelFollowsMarkerLength() throws MetaMarkException {
        Heading heading = (Heading) parse("###### Deep").blocks.get(0);

        assertEquals(6, heading.level);
        assertEquals("Deep", heading.content);
    }

    @Test
    void componentHeaderSplitsNameFromAttributes() throws MetaMarkException {
        Document document = parse("[[component: type=\"card\" theme=\"dark\"]]\nHello\n[[/component]]");

        Component component = (Component) document.blocks.get(0);
        assertEquals("type=\"card\"", component.name);
        assertEquals(Map.of("theme", "dark"), component.attributes);
        assertEquals(List.of(paragraph("Hello")), component.content);
    }

    @Test
    void componentAttributesWithoutEqualsAreIgnored() throws MetaMarkException {
        Component component = (Component) parse("[[component: alert level=\"high\" dismissible]]\n[[/component]]").blocks.get(0);

        assertEquals("alert", component.name);
        assertEquals(Map.of("level", "high"), component.attributes);
        assertTrue(component.content.isEmpty());
    }

    @Test
    void componentsNest() throws MetaMarkException {
        Document document = parse("[[component: tabs]]\n[[component: tab title=\"One\"]]\nfirst\n[[/component]]\n[[/component]]\nafter");

        Component tab = new Component("tab", Map.of("title", "One"), List.of(paragraph("first")));
        assertEquals(List.of(new Component("tabs", Map.of(), List.of(tab)), paragraph("after")), document.blocks);
    }

    @Test
    void unterminatedComponentIsReportedAtItsStart() {
        ParserException e = parseFailure("intro\n[[component: card]]\nbody");

        assertEquals(ErrorKind.PARSER, e.getKind());
        assertEquals(2, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    void strayComponentEndIsRejected() {
        ParserException e = parseFailure("text\n\n[[/component]]");

        assertEquals(3, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    void nestedListBelongsToPreviousItem() throws MetaMarkException {
        Document document = parse("1. Step one\n2. Step two\n  - Sub a\n  - Sub b\n3. Step three");

        ListBlock nested = new ListBlock(false, List.of(
                new ListItem(1, List.of(paragraph("Sub a"))),
                new ListItem(1, List.of(paragraph("Sub b")))));
        ListBlock expected = new ListBlock(true, List.of(
                new ListItem(0, List.of(paragraph("Step one"))),
                new ListItem(0, List.of(paragraph("Step two"), nested)),
                new ListItem(0, List.of(paragraph("Step three")))));
        assertEquals(List.of(expected), document.blocks);
    }

    @Test
    void blankLinesStayInsideTheList() throws MetaMarkException {
        Document document = parse("- a\n\n- b\n\nAfter the list");

        assertEquals(2, document.blocks.size());
        assertEquals(2, ((ListBlock) document.blocks.get(0)).items.size());
        assertEquals(paragraph("After the list"), document.blocks.get(1));
    }

    @Test
    void switchingMarkerTypeStartsANewList() throws MetaMarkException {
        Document document = parse("- a\n1. b");

        assertEquals(2, document.blocks.size());
        assertFalse(((ListBlock) document.blocks.get(0)).ordered);
        assertTrue(((ListBlock) document.blocks.get(1)).ordered);
    }

    @Test
    void emptyListItemHasNoContent() throws MetaMarkException {
        ListBlock list = (ListBlock) parse("- \n- b").blocks.get(0);

        assertTrue(list.items.get(0).content.isEmpty());
        assertEquals(List.of(paragraph("b")), list.items.get(1).content);
    }

    @Test
    void componentAfterListMarkerClosesTheItem() throws MetaMarkException {
        Document document = parse("- [[component: badge]]\n[[/component]]");

        assertEquals(List.of(
                new ListBlock(false, List.of(new ListItem(0, List.of()))),
                new Component("badge", Map.of(), List.of())), document.blocks);
    }

    @Test
    void tabIndentedListMarkerIsRejected() {
        ParserException e = parseFailure("- a\n\t- b");

        assertEquals(2, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    void diagramTagsBecomeDiagrams() throws MetaMarkException {
        Document document = parse("```mermaid\ngraph TD\n```\n\n```DOT\ndigraph {}\n```\n\n```rust\nfn main() {}\n```\n\n```\nplain\n```");

        assertEquals(List.of(
                new Diagram(DiagramKind.MERMAID, "graph TD\n"),
                new Diagram(DiagramKind.GRAPHVIZ, "digraph {}\n"),
                new CodeBlock("rust", "fn main() {}\n"),
                new CodeBlock(null, "plain\n")), document.blocks);
    }

    @Test
    void codeBlockKeepsMarkupVerbatim() throws MetaMarkException {
        CodeBlock code = (CodeBlock) parse("```md\n# not a heading\n- *not* a list\n```").blocks.get(0);

        assertEquals("# not a heading\n- *not* a list\n", code.content);
    }

    @Test
    void codeBlockBodyIsNotTokenized() throws MetaMarkException {
        Document document = parse("```text\npage\fbreak\u000Btab\n  ```\nafter");

        assertEquals(List.of(new CodeBlock("text", "page\fbreak\u000Btab\n"), paragraph("after")), document.blocks);
    }

    @Test
    void taggedFenceInsideCodeBlockIsContent() throws MetaMarkException {
        Document document = parse("```md\n```js\nx\n```\n");

        assertEquals(List.of(new CodeBlock("md", "```js\nx\n")), document.blocks);
    }

    @Test
    void unterminatedCodeBlockIsReportedAtTheFence() {
        ParserException e = parseFailure("text\n```js\nlet x");

        assertEquals(2, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    void commentIsTrimmed() throws MetaMarkException {
        assertEquals(List.of(new Comment("todo: fix")), parse("%% todo: fix  ").blocks);
    }

    @Test
    void blockMathAloneOnItsLine() throws MetaMarkException {
        Document document = parse("$$E=mc^2$$  \n\n$$a$$ and more");

        assertEquals(new MathBlock("E=mc^2"), document.blocks.get(0));
        Paragraph paragraph = (Paragraph) document.blocks.get(1);
        assertEquals(2, paragraph.content.size());
        assertEquals(new Text(" and more"), paragraph.content.get(1));
    }

    @Test
    void paragraphMayStartWithInlineSpan() throws MetaMarkException {
        Document document = parse("**Bold** start");

        assertEquals(List.of(new Paragraph(List.of(new Bold(new Text("Bold")), new Text(" start")), List.of())),
                document.blocks);
    }

    @Test
    void paragraphStopsBeforeComponentMarker() throws MetaMarkException {
        Document document = parse("intro [[component: box]]\n[[/component]]");

        assertEquals(List.of(paragraph("intro"), new Component("box", Map.of(), List.of())), document.blocks);
    }

    @Test
    void malformedAnnotationIsReportedAtTheAnnotation() {
        ParserException e = parseFailure("Some text @[broken]");

        assertEquals(1, e.getLine());
        assertEquals(11, e.getColumn());
        assertEquals("Invalid annotation format '@[broken]', expected @[kind: content]", e.getDetail());
        assertEquals("Parser error at line 1, column 11: Invalid annotation format '@[broken]', expected @[kind: content]",
                e.getMessage());
    }

    @Test
    void frontmatterIsResolvedIntoMetadata() throws MetaMarkException {
        Document document = parse("---\ntitle: Doc\ntags:\n  - a\n  - b\n---\n# Heading");

        assertEquals(MetaValue.of("Doc"), document.metadata.get("title"));
        assertEquals(MetaValue.of(List.of(MetaValue.of("a"), MetaValue.of("b"))), document.metadata.get("tags"));
        assertEquals(List.<Block>of(new Heading(1, "Heading", List.of())), document.blocks);
    }

    @Test
    void frontmatterOnlyCountsAsFirstToken() {
        ParserException e = parseFailure("# Heading\n---\ntitle: x\n---");

        assertEquals(2, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    void unterminatedFrontmatterIsReportedAtTheDelimiter() {
        ParserException e = parseFailure("---\ntitle: Doc\n");

        assertEquals(1, e.getLine());
        assertEquals(1, e.getColumn());
    }

    @Test
    void frontmatterRejectsInlineMarkup() {
        ParserException e = parseFailure("---\nt: **x**\n---");

        assertEquals(2, e.getLine());
        assertEquals(4, e.getColumn());
    }

    @Test
    void invalidFrontmatterFailsWithMetadataError() {
        MetaMarkException e = assertThrows(MetaMarkException.class, () -> parse("---\nkey: [unclosed\n---\n"));

        assertEquals(ErrorKind.METADATA, e.getKind());
        assertFalse(e.hasPosition());
    }

    @Test
    void nestingDepthIsBounded() throws MetaMarkException {
        MetamarkConfig config = MetamarkConfig.with(20000, 2, false);
        String twoDeep = "[[component: a]]\n[[component: b]]\n[[/component]]\n[[/component]]";
        String threeDeep = "[[component: a]]\n[[component: b]]\n[[component: c]]\n[[/component]]\n[[/component]]\n[[/component]]";

        assertEquals(1, parse(twoDeep, config).blocks.size());
        ParserException e = assertThrows(ParserException.class, () -> parse(threeDeep, config));
        assertEquals(3, e.getLine());
    }

    @Test
    void listNestingCountsTowardsDepth() {
        MetamarkConfig config = MetamarkConfig.with(20000, 2, false);

        ParserException e = assertThrows(ParserException.class, () -> parse("- a\n  - b\n    - c", config));
        assertEquals(3, e.getLine());
    }
}
