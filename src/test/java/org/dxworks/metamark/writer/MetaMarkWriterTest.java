package org.dxworks.metamark.writer;

import org.dxworks.metamark.App;
import org.dxworks.metamark.MetaMark;
import org.dxworks.metamark.MetamarkConfig;
import org.dxworks.metamark.model.Bold;
import org.dxworks.metamark.model.CodeBlock;
import org.dxworks.metamark.model.Comment;
import org.dxworks.metamark.model.Component;
import org.dxworks.metamark.model.Document;
import org.dxworks.metamark.model.EncryptionInfo;
import org.dxworks.metamark.model.Heading;
import org.dxworks.metamark.model.Metadata;
import org.dxworks.metamark.model.Paragraph;
import org.dxworks.metamark.model.SecureBlock;
import org.dxworks.metamark.model.Text;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetaMarkWriterTest {

    private final MetaMarkWriter writer = new MetaMarkWriter();

    @Test
    void separatesBlocksWithBlankLines() throws Exception {
        Document document = new Document(null, List.of(
                new Heading(1, "Title", List.of()),
                new Paragraph(List.of(new Text("Hello "), new Bold(new Text("world"))), List.of()),
                new Comment("c")));

        assertEquals("# Title\n\nHello **world**\n\n%% c\n", writer.write(document));
    }

    @Test
    void emptyMetadataKeepsItsDelimiters() throws Exception {
        Document document = new Document(Metadata.empty(), List.of());

        assertEquals("---\n---\n", writer.write(document));
        assertEquals(document, MetaMark.parseDocument(writer.write(document)));
    }

    @Test
    void codeBlockGetsClosingFenceOnItsOwnLine() throws Exception {
        Document document = new Document(null, List.of(new CodeBlock("py", "x = 1")));

        assertEquals("```py\nx = 1\n```\n", writer.write(document));
    }

    @Test
    void sampleDocumentsSurviveRoundTrip() throws Exception {
        for (String sample : List.of("basic.mmk", "nested.mmk")) {
            Document parsed = App.parseFile(Paths.get("src/test/resources/samples/metamark/" + sample), MetamarkConfig.defaults());

            assertEquals(parsed, MetaMark.parseDocument(writer.write(parsed)), sample);
        }
    }

    @Test
    void headingRoundTrip() throws Exception {
        Document parsed = MetaMark.parseDocument("### Results and **findings** @[todo: verify numbers]");

        assertEquals(parsed, MetaMark.parseDocument(writer.write(parsed)));
    }

    @Test
    void listsRoundTrip() throws Exception {
        String source = "- \n  - only nested\n- b @[tip: x]\n  1. one\n  - switched\n    - deeper\n\n1. fresh\n";
        Document parsed = MetaMark.parseDocument(source);

        assertEquals(parsed, MetaMark.parseDocument(writer.write(parsed)));
    }

    @Test
    void markerLikeTextAfterComponentMarkersRoundTrip() throws Exception {
        for (String source : List.of(
                "[[component: c]] - item\n[[/component]]",
                "[[component: c]] # not heading\n[[/component]]",
                "[[component: c]]\n[[/component]] 1. after",
                "[[component: c]] %% not a comment\nbody\n[[/component]] ---")) {
            Document parsed = MetaMark.parseDocument(source);

            assertEquals(parsed, MetaMark.parseDocument(writer.write(parsed)), source);
        }
    }

    @Test
    void markerLikeParagraphStaysOnTheComponentLine() throws Exception {
        Document document = new Document(null, List.of(
                new Component("c", Map.of(), List.of(new Paragraph(List.of(new Text("- item")), List.of()))),
                new Paragraph(List.of(new Text("2. after")), List.of()),
                new Paragraph(List.of(new Text("plain")), List.of())));

        assertEquals("[[component: c]] - item\n[[/component]] 2. after\n\nplain\n", writer.write(document));
    }

    @Test
    void secureBlocksCannotBeWritten() {
        Document document = new Document(null, List.of(
                new SecureBlock(new byte[]{1}, new EncryptionInfo("AES-256-GCM", "k", new byte[0]))));

        assertThrows(IllegalArgumentException.class, () -> writer.write(document));
    }
}
