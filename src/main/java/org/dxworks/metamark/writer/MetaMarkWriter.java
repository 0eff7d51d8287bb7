package org.dxworks.metamark.writer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.dxworks.metamark.model.Annotation;
import org.dxworks.metamark.model.Block;
import org.dxworks.metamark.model.Bold;
import org.dxworks.metamark.model.Code;
import org.dxworks.metamark.model.CodeBlock;
import org.dxworks.metamark.model.Comment;
import org.dxworks.metamark.model.Component;
import org.dxworks.metamark.model.Diagram;
import org.dxworks.metamark.model.Document;
import org.dxworks.metamark.model.Heading;
import org.dxworks.metamark.model.Inline;
import org.dxworks.metamark.model.InlineMath;
import org.dxworks.metamark.model.Italic;
import org.dxworks.metamark.model.Link;
import org.dxworks.metamark.model.ListBlock;
import org.dxworks.metamark.model.ListItem;
import org.dxworks.metamark.model.MathBlock;
import org.dxworks.metamark.model.Metadata;
import org.dxworks.metamark.model.Paragraph;
import org.dxworks.metamark.model.SecureBlock;
import org.dxworks.metamark.model.Text;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Writes a document tree back out as MetaMark source.
 * <p>
 * Top-level and component blocks are separated by a blank line; metadata is written as YAML.
 * Parsing the output of {@link #write(Document)} yields a tree equal to the one written, as long
 * as that tree could have come from the parser. Ordered list items are renumbered from 1.
 * <p>
 * A paragraph that the parser read from the rest of a component marker line stays on that line
 * when its text would otherwise start a heading, list, comment or delimiter.
 */
public class MetaMarkWriter {

    private static final String DELIMITER = "---";
    private static final String FENCE = "```";
    private static final String INDENT = "  ";
    private static final Pattern BLOCK_MARKER_LIKE = Pattern.compile("#{1,6} |%% |- |\\d+\\. |---[ \\t]*$");

    private static final YAMLMapper YAML_MAPPER = YAMLMapper.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build();

    public String write(Document document) throws JsonProcessingException {
        StringBuilder out = new StringBuilder();
        if (document.metadata != null) {
            writeMetadata(document.metadata, out);
        }
        out.append(writeBlocks(document.blocks));
        return out.toString();
    }

    private void writeMetadata(Metadata metadata, StringBuilder out) throws JsonProcessingException {
        out.append(DELIMITER).append('\n');
        if (!metadata.isEmpty()) {
            out.append(YAML_MAPPER.writeValueAsString(metadata.toPlain()));
        }
        out.append(DELIMITER).append('\n');
    }

    // Each block ends with its own line break; one more between blocks leaves a blank line.
    private String writeBlocks(List<Block> blocks) throws JsonProcessingException {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < blocks.size(); i++) {
            Block block = blocks.get(i);
            if (i > 0 && blocks.get(i - 1) instanceof Component && startsLikeBlockMarker(block)) {
                // continue the [[/component]] line
                out.setLength(out.length() - 1);
                out.append(' ').append(paragraphLine((Paragraph) block)).append('\n');
                continue;
            }
            if (i > 0) {
                out.append('\n');
            }
            out.append(writeBlock(block));
        }
        return out.toString();
    }

    private String writeBlock(Block block) throws JsonProcessingException {
        if (block instanceof Heading heading) {
            return "#".repeat(heading.level) + " " + heading.content + annotations(heading.annotations) + "\n";
        }
        if (block instanceof Paragraph paragraph) {
            return paragraphLine(paragraph) + "\n";
        }
        if (block instanceof Component component) {
            return writeComponent(component);
        }
        if (block instanceof CodeBlock codeBlock) {
            return fenced(codeBlock.language == null ? "" : codeBlock.language, codeBlock.content);
        }
        if (block instanceof Diagram diagram) {
            return fenced(diagram.kind.getTag(), diagram.content);
        }
        if (block instanceof ListBlock list) {
            StringBuilder out = new StringBuilder();
            writeList(list, out);
            return out.toString();
        }
        if (block instanceof Comment comment) {
            return "%% " + comment.content + "\n";
        }
        if (block instanceof MathBlock math) {
            return "$$" + math.content + "$$\n";
        }
        if (block instanceof SecureBlock) {
            throw new IllegalArgumentException("Secure blocks have no MetaMark source form");
        }
        throw new IllegalArgumentException("Unsupported block " + block.getClass().getSimpleName());
    }

    private String writeComponent(Component component) throws JsonProcessingException {
        StringBuilder out = new StringBuilder(componentStart(component));
        List<Block> content = component.content;
        if (!content.isEmpty() && startsLikeBlockMarker(content.get(0))) {
            out.append(' ').append(paragraphLine((Paragraph) content.get(0)));
            content = content.subList(1, content.size());
        }
        return out.append('\n')
                .append(writeBlocks(content))
                .append("[[/component]]\n")
                .toString();
    }

    private static boolean startsLikeBlockMarker(Block block) {
        return block instanceof Paragraph paragraph && BLOCK_MARKER_LIKE.matcher(paragraphLine(paragraph)).lookingAt();
    }

    private static String componentStart(Component component) {
        StringBuilder header = new StringBuilder("[[component: ").append(component.name);
        for (Map.Entry<String, String> attribute : component.attributes.entrySet()) {
            header.append(' ').append(attribute.getKey()).append("=\"").append(attribute.getValue()).append('"');
        }
        return header.append("]]").toString();
    }

    private static String fenced(String tag, String content) {
        StringBuilder out = new StringBuilder(FENCE).append(tag).append('\n').append(content);
        int lastBreak = Math.max(content.lastIndexOf('\n'), content.lastIndexOf('\r'));
        if (!content.substring(lastBreak + 1).isBlank()) {
            out.append('\n');
        }
        return out.append(FENCE).append('\n').toString();
    }

    private void writeList(ListBlock list, StringBuilder out) {
        int number = 1;
        for (ListItem item : list.items) {
            out.append(INDENT.repeat(item.level))
                    .append(list.ordered ? (number++) + ". " : "- ");

            List<Block> rest = item.content;
            if (!rest.isEmpty() && rest.get(0) instanceof Paragraph paragraph) {
                out.append(paragraphLine(paragraph));
                rest = rest.subList(1, rest.size());
            }
            out.append('\n');

            for (Block nested : rest) {
                if (!(nested instanceof ListBlock nestedList)) {
                    throw new IllegalArgumentException(
                            "List items hold one paragraph and nested lists, got " + nested.getClass().getSimpleName());
                }
                writeList(nestedList, out);
            }
        }
    }

    private static String paragraphLine(Paragraph paragraph) {
        StringBuilder line = new StringBuilder();
        for (Inline inline : paragraph.content) {
            line.append(inline(inline));
        }
        String annotations = annotations(paragraph.annotations);
        return line.length() == 0 ? annotations.stripLeading() : line + annotations;
    }

    private static String inline(Inline inline) {
        if (inline instanceof Text text) {
            return text.text;
        }
        if (inline instanceof Bold bold) {
            return "**" + inline(bold.inner) + "**";
        }
        if (inline instanceof Italic italic) {
            return "*" + inline(italic.inner) + "*";
        }
        if (inline instanceof Code code) {
            return "`" + code.content + "`";
        }
        if (inline instanceof Link link) {
            return "[" + link.text + "](" + link.url + ")";
        }
        if (inline instanceof InlineMath math) {
            return "$" + math.content + "$";
        }
        throw new IllegalArgumentException("Unsupported inline " + inline.getClass().getSimpleName());
    }

    private static String annotations(List<Annotation> annotations) {
        StringBuilder out = new StringBuilder();
        for (Annotation annotation : annotations) {
            out.append(" @[").append(annotation.kind).append(": ").append(annotation.content).append(']');
        }
        return out.toString();
    }
}
