package org.dxworks.metamark.parser;

import org.dxworks.metamark.model.Annotation;
import org.dxworks.metamark.model.Inline;
import org.dxworks.metamark.model.Paragraph;
import org.dxworks.metamark.model.Text;

import java.util.ArrayList;
import java.util.List;

/**
 * Inline nodes and trailing annotations collected from one source line.
 */
final class InlineLine {
    private final List<Inline> nodes = new ArrayList<>();
    private final List<Annotation> annotations = new ArrayList<>();
    private final StringBuilder pendingText = new StringBuilder();

    void appendText(String text) {
        pendingText.append(text);
    }

    void add(Inline node) {
        flushText(false);
        nodes.add(node);
    }

    void annotate(Annotation annotation) {
        annotations.add(annotation);
    }

    /** Closes the line; blanks left at its end are dropped. */
    InlineLine finish() {
        flushText(true);
        return this;
    }

    boolean isEmpty() {
        return nodes.isEmpty() && annotations.isEmpty();
    }

    List<Inline> nodes() {
        return nodes;
    }

    List<Annotation> annotations() {
        return annotations;
    }

    Paragraph toParagraph() {
        return new Paragraph(nodes, annotations);
    }

    private void flushText(boolean endOfLine) {
        String text = endOfLine ? pendingText.toString().stripTrailing() : pendingText.toString();
        if (!text.isEmpty()) {
            nodes.add(new Text(text));
        }
        pendingText.setLength(0);
    }
}
