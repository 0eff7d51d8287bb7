package org.dxworks.metamark.model;

import java.util.Locale;
import java.util.Optional;

public enum DiagramKind {
    MERMAID("mermaid"),
    PLANTUML("plantuml"),
    GRAPHVIZ("graphviz");

    private final String tag;

    DiagramKind(String tag) {
        this.tag = tag;
    }

    /** The fence language tag that selects this engine. */
    public String getTag() {
        return tag;
    }

    public static Optional<DiagramKind> fromFenceTag(String language) {
        if (language == null) {
            return Optional.empty();
        }
        String normalized = language.trim().toLowerCase(Locale.ROOT);
        if ("dot".equals(normalized)) {
            return Optional.of(GRAPHVIZ);
        }
        for (DiagramKind kind : values()) {
            if (kind.tag.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
