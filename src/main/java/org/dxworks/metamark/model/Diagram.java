package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"kind", "content"})
public final class Diagram extends Block {
    public final DiagramKind kind;
    public final String content;

    @JsonCreator
    public Diagram(@JsonProperty("kind") DiagramKind kind, @JsonProperty("content") String content) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.content = Objects.requireNonNull(content, "content");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagram other)) return false;
        return kind == other.kind && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, content);
    }

    @Override
    public String toString() {
        return "Diagram{kind=" + kind + ", content='" + content + "'}";
    }
}
