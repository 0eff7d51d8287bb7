package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"kind", "content"})
public final class Annotation {
    public final String kind; // note, warning, important, ...
    public final String content;

    @JsonCreator
    public Annotation(@JsonProperty("kind") String kind, @JsonProperty("content") String content) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.content = Objects.requireNonNull(content, "content");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Annotation other)) return false;
        return kind.equals(other.kind) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, content);
    }

    @Override
    public String toString() {
        return "@[" + kind + ": " + content + "]";
    }
}
