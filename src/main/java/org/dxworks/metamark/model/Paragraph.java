package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"content", "annotations"})
public final class Paragraph extends Block {
    public final List<Inline> content;
    public final List<Annotation> annotations;

    @JsonCreator
    public Paragraph(@JsonProperty("content") List<Inline> content,
                     @JsonProperty("annotations") List<Annotation> annotations) {
        this.content = content == null ? List.of() : List.copyOf(content);
        this.annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Paragraph other)) return false;
        return content.equals(other.content) && annotations.equals(other.annotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(content, annotations);
    }

    @Override
    public String toString() {
        return "Paragraph{content=" + content + ", annotations=" + annotations + "}";
    }
}
