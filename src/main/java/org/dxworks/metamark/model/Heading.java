package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"level", "content", "annotations"})
public final class Heading extends Block {
    public final int level; // 1-6
    public final String content;
    public final List<Annotation> annotations;

    @JsonCreator
    public Heading(@JsonProperty("level") int level,
                   @JsonProperty("content") String content,
                   @JsonProperty("annotations") List<Annotation> annotations) {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6, got " + level);
        }
        this.level = level;
        this.content = Objects.requireNonNull(content, "content");
        this.annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Heading other)) return false;
        return level == other.level && content.equals(other.content) && annotations.equals(other.annotations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, content, annotations);
    }

    @Override
    public String toString() {
        return "Heading{level=" + level + ", content='" + content + "', annotations=" + annotations + "}";
    }
}
