package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"level", "content"})
public final class ListItem {
    public final int level; // nesting depth, two leading spaces per level
    public final List<Block> content;

    @JsonCreator
    public ListItem(@JsonProperty("level") int level, @JsonProperty("content") List<Block> content) {
        if (level < 0) {
            throw new IllegalArgumentException("List item level must not be negative, got " + level);
        }
        this.level = level;
        this.content = content == null ? List.of() : List.copyOf(content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListItem other)) return false;
        return level == other.level && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, content);
    }

    @Override
    public String toString() {
        return "ListItem{level=" + level + ", content=" + content + "}";
    }
}
