package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class InlineMath extends Inline {
    public final String content;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public InlineMath(@JsonProperty("content") String content) {
        this.content = Objects.requireNonNull(content, "content");
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof InlineMath other && content.equals(other.content));
    }

    @Override
    public int hashCode() {
        return content.hashCode();
    }

    @Override
    public String toString() {
        return "Math('" + content + "')";
    }
}
