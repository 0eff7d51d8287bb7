package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"language", "content"})
public final class CodeBlock extends Block {
    public final String language; // nullable, the fence carried no tag
    public final String content;

    @JsonCreator
    public CodeBlock(@JsonProperty("language") String language, @JsonProperty("content") String content) {
        this.language = language;
        this.content = Objects.requireNonNull(content, "content");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CodeBlock other)) return false;
        return Objects.equals(language, other.language) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(language, content);
    }

    @Override
    public String toString() {
        return "CodeBlock{language=" + language + ", content='" + content + "'}";
    }
}
