package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@JsonPropertyOrder({"name", "attributes", "content"})
public final class Component extends Block {
    public final String name;
    public final Map<String, String> attributes; // insertion order of the source markup
    public final List<Block> content;

    @JsonCreator
    public Component(@JsonProperty("name") String name,
                     @JsonProperty("attributes") Map<String, String> attributes,
                     @JsonProperty("content") List<Block> content) {
        this.name = Objects.requireNonNull(name, "name");
        this.attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.content = content == null ? List.of() : List.copyOf(content);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Component other)) return false;
        return name.equals(other.name) && attributes.equals(other.attributes) && content.equals(other.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, attributes, content);
    }

    @Override
    public String toString() {
        return "Component{name='" + name + "', attributes=" + attributes + ", content=" + content + "}";
    }
}
