package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonPropertyOrder({"text", "url"})
public final class Link extends Inline {
    public final String text;
    public final String url;

    @JsonCreator
    public Link(@JsonProperty("text") String text, @JsonProperty("url") String url) {
        this.text = Objects.requireNonNull(text, "text");
        this.url = Objects.requireNonNull(url, "url");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Link other)) return false;
        return text.equals(other.text) && url.equals(other.url);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, url);
    }

    @Override
    public String toString() {
        return "Link[" + text + "](" + url + ")";
    }
}
