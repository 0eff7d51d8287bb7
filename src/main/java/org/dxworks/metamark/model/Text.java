package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class Text extends Inline {
    public final String text;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public Text(@JsonProperty("text") String text) {
        this.text = Objects.requireNonNull(text, "text");
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Text other && text.equals(other.text));
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return "Text('" + text + "')";
    }
}
