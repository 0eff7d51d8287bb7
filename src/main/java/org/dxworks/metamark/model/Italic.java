package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class Italic extends Inline {
    public final Inline inner;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public Italic(@JsonProperty("inner") Inline inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Italic other && inner.equals(other.inner));
    }

    @Override
    public int hashCode() {
        return 31 * inner.hashCode() + 2;
    }

    @Override
    public String toString() {
        return "Italic(" + inner + ")";
    }
}
