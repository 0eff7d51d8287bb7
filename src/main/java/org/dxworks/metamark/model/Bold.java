package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public final class Bold extends Inline {
    public final Inline inner;

    @JsonCreator(mode = JsonCreator.Mode.PROPERTIES)
    public Bold(@JsonProperty("inner") Inline inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Bold other && inner.equals(other.inner));
    }

    @Override
    public int hashCode() {
        return 31 * inner.hashCode() + 1;
    }

    @Override
    public String toString() {
        return "Bold(" + inner + ")";
    }
}
