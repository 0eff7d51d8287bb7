package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

public final class StringValue extends MetaValue {
    @JsonValue
    public final String value;

    public StringValue(String value) {
        this.value = Objects.requireNonNull(value, "value");
    }

    @Override
    public Object toPlain() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof StringValue other && value.equals(other.value));
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return '"' + value + '"';
    }
}
