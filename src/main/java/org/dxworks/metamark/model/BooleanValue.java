package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonValue;

public final class BooleanValue extends MetaValue {
    @JsonValue
    public final boolean value;

    public BooleanValue(boolean value) {
        this.value = value;
    }

    @Override
    public Object toPlain() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof BooleanValue other && value == other.value);
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
