package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonValue;

public final class NumberValue extends MetaValue {
    @JsonValue
    public final double value;

    public NumberValue(double value) {
        this.value = value;
    }

    @Override
    public Object toPlain() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof NumberValue other && Double.compare(value, other.value) == 0);
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
