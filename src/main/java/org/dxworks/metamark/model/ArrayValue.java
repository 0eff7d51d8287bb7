package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

public final class ArrayValue extends MetaValue {
    @JsonValue
    public final List<MetaValue> values;

    public ArrayValue(List<MetaValue> values) {
        this.values = values == null ? List.of() : List.copyOf(values);
    }

    @Override
    public Object toPlain() {
        List<Object> plain = new ArrayList<>(values.size());
        for (MetaValue value : values) {
            plain.add(value.toPlain());
        }
        return plain;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ArrayValue other && values.equals(other.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
