package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public final class ObjectValue extends MetaValue {
    @JsonValue
    public final Map<String, MetaValue> entries;

    public ObjectValue(Map<String, MetaValue> entries) {
        this.entries = entries == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public MetaValue get(String key) {
        return entries.get(key);
    }

    @Override
    public Object toPlain() {
        Map<String, Object> plain = new LinkedHashMap<>();
        entries.forEach((key, value) -> plain.put(key, value.toPlain()));
        return plain;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ObjectValue other && entries.equals(other.entries));
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
