package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolved frontmatter of a document. Keys are unique; their order carries no meaning but is
 * kept as written so exported documents stay stable.
 */
public final class Metadata {
    @JsonValue
    public final Map<String, MetaValue> values;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public Metadata(Map<String, MetaValue> values) {
        this.values = values == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Metadata empty() {
        return new Metadata(Map.of());
    }

    public MetaValue get(String key) {
        return values.get(key);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /** Plain Java view of every entry, as used by the YAML writer. */
    public Map<String, Object> toPlain() {
        Map<String, Object> plain = new LinkedHashMap<>();
        values.forEach((key, value) -> plain.put(key, value.toPlain()));
        return plain;
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Metadata other && values.equals(other.values));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Metadata" + values;
    }
}
