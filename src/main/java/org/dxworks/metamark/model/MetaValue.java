package org.dxworks.metamark.model;

import java.util.List;
import java.util.Map;

/**
 * Typed frontmatter value. Encodes as the plain JSON value it wraps.
 */
public abstract class MetaValue {

    MetaValue() {
    }

    public static StringValue of(String value) {
        return new StringValue(value);
    }

    public static NumberValue of(double value) {
        return new NumberValue(value);
    }

    public static BooleanValue of(boolean value) {
        return new BooleanValue(value);
    }

    public static ArrayValue of(List<MetaValue> values) {
        return new ArrayValue(values);
    }

    public static ObjectValue of(Map<String, MetaValue> entries) {
        return new ObjectValue(entries);
    }

    /** Plain Java view: String, Double, Boolean, List or Map. */
    public abstract Object toPlain();
}
