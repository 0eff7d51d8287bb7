package org.dxworks.metamark.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import org.dxworks.metamark.error.MetadataException;
import org.dxworks.metamark.model.ArrayValue;
import org.dxworks.metamark.model.BooleanValue;
import org.dxworks.metamark.model.MetaValue;
import org.dxworks.metamark.model.NumberValue;
import org.dxworks.metamark.model.ObjectValue;
import org.dxworks.metamark.model.StringValue;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps a Jackson tree (TOML frontmatter, JSON documents) or a loaded YAML object graph onto
 * {@link MetaValue}.
 * <p>
 * Values with no {@link MetaValue} counterpart (null, binary, non-finite numbers, complex mapping
 * keys and the like) become an empty string in lenient mode and a {@link MetadataException} in
 * strict mode.
 */
public final class MetaValueConverter {

    private static final MetaValueConverter LENIENT = new MetaValueConverter(false);
    private static final MetaValueConverter STRICT = new MetaValueConverter(true);

    private final boolean strict;

    private MetaValueConverter(boolean strict) {
        this.strict = strict;
    }

    public static MetaValueConverter lenient() {
        return LENIENT;
    }

    public static MetaValueConverter strict() {
        return STRICT;
    }

    public Map<String, MetaValue> convertEntries(JsonNode object) throws MetadataException {
        Map<String, MetaValue> entries = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            entries.put(field.getKey(), convert(field.getValue(), field.getKey()));
        }
        return entries;
    }

    public MetaValue convert(JsonNode node, String path) throws MetadataException {
        if (node == null) {
            return unsupported("missing", path);
        }
        if (node.isTextual()) {
            return new StringValue(node.textValue());
        }
        if (node.isNumber()) {
            return new NumberValue(node.doubleValue());
        }
        if (node.isBoolean()) {
            return new BooleanValue(node.booleanValue());
        }
        if (node.isArray()) {
            List<MetaValue> values = new ArrayList<>(node.size());
            for (int i = 0; i < node.size(); i++) {
                values.add(convert(node.get(i), path + "[" + i + "]"));
            }
            return new ArrayValue(values);
        }
        if (node.isObject()) {
            Map<String, MetaValue> entries = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                entries.put(field.getKey(), convert(field.getValue(), path + "." + field.getKey()));
            }
            return new ObjectValue(entries);
        }
        return unsupported(node.getNodeType().name().toLowerCase(Locale.ROOT), path);
    }

    public Map<String, MetaValue> convertYamlEntries(Map<?, ?> mapping) throws MetadataException {
        Set<Object> open = Collections.newSetFromMap(new IdentityHashMap<>());
        open.add(mapping);
        return yamlEntries(mapping, null, open);
    }

    private Map<String, MetaValue> yamlEntries(Map<?, ?> mapping, String path, Set<Object> open) throws MetadataException {
        Map<String, MetaValue> entries = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : mapping.entrySet()) {
            String key = yamlKey(entry.getKey(), path);
            String childPath = path == null ? key : path + "." + key;
            entries.put(key, convertYaml(entry.getValue(), childPath, open));
        }
        return entries;
    }

    private String yamlKey(Object key, String path) throws MetadataException {
        if (key instanceof String) {
            return (String) key;
        }
        if (key instanceof Number || key instanceof Boolean) {
            return String.valueOf(key);
        }
        if (strict) {
            throw new MetadataException("Unsupported non-string key at '" + (path == null ? "" : path) + "'");
        }
        return "";
    }

    private MetaValue convertYaml(Object value, String path, Set<Object> open) throws MetadataException {
        if (value == null) {
            return unsupported("null", path);
        }
        if (value instanceof String) {
            return new StringValue((String) value);
        }
        if (value instanceof Boolean) {
            return new BooleanValue((Boolean) value);
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            return Double.isFinite(number) ? new NumberValue(number) : unsupported("non-finite number", path);
        }
        if (value instanceof Collection || value instanceof Map) {
            // anchors can make a node contain itself
            if (!open.add(value)) {
                return unsupported("recursive", path);
            }
            try {
                if (value instanceof Map) {
                    return new ObjectValue(yamlEntries((Map<?, ?>) value, path, open));
                }
                List<MetaValue> values = new ArrayList<>();
                int i = 0;
                for (Object element : (Collection<?>) value) {
                    values.add(convertYaml(element, path + "[" + i++ + "]", open));
                }
                return new ArrayValue(values);
            } finally {
                open.remove(value);
            }
        }
        if (value instanceof byte[]) {
            return unsupported("binary", path);
        }
        return unsupported(value.getClass().getSimpleName().toLowerCase(Locale.ROOT), path);
    }

    private MetaValue unsupported(String nodeType, String path) throws MetadataException {
        if (strict) {
            throw new MetadataException("Unsupported " + nodeType + " value at '" + path + "'");
        }
        return new StringValue("");
    }
}
