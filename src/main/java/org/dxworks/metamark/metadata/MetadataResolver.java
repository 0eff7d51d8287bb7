package org.dxworks.metamark.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import org.dxworks.metamark.error.MetadataException;
import org.dxworks.metamark.model.Metadata;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Tag;

import java.util.Map;

/**
 * Resolves the raw text between two frontmatter delimiters into {@link Metadata}.
 * <p>
 * The text is read as YAML first and must yield a mapping; otherwise it is read as TOML.
 * A block that happens to be valid in both formats is therefore always taken as YAML.
 * <p>
 * YAML goes through SnakeYAML's safe loader rather than a Jackson tree, so complex keys and
 * {@code .inf}/{@code .nan} load and reach the lenient/strict rules of {@link MetaValueConverter}.
 */
public class MetadataResolver {

    private static final ObjectMapper TOML_MAPPER = TomlMapper.builder().build();

    private final MetaValueConverter converter;

    public MetadataResolver() {
        this(false);
    }

    public MetadataResolver(boolean strict) {
        this.converter = strict ? MetaValueConverter.strict() : MetaValueConverter.lenient();
    }

    public Metadata resolve(String text) throws MetadataException {
        if (text == null || text.isBlank()) {
            return Metadata.empty();
        }

        Map<?, ?> mapping = readYamlMapping(text);
        if (mapping != null) {
            return new Metadata(converter.convertYamlEntries(mapping));
        }
        return new Metadata(converter.convertEntries(readTomlTable(text)));
    }

    // Returns null when the text is not a YAML mapping so the caller can try TOML.
    private Map<?, ?> readYamlMapping(String text) {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        // Yaml instances are not thread-safe
        Yaml yaml = new Yaml(new TimestampsAsText(options));
        try {
            Object loaded = yaml.load(text);
            return loaded instanceof Map ? (Map<?, ?>) loaded : null;
        } catch (YAMLException e) {
            return null;
        }
    }

    private JsonNode readTomlTable(String text) throws MetadataException {
        try {
            JsonNode tree = TOML_MAPPER.readTree(text);
            if (tree == null || !tree.isObject()) {
                throw new MetadataException("Failed to parse metadata as YAML or TOML: not a table");
            }
            return tree;
        } catch (JsonProcessingException e) {
            throw new MetadataException("Failed to parse metadata as YAML or TOML: " + e.getOriginalMessage(), e);
        }
    }

    /** Keeps YAML timestamps as written, the way TOML datetimes come out of Jackson. */
    private static class TimestampsAsText extends SafeConstructor {

        TimestampsAsText(LoaderOptions options) {
            super(options);
            this.yamlConstructors.put(Tag.TIMESTAMP, new ConstructYamlStr());
        }
    }
}
