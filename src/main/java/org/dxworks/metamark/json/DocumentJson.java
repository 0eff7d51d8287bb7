package org.dxworks.metamark.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import org.dxworks.metamark.error.MetadataException;
import org.dxworks.metamark.metadata.MetaValueConverter;
import org.dxworks.metamark.model.Document;
import org.dxworks.metamark.model.MetaValue;

import java.io.IOException;

/**
 * JSON encoding of document trees. Blocks and inlines carry a {@code "type"} property, metadata
 * values are written as the plain JSON values they hold, and absent fields are omitted.
 */
public final class DocumentJson {

    private static final ObjectMapper MAPPER = configure(new ObjectMapper());

    private DocumentJson() {
    }

    /** Registers what a mapper needs to read and write {@link Document} trees. */
    public static ObjectMapper configure(ObjectMapper mapper) {
        SimpleModule module = new SimpleModule("metamark");
        module.addDeserializer(MetaValue.class, new MetaValueDeserializer());
        return mapper
                .registerModule(module)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String toJson(Document document) throws JsonProcessingException {
        return MAPPER.writeValueAsString(document);
    }

    public static String toPrettyJson(Document document) throws JsonProcessingException {
        return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(document);
    }

    public static Document fromJson(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, Document.class);
    }

    private static class MetaValueDeserializer extends StdDeserializer<MetaValue> {

        MetaValueDeserializer() {
            super(MetaValue.class);
        }

        @Override
        public MetaValue deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            try {
                return MetaValueConverter.lenient().convert(node, p.currentName() == null ? "" : p.currentName());
            } catch (MetadataException e) {
                throw JsonMappingException.from(p, e.getMessage(), e);
            }
        }

        @Override
        public MetaValue getNullValue(DeserializationContext ctxt) {
            return MetaValue.of("");
        }
    }
}
