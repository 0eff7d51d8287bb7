package org.dxworks.metamark.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Name and attributes of a {@code [[component: ...]]} start marker.
 * <p>
 * The grammar is intentionally narrow: the payload is split on its first space into a name and
 * an attribute tail, the tail is split on whitespace, each piece on its first {@code =}, and the
 * value loses its surrounding double quotes. There is no escaping and no quoted whitespace, so
 * {@code title="two words"} does not survive intact. Pieces without {@code =} are ignored.
 */
final class ComponentHeader {

    private static final String PREFIX = "[[component:";
    private static final String SUFFIX = "]]";

    final String name;
    final Map<String, String> attributes;

    private ComponentHeader(String name, Map<String, String> attributes) {
        this.name = name;
        this.attributes = attributes;
    }

    static ComponentHeader parse(String lexeme) {
        String payload = lexeme.substring(PREFIX.length(), lexeme.length() - SUFFIX.length()).trim();

        int space = payload.indexOf(' ');
        if (space < 0) {
            return new ComponentHeader(payload, Map.of());
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        String tail = payload.substring(space).trim();
        for (String piece : tail.split("\\s+")) {
            int equals = piece.indexOf('=');
            if (equals < 0) {
                continue;
            }
            String key = piece.substring(0, equals).trim();
            String value = LexemeUtils.trimChar(piece.substring(equals + 1).trim(), '"');
            attributes.put(key, value);
        }
        return new ComponentHeader(payload.substring(0, space), Collections.unmodifiableMap(attributes));
    }
}
