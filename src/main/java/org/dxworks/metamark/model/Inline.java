package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Inline node inside a paragraph or list item. Emphasis wraps exactly one inner node;
 * the dialect does not nest formatting marks.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Text.class, name = "text"),
        @JsonSubTypes.Type(value = Bold.class, name = "bold"),
        @JsonSubTypes.Type(value = Italic.class, name = "italic"),
        @JsonSubTypes.Type(value = Code.class, name = "code"),
        @JsonSubTypes.Type(value = Link.class, name = "link"),
        @JsonSubTypes.Type(value = InlineMath.class, name = "math")
})
public abstract class Inline {
    Inline() {
    }
}
