package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * Root of a parsed MetaMark document. Produced in one parse call and never mutated afterwards;
 * tools that edit a document build a new tree.
 */
@JsonPropertyOrder({"metadata", "blocks"})
public final class Document {
    public final Metadata metadata; // nullable, no frontmatter
    public final List<Block> blocks;

    @JsonCreator
    public Document(@JsonProperty("metadata") Metadata metadata, @JsonProperty("blocks") List<Block> blocks) {
        this.metadata = metadata;
        this.blocks = blocks == null ? List.of() : List.copyOf(blocks);
    }

    public boolean hasMetadata() {
        return metadata != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Document other)) return false;
        return Objects.equals(metadata, other.metadata) && blocks.equals(other.blocks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(metadata, blocks);
    }

    @Override
    public String toString() {
        return "Document{metadata=" + metadata + ", blocks=" + blocks + "}";
    }
}
