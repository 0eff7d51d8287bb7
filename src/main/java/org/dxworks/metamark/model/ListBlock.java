package org.dxworks.metamark.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonPropertyOrder({"ordered", "items"})
public final class ListBlock extends Block {
    public final boolean ordered;
    public final List<ListItem> items;

    @JsonCreator
    public ListBlock(@JsonProperty("ordered") boolean ordered, @JsonProperty("items") List<ListItem> items) {
        this.ordered = ordered;
        this.items = items == null ? List.of() : List.copyOf(items);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListBlock other)) return false;
        return ordered == other.ordered && items.equals(other.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ordered, items);
    }

    @Override
    public String toString() {
        return "List{ordered=" + ordered + ", items=" + items + "}";
    }
}
