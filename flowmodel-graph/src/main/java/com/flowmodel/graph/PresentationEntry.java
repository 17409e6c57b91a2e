package com.flowmodel.graph;

import java.util.Map;
import java.util.Objects;

/**
 * Visual placement of one semantic element on one diagram. {@code kind} names the graphical form
 * (operator box, constant, text block); the entry never outlives or precedes its element.
 */
public record PresentationEntry(
        ElementId id,
        ElementId element,
        ElementId diagram,
        String kind,
        Point position,
        Size size,
        Map<String, Object> attributes
) {
    public PresentationEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(element, "element");
        Objects.requireNonNull(diagram, "diagram");
        position = position != null ? position : Point.ORIGIN;
        size = size != null ? size : Size.EMPTY;
        attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
    }

    public Box bounds() {
        return new Box(position, size);
    }
}
