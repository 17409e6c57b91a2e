package com.flowmodel.graph.snapshot;

import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Persisted form of one graph element. */
public record ElementRecord(
        ElementId id,
        ElementKind kind,
        ElementId container,
        String role,
        Map<String, Object> attributes,
        List<ElementId> children,
        Map<String, List<ElementId>> references
) {
    public ElementRecord {
        attributes = attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>();
        children = children != null ? List.copyOf(children) : List.of();
        references = references != null ? new LinkedHashMap<>(references) : new LinkedHashMap<>();
    }
}
