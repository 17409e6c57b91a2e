package com.flowmodel.graph.snapshot;

import com.flowmodel.graph.PresentationEntry;

import java.util.List;

/**
 * Point-in-time copy of a graph store: elements and presentation entries in creation order plus
 * the next identity to assign.
 */
public record GraphSnapshot(long nextId, List<ElementRecord> elements, List<PresentationEntry> presentations) {

    public GraphSnapshot {
        elements = elements != null ? List.copyOf(elements) : List.of();
        presentations = presentations != null ? List.copyOf(presentations) : List.of();
    }
}
