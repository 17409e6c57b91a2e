package com.flowmodel.graph;

import java.util.Map;

/**
 * Staged group of store primitives applied all-or-nothing. Identities returned while staging
 * become real on {@link #commit()}; closing an uncommitted batch discards everything staged and
 * leaves the store exactly as it was.
 */
public interface GraphBatch extends AutoCloseable {

    ElementId createElement(ElementKind kind, Map<String, Object> attributes, ElementId container, String role);

    void link(ElementId source, String referenceName, ElementId target);

    ElementId createPresentation(ElementId element, ElementId diagram, String kind,
                                 Point position, Size size, Map<String, Object> attributes);

    /** Kind of an element that is either committed or staged in this batch. */
    ElementKind kindOf(ElementId id);

    /** Number of primitives staged so far. */
    int stagedCount();

    void commit();

    @Override
    void close();
}
