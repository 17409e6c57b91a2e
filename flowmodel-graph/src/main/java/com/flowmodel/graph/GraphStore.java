package com.flowmodel.graph;

import com.flowmodel.graph.snapshot.GraphSnapshot;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Arena of model elements and presentation entries addressed by {@link ElementId}.
 * <p>
 * The three write primitives commit immediately. Multi-step writes go through
 * {@link #openBatch()}: a batch verifies each primitive against the arena plus what it already
 * staged, and applies nothing until {@link GraphBatch#commit()}.
 */
public interface GraphStore {

    ElementId createElement(ElementKind kind, Map<String, Object> attributes, ElementId container, String role);

    void link(ElementId source, String referenceName, ElementId target);

    ElementId createPresentation(ElementId element, ElementId diagram, String kind,
                                 Point position, Size size, Map<String, Object> attributes);

    /** Opens a staged batch. Only one batch may be open at a time. */
    GraphBatch openBatch();

    Optional<GraphElement> find(ElementId id);

    /** Element by id; throws {@link GraphStoreException} when absent. */
    GraphElement get(ElementId id);

    boolean contains(ElementId id);

    /** Children of {@code container} held under {@code role}, in creation order. */
    List<GraphElement> children(ElementId container, String role);

    /** Elements without container (models), in creation order. */
    List<GraphElement> roots();

    Collection<GraphElement> elements();

    int elementCount();

    /** Entries shown on {@code diagram}, in creation order. */
    List<PresentationEntry> presentations(ElementId diagram);

    Optional<PresentationEntry> presentationOf(ElementId element);

    int presentationCount();

    GraphSnapshot snapshot();
}
