package com.flowmodel.graph;

import java.util.List;
import java.util.Optional;

/**
 * Read-only name lookup over a model and the libraries it references.
 */
public interface ModelRegistry {

    /** Every named element visible from {@code model}: own declarations first, then libraries. */
    List<NamedElement> allNamedElements(ElementId model);

    /** Predefined type or type constraint by name. */
    Optional<ElementId> findPredefined(String name);
}
