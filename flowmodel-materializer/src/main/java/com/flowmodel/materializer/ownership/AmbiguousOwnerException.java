package com.flowmodel.materializer.ownership;

import com.flowmodel.graph.FlowModelException;

import java.util.List;

/** Thrown when no storage unit can be chosen for a top-level declaration without an explicit path. */
public final class AmbiguousOwnerException extends FlowModelException {

    private final String elementName;
    private final List<String> candidates;

    public AmbiguousOwnerException(String elementName, List<String> candidates) {
        super("Cannot choose a storage unit for '" + elementName + "' among " + candidates + "; give an explicit path");
        this.elementName = elementName;
        this.candidates = List.copyOf(candidates);
    }

    public String getElementName() {
        return elementName;
    }

    public List<String> getCandidates() {
        return candidates;
    }
}
