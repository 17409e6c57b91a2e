package com.flowmodel.materializer;

import com.flowmodel.graph.ElementId;

import java.util.List;

/** Identities assigned by a committed plan. */
public final class CommitResult {

    private final ElementId[] ids;
    private final List<ElementId> created;

    CommitResult(ElementId[] ids, List<ElementId> created) {
        this.ids = ids;
        this.created = List.copyOf(created);
    }

    public ElementId id(PlanRef ref) {
        return ref.isPlanned() ? ids[ref.index()] : ref.existing();
    }

    /** Created elements in creation order. */
    public List<ElementId> created() {
        return created;
    }
}
