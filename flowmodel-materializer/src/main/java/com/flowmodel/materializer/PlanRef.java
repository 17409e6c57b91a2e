package com.flowmodel.materializer;

import com.flowmodel.graph.ElementId;

/**
 * Handle used while planning: either an element that already exists in the store or the index of
 * an element pending in a {@link CreationPlan}. Planned handles become real identities on commit.
 */
public record PlanRef(ElementId existing, int index) {

    public static PlanRef existing(ElementId id) {
        if (id == null) throw new IllegalArgumentException("id is required");
        return new PlanRef(id, -1);
    }

    static PlanRef planned(int index) {
        return new PlanRef(null, index);
    }

    public boolean isPlanned() {
        return existing == null;
    }

    @Override
    public String toString() {
        return isPlanned() ? "planned#" + index : existing.toString();
    }
}
