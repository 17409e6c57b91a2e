package com.flowmodel.materializer.ownership;

import com.flowmodel.graph.ElementId;
import com.flowmodel.graph.ElementKind;
import com.flowmodel.graph.ModelRoles;
import com.flowmodel.materializer.CreationPlan;
import com.flowmodel.materializer.PlanRef;

import java.util.Map;

/**
 * Storage unit chosen for a declaration: an existing unit, or the path of a unit to create in
 * {@code model} together with the declaration.
 */
public record OwnerDecision(ElementId model, ElementId unit, String newPath) {

    public static OwnerDecision existing(ElementId model, ElementId unit) {
        return new OwnerDecision(model, unit, null);
    }

    public static OwnerDecision create(ElementId model, String path) {
        return new OwnerDecision(model, null, path);
    }

    public boolean isNew() {
        return unit == null;
    }

    /** Handle of the unit, planning its creation when needed. */
    public PlanRef apply(CreationPlan plan) {
        if (!isNew()) return PlanRef.existing(unit);
        return plan.create(ElementKind.STORAGE_UNIT, Map.of(ModelRoles.ATTR_PATH, newPath),
                PlanRef.existing(model), ModelRoles.STORAGE_UNITS);
    }
}
