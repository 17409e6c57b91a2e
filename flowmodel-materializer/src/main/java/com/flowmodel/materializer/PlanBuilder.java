package com.flowmodel.materializer;

/** Plans a declaration around validated trees; run by {@link Materializer} inside the tree lifecycle. */
@FunctionalInterface
public interface PlanBuilder {

    /** @return the root handle of the declaration */
    PlanRef build(CreationPlan plan, TreeExpander expander);
}
