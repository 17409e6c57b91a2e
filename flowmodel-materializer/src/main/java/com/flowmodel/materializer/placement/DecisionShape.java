package com.flowmodel.materializer.placement;

import com.flowmodel.graph.Point;
import com.flowmodel.materializer.PlanRef;

/** Decision node of an if tree; {@code position} null means computed. */
public record DecisionShape(PlanRef node, BranchShape thenBranch, BranchShape elseBranch,
                            Point position, Integer labelWidth) implements BranchShape {
}
