package com.flowmodel.materializer.placement;

import com.flowmodel.graph.Point;
import com.flowmodel.graph.Size;
import com.flowmodel.materializer.PlanRef;

/** Action leaf of an if tree: the if-action element and the data definition it owns. */
public record ActionShape(PlanRef ifAction, PlanRef action, Point position, Size size, boolean display)
        implements BranchShape {
}
