package com.flowmodel.materializer.placement;

import com.flowmodel.graph.Point;
import com.flowmodel.graph.Size;
import com.flowmodel.materializer.PlanRef;

/** One branch of a when block. */
public record WhenShape(PlanRef branch, PlanRef action, Point position, Size size, boolean display,
                        Integer labelWidth) {
}
