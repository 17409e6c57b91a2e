package com.flowmodel.materializer.placement;

import com.flowmodel.graph.Box;
import com.flowmodel.materializer.PlanRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Boxes of an if block.
 *
 * @param boxes decision nodes and if-actions, pre-order
 */
public record IfLayout(Box block, Map<PlanRef, Box> boxes) {

    public IfLayout {
        boxes = Collections.unmodifiableMap(new LinkedHashMap<>(boxes));
    }
}
