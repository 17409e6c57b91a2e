package com.flowmodel.materializer.placement;

import com.flowmodel.graph.Box;
import com.flowmodel.materializer.PlanRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Boxes of a when block.
 *
 * @param actions action boxes keyed by action, in branch order
 * @param labels  branch label boxes keyed by branch
 */
public record WhenLayout(Box block, Map<PlanRef, Box> actions, Map<PlanRef, Box> labels) {

    public WhenLayout {
        actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
        labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
    }
}
