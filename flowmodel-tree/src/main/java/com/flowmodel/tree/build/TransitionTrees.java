package com.flowmodel.tree.build;

import com.flowmodel.tree.node.Construct;
import com.flowmodel.tree.node.Field;
import com.flowmodel.tree.node.TreeAttributes;
import com.flowmodel.tree.node.TreeNode;
import com.flowmodel.tree.ref.ExtendedRefResolver;
import com.flowmodel.tree.ref.Slot;
import com.flowmodel.tree.validate.ValidationRule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Composition operations for state machine transitions. A null trigger denotes the else
 * transition of a fork; priorities start at 1. Geometry is a flat list of {@code x, y} pairs
 * for the transition's polyline.
 */
public final class TransitionTrees {

    private TransitionTrees() {
    }

    public static TreeNode toState(Object trigger, Object state) {
        return toState(trigger, state, true, 1, null);
    }

    public static TreeNode toState(Object trigger, Object state, boolean reset, int priority, List<Integer> geometry) {
        List<Field> fields = new ArrayList<>();
        if (trigger != null) {
            fields.add(new Field("trigger", ExtendedRefResolver.resolve(trigger, Slot.BOOL)));
        }
        fields.add(new Field("target", ExtendedRefResolver.resolve(state, Slot.STATE)));
        Map<String, Object> attrs = attributes(Construct.TO_STATE, priority, geometry);
        attrs.put(TreeAttributes.RESET, reset);
        return TreeNode.composite(Construct.TO_STATE, List.of(), fields, attrs);
    }

    public static TreeNode fork(Object trigger, List<TreeNode> forks) {
        return fork(trigger, forks, 1, null);
    }

    /** Forked transition: the trigger is followed by the nested transitions in priority order. */
    public static TreeNode fork(Object trigger, List<TreeNode> forks, int priority, List<Integer> geometry) {
        Shapes.requireNotEmpty(Construct.FORK, forks, "forked transitions");
        List<Field> fields = new ArrayList<>();
        if (trigger != null) {
            fields.add(new Field("trigger", ExtendedRefResolver.resolve(trigger, Slot.BOOL)));
        }
        for (TreeNode f : forks) {
            fields.add(new Field("fork", ExtendedRefResolver.resolve(f, Slot.TRANSITION)));
        }
        return TreeNode.composite(Construct.FORK, List.of(), fields, attributes(Construct.FORK, priority, geometry));
    }

    private static Map<String, Object> attributes(Construct construct, int priority, List<Integer> geometry) {
        if (priority < 1) {
            throw Shapes.fail(construct, ValidationRule.SHAPE, "priority must be at least 1, got " + priority);
        }
        Map<String, Object> attrs = new HashMap<>();
        attrs.put(TreeAttributes.PRIORITY, priority);
        if (geometry != null) {
            if (geometry.isEmpty() || geometry.size() % 2 != 0 || geometry.contains(null)) {
                throw Shapes.fail(construct, ValidationRule.SHAPE, "geometry must be a list of x, y pairs");
            }
            attrs.put(TreeAttributes.GEOMETRY, List.copyOf(geometry));
        }
        return attrs;
    }
}
