package com.flowmodel.tree.build;

import com.flowmodel.graph.Point;
import com.flowmodel.graph.Size;
import com.flowmodel.tree.node.Construct;
import com.flowmodel.tree.node.Field;
import com.flowmodel.tree.node.TreeAttributes;
import com.flowmodel.tree.node.TreeNode;
import com.flowmodel.tree.ref.ExtendedRefResolver;
import com.flowmodel.tree.ref.Slot;
import com.flowmodel.tree.validate.ValidationRule;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Composition operations for the branches of if and when blocks. An if tree nests decisions
 * whose leaves are actions; a when block is a flat list of pattern branches. Geometry left null
 * is computed by the placement engine.
 */
public final class BranchTrees {

    private BranchTrees() {
    }

    public static TreeNode ifTree(Object condition, TreeNode thenBranch, TreeNode elseBranch) {
        return ifTree(condition, thenBranch, elseBranch, null, null);
    }

    public static TreeNode ifTree(Object condition, TreeNode thenBranch, TreeNode elseBranch,
                                  Point position, Integer labelWidth) {
        List<Field> fields = List.of(
                new Field("condition", ExtendedRefResolver.resolve(condition, Slot.BOOL)),
                new Field("then", ExtendedRefResolver.resolve(thenBranch, Slot.BRANCH)),
                new Field("else", ExtendedRefResolver.resolve(elseBranch, Slot.BRANCH)));
        Map<String, Object> attrs = new HashMap<>();
        attrs.put(TreeAttributes.POSITION, position);
        attrs.put(TreeAttributes.LABEL_WIDTH, positive(Construct.IF_TREE, labelWidth));
        return TreeNode.composite(Construct.IF_TREE, List.of(), fields, attrs);
    }

    public static TreeNode ifAction() {
        return ifAction(null, null, false);
    }

    /** Action leaf of an if tree; the data definition to fill is created with it. */
    public static TreeNode ifAction(Point position, Size size, boolean display) {
        return TreeNode.operator(Construct.IF_ACTION, List.of(), geometry(position, size, display));
    }

    public static TreeNode whenBranch(Object pattern) {
        return whenBranch(pattern, null, null, false, null);
    }

    public static TreeNode whenBranch(Object pattern, Point position, Size size, boolean display, Integer labelWidth) {
        Map<String, Object> attrs = geometry(position, size, display);
        attrs.put(TreeAttributes.LABEL_WIDTH, positive(Construct.WHEN_BRANCH, labelWidth));
        return TreeNode.operator(Construct.WHEN_BRANCH, List.of(ExtendedRefResolver.resolve(pattern, Slot.PATTERN)), attrs);
    }

    private static Map<String, Object> geometry(Point position, Size size, boolean display) {
        Map<String, Object> attrs = new HashMap<>();
        attrs.put(TreeAttributes.POSITION, position);
        attrs.put(TreeAttributes.SIZE, size);
        attrs.put(TreeAttributes.DISPLAY, display);
        return attrs;
    }

    private static Integer positive(Construct construct, Integer value) {
        if (value != null && value <= 0) {
            throw Shapes.fail(construct, ValidationRule.SHAPE, "label width must be positive, got " + value);
        }
        return value;
    }
}
